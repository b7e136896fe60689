package ai.ebook.translator.prompt;

import java.util.Objects;

/**
 * Values shared by every prompt of a run.
 */
public record PromptContext(String language, String genre, String title, String author) {

    public PromptContext {
        language = requireNonBlank(language, "language");
        genre = requireNonBlank(genre, "genre");
        title = Objects.requireNonNull(title, "title");
        author = Objects.requireNonNull(author, "author");
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
