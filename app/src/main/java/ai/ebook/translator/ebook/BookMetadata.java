package ai.ebook.translator.ebook;

import java.util.Optional;

/**
 * Title and author handed to the prompt template. A non-blank override always wins, then the value
 * stored in the e-book, then a fixed fallback.
 */
public record BookMetadata(String title, String author) {

    public static final String UNKNOWN_TITLE = "Unknown Title";
    public static final String UNKNOWN_AUTHOR = "Unknown Author";

    public BookMetadata {
        title = requireNonBlank(title, "title");
        author = requireNonBlank(author, "author");
    }

    public static BookMetadata resolve(EbookDocument document, Optional<String> overrideTitle, Optional<String> overrideAuthor) {
        return resolve(document.title(), document.author(), overrideTitle, overrideAuthor);
    }

    public static BookMetadata resolve(Optional<String> sourceTitle, Optional<String> sourceAuthor,
                                       Optional<String> overrideTitle, Optional<String> overrideAuthor) {
        String title = firstNonBlank(overrideTitle, sourceTitle).orElse(UNKNOWN_TITLE);
        String author = firstNonBlank(overrideAuthor, sourceAuthor).orElse(UNKNOWN_AUTHOR);
        return new BookMetadata(title, author);
    }

    private static Optional<String> firstNonBlank(Optional<String> preferred, Optional<String> fallback) {
        return nonBlank(preferred).or(() -> nonBlank(fallback));
    }

    private static Optional<String> nonBlank(Optional<String> value) {
        return value == null ? Optional.empty() : value.map(String::strip).filter(s -> !s.isEmpty());
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
