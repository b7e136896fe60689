package ai.ebook.translator.pipeline;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a single book translation run needs besides its collaborators.
 */
public record BookTranslationRequest(
        Path inputPath,
        Path outputPath,
        String targetLanguage,
        String genre,
        int tokenLimit,
        Optional<Path> templatePath,
        boolean bilingual,
        Optional<String> overrideTitle,
        Optional<String> overrideAuthor
) {

    public BookTranslationRequest {
        Objects.requireNonNull(inputPath, "inputPath");
        Objects.requireNonNull(outputPath, "outputPath");
        targetLanguage = requireNonBlank(targetLanguage, "targetLanguage");
        genre = requireNonBlank(genre, "genre");
        if (tokenLimit < 2) {
            throw new IllegalArgumentException("tokenLimit must be at least 2");
        }
        templatePath = templatePath == null ? Optional.empty() : templatePath;
        overrideTitle = overrideTitle == null ? Optional.empty() : overrideTitle;
        overrideAuthor = overrideAuthor == null ? Optional.empty() : overrideAuthor;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
