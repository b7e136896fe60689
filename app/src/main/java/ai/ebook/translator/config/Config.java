package ai.ebook.translator.config;

import ai.ebook.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path inputPath,
        Path outputPath,
        String targetLanguage,
        String genre,
        int tokenLimit,
        Optional<Path> templatePath,
        boolean bilingual,
        Optional<String> overrideTitle,
        Optional<String> overrideAuthor,
        Locale sentenceLocale,
        TranslationMode translationMode,
        LogFormat logFormat,
        boolean verbose,
        TranslatorConfig translatorConfig,
        Secrets secrets
) {

    public static final int MIN_TOKEN_LIMIT = 2;

    public Config {
        Objects.requireNonNull(inputPath, "inputPath");
        Objects.requireNonNull(outputPath, "outputPath");
        if (inputPath.toAbsolutePath().normalize().equals(outputPath.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("output path must differ from the input path");
        }
        targetLanguage = requireNonBlank(targetLanguage, "targetLanguage");
        genre = requireNonBlank(genre, "genre");
        if (tokenLimit < MIN_TOKEN_LIMIT) {
            throw new IllegalArgumentException("tokenLimit must be at least " + MIN_TOKEN_LIMIT);
        }
        templatePath = templatePath == null ? Optional.empty() : templatePath;
        overrideTitle = blankToEmpty(overrideTitle);
        overrideAuthor = blankToEmpty(overrideAuthor);
        sentenceLocale = sentenceLocale == null ? Locale.ROOT : sentenceLocale;
        translationMode = Objects.requireNonNull(translationMode, "translationMode");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        translatorConfig = Objects.requireNonNull(translatorConfig, "translatorConfig");
        secrets = secrets == null ? Secrets.none() : secrets;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.strip();
    }

    private static Optional<String> blankToEmpty(Optional<String> value) {
        return value == null ? Optional.empty() : value.map(String::strip).filter(s -> !s.isEmpty());
    }
}
