package ai.ebook.translator.config;

import ai.ebook.translator.cli.CliArguments;
import ai.ebook.translator.translate.RetryPolicy;
import ai.ebook.translator.translate.TranslationMode;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 * CLI values win over environment values, which win over defaults.
 */
public class ConfigLoader {

    static final String ENV_INPUT_PATH = "INPUT_PATH";
    static final String ENV_OUTPUT_PATH = "OUTPUT_PATH";
    static final String ENV_TARGET_LANGUAGE = "TARGET_LANGUAGE";
    static final String ENV_BOOK_GENRE = "BOOK_GENRE";
    static final String ENV_TOKEN_LIMIT = "TOKEN_LIMIT";
    static final String ENV_PROMPT_TEMPLATE = "PROMPT_TEMPLATE";
    static final String ENV_BILINGUAL = "BILINGUAL";
    static final String ENV_BOOK_TITLE = "BOOK_TITLE";
    static final String ENV_BOOK_AUTHOR = "BOOK_AUTHOR";
    static final String ENV_SENTENCE_LOCALE = "SENTENCE_LOCALE";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_RETRY_DELAY_SECONDS = "LLM_RETRY_DELAY_SECONDS";

    private static final String DEFAULT_TARGET_LANGUAGE = "Indonesian";
    private static final String DEFAULT_GENRE = "General";
    private static final int DEFAULT_TOKEN_LIMIT = 512;
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final double DEFAULT_RETRY_DELAY_SECONDS = 2.0;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        Path inputPath = resolvePath(arguments.inputPath(), ENV_INPUT_PATH)
                .orElseThrow(() -> new IllegalArgumentException("input e-book path must be provided (--input or " + ENV_INPUT_PATH + ")"));
        if (!Files.isRegularFile(inputPath)) {
            throw new IllegalArgumentException("input e-book does not exist: " + inputPath);
        }
        Path outputPath = resolvePath(arguments.outputPath(), ENV_OUTPUT_PATH)
                .orElseThrow(() -> new IllegalArgumentException("output e-book path must be provided (--output or " + ENV_OUTPUT_PATH + ")"));

        String targetLanguage = firstNonBlank(arguments.targetLanguage(), ENV_TARGET_LANGUAGE, DEFAULT_TARGET_LANGUAGE);
        String genre = firstNonBlank(arguments.genre(), ENV_BOOK_GENRE, DEFAULT_GENRE);
        int tokenLimit = resolveTokenLimit(arguments);

        Optional<Path> templatePath = resolvePath(arguments.templatePath(), ENV_PROMPT_TEMPLATE);
        templatePath.ifPresent(path -> {
            if (!Files.isRegularFile(path)) {
                throw new IllegalArgumentException("prompt template does not exist: " + path);
            }
        });

        boolean bilingual = arguments.bilingual() || environmentReader.get(ENV_BILINGUAL)
                .map(ConfigLoader::parseBoolean)
                .orElse(false);
        Optional<String> overrideTitle = firstNonBlank(arguments.title(), ENV_BOOK_TITLE);
        Optional<String> overrideAuthor = firstNonBlank(arguments.author(), ENV_BOOK_AUTHOR);
        Locale sentenceLocale = firstNonBlank(arguments.sentenceLocale(), ENV_SENTENCE_LOCALE)
                .map(ConfigLoader::parseLocale)
                .orElse(Locale.ROOT);

        TranslationMode translationMode = resolveTranslationMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        LlmProvider provider = environmentReader.get(ENV_LLM_PROVIDER)
                .filter(ConfigLoader::isNotBlank)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OLLAMA);
        String modelName = firstNonBlank(arguments.modelName(), ENV_LLM_MODEL, provider.defaultModel());
        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(firstNonBlank(null, ENV_OLLAMA_BASE_URL, DEFAULT_OLLAMA_BASE_URL));
        }
        Optional<String> geminiApiKey = environmentReader.get(ENV_GEMINI_API_KEY).filter(ConfigLoader::isNotBlank);
        if (provider == LlmProvider.GEMINI && translationMode == TranslationMode.PRODUCTION && geminiApiKey.isEmpty()) {
            throw new IllegalStateException(ENV_GEMINI_API_KEY + " must be provided when " + ENV_LLM_PROVIDER + "=gemini");
        }

        int maxAttempts = environmentReader.get(ENV_LLM_MAX_RETRY_ATTEMPTS)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parsePositiveInteger(raw, ENV_LLM_MAX_RETRY_ATTEMPTS))
                .orElse(RetryPolicy.DEFAULT_MAX_ATTEMPTS);
        double delaySeconds = environmentReader.get(ENV_LLM_RETRY_DELAY_SECONDS)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parseNonNegativeDouble(raw, ENV_LLM_RETRY_DELAY_SECONDS))
                .orElse(DEFAULT_RETRY_DELAY_SECONDS);

        TranslatorConfig translatorConfig = new TranslatorConfig(provider, modelName, baseUrl,
                RetryPolicy.ofSeconds(maxAttempts, delaySeconds));

        return new Config(inputPath, outputPath, targetLanguage, genre, tokenLimit, templatePath, bilingual,
                overrideTitle, overrideAuthor, sentenceLocale, translationMode, logFormat, arguments.verbose(),
                translatorConfig, new Secrets(geminiApiKey));
    }

    private int resolveTokenLimit(CliArguments arguments) {
        Integer cliLimit = arguments.tokenLimit();
        int limit = cliLimit != null
                ? cliLimit
                : environmentReader.get(ENV_TOKEN_LIMIT)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parsePositiveInteger(raw, ENV_TOKEN_LIMIT))
                .orElse(DEFAULT_TOKEN_LIMIT);
        if (limit < Config.MIN_TOKEN_LIMIT) {
            throw new IllegalArgumentException("--token-limit must be at least " + Config.MIN_TOKEN_LIMIT);
        }
        return limit;
    }

    private TranslationMode resolveTranslationMode(CliArguments arguments) {
        TranslationMode cliMode = arguments.translationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_TRANSLATION_MODE)
                .map(TranslationMode::from)
                .orElse(TranslationMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Optional<Path> resolvePath(Path cliValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parsePath(raw, envKey));
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        return firstNonBlank(cliValue, envKey).orElse(defaultValue);
    }

    private Optional<String> firstNonBlank(String cliValue, String envKey) {
        if (isNotBlank(cliValue)) {
            return Optional.of(cliValue.strip());
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::strip);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean parseBoolean(String raw) {
        String value = raw.trim();
        return value.equalsIgnoreCase("true") || value.equals("1") || value.equalsIgnoreCase("yes");
    }

    private static Path parsePath(String raw, String envKey) {
        try {
            return Path.of(raw);
        } catch (InvalidPathException ex) {
            throw new IllegalArgumentException(envKey + " is not a valid path: " + raw, ex);
        }
    }

    private static Locale parseLocale(String raw) {
        Locale locale = Locale.forLanguageTag(raw.replace('_', '-'));
        if (locale.getLanguage().isEmpty()) {
            throw new IllegalArgumentException("Unsupported sentence locale: " + raw);
        }
        return locale;
    }

    private static int parsePositiveInteger(String raw, String name) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be greater than zero");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer", ex);
        }
    }

    private static double parseNonNegativeDouble(String raw, String name) {
        try {
            double value = Double.parseDouble(raw);
            if (Double.isNaN(value) || value < 0) {
                throw new IllegalArgumentException(name + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be a number", ex);
        }
    }
}
