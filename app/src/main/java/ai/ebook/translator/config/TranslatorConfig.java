package ai.ebook.translator.config;

import ai.ebook.translator.translate.RetryPolicy;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds runtime settings for the translation model provider.
 */
public record TranslatorConfig(LlmProvider provider, String modelName, Optional<String> baseUrl, RetryPolicy retryPolicy) {

    public TranslatorConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = requireNonBlank(modelName, "modelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        retryPolicy = retryPolicy == null ? RetryPolicy.defaults() : retryPolicy;
    }

    public boolean isOllama() {
        return provider == LlmProvider.OLLAMA;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
