package ai.ebook.translator.translate;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends one translation job to the backend, retrying failed attempts with a fixed delay.
 *
 * <p>Backend failures never escape this class: once every attempt has failed the chunk is skipped and
 * an empty result is returned. Only an interrupt during the retry delay is propagated.</p>
 */
public class TranslationInvoker {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationInvoker.class);

    private final Translator translator;
    private final RetryPolicy retryPolicy;

    public TranslationInvoker(Translator translator) {
        this(translator, RetryPolicy.defaults());
    }

    public TranslationInvoker(Translator translator, RetryPolicy retryPolicy) {
        this.translator = Objects.requireNonNull(translator, "translator");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    public Optional<String> invoke(TranslationJob job) {
        Objects.requireNonNull(job, "job");
        int maxAttempts = retryPolicy.maxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String response = translator.translate(job);
                if (response != null) {
                    return Optional.of(response.strip());
                }
                LOGGER.warn("Translation attempt {}/{} returned no content", attempt, maxAttempts);
            } catch (RuntimeException ex) {
                LOGGER.warn("Translation attempt {}/{} failed: {}", attempt, maxAttempts, ex.getMessage(), ex);
            }
            if (attempt < maxAttempts) {
                pause();
            }
        }
        LOGGER.error("Translation failed after {} attempts; skipping chunk of {} tokens", maxAttempts, job.chunk().tokenEstimate());
        return Optional.empty();
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    private void pause() {
        long millis = retryPolicy.delay().toMillis();
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Translation retry interrupted", ex);
        }
    }
}
