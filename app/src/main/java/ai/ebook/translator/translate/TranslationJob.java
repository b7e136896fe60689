package ai.ebook.translator.translate;

import ai.ebook.translator.text.Chunk;
import java.util.Objects;

/**
 * One chunk together with the prompt rendered for it. Lives only for the duration of one retry loop.
 */
public record TranslationJob(Chunk chunk, String prompt) {

    public TranslationJob {
        Objects.requireNonNull(chunk, "chunk");
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
    }
}
