package ai.ebook.translator.pipeline;

import ai.ebook.translator.prompt.PromptContext;
import ai.ebook.translator.prompt.TranslationPromptTemplate;
import ai.ebook.translator.text.Chunk;
import ai.ebook.translator.text.TextChunker;
import ai.ebook.translator.translate.TranslationInvoker;
import ai.ebook.translator.translate.TranslationJob;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates one normalized paragraph: chunk it, render a prompt per chunk, invoke the backend and join
 * the successful outputs with single spaces. Chunks whose attempts are exhausted contribute nothing.
 */
public class ParagraphTranslator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ParagraphTranslator.class);

    private final TextChunker chunker;
    private final TranslationPromptTemplate template;
    private final PromptContext context;
    private final TranslationInvoker invoker;
    private final int maxTokens;

    public ParagraphTranslator(TextChunker chunker, TranslationPromptTemplate template, PromptContext context,
                               TranslationInvoker invoker, int maxTokens) {
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.template = Objects.requireNonNull(template, "template");
        this.context = Objects.requireNonNull(context, "context");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be at least 1");
        }
        this.maxTokens = maxTokens;
    }

    public Result translate(String normalizedText) {
        List<Chunk> chunks = chunker.split(normalizedText, maxTokens);
        List<String> outputs = new ArrayList<>(chunks.size());
        int dropped = 0;
        for (Chunk chunk : chunks) {
            if (chunk.exceeds(maxTokens)) {
                LOGGER.warn("Sentence of {} tokens exceeds the chunk budget of {} and is sent as is", chunk.tokenEstimate(), maxTokens);
            }
            TranslationJob job = new TranslationJob(chunk, template.render(chunk.text(), context));
            Optional<String> translated = invoker.invoke(job);
            if (translated.isEmpty()) {
                dropped++;
                continue;
            }
            if (!translated.get().isEmpty()) {
                outputs.add(translated.get());
            }
        }
        return new Result(String.join(" ", outputs), chunks.size() - dropped, dropped);
    }

    /**
     * Joined translation of one paragraph with the number of chunks that were translated or dropped.
     */
    public record Result(String text, int translatedChunks, int droppedChunks) {

        public Result {
            Objects.requireNonNull(text, "text");
        }
    }
}
