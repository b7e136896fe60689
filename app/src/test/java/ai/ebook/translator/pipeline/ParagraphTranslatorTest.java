package ai.ebook.translator.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import ai.ebook.translator.prompt.PromptContext;
import ai.ebook.translator.prompt.PromptTemplateLoader;
import ai.ebook.translator.prompt.TranslationPromptTemplate;
import ai.ebook.translator.text.SentenceSplitter;
import ai.ebook.translator.text.TextChunker;
import ai.ebook.translator.translate.RetryPolicy;
import ai.ebook.translator.translate.TranslationInvoker;
import ai.ebook.translator.translate.Translator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ParagraphTranslatorTest {

    private static final TranslationPromptTemplate TEMPLATE = new PromptTemplateLoader().parse("inline", "[{{language}}] {{text}}");
    private static final PromptContext CONTEXT = new PromptContext("English", "General", "Title", "Author");

    @Test
    void rendersOnePromptPerChunk() {
        List<String> prompts = new ArrayList<>();

        ParagraphTranslator.Result result = paragraphTranslator(job -> {
            prompts.add(job.prompt());
            return "t";
        }, 3).translate("One two. Three four. Five.");

        assertThat(prompts).containsExactly("[English] One two.", "[English] Three four. Five.");
        assertThat(result.text()).isEqualTo("t t");
        assertThat(result.translatedChunks()).isEqualTo(2);
        assertThat(result.droppedChunks()).isZero();
    }

    @Test
    void leavesFailedChunksOut() {
        ParagraphTranslator.Result result = paragraphTranslator(job -> {
            if (job.chunk().text().startsWith("Three")) {
                throw new IllegalStateException("boom");
            }
            return job.chunk().text();
        }, 2).translate("One two. Three four. Five six.");

        assertThat(result.text()).isEqualTo("One two. Five six.");
        assertThat(result.translatedChunks()).isEqualTo(2);
        assertThat(result.droppedChunks()).isEqualTo(1);
    }

    @Test
    void ignoresEmptyChunkOutputsWhenJoining() {
        ParagraphTranslator.Result result = paragraphTranslator(job -> job.chunk().text().startsWith("One") ? "" : "B", 2)
                .translate("One two. Three four.");

        assertThat(result.text()).isEqualTo("B");
        assertThat(result.translatedChunks()).isEqualTo(2);
    }

    private static ParagraphTranslator paragraphTranslator(Translator backend, int maxTokens) {
        TextChunker chunker = new TextChunker(new SentenceSplitter(),
                text -> text.isBlank() ? 0 : text.strip().split("\\s+").length);
        return new ParagraphTranslator(chunker, TEMPLATE, CONTEXT,
                new TranslationInvoker(backend, new RetryPolicy(2, Duration.ZERO)), maxTokens);
    }
}
