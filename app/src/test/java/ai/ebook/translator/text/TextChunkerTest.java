package ai.ebook.translator.text;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class TextChunkerTest {

    // one token per word keeps the budgets easy to reason about
    private static final TokenEstimator WORDS = text -> text.isBlank() ? 0 : text.strip().split("\\s+").length;

    private final TextChunker chunker = new TextChunker(new SentenceSplitter(), WORDS);

    @Test
    void keepsShortParagraphInOneChunk() {
        List<Chunk> chunks = chunker.split("Hello world. How are you?", 10);

        assertThat(chunks).containsExactly(new Chunk("Hello world. How are you?", 5));
    }

    @Test
    void startsNewChunkWhenNextSentenceWouldExceedBudget() {
        List<Chunk> chunks = chunker.split("One two three. Four five. Six seven eight nine.", 5);

        assertThat(chunks).extracting(Chunk::text)
                .containsExactly("One two three. Four five.", "Six seven eight nine.");
        assertThat(chunks).extracting(Chunk::tokenEstimate).containsExactly(5, 4);
    }

    @Test
    void emitsOversizedSentenceAsItsOwnChunk() {
        List<Chunk> chunks = chunker.split("Short one. This sentence is far too long for the budget. Tail.", 3);

        assertThat(chunks).extracting(Chunk::text)
                .containsExactly("Short one.", "This sentence is far too long for the budget.", "Tail.");
        assertThat(chunks.get(1).exceeds(3)).isTrue();
        assertThat(chunks.get(0).exceeds(3)).isFalse();
    }

    @Test
    void returnsNoChunksForBlankText() {
        assertThat(chunker.split("", 10)).isEmpty();
        assertThat(chunker.split("  \n ", 10)).isEmpty();
        assertThat(chunker.split(null, 10)).isEmpty();
    }

    @Test
    void normalizesSentencesInsideChunks() {
        List<Chunk> chunks = chunker.split("It’s\nlate.   Go   home.", 20);

        assertThat(chunks).extracting(Chunk::text).containsExactly("It's late. Go home.");
    }

    @Test
    void chunksCoverNormalizedTextInOrderAndRespectBudget() {
        Random random = new Random(42);
        for (int round = 0; round < 50; round++) {
            String text = randomParagraph(random);
            int budget = 1 + random.nextInt(12);

            List<Chunk> chunks = chunker.split(text, budget);

            assertThat(chunks.stream().map(Chunk::text).collect(Collectors.joining(" ")))
                    .isEqualTo(TextNormalizer.normalize(text));
            for (Chunk chunk : chunks) {
                assertThat(chunk.tokenEstimate()).isEqualTo(WORDS.estimate(chunk.text()));
                if (chunk.exceeds(budget)) {
                    assertThat(new SentenceSplitter().split(chunk.text())).hasSize(1);
                }
            }
        }
    }

    @Test
    void worksWithTiktokenEstimates() {
        TextChunker tiktokenChunker = new TextChunker(new SentenceSplitter(), new TiktokenEstimator());

        List<Chunk> chunks = tiktokenChunker.split("Hello world. Hello world. Hello world.", 6);

        assertThat(chunks).extracting(Chunk::text).containsExactly("Hello world. Hello world.", "Hello world.");
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.exceeds(6)).isFalse());
    }

    @Test
    void splitsParagraphQuotingSpecialTokenMarkers() {
        TextChunker tiktokenChunker = new TextChunker(new SentenceSplitter(), new TiktokenEstimator());

        List<Chunk> chunks = tiktokenChunker.split("The model emitted <|endoftext|> and stopped. Then it resumed.", 256);

        assertThat(chunks).extracting(Chunk::text)
                .containsExactly("The model emitted <|endoftext|> and stopped. Then it resumed.");
        assertThat(chunks.get(0).tokenEstimate()).isPositive();
    }

    @Test
    void rejectsNonPositiveBudget() {
        assertThatThrownBy(() -> chunker.split("Hello.", 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void derivesBudgetFromHalfTheTokenLimit() {
        assertThat(TextChunker.budgetFor(512)).isEqualTo(256);
        assertThat(TextChunker.budgetFor(3)).isEqualTo(1);
        assertThat(TextChunker.budgetFor(1)).isEqualTo(1);
        assertThatThrownBy(() -> TextChunker.budgetFor(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static String randomParagraph(Random random) {
        String[] words = {"alpha", "beta", "gamma", "delta", "river", "stone", "light", "house"};
        String[] endings = {".", "!", "?"};
        List<String> sentences = new ArrayList<>();
        int sentenceCount = 1 + random.nextInt(6);
        for (int i = 0; i < sentenceCount; i++) {
            int wordCount = 1 + random.nextInt(8);
            StringBuilder sentence = new StringBuilder("Start");
            for (int w = 0; w < wordCount; w++) {
                sentence.append(random.nextBoolean() ? " " : "  ").append(words[random.nextInt(words.length)]);
            }
            sentence.append(endings[random.nextInt(endings.length)]);
            sentences.add(sentence.toString());
        }
        return String.join(random.nextBoolean() ? " " : "\n", sentences);
    }
}
