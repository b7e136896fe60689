package ai.ebook.translator.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits paragraph text into chunks that fit a token budget without breaking sentences apart.
 *
 * <p>Sentences are accumulated greedily. A sentence whose own estimate is larger than the budget is
 * emitted as a chunk of its own; it is never split further and never dropped, so such a chunk may
 * exceed the nominal budget.</p>
 */
public class TextChunker {

    private final SentenceSplitter sentenceSplitter;
    private final TokenEstimator tokenEstimator;

    public TextChunker(SentenceSplitter sentenceSplitter, TokenEstimator tokenEstimator) {
        this.sentenceSplitter = Objects.requireNonNull(sentenceSplitter, "sentenceSplitter");
        this.tokenEstimator = Objects.requireNonNull(tokenEstimator, "tokenEstimator");
    }

    /**
     * Derives the chunk budget from a model token limit. Half of the limit is kept for the prompt
     * scaffolding and the model's answer; the ratio is a heuristic, not a measured bound.
     */
    public static int budgetFor(int tokenLimit) {
        if (tokenLimit < 1) {
            throw new IllegalArgumentException("tokenLimit must be at least 1");
        }
        return Math.max(1, tokenLimit / 2);
    }

    public List<Chunk> split(String text, int maxTokens) {
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be at least 1");
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Chunk> chunks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int currentTokens = 0;
        for (String rawSentence : sentenceSplitter.split(text)) {
            String sentence = TextNormalizer.normalize(rawSentence);
            if (sentence.isEmpty()) {
                continue;
            }
            int sentenceTokens = tokenEstimator.estimate(sentence);
            if (currentTokens + sentenceTokens > maxTokens) {
                if (!current.isEmpty()) {
                    chunks.add(new Chunk(String.join(" ", current), currentTokens));
                }
                current = new ArrayList<>();
                current.add(sentence);
                currentTokens = sentenceTokens;
            } else {
                current.add(sentence);
                currentTokens += sentenceTokens;
            }
        }
        if (!current.isEmpty()) {
            chunks.add(new Chunk(String.join(" ", current), currentTokens));
        }
        return List.copyOf(chunks);
    }
}
