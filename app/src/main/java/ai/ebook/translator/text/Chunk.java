package ai.ebook.translator.text;

/**
 * Sentence-aligned slice of a paragraph together with its estimated token cost.
 */
public record Chunk(String text, int tokenEstimate) {

    public Chunk {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
        if (tokenEstimate < 0) {
            throw new IllegalArgumentException("tokenEstimate must be zero or greater");
        }
    }

    public boolean exceeds(int maxTokens) {
        return tokenEstimate > maxTokens;
    }
}
