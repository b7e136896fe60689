package ai.ebook.translator.pipeline;

import java.util.Objects;

/**
 * Counts visited paragraphs against the total found by the pre-pass and forwards each step to a listener.
 */
public final class ProgressCounter {

    private final int total;
    private final ProgressListener listener;
    private int current;

    public ProgressCounter(int total, ProgressListener listener) {
        if (total < 0) {
            throw new IllegalArgumentException("total must be zero or greater");
        }
        this.total = total;
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public int advance() {
        if (current >= total) {
            throw new IllegalStateException("progress already reached total " + total);
        }
        current++;
        listener.onProgress(current, total);
        return current;
    }

    public int current() {
        return current;
    }

    public int total() {
        return total;
    }

    public boolean isComplete() {
        return current == total;
    }
}
