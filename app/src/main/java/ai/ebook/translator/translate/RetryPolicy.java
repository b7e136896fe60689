package ai.ebook.translator.translate;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry settings for backend calls: how many attempts in total and how long to wait between them.
 */
public record RetryPolicy(int maxAttempts, Duration delay) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(2);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_DELAY);
    }

    public static RetryPolicy ofSeconds(int maxAttempts, double delaySeconds) {
        if (Double.isNaN(delaySeconds) || delaySeconds < 0) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        return new RetryPolicy(maxAttempts, Duration.ofMillis(Math.round(delaySeconds * 1000)));
    }
}
