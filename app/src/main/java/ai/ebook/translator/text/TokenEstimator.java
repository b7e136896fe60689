package ai.ebook.translator.text;

/**
 * Estimates how many model tokens a span of text costs.
 * Implementations must be pure so that chunk boundaries are reproducible across runs.
 */
@FunctionalInterface
public interface TokenEstimator {

    int estimate(String text);
}
