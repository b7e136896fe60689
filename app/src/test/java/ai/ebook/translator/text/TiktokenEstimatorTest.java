package ai.ebook.translator.text;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TiktokenEstimatorTest {

    private final TiktokenEstimator estimator = new TiktokenEstimator();

    @Test
    void countsTokensWithCl100kEncoding() {
        assertThat(estimator.estimate("Hello world")).isEqualTo(2);
    }

    @Test
    void returnsZeroForEmptyText() {
        assertThat(estimator.estimate("")).isZero();
        assertThat(estimator.estimate(null)).isZero();
    }

    @Test
    void isDeterministicAcrossCallsAndInstances() {
        String text = "The quick brown fox jumps over the lazy dog. Le renard brun saute par-dessus le chien paresseux.";

        int first = estimator.estimate(text);
        int second = estimator.estimate(text);
        int fromOtherInstance = new TiktokenEstimator().estimate(text);

        assertThat(first).isPositive();
        assertThat(second).isEqualTo(first);
        assertThat(fromOtherInstance).isEqualTo(first);
    }

    @Test
    void longerTextNeverCostsLessThanItsPrefixSentence() {
        String sentence = "A short sentence.";

        assertThat(estimator.estimate(sentence + " " + sentence)).isGreaterThan(estimator.estimate(sentence));
    }

    @Test
    void countsSpecialTokenMarkersAsPlainText() {
        String text = "The model emitted <|endoftext|> and stopped.";

        int estimate = estimator.estimate(text);

        assertThat(estimate).isGreaterThan(estimator.estimate("The model emitted and stopped."));
        assertThat(estimator.estimate("<|endoftext|>")).isGreaterThan(1);
    }
}
