package ai.ebook.translator.text;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import java.util.Objects;

/**
 * Token estimator backed by the {@code cl100k_base} byte-pair encoding.
 * The encoding is fixed and does not depend on the model used for translation.
 * Special-token markers such as {@code <|endoftext|>} are counted as ordinary text.
 */
public class TiktokenEstimator implements TokenEstimator {

    private static final EncodingRegistry REGISTRY = Encodings.newDefaultEncodingRegistry();

    private final Encoding encoding;

    public TiktokenEstimator() {
        this(EncodingType.CL100K_BASE);
    }

    public TiktokenEstimator(EncodingType encodingType) {
        this.encoding = REGISTRY.getEncoding(Objects.requireNonNull(encodingType, "encodingType"));
    }

    @Override
    public int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokensOrdinary(text);
    }
}
