package ai.ebook.translator.translate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Provides translator instances based on the desired execution mode.
 * The production translator is created on first use so that dry and mock runs never build a model client.
 */
public class TranslatorFactory {

    private final Supplier<Translator> productionTranslator;
    private final Translator dryRunTranslator;
    private final Translator mockTranslator;

    public TranslatorFactory(Supplier<Translator> productionTranslator,
                             Translator dryRunTranslator,
                             Translator mockTranslator) {
        this.productionTranslator = Objects.requireNonNull(productionTranslator, "productionTranslator");
        this.dryRunTranslator = Objects.requireNonNull(dryRunTranslator, "dryRunTranslator");
        this.mockTranslator = Objects.requireNonNull(mockTranslator, "mockTranslator");
    }

    public Translator select(TranslationMode mode) {
        return switch (Objects.requireNonNull(mode, "mode")) {
            case PRODUCTION -> Objects.requireNonNull(productionTranslator.get(), "production translator");
            case DRY_RUN -> dryRunTranslator;
            case MOCK -> mockTranslator;
        };
    }
}
