package ai.ebook.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.ebook.translator.text.Chunk;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class TranslatorFactoryTest {

    private static final TranslationJob JOB = new TranslationJob(new Chunk("Bonjour.", 3), "prompt");

    @Test
    void createsProductionTranslatorOnlyWhenSelected() {
        AtomicInteger created = new AtomicInteger();
        Translator production = job -> "production";
        TranslatorFactory factory = new TranslatorFactory(() -> {
            created.incrementAndGet();
            return production;
        }, new PassThroughTranslator(), new MockTranslator());

        assertThat(factory.select(TranslationMode.MOCK).translate(JOB)).isEqualTo("[MOCK] Bonjour.");
        assertThat(factory.select(TranslationMode.DRY_RUN).translate(JOB)).isEqualTo("Bonjour.");
        assertThat(created).hasValue(0);

        assertThat(factory.select(TranslationMode.PRODUCTION)).isSameAs(production);
        assertThat(created).hasValue(1);
    }

    @Test
    void parsesTranslationModes() {
        assertThat(TranslationMode.from("dry-run")).isEqualTo(TranslationMode.DRY_RUN);
        assertThat(TranslationMode.from("MOCK")).isEqualTo(TranslationMode.MOCK);
        assertThat(TranslationMode.from(" production ")).isEqualTo(TranslationMode.PRODUCTION);
        assertThat(TranslationMode.from(null)).isEqualTo(TranslationMode.PRODUCTION);
        assertThatThrownBy(() -> TranslationMode.from("live")).isInstanceOf(IllegalArgumentException.class);
    }
}
