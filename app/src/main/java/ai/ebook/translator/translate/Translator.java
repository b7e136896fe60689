package ai.ebook.translator.translate;

/**
 * Low-level backend that turns one translation job into target-language text.
 *
 * <p>Returning {@code null} signals a malformed response; throwing signals a failed call. Both are
 * retried by {@link TranslationInvoker}.</p>
 */
@FunctionalInterface
public interface Translator {

    String translate(TranslationJob job);
}
