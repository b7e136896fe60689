package ai.ebook.translator.translate;

/**
 * Translator used for dry runs that keeps the original chunk text without invoking remote APIs.
 */
public class PassThroughTranslator implements Translator {

    @Override
    public String translate(TranslationJob job) {
        return job.chunk().text();
    }
}
