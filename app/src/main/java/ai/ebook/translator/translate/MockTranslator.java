package ai.ebook.translator.translate;

/**
 * Marks every chunk instead of translating it, so a run can be checked end to end without a model.
 */
public class MockTranslator implements Translator {

    @Override
    public String translate(TranslationJob job) {
        return "[MOCK] " + job.chunk().text();
    }
}
