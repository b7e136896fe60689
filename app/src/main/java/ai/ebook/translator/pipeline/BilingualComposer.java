package ai.ebook.translator.pipeline;

import org.jsoup.nodes.Entities;

/**
 * Builds the paragraph markup used in bilingual mode: the original text, two line breaks and the
 * translation in italics.
 */
public final class BilingualComposer {

    static final String ORIGINAL_LABEL = "ORIGINAL: ";
    static final String TRANSLATION_LABEL = "TRANSLATION: ";
    static final String SEPARATOR = "<br/><br/>";

    private BilingualComposer() {
    }

    public static String compose(String original, String translated) {
        return ORIGINAL_LABEL + Entities.escape(nullToEmpty(original))
                + SEPARATOR
                + "<i>" + TRANSLATION_LABEL + Entities.escape(nullToEmpty(translated)) + "</i>";
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
