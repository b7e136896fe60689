package ai.ebook.translator.text;

import java.util.regex.Pattern;

/**
 * Flattens paragraph text before chunking and before it is shown as the original in bilingual output.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String flattened = text.replace('\n', ' ')
                .replace('\r', ' ')
                .replace('’', '\'')
                .replace('‘', '\'');
        return WHITESPACE.matcher(flattened).replaceAll(" ").strip();
    }
}
