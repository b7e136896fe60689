package ai.ebook.translator.text;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Segments text into sentences using the locale-sensitive rules of {@link BreakIterator}.
 */
public class SentenceSplitter {

    private final Locale locale;

    public SentenceSplitter() {
        this(Locale.ROOT);
    }

    public SentenceSplitter(Locale locale) {
        this.locale = Objects.requireNonNull(locale, "locale");
    }

    public List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        // BreakIterator is stateful, so each call gets its own instance
        BreakIterator iterator = BreakIterator.getSentenceInstance(locale);
        iterator.setText(text);
        List<String> sentences = new ArrayList<>();
        int start = iterator.first();
        int end = iterator.next();
        while (end != BreakIterator.DONE) {
            String sentence = text.substring(start, end).strip();
            if (!sentence.isEmpty()) {
                sentences.add(sentence);
            }
            start = end;
            end = iterator.next();
        }
        return sentences;
    }

    public Locale locale() {
        return locale;
    }
}
