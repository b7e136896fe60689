package ai.ebook.translator.ebook;

import java.util.List;

/**
 * One content resource of an e-book, such as a chapter file.
 */
public interface DocumentPart {

    String name();

    /**
     * Paragraph elements of this part in document order. Repeated calls return the same units.
     */
    List<TextUnit> textUnits();

    /**
     * Serializes the mutated markup back into the owning document. A part that was never modified is
     * left byte-for-byte untouched.
     */
    void commit();
}
