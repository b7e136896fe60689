package ai.ebook.translator.ebook;

/**
 * Paragraph-like element inside a document part. A unit is a position in the part's markup,
 * so replacing its content mutates the owning part.
 */
public interface TextUnit {

    /**
     * Plain text of the element as found in the source markup, possibly empty.
     */
    String text();

    /**
     * Replaces the element's children with a single text node.
     */
    void replaceText(String text);

    /**
     * Replaces the element's children with parsed markup.
     */
    void replaceMarkup(String markup);
}
