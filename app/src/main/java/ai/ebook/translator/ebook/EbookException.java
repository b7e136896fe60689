package ai.ebook.translator.ebook;

/**
 * Raised when an e-book cannot be read, parsed or written.
 */
public class EbookException extends RuntimeException {

    public EbookException(String message) {
        super(message);
    }

    public EbookException(String message, Throwable cause) {
        super(message, cause);
    }
}
