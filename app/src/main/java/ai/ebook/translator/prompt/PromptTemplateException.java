package ai.ebook.translator.prompt;

/**
 * Raised when a prompt template cannot be read or refers to values that are never supplied.
 */
public class PromptTemplateException extends RuntimeException {

    public PromptTemplateException(String message) {
        super(message);
    }

    public PromptTemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
