package ai.ebook.translator.pipeline;

/**
 * Receives {@code (current, total)} once per visited paragraph, including paragraphs that had nothing
 * to translate. Called synchronously on the thread running the translation.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (current, total) -> { };

    void onProgress(int current, int total);
}
