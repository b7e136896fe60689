package ai.ebook.translator.pipeline;

import ai.ebook.translator.ebook.BookMetadata;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of a completed run. Dropped chunks are reported for logging only; they do not make the run fail.
 */
public record TranslationReport(
        Path outputPath,
        BookMetadata metadata,
        int parts,
        int paragraphs,
        int translatedParagraphs,
        int translatedChunks,
        int droppedChunks
) {

    public TranslationReport {
        Objects.requireNonNull(outputPath, "outputPath");
        Objects.requireNonNull(metadata, "metadata");
    }

    public boolean hasDroppedChunks() {
        return droppedChunks > 0;
    }
}
