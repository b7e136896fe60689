package ai.ebook.translator.ebook;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * In-memory e-book owned by a single translation run.
 */
public interface EbookDocument {

    List<DocumentPart> parts();

    Optional<String> title();

    Optional<String> author();

    void save(Path outputPath);
}
