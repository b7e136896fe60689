package ai.ebook.translator.ebook;

import java.nio.file.Path;

@FunctionalInterface
public interface EbookReader {

    EbookDocument read(Path inputPath);
}
