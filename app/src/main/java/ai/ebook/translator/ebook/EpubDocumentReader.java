package ai.ebook.translator.ebook;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import nl.siegmann.epublib.domain.Book;
import nl.siegmann.epublib.epub.EpubReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens EPUB archives with epublib.
 */
public class EpubDocumentReader implements EbookReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(EpubDocumentReader.class);

    @Override
    public EbookDocument read(Path inputPath) {
        Objects.requireNonNull(inputPath, "inputPath");
        if (!Files.isRegularFile(inputPath)) {
            throw new EbookException("Input e-book not found: " + inputPath);
        }
        Book book;
        try (InputStream in = Files.newInputStream(inputPath)) {
            book = new EpubReader().readEpub(in);
        } catch (IOException ex) {
            throw new EbookException("Failed to read e-book: " + inputPath, ex);
        } catch (RuntimeException ex) {
            throw new EbookException("Malformed e-book: " + inputPath, ex);
        }
        EpubDocument document = new EpubDocument(book);
        LOGGER.info("Opened {} with {} content parts", inputPath, document.parts().size());
        return document;
    }
}
