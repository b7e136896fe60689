package ai.ebook.translator.ebook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import nl.siegmann.epublib.domain.Author;
import nl.siegmann.epublib.domain.Book;
import nl.siegmann.epublib.domain.Resource;
import nl.siegmann.epublib.epub.EpubWriter;
import nl.siegmann.epublib.service.MediatypeService;

/**
 * EPUB backed document. Parts are the XHTML resources in reading order (spine, table of contents and
 * guide) followed by any XHTML resource that is not referenced from them, ordered by href.
 */
public class EpubDocument implements EbookDocument {

    private final Book book;
    private List<DocumentPart> parts;

    public EpubDocument(Book book) {
        this.book = Objects.requireNonNull(book, "book");
    }

    @Override
    public List<DocumentPart> parts() {
        if (parts == null) {
            parts = collectParts();
        }
        return parts;
    }

    @Override
    public Optional<String> title() {
        List<String> titles = book.getMetadata().getTitles();
        if (titles == null || titles.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(titles.get(0)).map(String::strip).filter(value -> !value.isEmpty());
    }

    /**
     * First creator in display order. epublib splits {@code "Austen, Jane"} into last and first name, so it
     * is returned as {@code "Jane Austen"}.
     */
    @Override
    public Optional<String> author() {
        List<Author> authors = book.getMetadata().getAuthors();
        if (authors == null || authors.isEmpty()) {
            return Optional.empty();
        }
        Author first = authors.get(0);
        String name = (nullToEmpty(first.getFirstname()) + " " + nullToEmpty(first.getLastname())).strip();
        return name.isEmpty() ? Optional.empty() : Optional.of(name);
    }

    @Override
    public void save(Path outputPath) {
        Objects.requireNonNull(outputPath, "outputPath");
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(outputPath)) {
                new EpubWriter().write(book, out);
            }
        } catch (IOException ex) {
            throw new EbookException("Failed to write e-book: " + outputPath, ex);
        }
    }

    Book book() {
        return book;
    }

    private List<DocumentPart> collectParts() {
        Map<String, Resource> ordered = new LinkedHashMap<>();
        for (Resource resource : book.getContents()) {
            if (isXhtml(resource)) {
                ordered.putIfAbsent(resource.getHref(), resource);
            }
        }
        book.getResources().getAll().stream()
                .filter(EpubDocument::isXhtml)
                .sorted(Comparator.comparing(Resource::getHref))
                .forEach(resource -> ordered.putIfAbsent(resource.getHref(), resource));
        List<DocumentPart> result = new ArrayList<>(ordered.size());
        for (Resource resource : ordered.values()) {
            result.add(new XhtmlPart(resource));
        }
        return List.copyOf(result);
    }

    private static boolean isXhtml(Resource resource) {
        return resource != null && resource.getMediaType() == MediatypeService.XHTML;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
