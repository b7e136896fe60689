package ai.ebook.translator.ebook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import nl.siegmann.epublib.domain.Author;
import nl.siegmann.epublib.domain.Book;
import nl.siegmann.epublib.epub.EpubReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EpubDocumentReaderTest {

    private final EpubDocumentReader reader = new EpubDocumentReader();

    @TempDir
    Path tempDir;

    @Test
    void readsPartsParagraphsAndMetadataInReadingOrder() throws Exception {
        Path input = EpubFixtures.writeBook(tempDir.resolve("in.epub"), "Le Petit Prince", new Author("Antoine", "Saint-Exupéry"),
                chapters());

        EbookDocument document = reader.read(input);

        assertThat(document.parts()).extracting(DocumentPart::name).containsExactly("chapter1.xhtml", "chapter2.xhtml");
        assertThat(document.parts().get(0).textUnits()).extracting(TextUnit::text)
                .containsExactly("Hello world.", "");
        assertThat(document.parts().get(1).textUnits()).extracting(TextUnit::text)
                .containsExactly("It was a bright day.");
        assertThat(document.title()).contains("Le Petit Prince");
        assertThat(document.author()).contains("Antoine Saint-Exupéry");
    }

    @Test
    void reportsMissingMetadataAsEmpty() throws Exception {
        Path input = EpubFixtures.writeBook(tempDir.resolve("in.epub"), null, null, chapters());

        EbookDocument document = reader.read(input);

        assertThat(document.title()).isEmpty();
        assertThat(document.author()).isEmpty();
        assertThat(BookMetadata.resolve(document, Optional.empty(), Optional.empty()))
                .isEqualTo(new BookMetadata(BookMetadata.UNKNOWN_TITLE, BookMetadata.UNKNOWN_AUTHOR));
    }

    @Test
    void savesReplacedTextAndKeepsUntouchedParts() throws Exception {
        Path input = EpubFixtures.writeBook(tempDir.resolve("in.epub"), "Title", new Author("Jane", "Doe"), chapters());
        EpubDocument document = (EpubDocument) reader.read(input);
        byte[] untouched = document.book().getResources().getByHref("chapter2.xhtml").getData();

        DocumentPart first = document.parts().get(0);
        first.textUnits().get(0).replaceText("Bonjour le monde & co.");
        first.commit();
        document.parts().get(1).commit();
        Path output = tempDir.resolve("out/translated.epub");
        document.save(output);

        EbookDocument reread = reader.read(output);
        assertThat(reread.parts().get(0).textUnits()).extracting(TextUnit::text)
                .containsExactly("Bonjour le monde & co.", "");
        assertThat(reread.parts().get(1).textUnits()).extracting(TextUnit::text)
                .containsExactly("It was a bright day.");
        assertThat(reread.title()).contains("Title");
        assertThat(rawPart(output, "chapter2.xhtml")).isEqualTo(new String(untouched, StandardCharsets.UTF_8));
    }

    @Test
    void savesReplacedMarkup() throws Exception {
        Path input = EpubFixtures.writeBook(tempDir.resolve("in.epub"), "Title", null, chapters());
        EbookDocument document = reader.read(input);

        document.parts().get(0).textUnits().get(0).replaceMarkup("ORIGINAL: Hello<br/><br/><i>TRANSLATION: Halo</i>");
        document.parts().get(0).commit();
        Path output = tempDir.resolve("bilingual.epub");
        document.save(output);

        String markup = rawPart(output, "chapter1.xhtml");
        assertThat(markup).contains("<i>TRANSLATION: Halo</i>");
        assertThat(markup).contains("ORIGINAL: Hello<br");
        List<TextUnit> units = reader.read(output).parts().get(0).textUnits();
        assertThat(units.get(0).text()).contains("ORIGINAL: Hello").contains("TRANSLATION: Halo");
    }

    @Test
    void failsWhenInputIsMissing() {
        Path missing = tempDir.resolve("missing.epub");

        assertThatThrownBy(() -> reader.read(missing))
                .isInstanceOf(EbookException.class)
                .hasMessageContaining("not found");
    }

    private static Map<String, String> chapters() {
        Map<String, String> chapters = new LinkedHashMap<>();
        chapters.put("chapter1.xhtml", "<h1>One</h1><p>Hello world.</p><p></p>");
        chapters.put("chapter2.xhtml", "<p>It was a   bright day.</p>");
        return chapters;
    }

    private static String rawPart(Path epub, String href) throws Exception {
        try (InputStream in = Files.newInputStream(epub)) {
            Book book = new EpubReader().readEpub(in);
            return new String(book.getResources().getByHref(href).getData(), StandardCharsets.UTF_8);
        }
    }
}
