package ai.ebook.translator.ebook;

import static org.assertj.core.api.Assertions.assertThat;

import nl.siegmann.epublib.domain.Author;
import nl.siegmann.epublib.domain.Book;
import org.junit.jupiter.api.Test;

class EpubDocumentTest {

    @Test
    void presentsFirstAuthorInDisplayOrder() {
        Book book = new Book();
        // epublib stores a "Austen, Jane" creator with the surname as last name
        book.getMetadata().addAuthor(new Author("Jane", "Austen"));
        book.getMetadata().addAuthor(new Author("Second", "Writer"));

        assertThat(new EpubDocument(book).author()).contains("Jane Austen");
    }

    @Test
    void usesSingleNamePartWhenOnlyOneIsKnown() {
        Book book = new Book();
        book.getMetadata().addAuthor(new Author("", "Homer"));

        assertThat(new EpubDocument(book).author()).contains("Homer");
    }

    @Test
    void usesFirstTitle() {
        Book book = new Book();
        book.getMetadata().addTitle(" Emma ");
        book.getMetadata().addTitle("Subtitle");

        assertThat(new EpubDocument(book).title()).contains("Emma");
    }
}
