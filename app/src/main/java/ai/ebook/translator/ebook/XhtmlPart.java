package ai.ebook.translator.ebook;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import nl.siegmann.epublib.domain.Resource;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Entities;
import org.jsoup.parser.Parser;

/**
 * XHTML content resource whose {@code <p>} elements are the text units. The markup is parsed on first
 * access with jsoup's XML parser so that serializing it again keeps the document well-formed.
 */
final class XhtmlPart implements DocumentPart {

    private static final String PARAGRAPH_SELECTOR = "p";

    private final Resource resource;
    private Document markup;
    private List<TextUnit> textUnits;
    private boolean modified;

    XhtmlPart(Resource resource) {
        this.resource = Objects.requireNonNull(resource, "resource");
    }

    @Override
    public String name() {
        return resource.getHref();
    }

    @Override
    public List<TextUnit> textUnits() {
        if (textUnits == null) {
            textUnits = markup().select(PARAGRAPH_SELECTOR).stream()
                    .map(element -> (TextUnit) new XhtmlTextUnit(element, this::markModified))
                    .collect(Collectors.toUnmodifiableList());
        }
        return textUnits;
    }

    @Override
    public void commit() {
        if (!modified) {
            return;
        }
        resource.setData(markup.outerHtml().getBytes(StandardCharsets.UTF_8));
        resource.setInputEncoding(StandardCharsets.UTF_8.name());
        modified = false;
    }

    private void markModified() {
        modified = true;
    }

    private Document markup() {
        if (markup == null) {
            String content = new String(readData(), charsetOf(resource));
            Document parsed = Jsoup.parse(content, "", Parser.xmlParser());
            parsed.outputSettings()
                    .syntax(Document.OutputSettings.Syntax.xml)
                    .escapeMode(Entities.EscapeMode.xhtml)
                    .charset(StandardCharsets.UTF_8)
                    .prettyPrint(false);
            parsed.updateMetaCharsetElement(true);
            markup = parsed;
        }
        return markup;
    }

    private byte[] readData() {
        try {
            return resource.getData();
        } catch (Exception ex) {
            throw new EbookException("Failed to read content part " + resource.getHref(), ex);
        }
    }

    private static Charset charsetOf(Resource resource) {
        String encoding = resource.getInputEncoding();
        if (encoding == null || encoding.isBlank()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(encoding.strip());
        } catch (IllegalArgumentException ex) {
            // unknown or illegal charset names fall back to the EPUB default
            return StandardCharsets.UTF_8;
        }
    }
}
