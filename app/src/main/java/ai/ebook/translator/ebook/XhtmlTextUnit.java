package ai.ebook.translator.ebook;

import java.util.Objects;
import org.jsoup.nodes.Element;

final class XhtmlTextUnit implements TextUnit {

    private final Element element;
    private final Runnable onChange;

    XhtmlTextUnit(Element element, Runnable onChange) {
        this.element = Objects.requireNonNull(element, "element");
        this.onChange = Objects.requireNonNull(onChange, "onChange");
    }

    @Override
    public String text() {
        return element.text();
    }

    @Override
    public void replaceText(String text) {
        element.text(Objects.requireNonNull(text, "text"));
        onChange.run();
    }

    @Override
    public void replaceMarkup(String markup) {
        element.html(Objects.requireNonNull(markup, "markup"));
        onChange.run();
    }
}
