package ai.ebook.translator.prompt;

import dev.langchain4j.model.input.PromptTemplate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validated prompt template with the named placeholders {@code language}, {@code text},
 * {@code genre}, {@code title} and {@code author}.
 *
 * <p>Instances are created by {@link PromptTemplateLoader}, which rejects unknown placeholders before
 * any chunk is rendered.</p>
 */
public final class TranslationPromptTemplate {

    public static final String LANGUAGE = "language";
    public static final String TEXT = "text";
    public static final String GENRE = "genre";
    public static final String TITLE = "title";
    public static final String AUTHOR = "author";

    static final Set<String> PLACEHOLDERS = Set.of(LANGUAGE, TEXT, GENRE, TITLE, AUTHOR);

    private final String source;
    private final PromptTemplate template;

    TranslationPromptTemplate(String source, String normalizedTemplate) {
        this.source = Objects.requireNonNull(source, "source");
        this.template = PromptTemplate.from(normalizedTemplate);
    }

    public String render(String text, PromptContext context) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(context, "context");
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(LANGUAGE, context.language());
        values.put(TEXT, text);
        values.put(GENRE, context.genre());
        values.put(TITLE, context.title());
        values.put(AUTHOR, context.author());
        return template.apply(values).text();
    }

    /**
     * Where the template was loaded from, for log messages.
     */
    public String source() {
        return source;
    }
}
