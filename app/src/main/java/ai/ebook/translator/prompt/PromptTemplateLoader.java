package ai.ebook.translator.prompt;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads prompt templates from disk or from the bundled classpath resource and validates their
 * placeholders.
 *
 * <p>Placeholders are written as {@code {{name}}}; whitespace inside the braces is tolerated so
 * templates written as {@code {{ language }}} keep working.</p>
 */
public class PromptTemplateLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(PromptTemplateLoader.class);

    static final String DEFAULT_TEMPLATE_RESOURCE = "/prompts/translate.txt";

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{([^{}]*)}}");
    private static final Pattern NAME_PATTERN = Pattern.compile("\\w+");

    public TranslationPromptTemplate load(Path templatePath) {
        Objects.requireNonNull(templatePath, "templatePath");
        if (!Files.isRegularFile(templatePath)) {
            throw new PromptTemplateException("Prompt template not found: " + templatePath);
        }
        String content;
        try {
            content = Files.readString(templatePath, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new PromptTemplateException("Failed to read prompt template: " + templatePath, ex);
        }
        return parse(templatePath.toString(), content);
    }

    public TranslationPromptTemplate loadDefault() {
        try (InputStream stream = PromptTemplateLoader.class.getResourceAsStream(DEFAULT_TEMPLATE_RESOURCE)) {
            if (stream == null) {
                throw new PromptTemplateException("Bundled prompt template is missing: " + DEFAULT_TEMPLATE_RESOURCE);
            }
            return parse("classpath:" + DEFAULT_TEMPLATE_RESOURCE, new String(stream.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new PromptTemplateException("Failed to read bundled prompt template", ex);
        }
    }

    public TranslationPromptTemplate parse(String source, String content) {
        if (content == null || content.isBlank()) {
            throw new PromptTemplateException("Prompt template is empty: " + source);
        }
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(content);
        StringBuilder normalized = new StringBuilder(content.length());
        Set<String> referenced = new LinkedHashSet<>();
        int last = 0;
        while (matcher.find()) {
            String name = matcher.group(1).strip();
            if (!NAME_PATTERN.matcher(name).matches() || !TranslationPromptTemplate.PLACEHOLDERS.contains(name)) {
                throw new PromptTemplateException("Prompt template %s references undefined placeholder '{{%s}}'; supported placeholders are %s"
                        .formatted(source, matcher.group(1), TranslationPromptTemplate.PLACEHOLDERS));
            }
            referenced.add(name);
            normalized.append(content, last, matcher.start()).append("{{").append(name).append("}}");
            last = matcher.end();
        }
        String remainder = content.substring(last);
        if (remainder.contains("{{")) {
            throw new PromptTemplateException("Prompt template %s contains an unterminated placeholder".formatted(source));
        }
        normalized.append(remainder);
        if (!referenced.contains(TranslationPromptTemplate.TEXT)) {
            throw new PromptTemplateException("Prompt template %s must reference {{text}}".formatted(source));
        }
        LOGGER.debug("Loaded prompt template {} with placeholders {}", source, referenced);
        return new TranslationPromptTemplate(source, normalized.toString());
    }
}
