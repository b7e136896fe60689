package ai.ebook.translator.cli;

import ai.ebook.translator.translate.TranslationMode;
import picocli.CommandLine;

/**
 * Parses translation mode CLI options such as {@code production}, {@code dry-run} or {@code mock}.
 */
public class TranslationModeConverter implements CommandLine.ITypeConverter<TranslationMode> {
    @Override
    public TranslationMode convert(String value) {
        return TranslationMode.from(value);
    }
}
