package ai.ebook.translator.cli;

import ai.ebook.translator.config.LogFormat;
import ai.ebook.translator.translate.TranslationMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "ebook-translator", mixinStandardHelpOptions = true,
        description = "Translates the paragraphs of an EPUB book with a language model while keeping its markup")
public class CliArguments {

    @CommandLine.Option(names = {"-i", "--input"}, description = "Source EPUB file", paramLabel = "FILE")
    private Path inputPath;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Where the translated EPUB is written", paramLabel = "FILE")
    private Path outputPath;

    @CommandLine.Option(names = {"-l", "--language"}, description = "Target language, e.g. English or Indonesian", paramLabel = "LANGUAGE")
    private String targetLanguage;

    @CommandLine.Option(names = {"-m", "--model"}, description = "Model name used by the LLM provider", paramLabel = "MODEL")
    private String modelName;

    @CommandLine.Option(names = "--token-limit", description = "Context size of the model in tokens; half of it is used per chunk", paramLabel = "TOKENS")
    private Integer tokenLimit;

    @CommandLine.Option(names = {"-t", "--template"}, description = "Prompt template file with {{language}}, {{text}}, {{genre}}, {{title}} and {{author}}", paramLabel = "FILE")
    private Path templatePath;

    @CommandLine.Option(names = {"-g", "--genre"}, description = "Genre of the book, passed to the prompt", paramLabel = "GENRE")
    private String genre;

    @CommandLine.Option(names = "--bilingual", description = "Keep the original text above each translated paragraph")
    private boolean bilingual;

    @CommandLine.Option(names = "--title", description = "Book title to use instead of the EPUB metadata", paramLabel = "TITLE")
    private String title;

    @CommandLine.Option(names = "--author", description = "Book author to use instead of the EPUB metadata", paramLabel = "AUTHOR")
    private String author;

    @CommandLine.Option(names = "--sentence-locale", description = "Locale for sentence segmentation, e.g. en or fr-FR", paramLabel = "LOCALE")
    private String sentenceLocale;

    @CommandLine.Option(names = "--translation-mode", description = "Translation execution mode: production, dry-run, or mock", converter = TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log debug output")
    private boolean verbose;

    public Path inputPath() {
        return inputPath;
    }

    public Path outputPath() {
        return outputPath;
    }

    public String targetLanguage() {
        return targetLanguage;
    }

    public String modelName() {
        return modelName;
    }

    public Integer tokenLimit() {
        return tokenLimit;
    }

    public Path templatePath() {
        return templatePath;
    }

    public String genre() {
        return genre;
    }

    public boolean bilingual() {
        return bilingual;
    }

    public String title() {
        return title;
    }

    public String author() {
        return author;
    }

    public String sentenceLocale() {
        return sentenceLocale;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
