package ai.ebook.translator.cli;

import ai.ebook.translator.config.Config;
import ai.ebook.translator.config.ConfigLoader;
import ai.ebook.translator.config.Secrets;
import ai.ebook.translator.config.SystemEnvironmentReader;
import ai.ebook.translator.config.TranslatorConfig;
import ai.ebook.translator.ebook.EbookException;
import ai.ebook.translator.ebook.EbookReader;
import ai.ebook.translator.ebook.EpubDocumentReader;
import ai.ebook.translator.logging.LoggingConfigurator;
import ai.ebook.translator.pipeline.BookTranslationRequest;
import ai.ebook.translator.pipeline.BookTranslator;
import ai.ebook.translator.pipeline.TranslationReport;
import ai.ebook.translator.prompt.PromptTemplateException;
import ai.ebook.translator.prompt.PromptTemplateLoader;
import ai.ebook.translator.text.SentenceSplitter;
import ai.ebook.translator.text.TextChunker;
import ai.ebook.translator.text.TiktokenEstimator;
import ai.ebook.translator.translate.ChatModelTranslator;
import ai.ebook.translator.translate.MockTranslator;
import ai.ebook.translator.translate.PassThroughTranslator;
import ai.ebook.translator.translate.TranslationException;
import ai.ebook.translator.translate.TranslationInvoker;
import ai.ebook.translator.translate.Translator;
import ai.ebook.translator.translate.TranslatorFactory;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and translation pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final EbookReader ebookReader;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()));
    }

    CliApplication(ConfigLoader configLoader) {
        this(configLoader, new EpubDocumentReader());
    }

    CliApplication(ConfigLoader configLoader, EbookReader ebookReader) {
        this.configLoader = configLoader;
        this.ebookReader = ebookReader;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println("Invalid configuration: " + ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.info("Translating {} -> {} (mode={}, provider={}, model={})",
                config.inputPath(), config.outputPath(), config.translationMode(),
                config.translatorConfig().provider(), config.translatorConfig().modelName());

        try {
            BookTranslator bookTranslator = createBookTranslator(config);
            TranslationReport report = bookTranslator.translate(toRequest(config), new ProgressLogger());
            LOGGER.info("Translation finished: {} paragraphs in {} parts, {} chunks translated, {} dropped; written to {}",
                    report.paragraphs(), report.parts(), report.translatedChunks(), report.droppedChunks(), report.outputPath());
            return 0;
        } catch (PromptTemplateException | EbookException | TranslationException | IllegalStateException ex) {
            LOGGER.error("Translation failed: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        } catch (RuntimeException ex) {
            LOGGER.error("Translation failed unexpectedly: {}", ex.toString(), ex);
            return EXIT_FAILURE;
        }
    }

    private BookTranslator createBookTranslator(Config config) {
        TextChunker chunker = new TextChunker(new SentenceSplitter(config.sentenceLocale()), new TiktokenEstimator());
        Translator translator = buildTranslatorFactory(config).select(config.translationMode());
        TranslationInvoker invoker = new TranslationInvoker(translator, config.translatorConfig().retryPolicy());
        return new BookTranslator(ebookReader, new PromptTemplateLoader(), chunker, invoker);
    }

    private BookTranslationRequest toRequest(Config config) {
        return new BookTranslationRequest(config.inputPath(), config.outputPath(), config.targetLanguage(),
                config.genre(), config.tokenLimit(), config.templatePath(), config.bilingual(),
                config.overrideTitle(), config.overrideAuthor());
    }

    private TranslatorFactory buildTranslatorFactory(Config config) {
        return new TranslatorFactory(() -> createProductionTranslator(config), new PassThroughTranslator(), new MockTranslator());
    }

    private Translator createProductionTranslator(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        ChatModel chatModel = switch (translatorConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(translatorConfig);
            case GEMINI -> createGeminiChatModel(translatorConfig, config.secrets());
        };
        return new ChatModelTranslator(chatModel, translatorConfig.provider().name(), translatorConfig.modelName());
    }

    private ChatModel createOllamaChatModel(TranslatorConfig translatorConfig) {
        try {
            String baseUrl = translatorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", translatorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private ChatModel createGeminiChatModel(TranslatorConfig translatorConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", translatorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
