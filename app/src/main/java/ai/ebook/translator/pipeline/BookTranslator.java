package ai.ebook.translator.pipeline;

import ai.ebook.translator.ebook.BookMetadata;
import ai.ebook.translator.ebook.DocumentPart;
import ai.ebook.translator.ebook.EbookDocument;
import ai.ebook.translator.ebook.EbookReader;
import ai.ebook.translator.ebook.TextUnit;
import ai.ebook.translator.prompt.PromptContext;
import ai.ebook.translator.prompt.PromptTemplateLoader;
import ai.ebook.translator.prompt.TranslationPromptTemplate;
import ai.ebook.translator.text.TextChunker;
import ai.ebook.translator.text.TextNormalizer;
import ai.ebook.translator.translate.TranslationInvoker;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Walks every paragraph of an e-book in document order, translates it and writes the result back in place.
 *
 * <p>The run is strictly sequential: one part, one paragraph, one chunk and one backend call at a time.
 * Template, read and write failures abort the run; failed chunks only shorten the paragraph they belong to.</p>
 */
public class BookTranslator {

    private static final Logger LOGGER = LoggerFactory.getLogger(BookTranslator.class);
    static final String MDC_PART = "part";

    private final EbookReader reader;
    private final PromptTemplateLoader templateLoader;
    private final TextChunker chunker;
    private final TranslationInvoker invoker;

    public BookTranslator(EbookReader reader, PromptTemplateLoader templateLoader, TextChunker chunker, TranslationInvoker invoker) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.templateLoader = Objects.requireNonNull(templateLoader, "templateLoader");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
    }

    public TranslationReport translate(BookTranslationRequest request, ProgressListener listener) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(listener, "listener");

        TranslationPromptTemplate template = request.templatePath()
                .map(templateLoader::load)
                .orElseGet(templateLoader::loadDefault);
        EbookDocument document = reader.read(request.inputPath());
        BookMetadata metadata = BookMetadata.resolve(document, request.overrideTitle(), request.overrideAuthor());
        int total = countParagraphs(document);
        int maxTokens = TextChunker.budgetFor(request.tokenLimit());
        LOGGER.info("Translating \"{}\" by {} into {}: {} paragraphs in {} parts, chunk budget {} tokens, template {}",
                metadata.title(), metadata.author(), request.targetLanguage(), total, document.parts().size(), maxTokens, template.source());

        PromptContext context = new PromptContext(request.targetLanguage(), request.genre(), metadata.title(), metadata.author());
        ParagraphTranslator paragraphTranslator = new ParagraphTranslator(chunker, template, context, invoker, maxTokens);
        ProgressCounter progress = new ProgressCounter(total, listener);

        int translatedParagraphs = 0;
        int translatedChunks = 0;
        int droppedChunks = 0;
        for (DocumentPart part : document.parts()) {
            MDC.put(MDC_PART, part.name());
            try {
                LOGGER.debug("Translating part {} ({} paragraphs)", part.name(), part.textUnits().size());
                for (TextUnit unit : part.textUnits()) {
                    String original = TextNormalizer.normalize(unit.text());
                    if (!original.isEmpty()) {
                        ParagraphTranslator.Result result = paragraphTranslator.translate(original);
                        if (request.bilingual()) {
                            unit.replaceMarkup(BilingualComposer.compose(original, result.text()));
                        } else {
                            unit.replaceText(result.text());
                        }
                        translatedParagraphs++;
                        translatedChunks += result.translatedChunks();
                        droppedChunks += result.droppedChunks();
                    }
                    progress.advance();
                }
                part.commit();
            } finally {
                MDC.remove(MDC_PART);
            }
        }

        document.save(request.outputPath());
        TranslationReport report = new TranslationReport(request.outputPath(), metadata, document.parts().size(),
                progress.current(), translatedParagraphs, translatedChunks, droppedChunks);
        if (report.hasDroppedChunks()) {
            LOGGER.warn("{} chunks could not be translated and were left out of the output", droppedChunks);
        }
        return report;
    }

    static int countParagraphs(EbookDocument document) {
        int total = 0;
        for (DocumentPart part : document.parts()) {
            total += part.textUnits().size();
        }
        return total;
    }
}
