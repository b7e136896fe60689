package ai.ebook.translator.cli;

import ai.ebook.translator.pipeline.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports progress to the log in steps of ten percent, with every paragraph at debug level.
 */
final class ProgressLogger implements ProgressListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressLogger.class);
    private static final int STEP_PERCENT = 10;

    private int lastReportedStep = -1;

    @Override
    public void onProgress(int current, int total) {
        LOGGER.debug("Paragraph {}/{}", current, total);
        int percent = total == 0 ? 100 : (int) ((current * 100L) / total);
        int step = percent / STEP_PERCENT;
        if (step > lastReportedStep) {
            lastReportedStep = step;
            LOGGER.info("Progress: {}/{} paragraphs ({}%)", current, total, percent);
        }
    }
}
