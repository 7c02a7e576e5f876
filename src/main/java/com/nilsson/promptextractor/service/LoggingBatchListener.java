package com.nilsson.promptextractor.service;

import com.nilsson.promptextractor.model.BatchSummary;
import com.nilsson.promptextractor.model.ExtractionResult;
import com.nilsson.promptextractor.model.FailureReason;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.Locale;

/**
 Default {@link BatchListener} that reports through an explicitly supplied SLF4J logger.
 <p>
 Progress is logged at INFO every {@code progressStepPercent} percent (and at completion),
 missing prompts at WARN, decode and unexpected failures at ERROR.
 </p>
 <p>
 Callbacks for one run always arrive on the thread that called
 {@link BatchCoordinator#process}, so the throttling state is kept per thread and one
 instance can serve concurrent runs.
 </p>
 */
public class LoggingBatchListener implements BatchListener {

    private final Logger logger;
    private final int progressStepPercent;
    private final ThreadLocal<Integer> lastLoggedStep = ThreadLocal.withInitial(() -> -1);

    public LoggingBatchListener(Logger logger, int progressStepPercent) {
        this.logger = logger;
        this.progressStepPercent = Math.max(1, Math.min(100, progressStepPercent));
    }

    @Override
    public void onNoInput(Path directory) {
        logger.warn("No matching images found in {}", directory);
    }

    @Override
    public void onStart(Path directory, int total) {
        lastLoggedStep.set(-1);
        logger.info("Processing {} images in {}", total, directory);
    }

    @Override
    public void onProgress(int completed, int total) {
        int step = (completed * 100 / total) / progressStepPercent;
        if (step != lastLoggedStep.get() || completed == total) {
            lastLoggedStep.set(step);
            logger.info("Progress: {}/{} ({}%)", completed, total, completed * 100 / total);
        }
    }

    @Override
    public void onFailure(ExtractionResult.Failure failure) {
        if (failure.getReason() == FailureReason.NO_MATCH) {
            logger.warn("No prompt found: {} ({})", failure.getIdentifier(), failure.getDetail());
        } else {
            logger.error("Failed to process {} [{}]: {}", failure.getIdentifier(), failure.getReason(), failure.getDetail());
        }
    }

    @Override
    public void onWriteFailure(Path directory, Exception cause) {
        logger.error("Could not write results to {}", directory, cause);
    }

    @Override
    public void onComplete(BatchSummary summary) {
        lastLoggedStep.remove();
        logger.info("Finished: {} processed, {} succeeded, {} failed in {} s -> {}",
                summary.getProcessedCount(),
                summary.getSuccessCount(),
                summary.getErrorCount(),
                String.format(Locale.ROOT, "%.2f", summary.getElapsedSeconds()),
                summary.getOutputPath().map(Path::toString).orElse("(not written)"));
    }
}
