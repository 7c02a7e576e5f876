package com.nilsson.promptextractor.service;

import com.nilsson.promptextractor.model.BatchSummary;
import com.nilsson.promptextractor.model.ExtractionResult;

import java.nio.file.Path;

/**
 Receives progress and failure events from {@link BatchCoordinator}. All callbacks are invoked on the
 thread that called {@link BatchCoordinator#process}, never from worker threads.
 */
public interface BatchListener {

    default void onNoInput(Path directory) {
    }

    default void onStart(Path directory, int total) {
    }

    default void onProgress(int completed, int total) {
    }

    /**
     Structured failure event: file identifier, reason and detail.
     */
    default void onFailure(ExtractionResult.Failure failure) {
    }

    default void onWriteFailure(Path directory, Exception cause) {
    }

    default void onComplete(BatchSummary summary) {
    }
}
