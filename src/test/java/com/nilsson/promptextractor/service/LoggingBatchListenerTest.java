package com.nilsson.promptextractor.service;

import com.nilsson.promptextractor.model.BatchSummary;
import com.nilsson.promptextractor.model.ExtractionResult;
import com.nilsson.promptextractor.model.FailureReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.time.Duration;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LoggingBatchListenerTest {

    @Mock
    private Logger logger;

    private LoggingBatchListener listener;

    @BeforeEach
    void setUp() {
        listener = new LoggingBatchListener(logger, 50);
    }

    @Test
    void testNoMatchIsWarning() {
        listener.onFailure(ExtractionResult.failure("a.png", FailureReason.NO_MATCH, "no annotation text"));

        verify(logger).warn(anyString(), eq("a.png"), eq("no annotation text"));
    }

    @Test
    void testDecodeErrorIsError() {
        listener.onFailure(ExtractionResult.failure("b.png", FailureReason.DECODE_ERROR, "bad"));

        verify(logger).error(anyString(), eq("b.png"), eq(FailureReason.DECODE_ERROR), eq("bad"));
    }

    @Test
    void testProgressIsThrottled() {
        listener.onStart(Path.of("."), 4);
        listener.onProgress(1, 4);
        listener.onProgress(2, 4);
        listener.onProgress(3, 4);
        listener.onProgress(4, 4);

        // 25% opens step 0, 50% opens step 1, 75% stays in step 1, 100% is final
        verify(logger, times(3)).info(eq("Progress: {}/{} ({}%)"), anyInt(), anyInt(), anyInt());
    }

    @Test
    void testConcurrentRunsKeepSeparateProgress() throws Exception {
        listener.onStart(Path.of("a"), 4);
        listener.onProgress(1, 4);

        Thread other = new Thread(() -> {
            listener.onStart(Path.of("b"), 4);
            listener.onProgress(2, 4);
        });
        other.start();
        other.join();

        // the other run reaching 50% must not swallow this run's own step change
        listener.onProgress(2, 4);

        verify(logger, times(3)).info(eq("Progress: {}/{} ({}%)"), anyInt(), anyInt(), anyInt());
    }

    @Test
    void testSummaryIsLogged() {
        listener.onComplete(BatchSummary.written(Path.of("out.txt"), 2, 1, Duration.ofSeconds(3)));

        verify(logger).info(anyString(), eq(3), eq(2), eq(1), eq("3.00"), eq("out.txt"));
    }
}
