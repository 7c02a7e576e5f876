package com.nilsson.promptextractor.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 <h2>BatchSummary</h2>
 <p>
 Aggregate outcome of one batch run, returned to the caller.
 </p>
 <ul>
 <li>{@code successCount + errorCount} equals the number of files dispatched.</li>
 <li>{@code outputPath} is absent when no input file was found, or when writing failed;
 in the latter case {@code writeFailure} holds the reason.</li>
 </ul>
 */
public final class BatchSummary {

    private final Path outputPath;
    private final int successCount;
    private final int errorCount;
    private final Duration elapsed;
    private final String writeFailure;

    private BatchSummary(Path outputPath, int successCount, int errorCount, Duration elapsed, String writeFailure) {
        this.outputPath = outputPath;
        this.successCount = successCount;
        this.errorCount = errorCount;
        this.elapsed = Objects.requireNonNull(elapsed, "elapsed");
        this.writeFailure = writeFailure;
    }

    public static BatchSummary noInput() {
        return new BatchSummary(null, 0, 0, Duration.ZERO, null);
    }

    public static BatchSummary written(Path outputPath, int successCount, int errorCount, Duration elapsed) {
        return new BatchSummary(Objects.requireNonNull(outputPath, "outputPath"), successCount, errorCount, elapsed, null);
    }

    public static BatchSummary unwritten(String writeFailure, int successCount, int errorCount, Duration elapsed) {
        return new BatchSummary(null, successCount, errorCount, elapsed, Objects.requireNonNull(writeFailure, "writeFailure"));
    }

    public Optional<Path> getOutputPath() {
        return Optional.ofNullable(outputPath);
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public int getProcessedCount() {
        return successCount + errorCount;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public double getElapsedSeconds() {
        return elapsed.toNanos() / 1_000_000_000.0;
    }

    public Optional<String> getWriteFailure() {
        return Optional.ofNullable(writeFailure);
    }

    @Override
    public String toString() {
        return "BatchSummary{output=" + outputPath
                + ", success=" + successCount
                + ", errors=" + errorCount
                + ", elapsed=" + elapsed
                + (writeFailure != null ? ", writeFailure=" + writeFailure : "")
                + "}";
    }
}
