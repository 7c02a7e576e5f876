package com.nilsson.promptextractor.service;

import com.nilsson.promptextractor.data.ExtractorSettings;
import com.nilsson.promptextractor.model.BatchSummary;
import com.nilsson.promptextractor.model.ExtractionResult;
import com.nilsson.promptextractor.model.FailureReason;
import com.nilsson.promptextractor.model.RawAnnotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 <h2>BatchCoordinator</h2>
 <p>
 Runs prompt extraction over one folder of images and writes the aggregated result.
 </p>

 <h3>Pipeline:</h3>
 <ul>
 <li><b>Enumeration:</b> regular files directly inside the folder with the configured extension
 (case-insensitive). Subfolders are not visited. The list is sorted by file name and then cut to the cap,
 so the same folder always yields the same batch.</li>
 <li><b>Fan-out:</b> one task per file on a fixed pool of at most {@code maxWorkers} daemon threads.
 Each task runs {@link MetadataReader} then {@link PromptParser} and returns an {@link ExtractionResult}.</li>
 <li><b>Fan-in:</b> results are drained from an {@link ExecutorCompletionService} by the calling thread,
 which alone owns the counters and the success list.</li>
 <li><b>Output:</b> successes go to {@link ResultWriter}; the elapsed time covers dispatch to write completion.</li>
 </ul>

 <h3>Failure Model:</h3>
 <p>
 A file that cannot be decoded, carries no prompt, or throws anything at all becomes a
 {@link ExtractionResult.Failure}. No task failure aborts its siblings. An unwritable output location is
 reported through {@link BatchSummary#getWriteFailure()}.
 </p>
 */
public class BatchCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(BatchCoordinator.class);

    private final MetadataReader metadataReader;
    private final PromptParser promptParser;
    private final ResultWriter resultWriter;
    private final BatchListener listener;
    private final ExtractorSettings settings;

    @Inject
    public BatchCoordinator(MetadataReader metadataReader,
                            PromptParser promptParser,
                            ResultWriter resultWriter,
                            BatchListener listener,
                            ExtractorSettings settings) {
        this.metadataReader = metadataReader;
        this.promptParser = promptParser;
        this.resultWriter = resultWriter;
        this.listener = listener;
        this.settings = settings;
    }

    // --- Public API ---

    /**
     Processes {@code directory} with the configured worker count and file cap.
     */
    public BatchSummary process(Path directory) {
        return process(directory, settings.getMaxWorkers(), settings.getFileCap());
    }

    public BatchSummary process(Path directory, int maxWorkers) {
        return process(directory, maxWorkers, settings.getFileCap());
    }

    /**
     Extracts the prompts of up to {@code cap} images in {@code directory} using at most
     {@code maxWorkers} concurrent tasks.
     @return The batch summary. Never null; per-file failures are counted, not thrown.
     @throws IllegalArgumentException if the path is not a directory or a limit is not positive.
     @throws UncheckedIOException     if the directory exists but its entries cannot be read.
     @throws IllegalStateException    if the calling thread is interrupted while waiting for results.
     */
    public BatchSummary process(Path directory, int maxWorkers, int cap) {
        if (maxWorkers < 1) throw new IllegalArgumentException("maxWorkers must be at least 1, was " + maxWorkers);
        if (cap < 1) throw new IllegalArgumentException("cap must be at least 1, was " + cap);
        if (directory == null || !Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Not a directory: " + directory);
        }

        List<Path> files = listCandidates(directory, cap);
        if (files.isEmpty()) {
            listener.onNoInput(directory);
            BatchSummary summary = BatchSummary.noInput();
            listener.onComplete(summary);
            return summary;
        }

        int total = files.size();
        listener.onStart(directory, total);
        long start = System.nanoTime();

        List<ExtractionResult.Success> successes = new ArrayList<>();
        int errorCount = 0;

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(maxWorkers, total), new WorkerThreadFactory());
        try {
            CompletionService<ExtractionResult> completion = new ExecutorCompletionService<>(pool);
            Map<Future<ExtractionResult>, Path> submitted = new HashMap<>();
            for (Path file : files) {
                submitted.put(completion.submit(() -> extract(file)), file);
            }

            for (int completed = 1; completed <= total; completed++) {
                Future<ExtractionResult> future = completion.take();
                ExtractionResult result = resolve(future, submitted.get(future));

                if (result.isSuccess()) {
                    successes.add((ExtractionResult.Success) result);
                } else {
                    errorCount++;
                    listener.onFailure((ExtractionResult.Failure) result);
                }
                listener.onProgress(completed, total);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while processing " + directory, e);
        } finally {
            pool.shutdownNow();
        }

        BatchSummary summary;
        try {
            Path output = resultWriter.write(directory, successes);
            summary = BatchSummary.written(output, successes.size(), errorCount, Duration.ofNanos(System.nanoTime() - start));
        } catch (IOException e) {
            listener.onWriteFailure(directory, e);
            summary = BatchSummary.unwritten(e.toString(), successes.size(), errorCount, Duration.ofNanos(System.nanoTime() - start));
        }

        listener.onComplete(summary);
        return summary;
    }

    /**
     The per-file task: read the annotations, then parse the prompt. Never throws for ordinary
     faults; they are returned as failures.
     */
    public ExtractionResult extract(Path file) {
        String identifier = file.getFileName().toString();
        try {
            RawAnnotation annotation = metadataReader.read(file);
            Optional<String> prompt = promptParser.extractPositive(annotation);
            if (prompt.isEmpty()) {
                throw new NoMatchException(file, annotation.isEmpty()
                        ? "no annotation text"
                        : "annotation text yielded no prompt");
            }
            return ExtractionResult.success(identifier, prompt.get());
        } catch (DecodeException e) {
            return ExtractionResult.failure(identifier, FailureReason.DECODE_ERROR, e.getMessage());
        } catch (NoMatchException e) {
            return ExtractionResult.failure(identifier, FailureReason.NO_MATCH, e.getMessage());
        } catch (RuntimeException e) {
            logger.debug("Unexpected fault while extracting {}", identifier, e);
            return ExtractionResult.failure(identifier, FailureReason.UNEXPECTED, e.toString());
        }
    }

    // --- Internal Helpers ---

    private ExtractionResult resolve(Future<ExtractionResult> future, Path file) throws InterruptedException {
        String identifier = file.getFileName().toString();
        try {
            ExtractionResult result = future.get();
            if (result == null) {
                return ExtractionResult.failure(identifier, FailureReason.UNEXPECTED, "task returned no result");
            }
            return result;
        } catch (ExecutionException e) {
            logger.debug("Worker task for {} terminated abnormally", identifier, e.getCause());
            return ExtractionResult.failure(identifier, FailureReason.UNEXPECTED, String.valueOf(e.getCause()));
        }
    }

    /**
     Matching regular files directly in {@code directory}, sorted by name and cut to {@code cap}.
     @throws UncheckedIOException if the directory cannot be opened or iterated.
     */
    List<Path> listCandidates(Path directory, int cap) {
        String suffix = "." + settings.getExtension().toLowerCase(Locale.ROOT);
        List<Path> files = new ArrayList<>();

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                String name = entry.getFileName().toString().toLowerCase(Locale.ROOT);
                if (name.endsWith(suffix) && Files.isRegularFile(entry)) {
                    files.add(entry);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list directory: " + directory, e);
        } catch (DirectoryIteratorException e) {
            throw new UncheckedIOException("Cannot list directory: " + directory, e.getCause());
        }

        files.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return files.size() > cap ? new ArrayList<>(files.subList(0, cap)) : files;
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("Prompt-Worker-" + count.getAndIncrement());
            return t;
        }
    }
}
