package com.nilsson.promptextractor.main;

import com.nilsson.promptextractor.data.ExtractorSettings;
import com.nilsson.promptextractor.model.BatchSummary;
import com.nilsson.promptextractor.service.BatchCoordinator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import javax.inject.Inject;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 <h2>ExtractCommand</h2>
 <p>
 Runs one batch over a folder and prints the summary. Per-file warnings and errors are also
 appended to the run log inside that folder while the batch runs.
 </p>
 <h3>Exit Codes:</h3>
 <ul>
 <li>{@code 0}: batch completed (including the "no images" case).</li>
 <li>{@code 1}: the folder does not exist or is not a directory.</li>
 <li>{@code 2}: prompts were extracted but the output file could not be written.</li>
 </ul>
 */
@Command(name = "extract", mixinStandardHelpOptions = true,
        description = "Extract positive prompts from every image in a folder into a timestamped text file.")
public class ExtractCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", defaultValue = ".",
            description = "Folder containing the images (default: current directory)")
    Path folder;

    @Option(names = "--workers", description = "Number of parallel workers (default: from settings, 4)")
    Integer workers;

    @Option(names = "--cap", description = "Maximum number of images per run (default: from settings, 1000)")
    Integer cap;

    @Spec
    CommandSpec spec;

    private final BatchCoordinator coordinator;
    private final ExtractorSettings settings;

    @Inject
    public ExtractCommand(BatchCoordinator coordinator, ExtractorSettings settings) {
        this.coordinator = coordinator;
        this.settings = settings;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path target = folder.toAbsolutePath().normalize();
        if (!Files.exists(target)) {
            err.println("Error: folder does not exist: " + target);
            return 1;
        }
        if (!Files.isDirectory(target)) {
            err.println("Error: not a directory: " + target);
            return 1;
        }

        int workerCount = workers != null ? workers : settings.getMaxWorkers();
        int fileCap = cap != null ? cap : settings.getFileCap();
        if (workerCount < 1 || fileCap < 1) {
            err.println("Error: --workers and --cap must be at least 1");
            return 1;
        }

        out.println("Target folder: " + target);

        BatchSummary summary;
        try (RunLog ignored = RunLog.attach(target.resolve(settings.getRunLogName()))) {
            summary = coordinator.process(target, workerCount, fileCap);
        }

        if (summary.getProcessedCount() == 0 && summary.getOutputPath().isEmpty()) {
            out.println("No ." + settings.getExtension() + " images found.");
            return 0;
        }

        out.println();
        out.println("Done:");
        out.println("  Processed: " + summary.getProcessedCount());
        out.println("  Succeeded: " + summary.getSuccessCount());
        out.println("  Failed:    " + summary.getErrorCount());
        out.printf("  Elapsed:   %.2f s%n", summary.getElapsedSeconds());

        if (summary.getWriteFailure().isPresent()) {
            err.println("Error: could not write output: " + summary.getWriteFailure().get());
            return 2;
        }
        out.println("  Output:    " + summary.getOutputPath().map(Path::toString).orElse(""));
        return 0;
    }
}
