package com.nilsson.promptextractor.service;

import com.nilsson.promptextractor.data.ExtractorSettings;
import com.nilsson.promptextractor.model.ExtractionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 <h2>ResultWriter</h2>
 <p>
 Writes the successful extractions of a batch to a new, timestamped text file.
 </p>
 <h3>Format:</h3>
 <p>
 Entries are sorted by identifier. Each one is a label line, the prompt, and a blank separator:
 </p>
 <pre>
 image_001.pngのprompt
 a castle on a hill, golden hour

 </pre>
 <p>
 The file is created with {@code CREATE_NEW}. If a file with the same timestamped name already
 exists, a numeric suffix is appended rather than overwriting it. If writing fails once the file
 exists, the incomplete file is deleted before the error is rethrown.
 </p>
 */
public class ResultWriter {

    private static final Logger logger = LoggerFactory.getLogger(ResultWriter.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String LABEL_SUFFIX = "のprompt";
    private static final String EXTENSION = ".txt";
    private static final int MAX_NAME_ATTEMPTS = 100;

    private final Clock clock;
    private final String prefix;

    @Inject
    public ResultWriter(Clock clock, ExtractorSettings settings) {
        this(clock, settings.getOutputPrefix());
    }

    public ResultWriter(Clock clock, String prefix) {
        this.clock = clock;
        this.prefix = prefix;
    }

    /**
     Writes all entries into a new file inside {@code directory}.
     @param directory Target directory; created if it does not exist.
     @param entries   Successful extractions, in any order.

     @return The path of the file that was created.
     @throws IOException if the directory or file cannot be created or written.
     */
    public Path write(Path directory, List<ExtractionResult.Success> entries) throws IOException {
        Files.createDirectories(directory);

        List<ExtractionResult.Success> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(ExtractionResult::getIdentifier));

        String baseName = prefix + LocalDateTime.now(clock).format(TIMESTAMP);

        for (int attempt = 1; attempt <= MAX_NAME_ATTEMPTS; attempt++) {
            Path target = directory.resolve(attempt == 1 ? baseName + EXTENSION : baseName + "_" + attempt + EXTENSION);
            OutputStream out;
            try {
                out = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            } catch (FileAlreadyExistsException e) {
                logger.debug("Output name taken, trying next suffix: {}", target.getFileName());
                continue;
            }
            try (BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8))) {
                writeEntries(writer, sorted);
            } catch (IOException | RuntimeException e) {
                discardPartial(target, e);
                throw e;
            }
            logger.debug("Wrote {} entries to {}", sorted.size(), target);
            return target;
        }
        throw new FileAlreadyExistsException(directory.resolve(baseName + EXTENSION).toString(),
                null, "No free output name after " + MAX_NAME_ATTEMPTS + " attempts");
    }

    /**
     Renders the sorted entries in the flat label/prompt/blank-line layout.
     */
    protected void writeEntries(Writer writer, List<ExtractionResult.Success> sorted) throws IOException {
        for (ExtractionResult.Success entry : sorted) {
            writer.write(entry.getIdentifier() + LABEL_SUFFIX);
            writer.write('\n');
            writer.write(entry.getPrompt());
            writer.write("\n\n");
        }
    }

    // A failed write must not leave a truncated result file behind.
    private static void discardPartial(Path target, Exception cause) {
        try {
            Files.deleteIfExists(target);
            logger.debug("Removed incomplete output {}", target);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }
}
