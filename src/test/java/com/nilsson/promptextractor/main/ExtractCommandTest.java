package com.nilsson.promptextractor.main;

import com.nilsson.promptextractor.data.ExtractorSettings;
import com.nilsson.promptextractor.service.BatchCoordinator;
import com.nilsson.promptextractor.service.LoggingBatchListener;
import com.nilsson.promptextractor.service.MetadataReader;
import com.nilsson.promptextractor.service.PromptParser;
import com.nilsson.promptextractor.service.ResultWriter;
import com.nilsson.promptextractor.testutil.PngFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ExtractCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        ExtractorSettings settings = new ExtractorSettings();
        BatchCoordinator coordinator = new BatchCoordinator(
                new MetadataReader(settings),
                new PromptParser(),
                new ResultWriter(Clock.systemDefaultZone(), settings),
                new LoggingBatchListener(LoggerFactory.getLogger(AppModule.BATCH_LOGGER), 10),
                settings);

        commandLine = new CommandLine(new ExtractCommand(coordinator, settings));
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void testExtractsFolderAndWritesRunLog() throws Exception {
        PngFixtures.png(tempDir.resolve("good.png"), "parameters", PngFixtures.a1111("a green valley"));
        PngFixtures.plainPng(tempDir.resolve("no_prompt.png"));

        int exit = commandLine.execute(tempDir.toString(), "--workers", "2");

        assertEquals(0, exit);
        String printed = out.toString();
        assertTrue(printed.contains("Processed: 2"));
        assertTrue(printed.contains("Succeeded: 1"));
        assertTrue(printed.contains("Failed:    1"));
        assertTrue(printed.contains("prompts_"));

        Path runLog = tempDir.resolve("error.log");
        assertTrue(Files.exists(runLog));
        assertTrue(Files.readString(runLog, StandardCharsets.UTF_8).contains("no_prompt.png"));

        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(1, files.filter(p -> p.getFileName().toString().startsWith("prompts_")).count());
        }
    }

    @Test
    void testEmptyFolderReportsNoInput() {
        int exit = commandLine.execute(tempDir.toString());

        assertEquals(0, exit);
        assertTrue(out.toString().contains("No .png images found."));
    }

    @Test
    void testMissingFolderFails() {
        int exit = commandLine.execute(tempDir.resolve("nope").toString());

        assertEquals(1, exit);
        assertTrue(err.toString().contains("does not exist"));
    }

    @Test
    void testFileInsteadOfFolderFails() throws Exception {
        Path file = PngFixtures.plainPng(tempDir.resolve("single.png"));

        assertEquals(1, commandLine.execute(file.toString()));
        assertTrue(err.toString().contains("not a directory"));
    }

    @Test
    void testRejectsZeroWorkers() {
        assertEquals(1, commandLine.execute(tempDir.toString(), "--workers", "0"));
    }
}
