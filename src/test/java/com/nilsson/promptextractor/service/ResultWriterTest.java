package com.nilsson.promptextractor.service;

import com.nilsson.promptextractor.model.ExtractionResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ResultWriterTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final ResultWriter writer = new ResultWriter(FIXED, "prompts_");

    @Test
    void testWritesSortedFlatBlocks() throws Exception {
        List<ExtractionResult.Success> entries = List.of(
                ExtractionResult.success("b.png", "second"),
                ExtractionResult.success("a.png", "first\nwith two lines"));

        Path output = writer.write(tempDir, entries);

        assertEquals("prompts_20240305_140709.txt", output.getFileName().toString());
        String expected = "a.pngのprompt\nfirst\nwith two lines\n\n"
                + "b.pngのprompt\nsecond\n\n";
        assertEquals(expected, Files.readString(output, StandardCharsets.UTF_8));
    }

    @Test
    void testWritesUtf8() throws Exception {
        Path output = writer.write(tempDir, List.of(ExtractionResult.success("jp.png", "夕焼けの海")));

        byte[] bytes = Files.readAllBytes(output);
        assertEquals("jp.pngのprompt\n夕焼けの海\n\n", new String(bytes, StandardCharsets.UTF_8));
    }

    @Test
    void testEmptyEntrySetCreatesEmptyFile() throws Exception {
        Path output = writer.write(tempDir, Collections.emptyList());

        assertTrue(Files.exists(output));
        assertEquals(0, Files.size(output));
    }

    @Test
    void testCreatesMissingParentDirectories() throws Exception {
        Path nested = tempDir.resolve("x").resolve("y");

        Path output = writer.write(nested, List.of(ExtractionResult.success("a.png", "p")));

        assertEquals(nested, output.getParent());
    }

    @Test
    void testNeverOverwritesExistingOutput() throws Exception {
        Path first = writer.write(tempDir, List.of(ExtractionResult.success("a.png", "one")));
        Path second = writer.write(tempDir, List.of(ExtractionResult.success("a.png", "two")));

        assertNotEquals(first, second);
        assertEquals("prompts_20240305_140709_2.txt", second.getFileName().toString());
        assertTrue(Files.readString(first).contains("one"));
        assertTrue(Files.readString(second).contains("two"));
    }

    @Test
    void testFailedWriteLeavesNoPartialFile() throws Exception {
        ResultWriter failing = new ResultWriter(FIXED, "prompts_") {
            @Override
            protected void writeEntries(Writer out, List<ExtractionResult.Success> sorted) throws IOException {
                out.write("a.pngのprompt\n");
                out.flush();
                throw new IOException("disk full");
            }
        };

        IOException e = assertThrows(IOException.class,
                () -> failing.write(tempDir, List.of(ExtractionResult.success("a.png", "p"))));

        assertEquals("disk full", e.getMessage());
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(0, files.count());
        }
    }
}
