package com.nilsson.promptextractor.main;

import com.nilsson.promptextractor.data.ExtractorSettings;
import com.nilsson.promptextractor.model.ImageDescription;
import com.nilsson.promptextractor.service.DecodeException;
import com.nilsson.promptextractor.service.MetadataReader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import javax.inject.Inject;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 Prints the format, pixel size, every textual chunk and the EXIF UserComment of one image, or of
 each image in a folder. Useful for finding out which keyword a generator used before tuning
 {@code annotationKeys}.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true,
        description = "Show the format, size and embedded text of an image or of every image in a folder.")
public class InspectCommand implements Callable<Integer> {

    static final int PREVIEW_LENGTH = 200;

    @Parameters(index = "0", description = "Image file or folder")
    Path path;

    @Spec
    CommandSpec spec;

    private final MetadataReader metadataReader;
    private final ExtractorSettings settings;

    @Inject
    public InspectCommand(MetadataReader metadataReader, ExtractorSettings settings) {
        this.metadataReader = metadataReader;
        this.settings = settings;
    }

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (Files.isRegularFile(path)) {
            inspect(path, out);
            return 0;
        }
        if (!Files.isDirectory(path)) {
            err.println("Error: path not found: " + path);
            return 1;
        }

        String suffix = "." + settings.getExtension().toLowerCase(Locale.ROOT);
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(path)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry) && entry.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(suffix)) {
                    files.add(entry);
                }
            }
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));
        for (Path file : files) {
            inspect(file, out);
        }
        return 0;
    }

    private void inspect(Path file, PrintWriter out) {
        out.println();
        out.println("=== " + file.getFileName() + " ===");
        ImageDescription description;
        try {
            description = metadataReader.describe(file);
        } catch (DecodeException e) {
            out.println("  Error: " + e.getMessage());
            return;
        }

        out.println("  Format: " + description.getFormat());
        out.println("  Size: " + description.getSize().orElse("unknown"));
        if (description.getTextChunks().isEmpty()) {
            out.println("  (no text chunks found)");
        }
        for (Map.Entry<String, String> chunk : description.getTextChunks().entrySet()) {
            out.println("  [" + chunk.getKey() + "]:");
            out.println("    " + preview(chunk.getValue()));
        }
        out.println("  EXIF UserComment: " + description.getUserCommentText().map(InspectCommand::preview).orElse("(none)"));
    }

    static String preview(String value) {
        return value.length() > PREVIEW_LENGTH ? value.substring(0, PREVIEW_LENGTH) + "..." : value;
    }
}
