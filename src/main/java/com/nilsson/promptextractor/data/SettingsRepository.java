package com.nilsson.promptextractor.data;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 Loads {@link ExtractorSettings} from JSON.
 * <p>Resolution order:
 <ul>
 <li><b>Bundled defaults:</b> {@code extractor-defaults.json} on the classpath.</li>
 <li><b>Local overlay:</b> {@code prompt-extractor.json} in the working directory, if present.
 Only the properties it names are replaced.</li>
 </ul>
 </p>
 * <p>Unknown properties are ignored so older overlay files keep working.</p>
 */
public class SettingsRepository {

    private static final Logger logger = LoggerFactory.getLogger(SettingsRepository.class);

    public static final String DEFAULTS_RESOURCE = "/extractor-defaults.json";
    public static final String OVERLAY_FILE = "prompt-extractor.json";

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(JsonParser.Feature.ALLOW_COMMENTS, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path workingDir;

    public SettingsRepository() {
        this(Paths.get(System.getProperty("user.dir")));
    }

    public SettingsRepository(Path workingDir) {
        this.workingDir = workingDir;
    }

    // --- Data Access Operations ---

    public ExtractorSettings load() {
        ExtractorSettings settings = loadDefaults();
        Path overlay = workingDir.resolve(OVERLAY_FILE);
        if (Files.isRegularFile(overlay)) {
            settings = applyOverlay(settings, overlay);
            logger.info("Applied settings overlay: {}", overlay);
        }
        validate(settings);
        logger.debug("Effective settings: {}", settings);
        return settings;
    }

    public ExtractorSettings loadDefaults() {
        try (InputStream in = SettingsRepository.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.warn("Bundled settings {} not found, using built-in values", DEFAULTS_RESOURCE);
                return new ExtractorSettings();
            }
            return mapper.readValue(in, ExtractorSettings.class);
        } catch (IOException e) {
            throw new SettingsException("Failed to read bundled settings " + DEFAULTS_RESOURCE, e);
        }
    }

    public ExtractorSettings applyOverlay(ExtractorSettings base, Path overlay) {
        try {
            return mapper.readerForUpdating(base).readValue(overlay.toFile());
        } catch (IOException e) {
            throw new SettingsException("Failed to read settings file " + overlay, e);
        }
    }

    public void validate(ExtractorSettings settings) {
        if (settings.getMaxWorkers() < 1) {
            throw new SettingsException("maxWorkers must be at least 1, was " + settings.getMaxWorkers());
        }
        if (settings.getFileCap() < 1) {
            throw new SettingsException("fileCap must be at least 1, was " + settings.getFileCap());
        }
        if (settings.getExtension() == null || settings.getExtension().isBlank()) {
            throw new SettingsException("extension must not be empty");
        }
        if (settings.getAnnotationKeys() == null || settings.getAnnotationKeys().isEmpty()) {
            throw new SettingsException("annotationKeys must name at least one key");
        }
        if (settings.getOutputPrefix() == null) {
            throw new SettingsException("outputPrefix must not be null");
        }
    }
}
