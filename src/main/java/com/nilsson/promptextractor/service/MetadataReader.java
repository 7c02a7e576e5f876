package com.nilsson.promptextractor.service;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.KeyValuePair;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.file.FileTypeDirectory;
import com.drew.metadata.png.PngDirectory;
import com.nilsson.promptextractor.data.ExtractorSettings;
import com.nilsson.promptextractor.model.ImageDescription;
import com.nilsson.promptextractor.model.RawAnnotation;

import javax.inject.Inject;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 <h2>MetadataReader</h2>
 <p>
 Opens a single image and collects the text that may carry a generation prompt, without
 interpreting it:
 </p>
 <ul>
 <li><b>Container annotations:</b> textual chunks (tEXt, zTXt, iTXt) looked up by keyword in a fixed
 priority order. Only the first keyword present is returned; lower-priority keywords are shadowed.</li>
 <li><b>EXIF UserComment:</b> the raw bytes of tag 0x9286 plus a lenient UTF-8 decoding of them.</li>
 </ul>
 <p>
 The file is opened read-only and the stream is closed before returning, on success or failure.
 </p>
 */
public class MetadataReader {

    private static final String UNKNOWN_FORMAT = "unknown";

    private static final List<byte[]> CHARACTER_CODE_HEADERS = Arrays.asList(
            "ASCII\0\0\0".getBytes(StandardCharsets.US_ASCII),
            "UNICODE\0".getBytes(StandardCharsets.US_ASCII),
            "JIS\0\0\0\0\0".getBytes(StandardCharsets.US_ASCII),
            new byte[8]
    );

    private final List<String> annotationKeys;

    @Inject
    public MetadataReader(ExtractorSettings settings) {
        this(settings.getAnnotationKeys());
    }

    public MetadataReader(List<String> annotationKeys) {
        this.annotationKeys = Collections.unmodifiableList(new ArrayList<>(annotationKeys));
    }

    public List<String> getAnnotationKeys() {
        return annotationKeys;
    }

    // --- Public API ---

    /**
     Reads the prompt-bearing annotations of one image.
     * @param file The image to read.

     @return The raw annotation, possibly empty.
     @throws DecodeException if the file cannot be opened or is not a recognizable image container.
     */
    public RawAnnotation read(Path file) throws DecodeException {
        Metadata metadata = load(file);
        Map<String, String> chunks = collectTextChunks(metadata);

        Map<String, String> fields = new LinkedHashMap<>();
        for (String key : annotationKeys) {
            String value = chunks.get(key);
            if (value != null) {
                fields.put(key, value);
                break;
            }
        }

        byte[] comment = findUserComment(metadata);
        String commentText = comment == null ? null : decodeUserComment(comment);

        return new RawAnnotation(fields, comment, commentText);
    }

    /**
     Describes an image for inspection: detected format, pixel size, every textual chunk in container
     order (first occurrence of a repeated keyword wins) and the decoded UserComment.
     */
    public ImageDescription describe(Path file) throws DecodeException {
        Metadata metadata = load(file);

        String format = UNKNOWN_FORMAT;
        FileTypeDirectory fileType = metadata.getFirstDirectoryOfType(FileTypeDirectory.class);
        if (fileType != null && fileType.getString(FileTypeDirectory.TAG_DETECTED_FILE_TYPE_NAME) != null) {
            format = fileType.getString(FileTypeDirectory.TAG_DETECTED_FILE_TYPE_NAME);
        }

        Integer width = null;
        Integer height = null;
        for (PngDirectory directory : metadata.getDirectoriesOfType(PngDirectory.class)) {
            if (directory.containsTag(PngDirectory.TAG_IMAGE_WIDTH)) {
                width = directory.getInteger(PngDirectory.TAG_IMAGE_WIDTH);
                height = directory.getInteger(PngDirectory.TAG_IMAGE_HEIGHT);
                break;
            }
        }

        byte[] comment = findUserComment(metadata);
        return new ImageDescription(format, width, height, collectTextChunks(metadata),
                comment == null ? null : decodeUserComment(comment));
    }

    // --- Internal Helpers ---

    private Metadata load(Path file) throws DecodeException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            return ImageMetadataReader.readMetadata(in);
        } catch (ImageProcessingException e) {
            throw new DecodeException(file, "Not a valid image: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DecodeException(file, "Cannot read file: " + e.getMessage(), e);
        }
    }

    private Map<String, String> collectTextChunks(Metadata metadata) {
        Map<String, String> chunks = new LinkedHashMap<>();
        for (PngDirectory directory : metadata.getDirectoriesOfType(PngDirectory.class)) {
            Object textual = directory.getObject(PngDirectory.TAG_TEXTUAL_DATA);
            if (!(textual instanceof List)) continue;

            for (Object item : (List<?>) textual) {
                if (!(item instanceof KeyValuePair)) continue;
                KeyValuePair pair = (KeyValuePair) item;
                if (pair.getKey() == null || pair.getValue() == null) continue;
                chunks.putIfAbsent(pair.getKey(), pair.getValue().toString());
            }
        }
        return chunks;
    }

    private byte[] findUserComment(Metadata metadata) {
        for (ExifSubIFDDirectory directory : metadata.getDirectoriesOfType(ExifSubIFDDirectory.class)) {
            byte[] bytes = directory.getByteArray(ExifSubIFDDirectory.TAG_USER_COMMENT);
            if (bytes != null && bytes.length > 0) return bytes;
        }
        return null;
    }

    /**
     Decodes an EXIF UserComment. A known 8-byte character code header is skipped, the rest is decoded
     as UTF-8 with malformed input replaced, and NUL padding is dropped.
     */
    static String decodeUserComment(byte[] raw) {
        int offset = hasCharacterCodeHeader(raw) ? 8 : 0;
        String text = new String(raw, offset, raw.length - offset, StandardCharsets.UTF_8);
        return text.replace("\0", "");
    }

    private static boolean hasCharacterCodeHeader(byte[] raw) {
        if (raw.length < 8) return false;
        byte[] head = Arrays.copyOf(raw, 8);
        for (byte[] header : CHARACTER_CODE_HEADERS) {
            if (Arrays.equals(head, header)) return true;
        }
        return false;
    }
}
