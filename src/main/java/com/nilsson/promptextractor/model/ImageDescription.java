package com.nilsson.promptextractor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 Everything the inspect command shows about one image: detected container format, pixel size,
 every textual chunk in container order and the decoded EXIF UserComment, if any.
 */
public final class ImageDescription {

    private final String format;
    private final Integer width;
    private final Integer height;
    private final Map<String, String> textChunks;
    private final String userCommentText;

    public ImageDescription(String format, Integer width, Integer height,
                            Map<String, String> textChunks, String userCommentText) {
        this.format = format;
        this.width = width;
        this.height = height;
        this.textChunks = Collections.unmodifiableMap(new LinkedHashMap<>(textChunks));
        this.userCommentText = userCommentText;
    }

    public String getFormat() {
        return format;
    }

    /** {@code "W x H"}, or empty when the container does not declare its dimensions. */
    public Optional<String> getSize() {
        if (width == null || height == null) return Optional.empty();
        return Optional.of(width + " x " + height);
    }

    public Map<String, String> getTextChunks() {
        return textChunks;
    }

    public Optional<String> getUserCommentText() {
        return Optional.ofNullable(userCommentText);
    }
}
