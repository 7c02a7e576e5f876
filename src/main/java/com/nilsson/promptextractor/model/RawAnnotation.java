package com.nilsson.promptextractor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 Text carried by one image before any prompt heuristics run.
 <p>
 Holds the container annotation (keyword to text, at most the highest-priority keyword
 that was present) and the optional EXIF UserComment, both as raw bytes and as decoded text.
 </p>
 */
public final class RawAnnotation {

    private static final RawAnnotation EMPTY = new RawAnnotation(Collections.emptyMap(), null, null);

    private final Map<String, String> textFields;
    private final byte[] userComment;
    private final String userCommentText;

    public RawAnnotation(Map<String, String> textFields, byte[] userComment, String userCommentText) {
        this.textFields = Collections.unmodifiableMap(new LinkedHashMap<>(textFields));
        this.userComment = userComment == null ? null : userComment.clone();
        this.userCommentText = userCommentText;
    }

    public static RawAnnotation empty() {
        return EMPTY;
    }

    public Map<String, String> getTextFields() {
        return textFields;
    }

    public Optional<byte[]> getUserComment() {
        return userComment == null ? Optional.empty() : Optional.of(userComment.clone());
    }

    public Optional<String> getUserCommentText() {
        return Optional.ofNullable(userCommentText);
    }

    /**
     Texts in the order the prompt heuristics should try them: container annotation first,
     then the decoded comment.
     */
    public List<String> candidateTexts() {
        List<String> candidates = new ArrayList<>(textFields.values());
        if (userCommentText != null) {
            candidates.add(userCommentText);
        }
        return candidates;
    }

    public boolean isEmpty() {
        return textFields.isEmpty() && userCommentText == null;
    }

    @Override
    public String toString() {
        return "RawAnnotation{fields=" + textFields.keySet()
                + ", userComment=" + (userComment == null ? "none" : userComment.length + " bytes")
                + "}";
    }
}
