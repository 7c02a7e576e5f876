package com.nilsson.promptextractor.service.strategy;

/**
 * Handles producers that label the prompt explicitly, e.g.
 * {@code "Positive prompt: a castle\nNegative prompt: blurry"}.
 *
 * <p>Takes the remainder of the marker's line only.</p>
 */
public class PositiveMarkerStrategy implements PromptStrategy {

    public static final String MARKER = "Positive prompt:";

    @Override
    public boolean applies(String text) {
        return text.contains(MARKER);
    }

    @Override
    public String extract(String text) {
        int start = text.indexOf(MARKER) + MARKER.length();
        int end = text.indexOf('\n', start);
        return end == -1 ? text.substring(start) : text.substring(start, end);
    }

    @Override
    public String name() {
        return "positive-marker";
    }
}
