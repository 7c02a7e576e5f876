package com.nilsson.promptextractor.service.strategy;

/**
 * Handles Automatic1111-style parameter dumps where the prompt is the unlabelled block
 * in front of {@code "Negative prompt:"}. The prompt may span several lines.
 */
public class NegativeMarkerStrategy implements PromptStrategy {

    public static final String MARKER = "Negative prompt:";

    @Override
    public boolean applies(String text) {
        return text.contains(MARKER);
    }

    @Override
    public String extract(String text) {
        return text.substring(0, text.indexOf(MARKER));
    }

    @Override
    public String name() {
        return "negative-marker";
    }
}
