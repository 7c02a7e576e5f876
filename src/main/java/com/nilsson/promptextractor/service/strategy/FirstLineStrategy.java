package com.nilsson.promptextractor.service.strategy;

/**
 * Fallback for bare annotations: everything up to the first line break.
 * Always applies, so it must stay last in the chain.
 */
public class FirstLineStrategy implements PromptStrategy {

    @Override
    public boolean applies(String text) {
        return true;
    }

    @Override
    public String extract(String text) {
        int end = text.indexOf('\n');
        return end == -1 ? text : text.substring(0, end);
    }

    @Override
    public String name() {
        return "first-line";
    }
}
