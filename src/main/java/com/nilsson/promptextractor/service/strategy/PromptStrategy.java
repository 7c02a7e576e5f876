package com.nilsson.promptextractor.service.strategy;

public interface PromptStrategy {

    /**
     * Decides whether this strategy owns the given annotation text.
     * Once a strategy applies, later strategies are never consulted for that text.
     * @param text The raw annotation text, never null
     */
    boolean applies(String text);

    /**
     * Cuts the positive prompt candidate out of the text. The result is not yet stripped.
     * @param text The raw annotation text for which {@link #applies(String)} returned true
     * @return The untrimmed candidate, possibly blank
     */
    String extract(String text);

    /**
     * Short name used in debug logging.
     */
    String name();
}
