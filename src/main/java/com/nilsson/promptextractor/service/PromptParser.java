package com.nilsson.promptextractor.service;

import com.nilsson.promptextractor.model.RawAnnotation;
import com.nilsson.promptextractor.service.strategy.FirstLineStrategy;
import com.nilsson.promptextractor.service.strategy.NegativeMarkerStrategy;
import com.nilsson.promptextractor.service.strategy.PositiveMarkerStrategy;
import com.nilsson.promptextractor.service.strategy.PromptStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 <h2>PromptParser</h2>
 <p>
 Isolates the positive prompt from a raw annotation string. Different generators embed the
 prompt differently, so the parser walks an ordered chain of {@link PromptStrategy} objects and
 lets the first one that applies produce the result:
 </p>
 <ol>
 <li>{@link PositiveMarkerStrategy}: explicit {@code "Positive prompt:"} label.</li>
 <li>{@link NegativeMarkerStrategy}: unlabelled block ended by {@code "Negative prompt:"}.</li>
 <li>{@link FirstLineStrategy}: first line of a bare annotation.</li>
 </ol>
 <p>
 The order is significant: a text carrying both markers is always resolved by the explicit one.
 A blank result (Unicode whitespace included, e.g. the ideographic space) is reported as no match;
 it does not fall through to the next strategy.
 </p>
 <p>Stateless and safe to share between worker threads.</p>
 */
public class PromptParser {

    private static final Logger logger = LoggerFactory.getLogger(PromptParser.class);

    private final List<PromptStrategy> strategies;

    public PromptParser() {
        this(Arrays.asList(
                new PositiveMarkerStrategy(),
                new NegativeMarkerStrategy(),
                new FirstLineStrategy()
        ));
    }

    public PromptParser(List<PromptStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one prompt strategy is required");
        }
        this.strategies = Collections.unmodifiableList(strategies);
    }

    public List<PromptStrategy> getStrategies() {
        return strategies;
    }

    // ------------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------------

    /**
     Extracts the positive prompt from a single annotation text.
     * @param text Raw annotation text, may be null.

     @return The stripped prompt, or empty when nothing usable was found.
     */
    public Optional<String> extractPositive(String text) {
        if (text == null) return Optional.empty();

        for (PromptStrategy strategy : strategies) {
            if (!strategy.applies(text)) continue;

            String prompt = strategy.extract(text).strip();
            logger.trace("Strategy '{}' selected, {} chars", strategy.name(), prompt.length());
            return prompt.isEmpty() ? Optional.empty() : Optional.of(prompt);
        }
        return Optional.empty();
    }

    /**
     Tries every candidate text of the annotation in priority order and returns the first match.
     */
    public Optional<String> extractPositive(RawAnnotation annotation) {
        for (String candidate : annotation.candidateTexts()) {
            Optional<String> prompt = extractPositive(candidate);
            if (prompt.isPresent()) return prompt;
        }
        return Optional.empty();
    }
}
