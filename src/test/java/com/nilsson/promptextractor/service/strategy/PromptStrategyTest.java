package com.nilsson.promptextractor.service.strategy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 Each strategy in isolation; the ordering between them is covered by {@code PromptParserTest}.
 */
class PromptStrategyTest {

    @Test
    void testPositiveMarker() {
        PositiveMarkerStrategy strategy = new PositiveMarkerStrategy();

        assertFalse(strategy.applies("no label here"));
        assertTrue(strategy.applies("x Positive prompt: y"));
        assertEquals(" cat ", strategy.extract("Positive prompt: cat \nNegative prompt: dog"));
        assertEquals(" cat", strategy.extract("Positive prompt: cat"));
    }

    @Test
    void testPositiveMarkerUsesFirstOccurrence() {
        PositiveMarkerStrategy strategy = new PositiveMarkerStrategy();
        assertEquals(" one", strategy.extract("Positive prompt: one\nPositive prompt: two"));
    }

    @Test
    void testNegativeMarker() {
        NegativeMarkerStrategy strategy = new NegativeMarkerStrategy();

        assertFalse(strategy.applies("plain"));
        assertTrue(strategy.applies("a\nNegative prompt: b"));
        assertEquals("a\n", strategy.extract("a\nNegative prompt: b"));
        assertEquals("", strategy.extract("Negative prompt: b"));
    }

    @Test
    void testMarkersAreCaseSensitive() {
        assertFalse(new PositiveMarkerStrategy().applies("positive prompt: x"));
        assertFalse(new NegativeMarkerStrategy().applies("negative prompt: x"));
    }

    @Test
    void testFirstLine() {
        FirstLineStrategy strategy = new FirstLineStrategy();

        assertTrue(strategy.applies(""));
        assertEquals("one", strategy.extract("one\ntwo"));
        assertEquals("single", strategy.extract("single"));
        assertEquals("", strategy.extract("\nsecond"));
    }
}
