package com.vbot.core.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommandNamesTest {

    @Test
    void testBotSuffixAndCaseAreDropped() {
        assertEquals("/play", CommandNames.normalize("/Play@SomeBot"));
        assertEquals("/play", CommandNames.normalize("/play"));
    }

    @Test
    void testOnlyFirstTokenCounts() {
        assertEquals("#ping", CommandNames.normalize("  #PING  now please"));
        assertEquals(".stats", CommandNames.normalize(".stats\tverbose"));
    }

    @Test
    void testEmptyInput() {
        assertEquals("", CommandNames.normalize(null));
        assertEquals("", CommandNames.normalize("   "));
    }
}
