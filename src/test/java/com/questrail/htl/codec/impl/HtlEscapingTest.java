package com.questrail.htl.codec.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class HtlEscapingTest
{
    // ---------------------------------------------------------------------
    // HTML escape map
    // ---------------------------------------------------------------------

    @Test
    void htmlSpecialCharactersAreEscaped()
    {
        assertEquals("&lt;", HtlEscaping.escapeHtml('<'));
        assertEquals("&gt;", HtlEscaping.escapeHtml('>'));
        assertEquals("&amp;", HtlEscaping.escapeHtml('&'));
        assertEquals("&apos;", HtlEscaping.escapeHtml('\''));
        assertEquals("&quot;", HtlEscaping.escapeHtml('"'));
    }

    @Test
    void otherCharactersPassThrough()
    {
        assertEquals("a", HtlEscaping.escapeHtml('a'));
        assertEquals("\\", HtlEscaping.escapeHtml('\\'));
        assertEquals("😀", HtlEscaping.escapeHtml(0x1F600));
    }

    // ---------------------------------------------------------------------
    // Backslash table
    // ---------------------------------------------------------------------

    @Test
    void controlEscapes()
    {
        assertEquals("\f", HtlEscaping.unescapeThenEscapeHtml('f'));
        assertEquals("\n", HtlEscaping.unescapeThenEscapeHtml('n'));
        assertEquals("\r", HtlEscaping.unescapeThenEscapeHtml('r'));
        assertEquals("\t", HtlEscaping.unescapeThenEscapeHtml('t'));
        assertEquals("\u000B", HtlEscaping.unescapeThenEscapeHtml('v'));
    }

    /**
     * Anything outside the control table falls back to the HTML escape map,
     * so an escaped quote becomes an entity and an escaped backslash a
     * literal backslash.
     */
    @Test
    void unknownEscapesFallBackToHtmlEscaping()
    {
        assertEquals("&quot;", HtlEscaping.unescapeThenEscapeHtml('"'));
        assertEquals("\\", HtlEscaping.unescapeThenEscapeHtml('\\'));
        assertEquals("&lt;", HtlEscaping.unescapeThenEscapeHtml('<'));
        assertEquals("b", HtlEscaping.unescapeThenEscapeHtml('b'));
    }
}
