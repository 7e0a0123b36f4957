package com.questrail.htl.codec.impl;

/**
 * HtlEscaping
 * -----------------------------------------------------------------------------
 * Character escaping applied to quoted strings while they are parsed.
 *
 * <p>Every character of a quoted string passes through the HTML escape map.
 * A character following a backslash goes through the backslash table first:
 * {@code f n r t v} map to their control characters, anything else (backslash
 * and double quote included) falls back to the HTML escape map. That makes
 * {@code \\} and a lone literal backslash render the same.</p>
 *
 * <p>Bare tokens never come through here.</p>
 */
final class HtlEscaping
{
    private HtlEscaping() {}

    static String escapeHtml(int codePoint)
    {
        switch (codePoint) {
            case '<':  return "&lt;";
            case '>':  return "&gt;";
            case '&':  return "&amp;";
            case '\'': return "&apos;";
            case '"':  return "&quot;";
            default:   return new String(Character.toChars(codePoint));
        }
    }

    static String unescapeThenEscapeHtml(int codePoint)
    {
        switch (codePoint) {
            case 'f': return "\f";
            case 'n': return "\n";
            case 'r': return "\r";
            case 't': return "\t";
            case 'v': return "\u000B";
            default:  return escapeHtml(codePoint);
        }
    }
}
