package com.questrail.htl.codec.impl;

/**
 * HtlSyntax
 * -----------------------------------------------------------------------------
 * Reserved characters and fixed tables of the HTL notation.
 *
 * <pre>
 *   element    := "(" symbol attribute* body* ")"
 *   attribute  := ":" symbol value
 *   value      := symbol | string
 *   body       := element | symbol | string
 *   string     := '"' ( escaped-char | html-escaped-char )* '"'
 *   comment    := ";" any-chars-except-newline* newline
 * </pre>
 */
final class HtlSyntax
{
    static final int OPEN_PAREN = '(';
    static final int CLOSE_PAREN = ')';
    static final int QUOTE = '"';
    static final int ESCAPE = '\\';

    /** Introduces an attribute key, only directly after a tag name. */
    static final int KEYWORD_START = ':';

    /** Starts a comment running to the end of the line. */
    static final int COMMENT_START = ';';

    static final int NEW_LINE = '\n';

    /** Open-element stack limit, synthetic root included. */
    static final int MAX_STACK_DEPTH = 256;

    private HtlSyntax() {}

    /**
     * Returns true for the Unicode White_Space set: TAB through CR, NEL
     * (U+0085) and the space, line and paragraph separators. The information
     * separators U+001C..U+001F are not white space, unlike
     * {@link Character#isWhitespace(int)}.
     */
    static boolean isSpace(int codePoint)
    {
        return (codePoint >= 0x09 && codePoint <= 0x0D)
                || codePoint == 0x85
                || Character.isSpaceChar(codePoint);
    }
}
