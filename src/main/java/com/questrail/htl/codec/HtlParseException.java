package com.questrail.htl.codec;

/**
 * Indicates that an HTL document could not be parsed.
 *
 * <p>Every failure is terminal for the input it was raised on. The exception
 * carries the offending character and its 1-based position, or, for failures
 * detected at end of input, a code point of {@code -1} and a zero position.</p>
 */
public final class HtlParseException extends Exception
{
    /** Broad classification of the failure. */
    public enum Kind
    {
        /** Unexpected parenthesis, illegal backslash or colon, unterminated string, unbalanced nesting. */
        STRUCTURAL,
        /** Nesting exceeded the parser's depth limit. */
        DEPTH_EXCEEDED
    }

    public static final int END_OF_INPUT = -1;

    private final Kind kind;
    private final String diagnostic;
    private final int codePoint;
    private final int line;
    private final int column;
    private final int missingClosers;

    private HtlParseException(Kind kind, String diagnostic, int codePoint, int line, int column, int missingClosers, String message)
    {
        super(message);
        this.kind = kind;
        this.diagnostic = diagnostic;
        this.codePoint = codePoint;
        this.line = line;
        this.column = column;
        this.missingClosers = missingClosers;
    }

    /**
     * Failure raised while consuming the character {@code codePoint}.
     */
    public static HtlParseException atCharacter(Kind kind, String diagnostic, int codePoint, int line, int column)
    {
        String message = String.format("Error processing character '%s' (line %d column %d): %s",
                printable(codePoint), line, column, diagnostic);
        return new HtlParseException(kind, diagnostic, codePoint, line, column, 0, message);
    }

    /**
     * End of input reached inside a quoted string.
     */
    public static HtlParseException unterminatedString(int line, int column)
    {
        String diagnostic = "unterminated string";
        String message = String.format("Unterminated string at end of input (line %d column %d)", line, column);
        return new HtlParseException(Kind.STRUCTURAL, diagnostic, END_OF_INPUT, line, column, 0, message);
    }

    /**
     * End of input reached with {@code count} elements still open.
     */
    public static HtlParseException missingClosers(int count)
    {
        String diagnostic = "missing closing parens";
        String message = String.format(
                "Parser stack contains more than the root element. Perhaps %d closing parens are missing?", count);
        return new HtlParseException(Kind.STRUCTURAL, diagnostic, END_OF_INPUT, 0, 0, count, message);
    }

    public Kind kind()
    {
        return kind;
    }

    public String diagnostic()
    {
        return diagnostic;
    }

    /** Offending code point, or {@link #END_OF_INPUT}. */
    public int codePoint()
    {
        return codePoint;
    }

    public int line()
    {
        return line;
    }

    public int column()
    {
        return column;
    }

    /** Number of missing {@code )} for an unbalanced document, otherwise 0. */
    public int missingClosers()
    {
        return missingClosers;
    }

    private static String printable(int codePoint)
    {
        switch (codePoint) {
            case '\n': return "\\n";
            case '\r': return "\\r";
            case '\t': return "\\t";
            default:   return new String(Character.toChars(codePoint));
        }
    }
}
