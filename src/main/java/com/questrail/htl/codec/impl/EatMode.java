package com.questrail.htl.codec.impl;

import static com.questrail.htl.codec.impl.HtlSyntax.CLOSE_PAREN;
import static com.questrail.htl.codec.impl.HtlSyntax.COMMENT_START;
import static com.questrail.htl.codec.impl.HtlSyntax.ESCAPE;
import static com.questrail.htl.codec.impl.HtlSyntax.KEYWORD_START;
import static com.questrail.htl.codec.impl.HtlSyntax.NEW_LINE;
import static com.questrail.htl.codec.impl.HtlSyntax.OPEN_PAREN;
import static com.questrail.htl.codec.impl.HtlSyntax.QUOTE;

/**
 * EatMode
 * -----------------------------------------------------------------------------
 * The character-consuming behaviours of the HTL state machine.
 *
 * <p>Each mode consumes one code point, may update the {@link ParseState}, and
 * returns the mode that consumes the next code point. {@link #FAILED} is
 * terminal; the state's diagnostic explains why it was entered.</p>
 *
 * <ul>
 *   <li>{@link #IDLE}: white space between tokens</li>
 *   <li>{@link #SYMBOL}: an unquoted token, copied verbatim</li>
 *   <li>{@link #STRING}: a quoted literal, HTML-escaped as it is read</li>
 *   <li>{@link #COMMENT}: everything up to and including the next line break</li>
 * </ul>
 */
enum EatMode
{
    IDLE {
        @Override
        EatMode eat(int c, ParseState ps)
        {
            switch (c) {
                case OPEN_PAREN:
                    if (ps.context == LexicalContext.AFTER_ATTR_KEY) {
                        return ps.fail("unexpected open paren");
                    }
                    return ps.push();

                case CLOSE_PAREN:
                    if (ps.context == LexicalContext.AFTER_ATTR_KEY) {
                        return ps.fail("unexpected close paren");
                    }
                    return ps.pop();

                case QUOTE:
                    ps.context = (ps.context == LexicalContext.AFTER_ATTR_KEY)
                            ? LexicalContext.ATTR_VALUE
                            : LexicalContext.CONTENT;
                    return STRING;

                case COMMENT_START:
                    return COMMENT;

                case KEYWORD_START:
                    if (ps.context == LexicalContext.AFTER_TAG) {
                        ps.context = LexicalContext.ATTR_KEY;
                        return SYMBOL;
                    }
                    return ps.fail("unexpected character");

                case ESCAPE:
                    return ps.fail("backslash-escaping not allowed here");

                default:
                    if (HtlSyntax.isSpace(c)) {
                        return IDLE;
                    }
                    ps.append(c);
                    ps.context = (ps.context == LexicalContext.AFTER_ATTR_KEY)
                            ? LexicalContext.ATTR_VALUE
                            : LexicalContext.CONTENT;
                    return SYMBOL;
            }
        }
    },

    SYMBOL {
        @Override
        EatMode eat(int c, ParseState ps)
        {
            switch (c) {
                case OPEN_PAREN:
                    if (ps.context == LexicalContext.ATTR_KEY) {
                        return ps.fail("unexpected open paren");
                    }
                    ps.commit();
                    return ps.push();

                case CLOSE_PAREN:
                    if (ps.context == LexicalContext.ATTR_KEY) {
                        return ps.fail("unexpected close paren");
                    }
                    ps.commit();
                    return ps.pop();

                case QUOTE:
                    ps.commit();
                    ps.context = (ps.context == LexicalContext.ATTR_KEY)
                            ? LexicalContext.ATTR_VALUE
                            : LexicalContext.CONTENT;
                    return STRING;

                case ESCAPE:
                    return ps.fail("backslash-escaping is not allowed here");

                default:
                    if (HtlSyntax.isSpace(c)) {
                        ps.commit();
                        ps.context = (ps.context == LexicalContext.ATTR_KEY)
                                ? LexicalContext.AFTER_ATTR_KEY
                                : LexicalContext.AFTER_TAG;
                        return IDLE;
                    }
                    ps.append(c);
                    return SYMBOL;
            }
        }
    },

    STRING {
        @Override
        EatMode eat(int c, ParseState ps)
        {
            if (ps.escaping) {
                ps.escaping = false;
                ps.append(HtlEscaping.unescapeThenEscapeHtml(c));
                return STRING;
            }

            if (c == QUOTE) {
                ps.commit();
                ps.context = (ps.context == LexicalContext.ATTR_VALUE)
                        ? LexicalContext.AFTER_TAG
                        : LexicalContext.DEFAULT;
                return IDLE;
            }

            if (c == ESCAPE) {
                ps.escaping = true;
                return STRING;
            }

            ps.append(HtlEscaping.escapeHtml(c));
            return STRING;
        }
    },

    COMMENT {
        @Override
        EatMode eat(int c, ParseState ps)
        {
            // The lexical context is left as it was before the comment.
            return (c == NEW_LINE) ? IDLE : COMMENT;
        }
    },

    FAILED {
        @Override
        EatMode eat(int c, ParseState ps)
        {
            throw new IllegalStateException("Parse already failed: " + ps.diagnostic());
        }
    };

    abstract EatMode eat(int c, ParseState ps);
}
