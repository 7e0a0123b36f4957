package com.questrail.htl.codec.impl;

import com.questrail.htl.codec.HtlParseException;
import com.questrail.htl.model.HtlElement;
import com.questrail.htl.model.HtlText;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * ParseState
 * -----------------------------------------------------------------------------
 * Mutable context of a single parse call.
 *
 * <p>The open-element stack always holds the synthetic root at the bottom. The
 * root is never popped, so an unmatched {@code )} is detected as soon as it is
 * read. The stack is capped at {@link HtlSyntax#MAX_STACK_DEPTH} frames.</p>
 *
 * <p>Instances never escape {@link DefaultHtlParser}.</p>
 */
final class ParseState
{
    LexicalContext context = LexicalContext.DEFAULT;
    boolean escaping;

    private final StringBuilder token = new StringBuilder();
    private String pendingKey = "";
    private final Deque<HtlElement> stack = new ArrayDeque<>();

    private HtlParseException.Kind failureKind = HtlParseException.Kind.STRUCTURAL;
    private String diagnostic = "";

    ParseState(HtlElement root)
    {
        stack.push(root);
    }

    HtlElement currentElement()
    {
        return stack.peek();
    }

    int depth()
    {
        return stack.size();
    }

    void append(int codePoint)
    {
        token.appendCodePoint(codePoint);
    }

    void append(String s)
    {
        token.append(s);
    }

    private String flushToken()
    {
        String s = token.toString();
        token.setLength(0);
        return s;
    }

    /**
     * Applies the pending token to the tree. What the token means depends on
     * the context it was read in; contexts with no pending token do nothing.
     */
    void commit()
    {
        switch (context) {
            case TAG:
                currentElement().setTag(flushToken());
                break;

            case ATTR_KEY:
                pendingKey = flushToken();
                break;

            case ATTR_VALUE: {
                String key = pendingKey;
                pendingKey = "";
                currentElement().putAttribute(key, flushToken());
                break;
            }

            case CONTENT:
                currentElement().appendChild(new HtlText(flushToken()));
                break;

            default:
                break;
        }
    }

    /**
     * Opens a new element under the current one.
     *
     * @return the mode reading the tag name, or {@link EatMode#FAILED} if the
     *         stack is full
     */
    EatMode push()
    {
        if (stack.size() >= HtlSyntax.MAX_STACK_DEPTH) {
            return fail(HtlParseException.Kind.DEPTH_EXCEEDED, "tree too deep");
        }
        HtlElement element = HtlElement.anonymous();
        currentElement().appendChild(element);
        stack.push(element);
        context = LexicalContext.TAG;
        return EatMode.SYMBOL;
    }

    /**
     * Closes the current element.
     *
     * @return {@link EatMode#IDLE}, or {@link EatMode#FAILED} if only the
     *         synthetic root is open
     */
    EatMode pop()
    {
        if (stack.size() <= 1) {
            return fail("unexpected closing paren");
        }
        stack.pop();
        context = LexicalContext.DEFAULT;
        return EatMode.IDLE;
    }

    EatMode fail(String diagnostic)
    {
        return fail(HtlParseException.Kind.STRUCTURAL, diagnostic);
    }

    EatMode fail(HtlParseException.Kind kind, String diagnostic)
    {
        this.failureKind = kind;
        this.diagnostic = diagnostic;
        return EatMode.FAILED;
    }

    HtlParseException.Kind failureKind()
    {
        return failureKind;
    }

    String diagnostic()
    {
        return diagnostic;
    }
}
