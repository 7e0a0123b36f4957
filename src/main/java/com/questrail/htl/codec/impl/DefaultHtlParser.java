package com.questrail.htl.codec.impl;

import com.questrail.htl.codec.HtlParseException;
import com.questrail.htl.codec.HtlParser;
import com.questrail.htl.model.HtlElement;

import java.util.Objects;
import java.util.Optional;

/**
 * DefaultHtlParser
 * -----------------------------------------------------------------------------
 * Single-pass, character-driven implementation of {@link HtlParser}.
 *
 * <p>The input is walked one code point at a time. Each code point is handed to
 * the current {@link EatMode}, which returns the mode for the next one. The
 * walk performs the following steps, in order:</p>
 * <ol>
 *   <li>Allocate the synthetic root and push it on a fresh {@link ParseState}</li>
 *   <li>Feed every code point, tracking a 1-based line and column</li>
 *   <li>Abort on the first {@link EatMode#FAILED}</li>
 *   <li>Reject an unterminated string or unclosed elements at end of input</li>
 * </ol>
 *
 * <p>Time is linear in the input length, extra space linear in the nesting
 * depth, which is capped at 256 open elements including the root.</p>
 */
public final class DefaultHtlParser implements HtlParser
{
    @Override
    public Optional<HtlElement> parse(String input)
            throws HtlParseException
    {
        Objects.requireNonNull(input, "input");
        if (input.isEmpty()) {
            return Optional.empty();
        }

        final HtlElement root = HtlElement.anonymous();
        final ParseState state = new ParseState(root);

        EatMode mode = EatMode.IDLE;
        int line = 1;
        int column = 0;

        for (int i = 0; i < input.length(); ) {
            final int c = input.codePointAt(i);
            i += Character.charCount(c);

            mode = mode.eat(c, state);

            if (c == HtlSyntax.NEW_LINE) {
                line++;
                column = 0;
            }
            else {
                column++;
            }

            if (mode == EatMode.FAILED) {
                throw HtlParseException.atCharacter(state.failureKind(), state.diagnostic(), c, line, column);
            }
        }

        if (mode == EatMode.STRING) {
            throw HtlParseException.unterminatedString(line, column);
        }

        if (state.depth() > 1) {
            throw HtlParseException.missingClosers(state.depth() - 1);
        }

        return Optional.of(root);
    }
}
