package com.questrail.htl.codec;

import com.questrail.htl.model.HtlElement;

import java.util.Optional;

/**
 * HtlParser
 * -----------------------------------------------------------------------------
 * Text-level decoder from HTL notation to a node tree.
 *
 * <p>The parser is responsible only for:</p>
 * <ul>
 *   <li>Tokenizing the input under the HTL lexical rules</li>
 *   <li>Enforcing nesting and escaping rules</li>
 *   <li>Building an {@link HtlElement} tree on success</li>
 * </ul>
 *
 * <p>The parser is <strong>not</strong> responsible for validating tag or
 * attribute names, or for any HTML conformance beyond the restricted subset.</p>
 *
 * <p>Implementations must be reentrant: every call works on its own state and
 * retains no reference to the returned tree.</p>
 */
public interface HtlParser
{
    /**
     * Parse a complete HTL document.
     *
     * <p>The whole input must be available up front; feeding a document across
     * several calls is not supported.</p>
     *
     * @param input complete document text
     * @return the synthetic root element (empty tag) holding every top-level
     *         node; {@link Optional#empty()} if {@code input} is empty
     * @throws HtlParseException if the input is malformed. No partial tree is
     *         produced in that case.
     */
    Optional<HtlElement> parse(String input) throws HtlParseException;
}
