package com.questrail.htl.codec;

import com.questrail.htl.model.HtlNode;

/**
 * HtlRenderer
 * -----------------------------------------------------------------------------
 * Serializes a node tree to restricted HTML.
 *
 * <p>Rendering is a pure function of the tree: no mutation, no I/O. Output is
 * deterministic; attributes are emitted in ascending key order regardless of
 * the order they were parsed in.</p>
 */
public interface HtlRenderer
{
    /**
     * Render {@code node} and its subtree.
     *
     * @param node tree to render; may be {@code null}
     * @return the markup, or the empty string for a {@code null} node
     */
    String render(HtlNode node);
}
