package com.questrail.htl.model;

/**
 * A node of a parsed HTL document.
 *
 * <h2>Cases</h2>
 * <ul>
 *   <li>{@link HtlElement}: a tag with attributes and ordered children</li>
 *   <li>{@link HtlText}: a literal text payload, always a leaf</li>
 * </ul>
 *
 * <p>A tree is exclusively owned by whoever received it from the parser. Nodes
 * are never shared between parents, so cycles cannot be built.</p>
 */
public sealed interface HtlNode
        permits HtlElement, HtlText {

    /**
     * Renders this node (and its subtree) to restricted HTML.
     *
     * @return the rendered markup, never {@code null}
     */
    default String render() {
        return HtlMarkup.render(this);
    }
}
