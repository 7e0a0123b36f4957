package com.questrail.htl.model;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Writes a node tree as restricted HTML.
 *
 * <ul>
 *   <li>text {@code _} renders as {@code &nbsp;}; other text verbatim</li>
 *   <li>an element with an empty tag renders only its children</li>
 *   <li>attributes are sorted by key and emitted verbatim as {@code key="value"}</li>
 *   <li>a childless void tag closes with {@code />}, any other childless tag
 *       with {@code ></tag>}</li>
 * </ul>
 *
 * <p>Values are never re-escaped here; quoted literals were escaped once by the
 * parser.</p>
 */
final class HtlMarkup {

    /** Tags rendered as {@code <tag/>} when they have no children. */
    static final Set<String> VOID_TAGS = Set.of("br", "hr", "link", "img", "meta");

    private static final String NBSP_ENTITY = "&nbsp;";

    private HtlMarkup() {}

    static String render(HtlNode node) {
        StringBuilder out = new StringBuilder();
        renderTo(node, out);
        return out.toString();
    }

    private static void renderTo(HtlNode node, StringBuilder out) {
        if (node instanceof HtlText text) {
            out.append(text.isNbspMarker() ? NBSP_ENTITY : text.text());
            return;
        }

        HtlElement element = (HtlElement) node;
        if (element.isAnonymous()) {
            renderChildren(element, out);
            return;
        }

        String tag = element.tag();
        out.append('<').append(tag);
        for (Map.Entry<String, String> attribute : new TreeMap<>(element.attributes()).entrySet()) {
            out.append(' ')
               .append(attribute.getKey())
               .append("=\"")
               .append(attribute.getValue())
               .append('"');
        }

        if (!element.children().isEmpty()) {
            out.append('>');
            renderChildren(element, out);
            out.append("</").append(tag).append('>');
        } else if (VOID_TAGS.contains(tag)) {
            out.append("/>");
        } else {
            out.append("></").append(tag).append('>');
        }
    }

    private static void renderChildren(HtlElement element, StringBuilder out) {
        for (HtlNode child : element.children()) {
            renderTo(child, out);
        }
    }
}
