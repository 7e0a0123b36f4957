package com.questrail.htl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Element node: a tag, its attributes and its ordered children.
 *
 * <p>An empty tag denotes an anonymous grouping node. The parser uses one as the
 * synthetic document root so that several top-level elements can be siblings;
 * it renders as the plain concatenation of its children.</p>
 *
 * <p>Mutators exist for the parser, which grows the tree while it walks the
 * input. Once a tree has been handed out it is treated as immutable; the
 * accessors only expose read-only views.</p>
 */
public final class HtlElement implements HtlNode {
    private String tag;
    private final Map<String, String> attributes = new HashMap<>();
    private final List<HtlNode> children = new ArrayList<>();

    public HtlElement(String tag) {
        this.tag = Objects.requireNonNull(tag, "tag");
    }

    /** Creates an anonymous (empty tag) element. */
    public static HtlElement anonymous() {
        return new HtlElement("");
    }

    public String tag() {
        return tag;
    }

    public boolean isAnonymous() {
        return tag.isEmpty();
    }

    /** Attribute view; iteration order is unspecified. */
    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /** Children in insertion order. */
    public List<HtlNode> children() {
        return Collections.unmodifiableList(children);
    }

    public void setTag(String tag) {
        this.tag = Objects.requireNonNull(tag, "tag");
    }

    /**
     * Stores an attribute. A later value for the same key replaces the earlier one.
     */
    public void putAttribute(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        attributes.put(key, value);
    }

    /**
     * Appends {@code child} as the last child of this element.
     *
     * @throws IllegalArgumentException if {@code child} is this element
     */
    public void appendChild(HtlNode child) {
        Objects.requireNonNull(child, "child");
        if (child == this) {
            throw new IllegalArgumentException("An element cannot contain itself");
        }
        children.add(child);
    }

    @Override
    public String toString() {
        return "HtlElement[tag=" + tag
                + ", attributes=" + attributes
                + ", children=" + children.size() + "]";
    }
}
