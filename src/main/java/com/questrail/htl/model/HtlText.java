package com.questrail.htl.model;

import java.util.Objects;

/**
 * Text leaf.
 *
 * <p>The payload is stored exactly as it will be emitted: quoted literals were
 * already HTML-escaped by the parser, bare tokens are raw.</p>
 */
public record HtlText(String text) implements HtlNode {

    /** Payload rendered as a non-breaking space. */
    public static final String NBSP_MARKER = "_";

    public HtlText {
        Objects.requireNonNull(text, "text");
    }

    public boolean isNbspMarker() {
        return NBSP_MARKER.equals(text);
    }
}
