package com.questrail.htl.resource;

import java.util.Objects;

/**
 * A servable file: its content type and the bytes to send.
 */
public record Resource(
    String contentType,
    byte[] content
) {
    public Resource {
        Objects.requireNonNull(contentType, "contentType");
        Objects.requireNonNull(content, "content");
    }
}
