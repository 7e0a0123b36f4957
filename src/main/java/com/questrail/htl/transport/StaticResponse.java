package com.questrail.htl.transport;

import java.util.Objects;

/**
 * Transport-neutral response. {@code contentType} is {@code null} for
 * responses without a body.
 */
public record StaticResponse(
    int status,
    String contentType,
    byte[] body
) {
    private static final byte[] EMPTY = new byte[0];

    public StaticResponse {
        Objects.requireNonNull(body, "body");
    }

    public static StaticResponse ok(String contentType, byte[] body) {
        return new StaticResponse(200, Objects.requireNonNull(contentType, "contentType"), body);
    }

    public static StaticResponse empty(int status) {
        return new StaticResponse(status, null, EMPTY);
    }
}
