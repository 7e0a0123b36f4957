package com.questrail.htl.observability;

import java.time.Instant;

/**
 * A request was answered with {@code status}.
 */
public record RequestServedEvent(
    Instant timestamp,
    String method,
    String path,
    int status,
    int contentLength
) {
}
