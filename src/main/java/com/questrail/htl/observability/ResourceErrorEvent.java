package com.questrail.htl.observability;

import java.time.Instant;

/**
 * Record representing a failure to load or transform a resource.
 */
public record ResourceErrorEvent(
    Instant timestamp,
    String path,
    String message,
    Throwable cause
) {
}
