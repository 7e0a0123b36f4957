package com.questrail.htl.observability;

import java.nio.file.Path;

/**
 * A URL path was bound to a file.
 */
public record RouteRegisteredEvent(
    String route,
    Path file,
    boolean reloading
) {
}
