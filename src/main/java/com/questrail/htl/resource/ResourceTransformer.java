package com.questrail.htl.resource;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns the raw contents of a file into the resource that is actually served.
 */
@FunctionalInterface
public interface ResourceTransformer {
    /**
     * @param file the file {@code raw} was read from, for diagnostics
     * @param raw the file bytes with the Content-Type derived from its extension
     * @return the transformed resource
     * @throws IOException if the content cannot be transformed
     */
    Resource transform(Path file, Resource raw) throws IOException;
}
