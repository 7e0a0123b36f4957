package com.questrail.htl.resource;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Supplies the resource served for one file.
 */
public interface ResourceHandler {
    /**
     * The file this handler serves.
     */
    Path file();

    /**
     * @return the resource to serve
     * @throws IOException if the resource cannot be produced
     */
    Resource resource() throws IOException;
}
