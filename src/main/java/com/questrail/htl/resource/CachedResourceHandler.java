package com.questrail.htl.resource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads its file once, at construction, and serves the cached result.
 */
public final class CachedResourceHandler implements ResourceHandler {
    private final Path file;
    private final Resource resource;

    /**
     * @throws IOException if the file cannot be loaded; the handler is not created
     */
    public CachedResourceHandler(Path file, ResourceLoader loader) throws IOException {
        this.file = Objects.requireNonNull(file, "file");
        this.resource = Objects.requireNonNull(loader, "loader").load(file);
    }

    @Override
    public Path file() {
        return file;
    }

    @Override
    public Resource resource() {
        return resource;
    }
}
