package com.questrail.htl.resource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Re-reads and re-transforms its file on every call. Used in dev mode so that
 * edits show up without a restart.
 */
public final class ReloadingResourceHandler implements ResourceHandler {
    private final Path file;
    private final ResourceLoader loader;

    public ReloadingResourceHandler(Path file, ResourceLoader loader) {
        this.file = Objects.requireNonNull(file, "file");
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    @Override
    public Path file() {
        return file;
    }

    @Override
    public Resource resource() throws IOException {
        return loader.load(file);
    }
}
