package com.questrail.htl.resource;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Indicates that a file was read but could not be transformed into its
 * servable form, for example an {@code .htl} file that does not parse.
 */
public final class ResourceTransformException extends IOException {
    private final Path file;

    public ResourceTransformException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
