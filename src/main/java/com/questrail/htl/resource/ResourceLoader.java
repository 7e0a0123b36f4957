package com.questrail.htl.resource;

import com.questrail.htl.codec.impl.DefaultHtlParser;
import com.questrail.htl.codec.impl.DefaultHtlRenderer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * ResourceLoader
 * =============================================================================
 * Reads a file and turns it into a servable {@link Resource}.
 *
 * <p>The Content-Type is derived from the file extension. If a transformer is
 * registered for the extension, it is applied to the raw bytes; otherwise the
 * file is served as is.</p>
 *
 * <pre>
 *   index.htl  → parse → render → text/html
 *   site.css   → (unchanged)    → text/css
 * </pre>
 */
public final class ResourceLoader {
    private final Map<String, ResourceTransformer> transformers;

    private ResourceLoader(Map<String, ResourceTransformer> transformers) {
        this.transformers = Map.copyOf(transformers);
    }

    /**
     * Loader with the {@code .htl} to HTML transformer registered.
     */
    public static ResourceLoader withDefaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws ResourceTransformException if the file was read but its
     *         transformer rejected it
     * @throws IOException if the file cannot be read
     */
    public Resource load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");

        byte[] content = Files.readAllBytes(file);
        String extension = ContentTypes.extensionOf(file);
        Resource resource = new Resource(ContentTypes.forExtension(extension), content);

        ResourceTransformer transformer = transformers.get(extension);
        if (transformer == null) {
            return resource;
        }
        return transformer.transform(file, resource);
    }

    public static final class Builder {
        private final Map<String, ResourceTransformer> transformers = new HashMap<>();

        private Builder() {
            transformers.put("htl", new HtlResourceTransformer(new DefaultHtlParser(), DefaultHtlRenderer.INSTANCE));
        }

        /**
         * Registers (or replaces) the transformer for files with {@code extension}
         * (given without the dot).
         */
        public Builder withTransformer(String extension, ResourceTransformer transformer) {
            Objects.requireNonNull(extension, "extension");
            if (extension.isEmpty() || extension.startsWith(".")) {
                throw new IllegalArgumentException("Extension must be given without the dot: " + extension);
            }
            transformers.put(extension, Objects.requireNonNull(transformer, "transformer"));
            return this;
        }

        public ResourceLoader build() {
            return new ResourceLoader(transformers);
        }
    }
}
