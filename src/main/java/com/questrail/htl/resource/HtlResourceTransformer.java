package com.questrail.htl.resource;

import com.questrail.htl.codec.HtlParseException;
import com.questrail.htl.codec.HtlParser;
import com.questrail.htl.codec.HtlRenderer;
import com.questrail.htl.model.HtlElement;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiles an {@code .htl} file to HTML: parse, then render.
 *
 * <p>The source is read as UTF-8 and the rendered HTML is encoded as UTF-8.
 * An empty file yields an empty HTML document.</p>
 */
public final class HtlResourceTransformer implements ResourceTransformer {
    private final HtlParser parser;
    private final HtlRenderer renderer;

    public HtlResourceTransformer(HtlParser parser, HtlRenderer renderer) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    @Override
    public Resource transform(Path file, Resource raw) throws ResourceTransformException {
        String source = new String(raw.content(), StandardCharsets.UTF_8);

        final Optional<HtlElement> tree;
        try {
            tree = parser.parse(source);
        } catch (HtlParseException e) {
            throw new ResourceTransformException(file, e.getMessage(), e);
        }

        String html = renderer.render(tree.orElse(null));
        return new Resource(ContentTypes.HTML, html.getBytes(StandardCharsets.UTF_8));
    }
}
