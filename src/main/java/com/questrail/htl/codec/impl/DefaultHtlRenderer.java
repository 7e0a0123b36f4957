package com.questrail.htl.codec.impl;

import com.questrail.htl.codec.HtlRenderer;
import com.questrail.htl.model.HtlNode;

/**
 * DefaultHtlRenderer
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link HtlRenderer}.
 *
 * <p>Emits the markup of {@link HtlNode#render()}, and the empty string for an
 * absent tree (the result of parsing empty input).</p>
 */
public final class DefaultHtlRenderer implements HtlRenderer
{
    public static final DefaultHtlRenderer INSTANCE = new DefaultHtlRenderer();

    @Override
    public String render(HtlNode node)
    {
        if (node == null) {
            return "";
        }
        return node.render();
    }
}
