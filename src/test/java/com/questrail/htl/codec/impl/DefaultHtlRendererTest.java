package com.questrail.htl.codec.impl;

import com.questrail.htl.model.HtlElement;
import com.questrail.htl.model.HtlText;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DefaultHtlRenderer} on hand-built trees.
 */
final class DefaultHtlRendererTest
{
    private final DefaultHtlRenderer renderer = DefaultHtlRenderer.INSTANCE;

    @Test
    void absentNodeRendersEmpty()
    {
        assertEquals("", renderer.render(null));
    }

    @Test
    void textIsVerbatim()
    {
        assertEquals("a<b &amp; c", renderer.render(new HtlText("a<b &amp; c")));
    }

    @Test
    void underscoreTextIsNonBreakingSpace()
    {
        assertEquals("&nbsp;", renderer.render(new HtlText("_")));
        assertEquals(" _", renderer.render(new HtlText(" _")));
    }

    @Test
    void attributesAreSortedRegardlessOfInsertionOrder()
    {
        HtlElement div = new HtlElement("div");
        div.putAttribute("z", "1");
        div.putAttribute("a", "2");
        div.putAttribute("m", "3");

        assertEquals("<div a=\"2\" m=\"3\" z=\"1\"></div>", renderer.render(div));
    }

    @Test
    void attributeValuesAreNotReEscaped()
    {
        HtlElement a = new HtlElement("a");
        a.putAttribute("title", "x\"y&z");

        assertEquals("<a title=\"x\"y&z\"></a>", renderer.render(a));
    }

    @Test
    void everyVoidTagSelfClosesWhenChildless()
    {
        for (String tag : new String[] { "br", "hr", "link", "img", "meta" }) {
            assertEquals("<" + tag + "/>", renderer.render(new HtlElement(tag)));
        }
    }

    @Test
    void voidTagWithChildrenIsPaired()
    {
        HtlElement br = new HtlElement("br");
        br.appendChild(new HtlText("x"));

        assertEquals("<br>x</br>", renderer.render(br));
    }

    @Test
    void voidTagMatchIsExact()
    {
        assertEquals("<BR></BR>", renderer.render(new HtlElement("BR")));
        assertEquals("<brx></brx>", renderer.render(new HtlElement("brx")));
    }

    @Test
    void childrenRenderInOrder()
    {
        HtlElement ul = new HtlElement("ul");
        for (String item : new String[] { "one", "two", "three" }) {
            HtlElement li = new HtlElement("li");
            li.appendChild(new HtlText(item));
            ul.appendChild(li);
        }

        assertEquals("<ul><li>one</li><li>two</li><li>three</li></ul>", renderer.render(ul));
    }

    @Test
    void anonymousElementsRenderOnlyTheirChildren()
    {
        HtlElement inner = HtlElement.anonymous();
        inner.appendChild(new HtlText("b"));
        inner.appendChild(new HtlElement("hr"));

        HtlElement root = HtlElement.anonymous();
        root.appendChild(new HtlText("a"));
        root.appendChild(inner);

        assertEquals("ab<hr/>", renderer.render(root));
        assertEquals("", renderer.render(HtlElement.anonymous()));
    }

    @Test
    void nodeRenderDelegatesToDefaultRenderer()
    {
        HtlElement p = new HtlElement("p");
        p.putAttribute("class", "x");
        p.appendChild(new HtlText("_"));

        assertEquals(renderer.render(p), p.render());
        assertEquals("<p class=\"x\">&nbsp;</p>", p.render());
    }

    @Test
    void renderingDoesNotMutateTheTree()
    {
        HtlElement a = new HtlElement("a");
        a.putAttribute("b", "1");
        a.appendChild(new HtlText("c"));

        String first = renderer.render(a);
        assertEquals(first, renderer.render(a));
        assertEquals(1, a.children().size());
        assertEquals(1, a.attributes().size());
    }

    @Test
    void deepTreeRenders()
    {
        HtlElement root = new HtlElement("d");
        HtlElement current = root;
        for (int i = 0; i < 999; i++) {
            HtlElement child = new HtlElement("d");
            current.appendChild(child);
            current = child;
        }

        String html = renderer.render(root);
        assertEquals("<d>".repeat(999) + "<d></d>" + "</d>".repeat(999), html);
    }
}
