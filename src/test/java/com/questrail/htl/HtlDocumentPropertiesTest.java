package com.questrail.htl;

import com.questrail.htl.codec.HtlParseException;
import com.questrail.htl.codec.HtlParser;
import com.questrail.htl.codec.HtlRenderer;
import com.questrail.htl.codec.impl.DefaultHtlParser;
import com.questrail.htl.codec.impl.DefaultHtlRenderer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end properties of parse followed by render.
 *
 * These tests prove:
 *   HTL text -> tree -> HTML
 * behaves the same for every document of a given shape.
 */
final class HtlDocumentPropertiesTest
{
    private final HtlParser parser = new DefaultHtlParser();
    private final HtlRenderer renderer = DefaultHtlRenderer.INSTANCE;

    @Test
    void emptyDocumentRendersEmpty() throws HtlParseException
    {
        assertEquals("", compile(""));
    }

    @Test
    void taggedDocumentIsWrappedInItsTag() throws HtlParseException
    {
        String[] tags = { "a", "div", "span", "p", "section", "br", "img", "meta", "hr", "link" };
        for (String tag : tags) {
            for (String body : new String[] { "", " x", " \"y\"", " (i z)", " :k v" }) {
                String html = compile("(" + tag + body + ")");
                assertTrue(html.startsWith("<" + tag), html);

                boolean selfClosed = html.endsWith("/>");
                boolean paired = html.endsWith("</" + tag + ">");
                assertTrue(selfClosed ^ paired, html);
            }
        }
    }

    @Test
    void nestedAttributesAreSortedPerElement() throws HtlParseException
    {
        String html = compile("(a :x 1 (b :z 2 :y 3 (c)))");

        int b = html.indexOf("<b");
        assertTrue(html.indexOf("y=\"3\"", b) < html.indexOf("z=\"2\"", b));
    }

    @Test
    void malformedNestingIsNeverRepaired()
    {
        assertThrows(HtlParseException.class, () -> parser.parse("(a(b(c))"));
        assertThrows(HtlParseException.class, () -> parser.parse("(a(b(c))))"));
    }

    /**
     * Compiling twice is not an identity: the first pass produces HTML, which
     * reads back as a single bare token outside any element.
     */
    @Test
    void compilingTwiceIsNotIdempotent() throws HtlParseException
    {
        String once = compile("(p (b bold) \"&\")");
        assertEquals("<p><b>bold</b>&amp;</p>", once);
        assertEquals("", compile(once));
    }

    @Test
    void quotedAndBareTokensDifferOnlyInEscaping() throws HtlParseException
    {
        assertEquals("<a>x&lt;y</a>", compile("(a \"x<y\")"));
        assertEquals("<a>x<y</a>", compile("(a x<y)"));
        assertEquals(compile("(a \"plain\")"), compile("(a plain)"));
    }

    private String compile(String input) throws HtlParseException
    {
        return renderer.render(parser.parse(input).orElse(null));
    }
}
