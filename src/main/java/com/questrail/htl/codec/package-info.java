/**
 * HTL Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec boundary</strong> for HTL, a compact
 * S-expression notation that compiles to a restricted HTML subset:</p>
 *
 * <pre>
 *   (a :href http://foo "body")   →   &lt;a href="http://foo"&gt;body&lt;/a&gt;
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 *
 * <pre>
 *   String
 *        → HtlParser     (lexing, nesting, escaping applied here)
 *            → HtlElement   (synthetic root of the node tree)
 *                → HtlRenderer
 *                    → String (HTML)
 * </pre>
 *
 * <h2>Escaping Asymmetry</h2>
 * <p>Only quoted strings are HTML-escaped, once, at parse time. Bare tokens are
 * copied through untouched, and the renderer never re-escapes. As a result
 * {@code (a b<c)} renders a raw {@code <}. Existing documents depend on this,
 * so it is kept as is.</p>
 *
 * <p>Concrete implementations live in {@code codec.impl}.</p>
 */
package com.questrail.htl.codec;
