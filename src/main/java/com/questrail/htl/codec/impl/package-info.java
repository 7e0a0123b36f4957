/**
 * Concrete HTL codec.
 *
 * <p>{@link com.questrail.htl.codec.impl.DefaultHtlParser} drives a state
 * machine built from {@code EatMode} (how the next character is consumed) and
 * {@code LexicalContext} (what the pending token means). Character tables and
 * escaping live in {@code HtlSyntax} and {@code HtlEscaping}.</p>
 */
package com.questrail.htl.codec.impl;
