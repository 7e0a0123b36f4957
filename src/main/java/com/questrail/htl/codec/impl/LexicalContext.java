package com.questrail.htl.codec.impl;

/**
 * Lexical context of the parser: decides what a token means when it is
 * committed, and which characters are legal next.
 */
enum LexicalContext
{
    /** Between nodes; nothing pending. */
    DEFAULT,
    /** Reading the tag name right after {@code (}. */
    TAG,
    /** A tag name, attribute value or bare content token has just ended. */
    AFTER_TAG,
    /** Reading an attribute key after {@code :}. */
    ATTR_KEY,
    /** Key read; its value must come next. */
    AFTER_ATTR_KEY,
    /** Reading an attribute value. */
    ATTR_VALUE,
    /** Reading a content token. */
    CONTENT
}
