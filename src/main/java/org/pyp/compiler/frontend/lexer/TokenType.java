package org.pyp.compiler.frontend.lexer;

/**
 * Defines the kinds of template lines the {@link Lexer} can recognize,
 * in the priority order in which they are tested.
 */
public enum TokenType {
    /** A physical line swallowed by a multi-line expression on an earlier line. */
    PLACEHOLDER,
    /** A line starting with {@code ##}. */
    COMMENT,
    /** A line starting with {@code <%}, opening a block of raw Python. */
    VERBATIM_START,
    /** {@code %} followed by a block-opening keyword and a trailing colon, e.g. {@code %for x in xs:}. */
    CONTROL_START,
    /** {@code %} followed by a clause keyword, e.g. {@code %elif y:}. */
    CONTROL_MIDDLE,
    /** {@code %end} followed by a block-opening keyword, e.g. {@code %endfor}. */
    CONTROL_END,
    /** {@code %} followed by any Python statement. */
    STATEMENT,
    /** Text to be written to the output, possibly with embedded expressions. */
    LITERAL
}
