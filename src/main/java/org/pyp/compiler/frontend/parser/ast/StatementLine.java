package org.pyp.compiler.frontend.parser.ast;

/**
 * A single line of generated Python.
 *
 * @param text The statement text, without indentation.
 * @param verbatim {@code true} if the line must be emitted exactly as stored, ignoring the
 *                 indentation depth of the enclosing blocks (continuation lines of a
 *                 triple-quoted string in a verbatim block).
 */
public record StatementLine(String text, boolean verbatim) implements Node {

    /**
     * Creates a statement that is indented with its enclosing block.
     * @param text The statement text.
     * @return The statement line.
     */
    public static StatementLine of(String text) {
        return new StatementLine(text, false);
    }
}
