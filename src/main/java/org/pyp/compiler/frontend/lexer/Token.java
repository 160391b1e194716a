package org.pyp.compiler.frontend.lexer;

import org.pyp.compiler.frontend.SourceLine;

/**
 * A classified template line.
 *
 * @param type The kind of line.
 * @param statement The Python text carried by the line: the block header for
 *                  {@link TokenType#CONTROL_START} and {@link TokenType#CONTROL_MIDDLE},
 *                  the statement for {@link TokenType#STATEMENT}, the raw text otherwise.
 * @param word The keyword as written ({@code elif}, {@code endfor}), or {@code null}.
 * @param keyword The block keyword the line opens, continues or closes, or {@code null}.
 * @param source The line the token was classified from.
 */
public record Token(
        TokenType type,
        String statement,
        String word,
        ControlKeyword keyword,
        SourceLine source
) {
    public int line() {
        return source.lineNumber();
    }

    public String text() {
        return source.text();
    }
}
