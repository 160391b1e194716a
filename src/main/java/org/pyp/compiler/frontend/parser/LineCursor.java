package org.pyp.compiler.frontend.parser;

import org.pyp.compiler.frontend.SourceLine;

import java.util.List;

/**
 * A forward-only cursor over the preprocessed template lines.
 * <p>
 * The parser hands one cursor down its recursion; whichever frame currently parses
 * a block is the only one advancing it.
 */
public final class LineCursor {

    private final List<SourceLine> lines;
    private int current = 0;

    /**
     * @param lines The preprocessed lines. The list is copied.
     */
    public LineCursor(List<SourceLine> lines) {
        this.lines = List.copyOf(lines);
    }

    public boolean isAtEnd() {
        return current >= lines.size();
    }

    /**
     * Returns the current line and moves past it.
     * @return The consumed line.
     * @throws IllegalStateException if the cursor is at the end.
     */
    public SourceLine advance() {
        if (isAtEnd()) {
            throw new IllegalStateException("No more template lines");
        }
        return lines.get(current++);
    }
}
