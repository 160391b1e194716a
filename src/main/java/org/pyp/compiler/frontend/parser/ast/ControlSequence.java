package org.pyp.compiler.frontend.parser.ast;

import org.pyp.compiler.frontend.lexer.ControlKeyword;

import java.util.ArrayList;
import java.util.List;

/**
 * A control structure such as {@code for}, {@code if/elif/else} or {@code try/except}:
 * the opening clause followed by its middle clauses, in template order.
 *
 * @param keyword The keyword that opened the structure.
 * @param openingLine The template line of the opening keyword.
 * @param blocks The clauses; the first one is the opening clause.
 */
public record ControlSequence(ControlKeyword keyword, int openingLine, List<ControlBlock> blocks) implements Node {

    public ControlSequence {
        blocks = List.copyOf(blocks);
    }

    /**
     * Returns the nodes of all clauses in order; headers are not included.
     */
    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>();
        for (ControlBlock block : blocks) {
            children.addAll(block.nodes());
        }
        return children;
    }
}
