package org.pyp.compiler.frontend.parser.ast;

import java.util.List;

/**
 * One clause of a control structure: a header such as {@code if x > 0:} or {@code else:}
 * and the nodes nested under it.
 *
 * @param header The header statement, emitted at the depth of the enclosing structure.
 * @param nodes The clause body, emitted one level deeper.
 */
public record ControlBlock(StatementLine header, List<Node> nodes) {

    public ControlBlock {
        nodes = List.copyOf(nodes);
    }
}
