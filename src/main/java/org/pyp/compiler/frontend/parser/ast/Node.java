package org.pyp.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes of the template tree.
 */
public interface Node {
    /**
     * Returns the direct child nodes, in generation order.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<Node> getChildren() {
        return Collections.emptyList();
    }
}
