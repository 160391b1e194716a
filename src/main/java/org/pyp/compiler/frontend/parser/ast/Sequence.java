package org.pyp.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An ordered list of nodes at one indentation level. The root of every parsed template is a Sequence.
 *
 * @param nodes The nodes, in template order.
 */
public record Sequence(List<Node> nodes) implements Node {

    public Sequence {
        nodes = List.copyOf(nodes);
    }

    @Override
    public List<Node> getChildren() {
        return nodes;
    }
}
