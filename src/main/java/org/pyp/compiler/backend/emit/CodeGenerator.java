package org.pyp.compiler.backend.emit;

import org.pyp.compiler.frontend.parser.ast.ControlBlock;
import org.pyp.compiler.frontend.parser.ast.ControlSequence;
import org.pyp.compiler.frontend.parser.ast.Node;
import org.pyp.compiler.frontend.parser.ast.Sequence;
import org.pyp.compiler.frontend.parser.ast.StatementLine;

import java.util.ArrayList;
import java.util.List;

/**
 * The CodeGenerator is the backend of the template compiler. It projects the parsed tree onto
 * indented Python source, one line per statement and clause header, in tree order.
 * <p>
 * No validation happens here; whatever the template embeds is copied into the script.
 */
public class CodeGenerator {

    /** One level of Python indentation. */
    public static final String INDENT = "    ";

    /**
     * Generates the script for a parsed template.
     *
     * @param root The root sequence.
     * @return The Python source. Non-empty output ends with a line break.
     */
    public String generate(Sequence root) {
        List<String> lines = generateLines(root);
        return lines.isEmpty() ? "" : String.join("\n", lines) + "\n";
    }

    /**
     * Generates the script as individual lines; index {@code i} holds generated line {@code i + 1}.
     *
     * @param root The root sequence.
     * @return The generated lines.
     */
    public List<String> generateLines(Sequence root) {
        List<String> out = new ArrayList<>();
        emitNodes(root.nodes(), 0, out);
        return out;
    }

    private void emitNodes(List<Node> nodes, int depth, List<String> out) {
        for (Node node : nodes) {
            if (node instanceof StatementLine statement) {
                out.add(statement.verbatim() ? statement.text() : INDENT.repeat(depth) + statement.text());
            } else if (node instanceof ControlSequence control) {
                for (ControlBlock block : control.blocks()) {
                    out.add(INDENT.repeat(depth) + block.header().text());
                    emitNodes(block.nodes(), depth + 1, out);
                }
            } else if (node instanceof Sequence sequence) {
                emitNodes(sequence.nodes(), depth, out);
            } else {
                throw new IllegalStateException("Unexpected node type: " + node.getClass().getName());
            }
        }
    }
}
