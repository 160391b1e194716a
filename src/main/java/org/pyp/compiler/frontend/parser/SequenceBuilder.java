package org.pyp.compiler.frontend.parser;

import org.pyp.compiler.api.LineMap;
import org.pyp.compiler.frontend.lexer.ControlKeyword;
import org.pyp.compiler.frontend.lexer.Token;
import org.pyp.compiler.frontend.parser.ast.ControlBlock;
import org.pyp.compiler.frontend.parser.ast.ControlSequence;
import org.pyp.compiler.frontend.parser.ast.Node;
import org.pyp.compiler.frontend.parser.ast.Sequence;
import org.pyp.compiler.frontend.parser.ast.StatementLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the nodes of one open block while it is being parsed and numbers the
 * generated lines they will occupy.
 * <p>
 * New nodes go to the clause opened last. A nested block gets its own builder starting
 * right after its header line; closing it hands the builder's line counter and line map
 * back to the parent.
 */
final class SequenceBuilder {

    private final ControlKeyword keyword;
    private final Token opening;
    private final boolean accumulating;
    private final List<Node> rootNodes = new ArrayList<>();
    private final List<StatementLine> headers = new ArrayList<>();
    private final List<List<Node>> clauses = new ArrayList<>();
    private List<Node> current;
    private final LineMap lineMap = new LineMap();
    private int nextGeneratedLine;

    private SequenceBuilder(ControlKeyword keyword, Token opening, boolean accumulating, int firstGeneratedLine) {
        this.keyword = keyword;
        this.opening = opening;
        this.accumulating = accumulating;
        this.nextGeneratedLine = firstGeneratedLine;
        this.current = rootNodes;
    }

    /**
     * @return A builder for the top level of a template.
     */
    static SequenceBuilder root() {
        return new SequenceBuilder(null, null, false, 1);
    }

    /**
     * Opens a nested block whose header is the given line. The header's generated line is
     * mapped here, in the parent; the nested builder starts numbering on the next line.
     *
     * @param token The opening token.
     * @param header The header statement as it is to be generated.
     * @return The builder of the nested block.
     */
    SequenceBuilder openChild(Token token, StatementLine header) {
        lineMap.put(nextGeneratedLine, token.line());
        boolean childAccumulates = accumulating || token.keyword().isTemplateFunction();
        SequenceBuilder child = new SequenceBuilder(token.keyword(), token, childAccumulates, nextGeneratedLine + 1);
        child.startClause(header);
        return child;
    }

    /**
     * Splices a completed nested block into the current clause.
     * @param child The builder returned by {@link #openChild}.
     */
    void closeChild(SequenceBuilder child) {
        current.add(child.buildControlSequence());
        nextGeneratedLine = child.nextGeneratedLine;
        lineMap.mergeFrom(child.lineMap);
    }

    /**
     * Starts a middle clause ({@code elif}, {@code except}, ...) of this block.
     * @param header The clause header.
     * @param sourceLine The template line of the clause keyword.
     */
    void openClause(StatementLine header, int sourceLine) {
        lineMap.put(nextGeneratedLine, sourceLine);
        nextGeneratedLine++;
        startClause(header);
    }

    private void startClause(StatementLine header) {
        headers.add(header);
        List<Node> nodes = new ArrayList<>();
        clauses.add(nodes);
        current = nodes;
    }

    /**
     * Adds a statement that stems from a template line.
     * @param statement The statement.
     * @param sourceLine The template line.
     */
    void add(StatementLine statement, int sourceLine) {
        lineMap.put(nextGeneratedLine, sourceLine);
        addSynthetic(statement);
    }

    /**
     * Adds a statement introduced by code generation. It occupies a generated line but has no map entry.
     * @param statement The statement.
     */
    void addSynthetic(StatementLine statement) {
        current.add(statement);
        nextGeneratedLine++;
    }

    boolean isRoot() {
        return keyword == null;
    }

    /**
     * @return {@code true} if literal lines append to the accumulator of a named template function.
     */
    boolean isAccumulating() {
        return accumulating;
    }

    ControlKeyword keyword() {
        return keyword;
    }

    Token opening() {
        return opening;
    }

    /**
     * @return The header of the opening clause, e.g. {@code if x > 0:}.
     */
    String openingHeader() {
        return headers.isEmpty() ? "" : headers.get(0).text();
    }

    LineMap lineMap() {
        return lineMap;
    }

    /**
     * @return The number of generated lines assigned so far.
     */
    int generatedLineCount() {
        return nextGeneratedLine - 1;
    }

    Sequence buildSequence() {
        return new Sequence(rootNodes);
    }

    private ControlSequence buildControlSequence() {
        List<ControlBlock> blocks = new ArrayList<>(headers.size());
        for (int i = 0; i < headers.size(); i++) {
            blocks.add(new ControlBlock(headers.get(i), clauses.get(i)));
        }
        return new ControlSequence(keyword, opening.line(), blocks);
    }
}
