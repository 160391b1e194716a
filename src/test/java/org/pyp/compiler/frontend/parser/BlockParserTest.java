package org.pyp.compiler.frontend.parser;

import org.pyp.compiler.api.TemplateParseException;
import org.pyp.compiler.frontend.SourceLine;
import org.pyp.compiler.frontend.lexer.ControlKeyword;
import org.pyp.compiler.frontend.parser.ast.ControlBlock;
import org.pyp.compiler.frontend.parser.ast.ControlSequence;
import org.pyp.compiler.frontend.parser.ast.Node;
import org.pyp.compiler.frontend.parser.ast.StatementLine;
import org.pyp.compiler.frontend.preprocessor.PreProcessor;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Contains unit tests for the {@link BlockParser}.
 * These tests verify the tree structure, the line map and the structural error reports.
 */
public class BlockParserTest {

    private static List<SourceLine> lines(String... template) {
        return new PreProcessor().process(List.of(template));
    }

    private static ParseResult parse(String... template) throws TemplateParseException {
        return new BlockParser("test.pyp").parse(lines(template));
    }

    /**
     * Verifies the tree and line map of an if/else template.
     */
    @Test
    @Tag("unit")
    void testIfElse() throws Exception {
        // Act
        ParseResult result = parse(
                "%if x > 0:",
                "positive",
                "%else:",
                "other",
                "%endif");

        // Assert
        assertThat(result.root().nodes()).hasSize(1);
        ControlSequence control = (ControlSequence) result.root().nodes().get(0);
        assertThat(control.keyword()).isEqualTo(ControlKeyword.IF);
        assertThat(control.blocks()).hasSize(2);
        assertThat(control.blocks().get(0).header().text()).isEqualTo("if x > 0:");
        assertThat(control.blocks().get(0).nodes()).containsExactly(StatementLine.of("_PRINT('positive')"));
        assertThat(control.blocks().get(1).header().text()).isEqualTo("else:");
        assertThat(result.generatedLineCount()).isEqualTo(4);
        assertThat(result.lineMap().entries()).containsExactly(entry(1, 1), entry(2, 2), entry(3, 3), entry(4, 4));
    }

    /**
     * Verifies that the depth of the tree equals the nesting depth of the control keywords.
     */
    @Test
    @Tag("unit")
    void testTreeDepthMatchesKeywordNesting() throws Exception {
        // Act
        ParseResult result = parse(
                "%for a in x:",
                "%while b:",
                "%with c as d:",
                "%try:",
                "deep",
                "%except E:",
                "%if e:",
                "deeper",
                "%endif",
                "%endtry",
                "%endwith",
                "%endwhile",
                "%endfor");

        // Assert
        assertThat(depth(result.root())).isEqualTo(5);
    }

    /**
     * Verifies that plain literal lines yield one emitting statement each, in order.
     */
    @Test
    @Tag("unit")
    void testPlainLinesYieldOneStatementEach() throws Exception {
        // Act
        ParseResult result = parse("one", "two", "", "three");

        // Assert
        assertThat(result.root().nodes()).containsExactly(
                StatementLine.of("_PRINT('one')"),
                StatementLine.of("_PRINT('two')"),
                StatementLine.of("_PRINT('')"),
                StatementLine.of("_PRINT('three')"));
    }

    private static int depth(Node node) {
        int childDepth = 0;
        if (node instanceof ControlSequence control) {
            for (ControlBlock block : control.blocks()) {
                for (Node child : block.nodes()) {
                    childDepth = Math.max(childDepth, depth(child));
                }
            }
            return childDepth + 1;
        }
        for (Node child : node.getChildren()) {
            childDepth = Math.max(childDepth, depth(child));
        }
        return childDepth;
    }

    /**
     * Verifies that a named template function gets its accumulator lines and that these
     * synthetic lines have no line map entry.
     */
    @Test
    @Tag("unit")
    void testPypdefAddsSyntheticLines() throws Exception {
        // Act
        ParseResult result = parse(
                "%pypdef greet(n):",
                "Hi ${n}",
                "%endpypdef",
                "${greet('Bob')}");

        // Assert
        ControlSequence function = (ControlSequence) result.root().nodes().get(0);
        assertThat(function.keyword()).isEqualTo(ControlKeyword.PYPDEF);
        assertThat(function.blocks().get(0).header().text()).isEqualTo("def greet(n):");
        assertThat(function.blocks().get(0).nodes()).containsExactly(
                StatementLine.of("_OUTPUT=[]"),
                StatementLine.of("_OUTPUT.append('Hi %s' % ((n),))"),
                StatementLine.of("return '\\n'.join(_OUTPUT)"));
        assertThat(result.generatedLineCount()).isEqualTo(5);
        assertThat(result.lineMap().entries()).containsExactly(entry(1, 1), entry(3, 2), entry(5, 4));
    }

    /**
     * Verifies that literal lines in a block nested inside a named template function still accumulate.
     */
    @Test
    @Tag("unit")
    void testNestedBlockInsidePypdefAccumulates() throws Exception {
        // Act
        ParseResult result = parse(
                "%pypdef items(xs):",
                "%for x in xs:",
                "- ${x}",
                "%endfor",
                "%endpypdef");

        // Assert
        ControlSequence function = (ControlSequence) result.root().nodes().get(0);
        assertThat(result.root().getChildren()).containsExactly(function);
        assertThat(function.getChildren()).hasSize(3);
        ControlSequence loop = (ControlSequence) function.blocks().get(0).nodes().get(1);
        assertThat(loop.blocks().get(0).nodes()).containsExactly(StatementLine.of("_OUTPUT.append('- %s' % ((x),))"));
    }

    /**
     * Verifies that comments and placeholder lines generate nothing while the numbering of
     * later template lines stays intact.
     */
    @Test
    @Tag("unit")
    void testCommentsAndPlaceholdersAreSkipped() throws Exception {
        // Act
        ParseResult result = parse(
                "## header comment",
                "${f(1,",
                "  2)}",
                "last");

        // Assert
        assertThat(result.generatedLineCount()).isEqualTo(2);
        assertThat(result.lineMap().entries()).containsExactly(entry(1, 2), entry(2, 4));
    }

    /**
     * Verifies the line map through nested blocks and raw statements.
     */
    @Test
    @Tag("unit")
    void testNestedLineMap() throws Exception {
        // Act
        ParseResult result = parse(
                "% total = 0",
                "%for i in range(3):",
                "  %if i % 2:",
                "  % total += i",
                "  %endif",
                "%endfor",
                "${total}");

        // Assert
        Map<Integer, Integer> entries = result.lineMap().entries();
        assertThat(entries).containsExactly(entry(1, 1), entry(2, 2), entry(3, 3), entry(4, 4), entry(5, 7));
        assertThat(result.generatedLineCount()).isEqualTo(5);
    }

    /**
     * Verifies that a verbatim block is shifted left by its first code line's indentation and
     * that triple-quoted continuation lines are kept as written.
     */
    @Test
    @Tag("unit")
    void testVerbatimBlock() throws Exception {
        // Act
        ParseResult result = parse(
                "%if a:",
                "<%",
                "    x = 1",
                "    s = \"\"\"",
                "  keep",
                "\"\"\"",
                "%>",
                "%endif");

        // Assert
        ControlSequence control = (ControlSequence) result.root().nodes().get(0);
        assertThat(control.blocks().get(0).nodes()).containsExactly(
                StatementLine.of("x = 1"),
                StatementLine.of("s = \"\"\""),
                new StatementLine("  keep", true),
                new StatementLine("\"\"\"", true));
        assertThat(result.lineMap().entries()).containsExactly(
                entry(1, 1), entry(2, 3), entry(3, 4), entry(4, 5), entry(5, 6));
    }

    /**
     * Verifies that an end keyword for a different block is reported at its own line.
     */
    @Test
    @Tag("unit")
    void testMismatchedEnd() {
        assertThatThrownBy(() -> parse("%for x in y:", "body", "%endif"))
                .isInstanceOf(TemplateParseException.class)
                .hasMessage("End control word (endif) doesn't match current block ('for x in y:', line 1)")
                .satisfies(e -> assertThat(((TemplateParseException) e).getLineNumber()).isEqualTo(3));
    }

    /**
     * Verifies that a middle keyword of another block family is rejected.
     */
    @Test
    @Tag("unit")
    void testMismatchedMiddle() {
        assertThatThrownBy(() -> parse("%for x in y:", "%else:", "%endfor"))
                .isInstanceOf(TemplateParseException.class)
                .hasMessage("Middle control word (else) doesn't match current block ('for x in y:', line 1)")
                .satisfies(e -> assertThat(((TemplateParseException) e).getLineNumber()).isEqualTo(2));
    }

    /**
     * Verifies the reports for middle and end keywords at the top level.
     */
    @Test
    @Tag("unit")
    void testKeywordsWithoutStart() {
        assertThatThrownBy(() -> parse("text", "%else:"))
                .hasMessage("Found middle control word (else) without starting word");
        assertThatThrownBy(() -> parse("%endfor"))
                .hasMessage("Found end control word (endfor) without starting word")
                .satisfies(e -> assertThat(((TemplateParseException) e).getLineContent()).isEqualTo("%endfor"));
    }

    /**
     * Verifies that a block still open at the end of input is reported at its opening line.
     */
    @Test
    @Tag("unit")
    void testUnclosedBlock() {
        assertThatThrownBy(() -> parse("first", "%if a:", "inside"))
                .isInstanceOf(TemplateParseException.class)
                .hasMessage("Block ('if a:', line 2) was not closed before end of input")
                .satisfies(e -> assertThat(((TemplateParseException) e).getLineNumber()).isEqualTo(2));
    }

    /**
     * Verifies that an unterminated verbatim block is a parse error at its opening line.
     */
    @Test
    @Tag("unit")
    void testUnclosedVerbatimBlock() {
        assertThatThrownBy(() -> parse("a", "<%", "x = 1"))
                .isInstanceOf(TemplateParseException.class)
                .hasMessage("Python block opened with '<%' is not closed with '%>'")
                .satisfies(e -> assertThat(((TemplateParseException) e).getLineNumber()).isEqualTo(2));
    }
}
