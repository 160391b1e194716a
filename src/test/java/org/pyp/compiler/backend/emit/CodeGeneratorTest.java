package org.pyp.compiler.backend.emit;

import org.pyp.compiler.frontend.lexer.ControlKeyword;
import org.pyp.compiler.frontend.parser.BlockParser;
import org.pyp.compiler.frontend.parser.ParseResult;
import org.pyp.compiler.frontend.parser.ast.ControlBlock;
import org.pyp.compiler.frontend.parser.ast.ControlSequence;
import org.pyp.compiler.frontend.parser.ast.Sequence;
import org.pyp.compiler.frontend.parser.ast.StatementLine;
import org.pyp.compiler.frontend.preprocessor.PreProcessor;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link CodeGenerator}.
 */
public class CodeGeneratorTest {

    private final CodeGenerator generator = new CodeGenerator();

    /**
     * Verifies that clause bodies are indented by one level per nesting depth.
     */
    @Test
    @Tag("unit")
    void testIndentationFollowsNesting() {
        // Arrange
        ControlSequence inner = new ControlSequence(ControlKeyword.IF, 2, List.of(
                new ControlBlock(StatementLine.of("if i:"), List.of(StatementLine.of("a()"))),
                new ControlBlock(StatementLine.of("else:"), List.of(StatementLine.of("b()")))));
        ControlSequence outer = new ControlSequence(ControlKeyword.FOR, 1, List.of(
                new ControlBlock(StatementLine.of("for i in x:"), List.of(inner))));
        Sequence root = new Sequence(List.of(outer, StatementLine.of("done()")));

        // Act
        String python = generator.generate(root);

        // Assert
        assertThat(python).isEqualTo(String.join("\n",
                "for i in x:",
                "    if i:",
                "        a()",
                "    else:",
                "        b()",
                "done()",
                ""));
    }

    /**
     * Verifies that verbatim lines are emitted without indentation.
     */
    @Test
    @Tag("unit")
    void testVerbatimLinesAreNotIndented() {
        // Arrange
        ControlSequence block = new ControlSequence(ControlKeyword.IF, 1, List.of(
                new ControlBlock(StatementLine.of("if a:"), List.of(
                        StatementLine.of("s = '''"),
                        new StatementLine("  raw", true),
                        new StatementLine("'''", true)))));

        // Act
        List<String> lines = generator.generateLines(new Sequence(List.of(block)));

        // Assert
        assertThat(lines).containsExactly("if a:", "    s = '''", "  raw", "'''");
    }

    /**
     * Verifies that an empty tree generates an empty script.
     */
    @Test
    @Tag("unit")
    void testEmptyTree() {
        assertThat(generator.generate(new Sequence(List.of()))).isEmpty();
    }

    /**
     * Verifies that the generator emits exactly as many lines as the parser numbered, so the
     * line map stays valid for the generated text.
     */
    @Test
    @Tag("unit")
    void testLineCountMatchesParser() throws Exception {
        // Arrange
        List<String> template = List.of(
                "%pypdef row(cells):",
                "%for c in cells:",
                "| ${c}",
                "%endfor",
                "%endpypdef",
                "%try:",
                "${row([1, 2])}",
                "%except Exception:",
                "<%",
                "  pass",
                "%>",
                "%finally:",
                "end",
                "%endtry");
        ParseResult parsed = new BlockParser("t.pyp").parse(new PreProcessor().process(template));

        // Act
        List<String> lines = generator.generateLines(parsed.root());

        // Assert
        assertThat(lines).hasSize(parsed.generatedLineCount());
        assertThat(lines.get(parsed.lineMap().entries().keySet().stream().max(Integer::compare).orElseThrow() - 1))
                .isEqualTo("    _PRINT('end')");
    }
}
