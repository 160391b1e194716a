package org.pyp.compiler.frontend.parser;

import org.pyp.compiler.api.SourceInfo;
import org.pyp.compiler.api.TemplateParseException;
import org.pyp.compiler.frontend.SourceLine;
import org.pyp.compiler.frontend.lexer.ControlKeyword;
import org.pyp.compiler.frontend.lexer.Lexer;
import org.pyp.compiler.frontend.lexer.Token;
import org.pyp.compiler.frontend.parser.ast.StatementLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The parser for templates. It consumes the preprocessed lines from top to bottom, without
 * backtracking, and builds the tree of statements and control structures together with the
 * line map used to attribute failures of the generated script to template lines.
 * <p>
 * Each control structure is parsed by a recursive call, so the recursion depth equals the
 * nesting depth of the template. Parsing stops at the first structural error.
 */
public class BlockParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(BlockParser.class);

    static final String ACCUMULATOR_INIT = LiteralLineTransformer.ACCUMULATOR + "=[]";
    static final String ACCUMULATOR_RETURN = "return '\\n'.join(" + LiteralLineTransformer.ACCUMULATOR + ")";

    private final Lexer lexer = new Lexer();
    private final LiteralLineTransformer transformer = new LiteralLineTransformer();
    private final VerbatimBlockReader verbatimReader;
    private final String fileName;

    /**
     * Constructs a new parser.
     * @param fileName The template name used in error reports.
     */
    public BlockParser(String fileName) {
        this.fileName = fileName;
        this.verbatimReader = new VerbatimBlockReader(lexer, fileName);
    }

    /**
     * Parses the complete template.
     *
     * @param lines The preprocessed template lines.
     * @return The root sequence and the line map.
     * @throws TemplateParseException if control keywords are mismatched or a block is not closed.
     */
    public ParseResult parse(List<SourceLine> lines) throws TemplateParseException {
        LineCursor cursor = new LineCursor(lines);
        SequenceBuilder root = SequenceBuilder.root();
        parseBlock(cursor, root);
        LOGGER.debug("Parsed {} template lines of '{}' into {} generated lines", lines.size(), fileName, root.generatedLineCount());
        return new ParseResult(root.buildSequence(), root.lineMap(), root.generatedLineCount());
    }

    /**
     * Parses lines into the given builder until the block's end keyword or the end of input.
     */
    private void parseBlock(LineCursor cursor, SequenceBuilder block) throws TemplateParseException {
        while (!cursor.isAtEnd()) {
            Token token = lexer.classify(cursor.advance());
            boolean blockEnded = switch (token.type()) {
                case PLACEHOLDER, COMMENT -> false;
                case VERBATIM_START -> {
                    for (VerbatimBlockReader.VerbatimLine line : verbatimReader.read(cursor, token)) {
                        block.add(line.statement(), line.lineNumber());
                    }
                    yield false;
                }
                case CONTROL_START -> {
                    parseControlStructure(cursor, token, block);
                    yield false;
                }
                case CONTROL_MIDDLE -> {
                    openMiddleClause(token, block);
                    yield false;
                }
                case CONTROL_END -> {
                    closeBlock(token, block);
                    yield true;
                }
                case STATEMENT -> {
                    block.add(StatementLine.of(token.statement()), token.line());
                    yield false;
                }
                case LITERAL -> {
                    block.add(StatementLine.of(transformer.toStatement(token.text(), block.isAccumulating())), token.line());
                    yield false;
                }
            };
            if (blockEnded) {
                return;
            }
        }

        if (!block.isRoot()) {
            Token opening = block.opening();
            throw error(String.format("Block ('%s', line %d) was not closed before end of input",
                    block.openingHeader(), opening.line()), opening);
        }
    }

    private void parseControlStructure(LineCursor cursor, Token token, SequenceBuilder parent) throws TemplateParseException {
        String header = token.statement();
        if (token.keyword().isTemplateFunction()) {
            header = ControlKeyword.DEF.word() + header.substring(token.keyword().word().length());
        }
        SequenceBuilder child = parent.openChild(token, StatementLine.of(header));
        if (token.keyword().isTemplateFunction()) {
            child.addSynthetic(StatementLine.of(ACCUMULATOR_INIT));
        }
        parseBlock(cursor, child);
        parent.closeChild(child);
    }

    private void openMiddleClause(Token token, SequenceBuilder block) throws TemplateParseException {
        if (block.isRoot()) {
            throw error(String.format("Found middle control word (%s) without starting word", token.word()), token);
        }
        if (token.keyword() != block.keyword()) {
            throw error(String.format("Middle control word (%s) doesn't match current block ('%s', line %d)",
                    token.word(), block.openingHeader(), block.opening().line()), token);
        }
        block.openClause(StatementLine.of(token.statement()), token.line());
    }

    private void closeBlock(Token token, SequenceBuilder block) throws TemplateParseException {
        if (block.isRoot()) {
            throw error(String.format("Found end control word (%s) without starting word", token.word()), token);
        }
        if (token.keyword() != block.keyword()) {
            throw error(String.format("End control word (%s) doesn't match current block ('%s', line %d)",
                    token.word(), block.openingHeader(), block.opening().line()), token);
        }
        if (block.keyword().isTemplateFunction()) {
            block.addSynthetic(StatementLine.of(ACCUMULATOR_RETURN));
        }
    }

    private TemplateParseException error(String message, Token token) {
        return new TemplateParseException(message, new SourceInfo(fileName, token.line(), token.text()));
    }
}
