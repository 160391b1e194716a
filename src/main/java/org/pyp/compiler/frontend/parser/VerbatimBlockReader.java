package org.pyp.compiler.frontend.parser;

import org.pyp.compiler.api.SourceInfo;
import org.pyp.compiler.api.TemplateParseException;
import org.pyp.compiler.frontend.SourceLine;
import org.pyp.compiler.frontend.lexer.Lexer;
import org.pyp.compiler.frontend.lexer.Token;
import org.pyp.compiler.frontend.parser.ast.StatementLine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a {@code <% ... %>} block of raw Python.
 * <p>
 * The block is shifted left by the indentation of its first non-blank, non-comment line so it
 * can be re-indented to the depth of the enclosing template block. Lines that continue a
 * triple-quoted string are left untouched: an odd number of {@code """} or {@code '''} on a line
 * toggles that mode for the lines that follow it.
 */
class VerbatimBlockReader {

    private static final Pattern TRIPLE_QUOTE = Pattern.compile("\"\"\"|'''");
    private static final Pattern BLANK_OR_COMMENT = Pattern.compile("^\\s*(#.*)?$");

    /**
     * A line of the block together with its template line number.
     */
    record VerbatimLine(StatementLine statement, int lineNumber) {}

    private final Lexer lexer;
    private final String fileName;

    VerbatimBlockReader(Lexer lexer, String fileName) {
        this.lexer = lexer;
        this.fileName = fileName;
    }

    /**
     * Consumes lines up to and including the closing {@code %>}.
     *
     * @param cursor The cursor, positioned after the opening line.
     * @param opening The opening token.
     * @return The normalized lines of the block.
     * @throws TemplateParseException if the input ends before the block is closed.
     */
    List<VerbatimLine> read(LineCursor cursor, Token opening) throws TemplateParseException {
        List<SourceLine> raw = new ArrayList<>();
        List<Boolean> keepAsIs = new ArrayList<>();
        boolean inTripleQuotes = false;
        Integer indent = null;
        boolean closed = false;

        while (!cursor.isAtEnd()) {
            SourceLine line = cursor.advance();
            if (line.placeholder()) {
                continue;
            }
            if (lexer.isVerbatimEnd(line.text())) {
                closed = true;
                break;
            }
            raw.add(line);
            keepAsIs.add(inTripleQuotes);
            if (countTripleQuotes(line.text()) % 2 != 0) {
                inTripleQuotes = !inTripleQuotes;
            }
            if (indent == null && !BLANK_OR_COMMENT.matcher(line.text()).matches()) {
                indent = leadingWhitespace(line.text());
            }
        }
        if (!closed) {
            throw new TemplateParseException("Python block opened with '<%' is not closed with '%>'",
                    new SourceInfo(fileName, opening.line(), opening.text()));
        }

        int strip = indent == null ? 0 : indent;
        List<VerbatimLine> result = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            SourceLine line = raw.get(i);
            StatementLine statement = keepAsIs.get(i)
                    ? new StatementLine(line.text(), true)
                    : StatementLine.of(line.text().substring(Math.min(strip, leadingWhitespace(line.text()))));
            result.add(new VerbatimLine(statement, line.lineNumber()));
        }
        return result;
    }

    static int countTripleQuotes(String text) {
        Matcher m = TRIPLE_QUOTE.matcher(text);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }

    private static int leadingWhitespace(String text) {
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }
}
