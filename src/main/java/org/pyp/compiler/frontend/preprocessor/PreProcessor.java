package org.pyp.compiler.frontend.preprocessor;

import org.pyp.compiler.frontend.SourceLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The preprocessor for templates. It runs before the parser and turns the raw text
 * into a list of {@link SourceLine}s.
 * <p>
 * An embedded expression {@code ${...}} may span several physical lines. Such an expression
 * is collapsed into one logical line (the line breaks inside it become spaces) and every
 * physical line it swallowed is represented by a placeholder line directly after it, so the
 * output has exactly one entry per physical template line.
 */
public class PreProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PreProcessor.class);

    static final String EXPRESSION_START = "${";
    static final char EXPRESSION_END = '}';

    /**
     * Splits template text into physical lines. Both {@code \n} and {@code \r\n} end a line;
     * a single trailing line break terminates the last line instead of opening an empty one.
     *
     * @param text The template text.
     * @return The physical lines.
     */
    public static List<String> splitLines(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\\r?\\n", -1)));
        if (lines.size() > 1 && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    /**
     * Preprocesses the given template text.
     * @param text The template text.
     * @return One {@link SourceLine} per physical line, in order.
     */
    public List<SourceLine> process(String text) {
        return process(splitLines(text));
    }

    /**
     * Preprocesses the given physical lines.
     * @param physicalLines The template lines.
     * @return One {@link SourceLine} per physical line, in order.
     */
    public List<SourceLine> process(List<String> physicalLines) {
        List<SourceLine> result = new ArrayList<>(physicalLines.size());
        int index = 0;
        while (index < physicalLines.size()) {
            int lineNumber = index + 1;
            StringBuilder logical = new StringBuilder(physicalLines.get(index));
            int joined = 0;
            int searchFrom = 0;
            while (true) {
                int start = logical.indexOf(EXPRESSION_START, searchFrom);
                if (start < 0) {
                    break;
                }
                int end = logical.indexOf(String.valueOf(EXPRESSION_END), start + EXPRESSION_START.length());
                if (end >= 0) {
                    searchFrom = end + 1;
                    continue;
                }
                int next = index + joined + 1;
                if (!closedFrom(physicalLines, next)) {
                    // unterminated expression, stays literal text
                    break;
                }
                logical.append(' ').append(physicalLines.get(next));
                joined++;
            }

            result.add(SourceLine.of(logical.toString(), lineNumber));
            for (int i = 1; i <= joined; i++) {
                result.add(SourceLine.placeholder(lineNumber + i));
            }
            if (joined > 0) {
                LOGGER.debug("Collapsed multi-line expression at line {} spanning {} lines", lineNumber, joined + 1);
            }
            index += joined + 1;
        }
        return result;
    }

    /**
     * Checks whether any physical line from the given index on holds an expression end.
     */
    private static boolean closedFrom(List<String> physicalLines, int from) {
        for (int i = from; i < physicalLines.size(); i++) {
            if (physicalLines.get(i).indexOf(EXPRESSION_END) >= 0) {
                return true;
            }
        }
        return false;
    }
}
