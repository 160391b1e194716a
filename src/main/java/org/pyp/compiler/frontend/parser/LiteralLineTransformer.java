package org.pyp.compiler.frontend.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a literal template line into a single Python statement that emits it.
 * <p>
 * Every {@code ${expr}} becomes a {@code %s} placeholder and {@code expr} becomes the
 * matching argument of a {@code %} format operation, in the order of appearance.
 * Expressions are copied as written; they are checked by Python, not here.
 */
public class LiteralLineTransformer {

    /** Name of the host function that writes one output line. */
    public static final String OUTPUT_FUNCTION = "_PRINT";
    /** Name of the list a named template function collects its lines in. */
    public static final String ACCUMULATOR = "_OUTPUT";

    static final Pattern EXPRESSION = Pattern.compile("\\$\\{(.*?)\\}", Pattern.DOTALL);

    /**
     * Builds the emitting statement for one literal line.
     *
     * @param line The literal line, without line terminator.
     * @param accumulate {@code true} inside a named template function: the line is appended
     *                   to the accumulator instead of being written out.
     * @return The Python statement.
     */
    public String toStatement(String line, boolean accumulate) {
        String function = accumulate ? ACCUMULATOR + ".append" : OUTPUT_FUNCTION;

        Matcher m = EXPRESSION.matcher(line);
        List<String> expressions = new ArrayList<>();
        StringBuilder format = new StringBuilder();
        int last = 0;
        while (m.find()) {
            format.append(escapePercent(line.substring(last, m.start()))).append("%s");
            expressions.add(m.group(1));
            last = m.end();
        }

        if (expressions.isEmpty()) {
            return function + "('" + escapeQuotes(line) + "')";
        }
        format.append(escapePercent(line.substring(last)));
        String arguments = expressions.stream()
                .map(expr -> "(" + expr + ")")
                .collect(Collectors.joining(","));
        return function + "('" + escapeQuotes(format.toString()) + "' % (" + arguments + ",))";
    }

    /**
     * Escapes backslashes and both quote characters for a single-quoted Python literal.
     * @param text The raw text.
     * @return The escaped text.
     */
    static String escapeQuotes(String text) {
        return text.replace("\\", "\\\\").replace("'", "\\'").replace("\"", "\\\"");
    }

    static String escapePercent(String text) {
        return text.replace("%", "%%");
    }
}
