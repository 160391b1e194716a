package org.pyp.compiler.frontend;

/**
 * One physical line of the template after preprocessing.
 *
 * @param text The line content. For a logical line built from a multi-line expression
 *             this is the joined content.
 * @param lineNumber The 1-based physical line number in the template.
 * @param placeholder {@code true} if the physical line was swallowed by a multi-line
 *                    expression on an earlier line and only keeps the numbering intact.
 */
public record SourceLine(String text, int lineNumber, boolean placeholder) {

    /**
     * Creates a regular content line.
     * @param text The line content.
     * @param lineNumber The 1-based line number.
     * @return The line.
     */
    public static SourceLine of(String text, int lineNumber) {
        return new SourceLine(text, lineNumber, false);
    }

    /**
     * Creates a placeholder for a physical line that was joined into an earlier logical line.
     * @param lineNumber The 1-based line number.
     * @return The placeholder line.
     */
    public static SourceLine placeholder(int lineNumber) {
        return new SourceLine("", lineNumber, true);
    }
}
