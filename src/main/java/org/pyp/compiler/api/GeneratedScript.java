package org.pyp.compiler.api;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * The result of translating a template: the generated Python text together with
 * everything needed to attribute failures back to template lines.
 *
 * @param programName The template name used in diagnostics.
 * @param sourceLines The original template lines, as read.
 * @param pythonText The generated script.
 * @param lineMap The generated-line to template-line mapping.
 */
public record GeneratedScript(String programName, List<String> sourceLines, String pythonText, LineMap lineMap) {

    /**
     * Resolves a line of the generated script to the template line it came from.
     *
     * @param generatedLine The 1-based line number in {@link #pythonText()}.
     * @return The template position, or empty if the line has no template counterpart.
     */
    public Optional<SourceInfo> resolve(int generatedLine) {
        OptionalInt sourceLine = lineMap.sourceLineOf(generatedLine);
        if (sourceLine.isEmpty()) {
            return Optional.empty();
        }
        int lineNumber = sourceLine.getAsInt();
        String content = lineNumber >= 1 && lineNumber <= sourceLines.size() ? sourceLines.get(lineNumber - 1) : "";
        return Optional.of(new SourceInfo(programName, lineNumber, content));
    }
}
