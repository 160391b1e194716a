package org.pyp.runtime;

import java.util.List;
import java.util.OptionalInt;

/**
 * A failure of a generated script, described in terms of generated line numbers only.
 * Attribution to template lines is left to the caller, which owns the line map.
 */
public class ScriptExecutionException extends Exception {

    /**
     * The kind of failure.
     */
    public enum Kind {
        /** The script could not be compiled. */
        SYNTAX,
        /** The script raised an error while running. */
        RUNTIME
    }

    private final Kind kind;
    private final String errorType;
    private final Integer generatedLine;
    private final transient List<Integer> frameLines;
    private final String detail;

    /**
     * @param kind The kind of failure.
     * @param errorType The Python exception type name.
     * @param message The exception message.
     * @param generatedLine The failing line of the generated script, or {@code null} if unknown.
     * @param frameLines The lines of all script frames on the failing call chain, outermost first.
     * @param detail The host's own rendering of the error.
     */
    public ScriptExecutionException(Kind kind, String errorType, String message, Integer generatedLine,
                                    List<Integer> frameLines, String detail) {
        super(message);
        this.kind = kind;
        this.errorType = errorType;
        this.generatedLine = generatedLine;
        this.frameLines = frameLines == null ? List.of() : List.copyOf(frameLines);
        this.detail = detail;
    }

    public Kind getKind() {
        return kind;
    }

    public String getErrorType() {
        return errorType;
    }

    /**
     * @return The failing generated line: the reported line of a syntax error, or the line of
     *         the innermost script frame of a runtime error.
     */
    public OptionalInt getGeneratedLine() {
        return generatedLine == null ? OptionalInt.empty() : OptionalInt.of(generatedLine);
    }

    public List<Integer> getFrameLines() {
        return frameLines;
    }

    public String getDetail() {
        return detail;
    }
}
