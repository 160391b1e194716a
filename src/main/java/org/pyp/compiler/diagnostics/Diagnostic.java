package org.pyp.compiler.diagnostics;

import org.pyp.compiler.api.SourceInfo;
import org.pyp.compiler.api.TemplateParseException;

import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Represents a failure of a template: a structural error found while parsing, or a failure
 * of the generated script attributed back to a template line.
 *
 * @param type The kind of failure.
 * @param errorType The name of the error, e.g. {@code ParseError} or {@code ZeroDivisionError}.
 * @param message The error message.
 * @param fileName The template name.
 * @param location The template line the failure was attributed to, or {@code null} if it
 *                 could not be determined.
 * @param detail Additional text shown with the report (e.g. the raw Python error), or {@code null}.
 * @param traceback The mapped call chain of a runtime failure, innermost last; empty unless requested.
 */
public record Diagnostic(
        Type type,
        String errorType,
        String message,
        String fileName,
        SourceInfo location,
        String detail,
        List<String> traceback
) {
    /**
     * The kind of a diagnostic.
     */
    public enum Type {
        /** Mismatched or unclosed control keywords; nothing was executed. */
        PARSE_ERROR,
        /** The generated script is not valid Python. */
        SYNTAX_ERROR,
        /** The generated script raised an error while running. */
        RUNTIME_ERROR
    }

    /** Shown in place of a template line when a failure cannot be attributed to one. */
    public static final String UNKNOWN_SOURCE_LINE = "Sorry, could not find pyp source line";

    public Diagnostic {
        traceback = traceback == null ? List.of() : List.copyOf(traceback);
    }

    /**
     * Creates the diagnostic for a structural template error.
     * @param e The parse exception.
     * @return The diagnostic.
     */
    public static Diagnostic fromParseError(TemplateParseException e) {
        SourceInfo info = e.getSourceInfo();
        return new Diagnostic(Type.PARSE_ERROR, "ParseError", e.getMessage(), info.fileName(), info, null, List.of());
    }

    /**
     * @return The template line, if the failure could be attributed to one.
     */
    public Optional<SourceInfo> sourceInfo() {
        return Optional.ofNullable(location);
    }

    /**
     * Renders the diagnostic as the framed report printed by the command line.
     * @return The multi-line report.
     */
    public String render() {
        StringJoiner out = new StringJoiner("\n");
        switch (type) {
            case PARSE_ERROR -> {
                out.add("====== PARSE ERROR =========");
                appendLocation(out);
                out.add(errorType + ": " + message);
                out.add("============================");
            }
            case SYNTAX_ERROR -> {
                out.add("======= SYNTAX ERROR =============");
                appendLocation(out);
                out.add(errorType + ": " + message);
                if (detail != null) {
                    out.add("");
                    out.add("DETAILED SYNTAX ERROR:");
                    out.add(detail);
                }
                out.add("===================================");
            }
            case RUNTIME_ERROR -> {
                out.add("======= ERROR INFO ================");
                appendLocation(out);
                if (location == null && detail != null) {
                    out.add(detail);
                }
                out.add(errorType + ": " + message);
                if (!traceback.isEmpty()) {
                    out.add("");
                    out.add("PYP TRACEBACK:");
                    traceback.forEach(out::add);
                }
                out.add("===================================");
            }
        }
        return out.toString();
    }

    private void appendLocation(StringJoiner out) {
        if (location != null) {
            out.add(location.toString());
            out.add("  " + location.lineContent());
        } else {
            out.add(UNKNOWN_SOURCE_LINE);
        }
    }

    @Override
    public String toString() {
        String where = location != null ? fileName + ":" + location.lineNumber() : fileName + ":?";
        return String.format("[%s] %s: %s: %s", type, where, errorType, message);
    }
}
