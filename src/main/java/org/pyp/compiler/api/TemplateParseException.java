package org.pyp.compiler.api;

/**
 * Thrown when a template is structurally invalid: a control keyword does not match
 * the block it appears in, or a block is never closed.
 * <p>
 * Parsing stops at the first such error; no code is generated or executed.
 */
public class TemplateParseException extends Exception {

    private final transient SourceInfo sourceInfo;

    /**
     * Constructs a new parse exception.
     * @param message The diagnostic message.
     * @param sourceInfo The offending template line.
     */
    public TemplateParseException(String message, SourceInfo sourceInfo) {
        super(message, null);
        this.sourceInfo = sourceInfo;
    }

    /**
     * @return The offending template line.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }

    /**
     * @return The 1-based template line number of the error.
     */
    public int getLineNumber() {
        return sourceInfo.lineNumber();
    }

    /**
     * @return The text of the offending template line.
     */
    public String getLineContent() {
        return sourceInfo.lineContent();
    }
}
