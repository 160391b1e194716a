package org.pyp.compiler.api;

/**
 * A pure data class representing a position in the template source.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The template the line belongs to.
 * @param lineNumber The 1-based line number.
 * @param lineContent The content of the line.
 */
public record SourceInfo(String fileName, int lineNumber, String lineContent) {

    @Override
    public String toString() {
        return String.format("File \"%s\", line %d", fileName, lineNumber);
    }
}
