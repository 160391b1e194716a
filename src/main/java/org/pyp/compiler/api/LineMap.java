package org.pyp.compiler.api;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Maps line numbers of the generated script to line numbers of the template.
 * <p>
 * A generated line without an entry was introduced by code generation
 * (for example the accumulator setup of a {@code pypdef} block) and has no template counterpart.
 */
public final class LineMap {

    private final TreeMap<Integer, Integer> generatedToSource = new TreeMap<>();

    /**
     * Records that the given generated line stems from the given template line.
     * @param generatedLine The 1-based line in the generated script.
     * @param sourceLine The 1-based line in the template.
     */
    public void put(int generatedLine, int sourceLine) {
        generatedToSource.put(generatedLine, sourceLine);
    }

    /**
     * Copies all entries of a nested block's map into this one.
     * @param nested The map built for a nested block.
     */
    public void mergeFrom(LineMap nested) {
        generatedToSource.putAll(nested.generatedToSource);
    }

    /**
     * Resolves a generated line to its template line.
     * @param generatedLine The 1-based line in the generated script.
     * @return The template line, or empty if the generated line is synthetic.
     */
    public OptionalInt sourceLineOf(int generatedLine) {
        Integer source = generatedToSource.get(generatedLine);
        return source == null ? OptionalInt.empty() : OptionalInt.of(source);
    }

    public int size() {
        return generatedToSource.size();
    }

    /**
     * @return An unmodifiable, ordered view of all entries.
     */
    public Map<Integer, Integer> entries() {
        return Collections.unmodifiableMap(generatedToSource);
    }

    @Override
    public String toString() {
        return generatedToSource.toString();
    }
}
