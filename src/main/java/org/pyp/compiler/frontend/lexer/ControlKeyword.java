package org.pyp.compiler.frontend.lexer;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The closed family of keywords that open a control block in a template.
 */
public enum ControlKeyword {
    FOR,
    IF,
    TRY,
    WHILE,
    DEF,
    CLASS,
    WITH,
    /** A named template function: like {@code def}, but literal lines accumulate into its return value. */
    PYPDEF;

    /**
     * @return The keyword as written in templates.
     */
    public String word() {
        return name().toLowerCase();
    }

    /**
     * @return The keyword that closes a block opened by this keyword, e.g. {@code endif}.
     */
    public String endWord() {
        return "end" + word();
    }

    public boolean isTemplateFunction() {
        return this == PYPDEF;
    }

    /**
     * Looks up a keyword by its template spelling.
     * @param word The keyword text.
     * @return The keyword, or empty if the text is not a control keyword.
     */
    public static Optional<ControlKeyword> fromWord(String word) {
        return Arrays.stream(values()).filter(k -> k.word().equals(word)).findFirst();
    }

    static String alternation() {
        return Arrays.stream(values()).map(ControlKeyword::word).collect(Collectors.joining("|"));
    }
}
