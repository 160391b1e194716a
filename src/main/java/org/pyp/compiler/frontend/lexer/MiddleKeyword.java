package org.pyp.compiler.frontend.lexer;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Keywords that continue an open control block with a new clause.
 */
public enum MiddleKeyword {
    ELIF,
    ELSE,
    EXCEPT,
    FINALLY;

    public String word() {
        return name().toLowerCase();
    }

    /**
     * @return The keyword of the block this clause belongs to.
     */
    public ControlKeyword opens() {
        return switch (this) {
            case ELIF, ELSE -> ControlKeyword.IF;
            case EXCEPT, FINALLY -> ControlKeyword.TRY;
        };
    }

    public static Optional<MiddleKeyword> fromWord(String word) {
        return Arrays.stream(values()).filter(k -> k.word().equals(word)).findFirst();
    }

    static String alternation() {
        return Arrays.stream(values()).map(MiddleKeyword::word).collect(Collectors.joining("|"));
    }
}
