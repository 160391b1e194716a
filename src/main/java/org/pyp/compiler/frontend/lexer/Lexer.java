package org.pyp.compiler.frontend.lexer;

import org.pyp.compiler.frontend.SourceLine;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies template lines into {@link Token}s. Classification is line-local; the parser
 * decides what to do with a line based on the block it is currently in.
 */
public class Lexer {

    private static final Pattern COMMENT = Pattern.compile("^\\s*##");
    private static final Pattern VERBATIM_START = Pattern.compile("^\\s*<%");
    private static final Pattern VERBATIM_END = Pattern.compile("^\\s*%>");
    private static final Pattern CONTROL_START =
            Pattern.compile("^\\s*%\\s*((" + ControlKeyword.alternation() + ")\\b.*:)");
    private static final Pattern CONTROL_MIDDLE =
            Pattern.compile("^\\s*%\\s*((" + MiddleKeyword.alternation() + ")\\b.*:)");
    private static final Pattern CONTROL_END =
            Pattern.compile("^\\s*%\\s*end(" + ControlKeyword.alternation() + ")\\b");
    private static final Pattern STATEMENT = Pattern.compile("^\\s*%\\s*(.*)");

    /**
     * Classifies one line.
     * @param line The preprocessed line.
     * @return The token for the line.
     */
    public Token classify(SourceLine line) {
        if (line.placeholder()) {
            return new Token(TokenType.PLACEHOLDER, "", null, null, line);
        }
        String text = line.text();
        if (COMMENT.matcher(text).find()) {
            return new Token(TokenType.COMMENT, text, null, null, line);
        }
        if (VERBATIM_START.matcher(text).find()) {
            return new Token(TokenType.VERBATIM_START, text, null, null, line);
        }

        Matcher m = CONTROL_START.matcher(text);
        if (m.find()) {
            String word = m.group(2);
            return new Token(TokenType.CONTROL_START, m.group(1), word,
                    ControlKeyword.fromWord(word).orElseThrow(), line);
        }

        m = CONTROL_MIDDLE.matcher(text);
        if (m.find()) {
            String word = m.group(2);
            MiddleKeyword middle = MiddleKeyword.fromWord(word).orElseThrow();
            return new Token(TokenType.CONTROL_MIDDLE, m.group(1), word, middle.opens(), line);
        }

        m = CONTROL_END.matcher(text);
        if (m.find()) {
            ControlKeyword ended = ControlKeyword.fromWord(m.group(1)).orElseThrow();
            return new Token(TokenType.CONTROL_END, "", ended.endWord(), ended, line);
        }

        m = STATEMENT.matcher(text);
        if (m.find()) {
            return new Token(TokenType.STATEMENT, m.group(1), null, null, line);
        }
        return new Token(TokenType.LITERAL, text, null, null, line);
    }

    /**
     * Checks whether a line closes a verbatim block. Only meaningful inside such a block.
     * @param text The raw line.
     * @return {@code true} if the line starts with {@code %>}.
     */
    public boolean isVerbatimEnd(String text) {
        return VERBATIM_END.matcher(text).find();
    }
}
