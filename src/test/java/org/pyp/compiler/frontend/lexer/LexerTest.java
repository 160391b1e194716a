package org.pyp.compiler.frontend.lexer;

import org.pyp.compiler.frontend.SourceLine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that every kind of template line is classified and that the
 * keyword and statement text are extracted correctly.
 */
public class LexerTest {

    private final Lexer lexer = new Lexer();

    private Token classify(String text) {
        return lexer.classify(SourceLine.of(text, 1));
    }

    /**
     * Verifies that a control start line yields its header as statement and its keyword.
     */
    @Test
    @Tag("unit")
    void testControlStart() {
        // Act
        Token token = classify("  %  for item in items:");

        // Assert
        assertThat(token).extracting(Token::type, Token::statement, Token::word, Token::keyword)
                .containsExactly(TokenType.CONTROL_START, "for item in items:", "for", ControlKeyword.FOR);
    }

    /**
     * Verifies that middle keywords report the block keyword they belong to.
     */
    @Test
    @Tag("unit")
    void testControlMiddleMapsToOpeningKeyword() {
        assertThat(classify("%elif x > 1:")).extracting(Token::type, Token::word, Token::keyword)
                .containsExactly(TokenType.CONTROL_MIDDLE, "elif", ControlKeyword.IF);
        assertThat(classify("% else:")).extracting(Token::type, Token::keyword)
                .containsExactly(TokenType.CONTROL_MIDDLE, ControlKeyword.IF);
        assertThat(classify("%except ValueError as e:")).extracting(Token::type, Token::statement, Token::keyword)
                .containsExactly(TokenType.CONTROL_MIDDLE, "except ValueError as e:", ControlKeyword.TRY);
        assertThat(classify("%finally:")).extracting(Token::type, Token::keyword)
                .containsExactly(TokenType.CONTROL_MIDDLE, ControlKeyword.TRY);
    }

    /**
     * Verifies that end lines carry the end word and the keyword they close.
     */
    @Test
    @Tag("unit")
    void testControlEnd() {
        assertThat(classify("%endpypdef")).extracting(Token::type, Token::word, Token::keyword)
                .containsExactly(TokenType.CONTROL_END, "endpypdef", ControlKeyword.PYPDEF);
        assertThat(classify("   % endwhile  ")).extracting(Token::type, Token::keyword)
                .containsExactly(TokenType.CONTROL_END, ControlKeyword.WHILE);
    }

    /**
     * Verifies that a keyword must end at a word boundary; otherwise the line is a raw statement.
     */
    @Test
    @Tag("unit")
    void testKeywordNeedsWordBoundary() {
        assertThat(classify("%iffy = 1")).extracting(Token::type, Token::statement)
                .containsExactly(TokenType.STATEMENT, "iffy = 1");
        assertThat(classify("%format(x):")).extracting(Token::type)
                .isEqualTo(TokenType.STATEMENT);
    }

    /**
     * Verifies comment, verbatim, statement and literal classification.
     */
    @Test
    @Tag("unit")
    void testOtherLineKinds() {
        assertThat(classify("  ## a comment").type()).isEqualTo(TokenType.COMMENT);
        assertThat(classify("<%").type()).isEqualTo(TokenType.VERBATIM_START);
        assertThat(classify("% import math")).extracting(Token::type, Token::statement)
                .containsExactly(TokenType.STATEMENT, "import math");
        assertThat(classify("50% off").type()).isEqualTo(TokenType.LITERAL);
        assertThat(classify("# not a template comment").type()).isEqualTo(TokenType.LITERAL);
        assertThat(lexer.classify(SourceLine.placeholder(3)).type()).isEqualTo(TokenType.PLACEHOLDER);
    }

    /**
     * Verifies recognition of the verbatim block terminator.
     */
    @Test
    @Tag("unit")
    void testVerbatimEnd() {
        assertThat(lexer.isVerbatimEnd("  %>")).isTrue();
        assertThat(lexer.isVerbatimEnd("x = 1 %>")).isFalse();
    }
}
