package org.pl0vm.compiler.frontend.lexer;

import org.pl0vm.compiler.api.CompilationException;
import org.pl0vm.compiler.api.CompilerErrorCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify token types, values and positions, and the lexical errors.
 */
public class LexerTest {

    /**
     * Verifies that a small program is split into keywords, identifiers, symbols and numbers,
     * terminated by an end-of-input token.
     */
    @Test
    @Tag("unit")
    void testProgramTokenization() throws CompilationException {
        // Arrange
        String source = "program p; var x; x := 2.5 + 3;";

        // Act
        List<Token> tokens = new Lexer(source).scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.SYMBOL,
                TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.SYMBOL,
                TokenType.IDENTIFIER, TokenType.SYMBOL, TokenType.FLOAT, TokenType.SYMBOL, TokenType.NUMBER,
                TokenType.SYMBOL, TokenType.END_OF_INPUT);
        assertThat(tokens.get(7).text()).isEqualTo(":=");
        assertThat(tokens.get(8).value()).isEqualTo(2.5);
        assertThat(tokens.get(10).value()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void testKeywordsAreCaseInsensitiveButIdentifiersKeepCase() throws CompilationException {
        List<Token> tokens = new Lexer("BEGIN Foo End").scanTokens();

        assertThat(tokens.get(0).isKeyword("begin")).isTrue();
        assertThat(tokens.get(0).text()).isEqualTo("BEGIN");
        assertThat(tokens.get(1)).extracting(Token::type, Token::text).containsExactly(TokenType.IDENTIFIER, "Foo");
        assertThat(tokens.get(2).isKeyword("end")).isTrue();
    }

    /**
     * Verifies that line comments are dropped and that positions count lines and columns from 1.
     */
    @Test
    @Tag("unit")
    void testCommentsAndPositions() throws CompilationException {
        String source = "x // a comment := 1\n  y";

        List<Token> tokens = new Lexer(source).scanTokens();

        assertThat(tokens).hasSize(3);
        assertThat(tokens.get(0)).extracting(Token::text, Token::line, Token::column).containsExactly("x", 1, 1);
        assertThat(tokens.get(1)).extracting(Token::text, Token::line, Token::column, Token::offset)
                .containsExactly("y", 2, 3, 22);
    }

    @Test
    @Tag("unit")
    void testNumberForms() throws CompilationException {
        List<Token> tokens = new Lexer("1e3 2.5E-1 7 end.").scanTokens();

        assertThat(tokens.get(0)).extracting(Token::type, Token::value).containsExactly(TokenType.FLOAT, 1000.0);
        assertThat(tokens.get(1)).extracting(Token::type, Token::value).containsExactly(TokenType.FLOAT, 0.25);
        assertThat(tokens.get(2)).extracting(Token::type, Token::value).containsExactly(TokenType.NUMBER, 7);
        assertThat(tokens.get(4).isSymbol(".")).isTrue();
    }

    @Test
    @Tag("unit")
    void testIntegerOverflowIsInvalidNumber() {
        assertThatThrownBy(() -> new Lexer("x := 99999999999;").scanTokens())
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.INVALID_NUMBER));
    }

    /**
     * Verifies that a character starting no token is reported with its position.
     */
    @Test
    @Tag("unit")
    void testUnexpectedCharacter() {
        assertThatThrownBy(() -> new Lexer("x := 1;\n  @").scanTokens())
                .isInstanceOfSatisfying(CompilationException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNEXPECTED_CHARACTER);
                    assertThat(e.getSourceInfo().line()).isEqualTo(2);
                    assertThat(e.getSourceInfo().column()).isEqualTo(3);
                });
    }

    @Test
    @Tag("unit")
    void testLoneColonIsRejected() {
        assertThatThrownBy(() -> new Lexer("x : 1").scanTokens())
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNEXPECTED_CHARACTER));
    }

    @Test
    @Tag("unit")
    void testScanningTwiceReturnsTheSameTokens() throws CompilationException {
        Lexer lexer = new Lexer("begin x := 1; end");

        assertThat(lexer.scanTokens()).isEqualTo(lexer.scanTokens());
    }
}
