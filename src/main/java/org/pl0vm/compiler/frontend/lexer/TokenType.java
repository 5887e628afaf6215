package org.pl0vm.compiler.frontend.lexer;

/**
 * Defines the types of tokens the {@link Lexer} can produce.
 */
public enum TokenType {
    /** An integer literal; its value is the unscaled {@link Integer}. */
    NUMBER,
    /** A literal with a fraction or exponent; its value is the real {@link Double}. */
    FLOAT,
    IDENTIFIER,
    /** A reserved word; its value is the lower-case keyword. */
    KEYWORD,
    /** An operator or punctuation, including {@code :=}. */
    SYMBOL,
    END_OF_INPUT
}
