package org.pl0vm.compiler.frontend.lexer;

import org.pl0vm.compiler.api.SourceInfo;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token (an Integer, a Double, or the
 *              lower-case keyword).
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param offset The character offset where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        int offset
) {

    /**
     * @param keyword The keyword, lower case.
     * @return true if this token is that keyword.
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && keyword.equals(value);
    }

    /**
     * @param symbol The symbol text.
     * @return true if this token is that symbol.
     */
    public boolean isSymbol(String symbol) {
        return type == TokenType.SYMBOL && symbol.equals(text);
    }

    public SourceInfo sourceInfo() {
        return new SourceInfo(line, column, offset);
    }

    /**
     * @return A short description for error messages.
     */
    public String describe() {
        return type == TokenType.END_OF_INPUT ? "end of input" : "'" + text + "'";
    }
}
