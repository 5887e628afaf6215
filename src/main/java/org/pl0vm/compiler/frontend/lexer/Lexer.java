package org.pl0vm.compiler.frontend.lexer;

import org.pl0vm.compiler.api.CompilationException;
import org.pl0vm.compiler.api.CompilerErrorCode;
import org.pl0vm.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * PL/0 source text into a sequence of tokens.
 * <p>
 * Line comments starting with {@code //} are skipped. Keywords are matched
 * case-insensitively, identifiers keep their case. Numbers with a fraction or an
 * exponent become {@link TokenType#FLOAT} tokens carrying the unscaled real value.
 */
public class Lexer {

    /** The reserved words. {@code odd} is reserved although no statement uses it. */
    public static final Set<String> KEYWORDS = Set.of(
            "program", "var", "begin", "end", "call", "if", "then", "while", "do", "odd",
            "push", "pop", "peek", "poke");

    private static final String SINGLE_CHAR_SYMBOLS = "+-*/(),;.=";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Performs the tokenization of the entire source code. Calling it again returns
     * the same tokens.
     * @return A list of the recognized tokens, terminated by {@link TokenType#END_OF_INPUT}.
     * @throws CompilationException at the first character that starts no token or an unrepresentable number.
     */
    public List<Token> scanTokens() throws CompilationException {
        if (!tokens.isEmpty()) {
            return List.copyOf(tokens);
        }
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_INPUT, "", null, line, column, current));
        return List.copyOf(tokens);
    }

    private void scanToken() throws CompilationException {
        char c = advance();
        switch (c) {
            case ' ', '\r', '\t', '\f' -> {
                // whitespace
            }
            case '\n' -> {
                line++;
                column = 1;
            }
            case ':' -> {
                if (peek() == '=') {
                    advance();
                    addToken(TokenType.SYMBOL, ":=");
                } else {
                    throw error(CompilerErrorCode.UNEXPECTED_CHARACTER, "Unexpected character ':'");
                }
            }
            case '/' -> {
                if (peek() == '/') {
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    addToken(TokenType.SYMBOL, "/");
                }
            }
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else if (SINGLE_CHAR_SYMBOLS.indexOf(c) >= 0) {
                    addToken(TokenType.SYMBOL, String.valueOf(c));
                } else {
                    throw error(CompilerErrorCode.UNEXPECTED_CHARACTER, "Unexpected character '" + c + "'");
                }
            }
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        String lower = text.toLowerCase(Locale.ROOT);
        if (KEYWORDS.contains(lower)) {
            addToken(TokenType.KEYWORD, lower);
        } else {
            addToken(TokenType.IDENTIFIER, text);
        }
    }

    private void number() throws CompilationException {
        boolean isFloat = false;
        while (isDigit(peek())) advance();

        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance();
            while (isDigit(peek())) advance();
        }

        if (peek() == 'e' || peek() == 'E') {
            char sign = peekNext();
            boolean exponent = isDigit(sign) || ((sign == '+' || sign == '-') && isDigit(peekAt(2)));
            if (exponent) {
                isFloat = true;
                advance();
                if (peek() == '+' || peek() == '-') advance();
                while (isDigit(peek())) advance();
            }
        }

        String text = source.substring(start, current);
        if (isFloat) {
            double value = Double.parseDouble(text);
            if (!Double.isFinite(value)) {
                throw error(CompilerErrorCode.INVALID_NUMBER, "Bad float literal: " + text);
            }
            addToken(TokenType.FLOAT, value);
        } else {
            try {
                addToken(TokenType.NUMBER, Integer.parseInt(text));
            } catch (NumberFormatException e) {
                throw error(CompilerErrorCode.INVALID_NUMBER, "Integer literal out of range: " + text);
            }
        }
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, startLine, startColumn, start));
    }

    private CompilationException error(CompilerErrorCode code, String message) {
        return new CompilationException(code, message, new SourceInfo(startLine, startColumn, start));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int distance) {
        int index = current + distance;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c) || c == '_';
    }
}
