package org.pl0vm.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the error messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A character that starts no token. */
    UNEXPECTED_CHARACTER,
    /** A numeric literal that cannot be represented. */
    INVALID_NUMBER,
    // endregion

    // region Parser Errors
    /** A token other than the one the grammar requires. */
    UNEXPECTED_TOKEN,
    // endregion

    // region Semantic Errors
    /** A variable declared twice in one program. */
    DUPLICATE_VARIABLE,
    /** A reference to a variable that was never declared. */
    UNKNOWN_VARIABLE,
    /** A call-like form {@code name(expr)} whose name is no intrinsic or conversion. */
    UNKNOWN_INTRINSIC,
    /** A {@code call} to a program that is neither registered nor part of the batch. */
    UNKNOWN_PROGRAM,
    /** Variables and temporaries no longer fit into memory. */
    ADDRESS_SPACE_EXHAUSTED
    // endregion
}
