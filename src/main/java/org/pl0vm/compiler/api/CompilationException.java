package org.pl0vm.compiler.api;

/**
 * An exception that is thrown when compilation fails. The compiler stops at the
 * first error, so one exception describes exactly one problem.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;
    private final SourceInfo sourceInfo;

    /**
     * Constructs a new compilation exception with the specified detail message and source information.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The source position of the offending construct.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        super(String.format("%s at %s", message, sourceInfo), null);
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
    }

    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
