package org.pl0vm.runtime.api;

import org.pl0vm.runtime.isa.Instruction;

/**
 * Thrown when an execution run aborts. The machine state is left as it was at the
 * moment of failure so the caller can inspect it.
 */
public class ExecutionException extends Exception {

    private final ExecutionErrorCode errorCode;
    private final transient Instruction instruction;
    private final int instructionPointer;

    /**
     * Constructs a new execution exception.
     * @param errorCode The error category.
     * @param message The detail message.
     * @param instruction The instruction being executed, may be null if none was fetched.
     * @param instructionPointer The instruction pointer of the failing instruction.
     */
    public ExecutionException(ExecutionErrorCode errorCode, String message, Instruction instruction, int instructionPointer) {
        this(errorCode, message, instruction, instructionPointer, null);
    }

    /**
     * Constructs a new execution exception with a cause.
     * @param errorCode The error category.
     * @param message The detail message.
     * @param instruction The instruction being executed, may be null if none was fetched.
     * @param instructionPointer The instruction pointer of the failing instruction.
     * @param cause The underlying cause.
     */
    public ExecutionException(ExecutionErrorCode errorCode, String message, Instruction instruction, int instructionPointer, Throwable cause) {
        super(format(errorCode, message, instruction, instructionPointer), cause);
        this.errorCode = errorCode;
        this.instruction = instruction;
        this.instructionPointer = instructionPointer;
    }

    private static String format(ExecutionErrorCode code, String message, Instruction instruction, int ip) {
        if (instruction == null) {
            return String.format("[%s] %s (ip=%d)", code, message, ip);
        }
        return String.format("[%s] %s at ip=%d: %s", code, message, ip, instruction);
    }

    public ExecutionErrorCode getErrorCode() {
        return errorCode;
    }

    public Instruction getInstruction() {
        return instruction;
    }

    public int getInstructionPointer() {
        return instructionPointer;
    }
}
