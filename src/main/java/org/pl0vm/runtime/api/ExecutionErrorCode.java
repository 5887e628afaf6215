package org.pl0vm.runtime.api;

/**
 * Identifies the kind of fatal error that aborted an execution run.
 */
public enum ExecutionErrorCode {
    /** No executor is registered for the opcode. */
    UNKNOWN_OPCODE,
    /** An operand has the wrong kind, or an operand is missing. */
    MALFORMED_OPERAND,
    /** A register index lies outside the register file. */
    REGISTER_OUT_OF_RANGE,
    /** A jump, branch or call names a label the active sequence does not define. */
    UNRESOLVED_LABEL,
    /** PUSH onto a full data stack. */
    DATA_STACK_OVERFLOW,
    /** POP from an empty data stack. */
    DATA_STACK_UNDERFLOW,
    /** CALL or PL0CALL with a full call stack. */
    CALL_STACK_OVERFLOW,
    /** DIV with a zero divisor. */
    DIVISION_BY_ZERO,
    /** PL0CALL names a program missing from the registry. */
    UNKNOWN_PROGRAM,
    /** The run fetched more instructions than its step limit allows. */
    STEP_LIMIT_EXCEEDED,
    /** An attached provider threw or returned an invalid result. */
    PROVIDER_FAILURE
}
