package org.pl0vm.runtime.model;

/**
 * An entry on the call stack.
 * <p>
 * An intra-program {@code CALL} pushes a {@link ReturnAddress}; a cross-program
 * {@code PL0CALL} pushes a {@link ContextFrame} that also restores the caller's
 * instruction sequence and label table on return.
 */
public sealed interface CallFrame permits CallFrame.ReturnAddress, CallFrame.ContextFrame {

    /**
     * @return The instruction index execution resumes at.
     */
    int returnIndex();

    /**
     * Return point inside the active instruction sequence.
     * @param returnIndex The index of the instruction after the call.
     */
    record ReturnAddress(int returnIndex) implements CallFrame {}

    /**
     * Saved caller context of a cross-program call.
     * @param program The caller's instruction sequence.
     * @param labels The caller's label table.
     * @param returnIndex The index of the instruction after the PL0CALL.
     */
    record ContextFrame(Program program, LabelTable labels, int returnIndex) implements CallFrame {}
}
