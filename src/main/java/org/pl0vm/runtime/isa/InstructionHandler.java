package org.pl0vm.runtime.isa;

import org.pl0vm.runtime.api.ExecutionErrorCode;
import org.pl0vm.runtime.api.ExecutionException;
import org.pl0vm.runtime.internal.services.ExecutionContext;
import org.pl0vm.runtime.model.MachineState;

/**
 * The abstract base class for the instruction families of the VM.
 * A family executes every opcode it is registered for in {@link InstructionSet};
 * handlers are stateless and shared across runs.
 */
public abstract class InstructionHandler {

    /**
     * Executes the instruction held by the context. The machine's instruction pointer
     * already points at the next instruction; jumps and calls overwrite it.
     * @param context The execution context.
     * @throws ExecutionException if the instruction cannot be executed.
     */
    public abstract void execute(ExecutionContext context) throws ExecutionException;

    /**
     * Resolves a register operand to a validated register index.
     * @param context The execution context.
     * @param position The operand position.
     * @return The register index.
     * @throws ExecutionException if the operand is not a register or is out of range.
     */
    protected int register(ExecutionContext context, int position) throws ExecutionException {
        Operand operand = context.getInstruction().operand(position);
        if (!(operand instanceof RegisterOperand reg)) {
            throw fail(context, ExecutionErrorCode.MALFORMED_OPERAND,
                    "Expected register as operand " + (position + 1) + ", got " + operand);
        }
        if (!context.getState().isValidRegister(reg.index())) {
            throw fail(context, ExecutionErrorCode.REGISTER_OUT_OF_RANGE,
                    "Register out of range: " + reg);
        }
        return reg.index();
    }

    /**
     * Resolves a bracketed memory operand. Absolute addresses are used as written,
     * register-indirect addresses read the register; both are normalized into range.
     * @param context The execution context.
     * @param position The operand position.
     * @return The normalized memory address.
     * @throws ExecutionException if the operand is not a memory operand.
     */
    protected int address(ExecutionContext context, int position) throws ExecutionException {
        Operand operand = context.getInstruction().operand(position);
        MachineState state = context.getState();
        if (operand instanceof AddressOperand absolute) {
            return state.normalizeAddress(absolute.address());
        }
        if (operand instanceof IndirectOperand indirect) {
            if (!state.isValidRegister(indirect.register())) {
                throw fail(context, ExecutionErrorCode.REGISTER_OUT_OF_RANGE,
                        "Register out of range: " + indirect);
            }
            return state.normalizeAddress(state.getRegister(indirect.register()));
        }
        throw fail(context, ExecutionErrorCode.MALFORMED_OPERAND,
                "Expected memory operand as operand " + (position + 1) + ", got " + operand);
    }

    /**
     * Resolves a label operand against the active label table.
     * @param context The execution context.
     * @param position The operand position.
     * @return The instruction index of the label.
     * @throws ExecutionException if the operand is not a label or the label is undefined.
     */
    protected int label(ExecutionContext context, int position) throws ExecutionException {
        Operand operand = context.getInstruction().operand(position);
        if (!(operand instanceof LabelOperand label)) {
            throw fail(context, ExecutionErrorCode.MALFORMED_OPERAND,
                    "Expected label as operand " + (position + 1) + ", got " + operand);
        }
        return context.getState().getLabels().resolve(label.name())
                .orElseThrow(() -> fail(context, ExecutionErrorCode.UNRESOLVED_LABEL,
                        "Unknown label: " + label.name()));
    }

    /**
     * Creates an execution exception for the current instruction.
     * @param context The execution context.
     * @param code The error code.
     * @param message The detail message.
     * @return The exception, to be thrown by the caller.
     */
    protected ExecutionException fail(ExecutionContext context, ExecutionErrorCode code, String message) {
        return new ExecutionException(code, message, context.getInstruction(), context.getInstructionPointer());
    }
}
