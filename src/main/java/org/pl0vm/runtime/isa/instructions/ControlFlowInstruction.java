package org.pl0vm.runtime.isa.instructions;

import org.pl0vm.runtime.api.ExecutionErrorCode;
import org.pl0vm.runtime.api.ExecutionException;
import org.pl0vm.runtime.internal.services.ExecutionContext;
import org.pl0vm.runtime.internal.services.ProgramCallHandler;
import org.pl0vm.runtime.isa.InstructionHandler;
import org.pl0vm.runtime.isa.LabelOperand;
import org.pl0vm.runtime.isa.Operand;
import org.pl0vm.runtime.isa.ProgramOperand;
import org.pl0vm.runtime.model.MachineState;

/**
 * Handles jumps, branches, calls, returns, halting and label markers.
 * Branch targets are resolved in the active label table before the predicate is tested,
 * so an undefined label fails even when the branch is not taken.
 */
public class ControlFlowInstruction extends InstructionHandler {

    @Override
    public void execute(ExecutionContext context) throws ExecutionException {
        MachineState state = context.getState();
        switch (context.getInstruction().opcode()) {
            case LABEL -> {
                // marker only
            }
            case JMP -> state.setIp(label(context, 0));
            case JZ -> {
                int rX = register(context, 0);
                int target = label(context, 1);
                if (state.getRegister(rX) == 0) {
                    state.setIp(target);
                }
            }
            case JNZ -> {
                int rX = register(context, 0);
                int target = label(context, 1);
                if (state.getRegister(rX) != 0) {
                    state.setIp(target);
                }
            }
            case CALL -> new ProgramCallHandler(context).executeCall(label(context, 0));
            case PL0CALL -> new ProgramCallHandler(context).executeProgramCall(programName(context));
            case RET -> new ProgramCallHandler(context).executeReturn();
            case HALT -> state.setRunning(false);
            default -> throw new IllegalStateException("ControlFlowInstruction cannot execute " + context.getInstruction().opcode());
        }
    }

    private String programName(ExecutionContext context) throws ExecutionException {
        Operand operand = context.getInstruction().operand(0);
        if (operand instanceof ProgramOperand program) {
            return program.name();
        }
        if (operand instanceof LabelOperand label) {
            return label.name();
        }
        throw fail(context, ExecutionErrorCode.MALFORMED_OPERAND, "Expected program name, got " + operand);
    }
}
