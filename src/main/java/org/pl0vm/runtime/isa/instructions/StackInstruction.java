package org.pl0vm.runtime.isa.instructions;

import org.pl0vm.runtime.api.ExecutionErrorCode;
import org.pl0vm.runtime.api.ExecutionException;
import org.pl0vm.runtime.internal.services.ExecutionContext;
import org.pl0vm.runtime.isa.InstructionHandler;
import org.pl0vm.runtime.model.DataStack;
import org.pl0vm.runtime.model.MachineState;

/**
 * Handles {@code PUSH rX} and {@code POP rX} on the bounded data stack.
 */
public class StackInstruction extends InstructionHandler {

    @Override
    public void execute(ExecutionContext context) throws ExecutionException {
        MachineState state = context.getState();
        DataStack stack = state.getDataStack();
        int rX = register(context, 0);
        switch (context.getInstruction().opcode()) {
            case PUSH -> {
                if (stack.isFull()) {
                    throw fail(context, ExecutionErrorCode.DATA_STACK_OVERFLOW,
                            "Data stack overflow (capacity " + stack.capacity() + ")");
                }
                stack.push(state.getRegister(rX));
            }
            case POP -> {
                if (stack.isEmpty()) {
                    throw fail(context, ExecutionErrorCode.DATA_STACK_UNDERFLOW, "Data stack underflow");
                }
                state.setRegister(rX, stack.pop());
            }
            default -> throw new IllegalStateException("StackInstruction cannot execute " + context.getInstruction().opcode());
        }
    }
}
