package org.pl0vm.runtime.isa.instructions;

import org.pl0vm.runtime.api.ExecutionException;
import org.pl0vm.runtime.internal.services.ExecutionContext;
import org.pl0vm.runtime.isa.ImmediateOperand;
import org.pl0vm.runtime.isa.InstructionHandler;
import org.pl0vm.runtime.model.MachineState;

/**
 * Handles data movement between registers and memory.
 * <ul>
 *   <li>{@code LOAD rX, #imm} / {@code LOAD rX, [addr]} / {@code LOAD rX, [rY]}</li>
 *   <li>{@code STORE rX, [addr]} / {@code STORE rX, [rY]}</li>
 *   <li>{@code PEEK} and {@code POKE} are synonyms of the memory forms of LOAD and STORE.</li>
 * </ul>
 */
public class DataInstruction extends InstructionHandler {

    @Override
    public void execute(ExecutionContext context) throws ExecutionException {
        MachineState state = context.getState();
        int rX = register(context, 0);
        switch (context.getInstruction().opcode()) {
            case LOAD -> {
                if (context.getInstruction().operand(1) instanceof ImmediateOperand imm) {
                    state.setRegister(rX, imm.value());
                } else {
                    state.setRegister(rX, state.read(address(context, 1)));
                }
            }
            case PEEK -> state.setRegister(rX, state.read(address(context, 1)));
            case STORE, POKE -> state.write(address(context, 1), state.getRegister(rX));
            default -> throw new IllegalStateException("DataInstruction cannot execute " + context.getInstruction().opcode());
        }
    }
}
