package org.pl0vm.runtime.isa;

import org.pl0vm.runtime.isa.instructions.ArithmeticInstruction;
import org.pl0vm.runtime.isa.instructions.ControlFlowInstruction;
import org.pl0vm.runtime.isa.instructions.DataInstruction;
import org.pl0vm.runtime.isa.instructions.MathInstruction;
import org.pl0vm.runtime.isa.instructions.StackInstruction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Registry binding every opcode to the instruction family that executes it.
 */
public final class InstructionSet {

    private static final Map<Opcode, InstructionHandler> HANDLERS = new EnumMap<>(Opcode.class);

    static {
        // Data-Family
        registerFamily(new DataInstruction(), EnumSet.of(Opcode.LOAD, Opcode.STORE, Opcode.PEEK, Opcode.POKE));

        // Stack-Family
        registerFamily(new StackInstruction(), EnumSet.of(Opcode.PUSH, Opcode.POP));

        // Arithmetic-Family
        registerFamily(new ArithmeticInstruction(), EnumSet.of(Opcode.ADD, Opcode.SUB, Opcode.MUL, Opcode.DIV));

        // Math-Family
        registerFamily(new MathInstruction(), EnumSet.of(Opcode.FSIN, Opcode.FCOS, Opcode.FTAN, Opcode.FTANH,
                Opcode.FSINH, Opcode.FCOSH, Opcode.FLN, Opcode.FLOG10, Opcode.FEXP, Opcode.FSQRT));

        // ControlFlow-Family
        registerFamily(new ControlFlowInstruction(), EnumSet.of(Opcode.LABEL, Opcode.JMP, Opcode.JZ, Opcode.JNZ,
                Opcode.CALL, Opcode.PL0CALL, Opcode.RET, Opcode.HALT));

        Set<Opcode> missing = EnumSet.complementOf(EnumSet.copyOf(HANDLERS.keySet()));
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Opcodes without an instruction family: " + missing);
        }
    }

    private InstructionSet() {}

    private static void registerFamily(InstructionHandler handler, Set<Opcode> opcodes) {
        for (Opcode opcode : opcodes) {
            InstructionHandler previous = HANDLERS.put(opcode, handler);
            if (previous != null) {
                throw new IllegalStateException("Opcode " + opcode + " registered twice");
            }
        }
    }

    /**
     * @param opcode The opcode.
     * @return The family executing it, or {@code null} if none is registered.
     */
    public static InstructionHandler handlerFor(Opcode opcode) {
        return HANDLERS.get(opcode);
    }

    public static Map<Opcode, InstructionHandler> handlers() {
        return Collections.unmodifiableMap(HANDLERS);
    }
}
