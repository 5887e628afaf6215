package org.pl0vm.runtime.model;

import org.pl0vm.runtime.isa.Instruction;

import java.util.List;
import java.util.Objects;

/**
 * A named, immutable instruction sequence.
 *
 * @param name The program name.
 * @param instructions The instructions in execution order.
 */
public record Program(String name, List<Instruction> instructions) {

    public Program {
        Objects.requireNonNull(name, "name");
        instructions = List.copyOf(instructions);
    }

    /**
     * @return The number of instructions, label markers included.
     */
    public int size() {
        return instructions.size();
    }

    /**
     * @param index The instruction index.
     * @return The instruction at the index.
     */
    public Instruction get(int index) {
        return instructions.get(index);
    }
}
