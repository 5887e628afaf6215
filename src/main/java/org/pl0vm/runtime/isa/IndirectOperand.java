package org.pl0vm.runtime.isa;

/**
 * A memory address held in a register, written {@code [r<register>]}.
 */
public record IndirectOperand(int register) implements Operand {
    @Override
    public String toString() {
        return "[r" + register + "]";
    }
}
