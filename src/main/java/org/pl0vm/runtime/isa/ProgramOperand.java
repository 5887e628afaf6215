package org.pl0vm.runtime.isa;

/**
 * The name of a compiled program, resolved against the program registry.
 */
public record ProgramOperand(String name) implements Operand {
    @Override
    public String toString() {
        return name;
    }
}
