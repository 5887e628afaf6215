package org.pl0vm.runtime.isa;

/**
 * An absolute memory address, written {@code [<address>]}. The address is normalized
 * into the memory range when the instruction executes.
 */
public record AddressOperand(int address) implements Operand {
    @Override
    public String toString() {
        return "[" + address + "]";
    }
}
