package org.pl0vm.runtime.isa;

/**
 * An immediate integer, written {@code #<value>}.
 */
public record ImmediateOperand(int value) implements Operand {
    @Override
    public String toString() {
        return "#" + value;
    }
}
