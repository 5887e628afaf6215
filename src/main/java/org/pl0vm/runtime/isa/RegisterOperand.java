package org.pl0vm.runtime.isa;

/**
 * A register operand, written {@code r<index>}.
 */
public record RegisterOperand(int index) implements Operand {
    @Override
    public String toString() {
        return "r" + index;
    }
}
