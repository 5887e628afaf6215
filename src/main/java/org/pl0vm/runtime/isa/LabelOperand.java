package org.pl0vm.runtime.isa;

/**
 * A label name, resolved against the label table of the active instruction sequence.
 */
public record LabelOperand(String name) implements Operand {
    @Override
    public String toString() {
        return name;
    }
}
