package org.pl0vm.runtime.isa;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An immutable machine instruction: an opcode and zero to two operands.
 * <p>
 * {@link #toString()} produces the instruction text form, e.g. {@code STORE r0, [30]},
 * or {@code name:} for a label marker.
 *
 * @param opcode The opcode.
 * @param operands The operands, in order.
 */
public record Instruction(Opcode opcode, List<Operand> operands) {

    /** Largest number of operands any instruction takes. */
    public static final int MAX_OPERANDS = 2;

    public Instruction {
        Objects.requireNonNull(opcode, "opcode");
        operands = List.copyOf(operands);
        if (operands.size() > MAX_OPERANDS) {
            throw new IllegalArgumentException(opcode + " takes at most " + MAX_OPERANDS + " operands, got " + operands.size());
        }
    }

    /**
     * Creates an instruction.
     * @param opcode The opcode.
     * @param operands The operands.
     * @return The instruction.
     */
    public static Instruction of(Opcode opcode, Operand... operands) {
        return new Instruction(opcode, List.of(operands));
    }

    /**
     * Creates a label marker.
     * @param name The label name.
     * @return A {@link Opcode#LABEL} instruction.
     */
    public static Instruction label(String name) {
        return of(Opcode.LABEL, new LabelOperand(name));
    }

    /**
     * @return {@code true} if this is a label marker.
     */
    public boolean isLabel() {
        return opcode == Opcode.LABEL;
    }

    /**
     * Returns the operand at the given position.
     * @param index The operand position.
     * @return The operand, or {@code null} if the instruction has fewer operands.
     */
    public Operand operand(int index) {
        return index < operands.size() ? operands.get(index) : null;
    }

    @Override
    public String toString() {
        if (isLabel()) {
            return operands.isEmpty() ? ":" : operands.get(0) + ":";
        }
        if (operands.isEmpty()) {
            return opcode.mnemonic();
        }
        return opcode.mnemonic() + " " + operands.stream().map(Operand::toString).collect(Collectors.joining(", "));
    }
}
