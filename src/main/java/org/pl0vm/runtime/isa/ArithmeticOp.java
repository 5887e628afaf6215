package org.pl0vm.runtime.isa;

import java.util.Optional;

/**
 * The four binary arithmetic operations, with their exact integer semantics.
 * <p>
 * Exact results use 32-bit two's-complement arithmetic. {@link #DIV} is floor division,
 * so {@code DIV(-7, 2) == -4}.
 */
public enum ArithmeticOp {
    ADD(Opcode.ADD),
    SUB(Opcode.SUB),
    MUL(Opcode.MUL),
    DIV(Opcode.DIV);

    private final Opcode opcode;

    ArithmeticOp(Opcode opcode) {
        this.opcode = opcode;
    }

    public Opcode opcode() {
        return opcode;
    }

    /**
     * Computes the exact result.
     * @param a The left operand.
     * @param b The right operand.
     * @return The result.
     * @throws ArithmeticException if this is {@link #DIV} and {@code b} is zero.
     */
    public int exact(int a, int b) {
        return switch (this) {
            case ADD -> a + b;
            case SUB -> a - b;
            case MUL -> a * b;
            case DIV -> Math.floorDiv(a, b);
        };
    }

    /**
     * Computes the exact result, yielding 0 for a division by zero.
     * Providers use this as their comparator.
     * @param a The left operand.
     * @param b The right operand.
     * @return The result.
     */
    public int exactGuarded(int a, int b) {
        if (this == DIV && b == 0) {
            return 0;
        }
        return exact(a, b);
    }

    /**
     * Finds the operation executed by an arithmetic opcode.
     * @param opcode The opcode.
     * @return The operation, or empty if the opcode is not arithmetic.
     */
    public static Optional<ArithmeticOp> forOpcode(Opcode opcode) {
        for (ArithmeticOp op : values()) {
            if (op.opcode == opcode) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
