package org.pl0vm.runtime.spi;

import org.pl0vm.runtime.isa.ArithmeticOp;

/**
 * Satisfies the binary arithmetic instructions {@code ADD}, {@code SUB}, {@code MUL}
 * and {@code DIV} in place of native integer arithmetic.
 * <p>
 * Implementations blend an exact reference value with their own prediction using a
 * mixing factor and may fall back to the exact value when the blend strays too far.
 * The exact value must follow the virtual machine's contract: 32-bit integer
 * arithmetic with floor division, and a zero-guarded division that yields 0.
 * </p>
 * Implementations are called synchronously from the instruction loop. Any runtime
 * exception they throw aborts the run.
 */
public interface IArithmeticProvider {

    /**
     * Computes one binary operation.
     *
     * @param op the operation
     * @param a the left operand
     * @param b the right operand
     * @return the result with its diagnostics, never {@code null}
     */
    ArithmeticResult compute(ArithmeticOp op, int a, int b);
}
