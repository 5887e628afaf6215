package org.pl0vm.runtime.spi;

import org.pl0vm.runtime.math.MathOp;

/**
 * Satisfies the unary math instructions ({@code FSIN}, {@code FLN}, ...) in place of
 * the deterministic fixed-point reference.
 * <p>
 * Unlike {@link IArithmeticProvider}, mixing and fallback are evaluated in the
 * operation's normalized {@code [0,1]} output space, since the provider works on
 * bounded real ranges rather than raw integer magnitudes.
 * </p>
 */
public interface IMathProvider {

    /**
     * Computes one intrinsic.
     *
     * @param op the operation
     * @param input the fixed-point input
     * @return the result with its diagnostics, never {@code null}
     */
    MathResult compute(MathOp op, int input);
}
