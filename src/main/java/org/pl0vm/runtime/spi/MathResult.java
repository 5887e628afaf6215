package org.pl0vm.runtime.spi;

/**
 * Outcome of one unary provider call.
 *
 * @param result The fixed-point value written to the register.
 * @param prediction The provider's raw prediction, in fixed point.
 * @param exact The deterministic reference value, in fixed point.
 * @param usedFallback Whether the safety fallback replaced the blend with the exact value.
 * @param outNorm The normalized value the result was decoded from.
 * @param exactNorm The normalized exact value.
 * @param predNorm The normalized prediction.
 */
public record MathResult(int result, int prediction, int exact, boolean usedFallback,
                         double outNorm, double exactNorm, double predNorm) {

    /**
     * @return The absolute error between prediction and exact value in normalized units.
     */
    public double absError() {
        return Math.abs(predNorm - exactNorm);
    }
}
