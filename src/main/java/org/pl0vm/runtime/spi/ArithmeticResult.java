package org.pl0vm.runtime.spi;

/**
 * Outcome of one binary provider call.
 *
 * @param result The value written to the destination register.
 * @param exact The exact reference value.
 * @param prediction The provider's raw prediction.
 * @param mixed The blend of exact value and prediction.
 * @param usedFallback Whether the safety fallback replaced the blend with the exact value.
 */
public record ArithmeticResult(int result, int exact, int prediction, int mixed, boolean usedFallback) {

    /**
     * @return The absolute difference between prediction and exact value.
     */
    public long absError() {
        return Math.abs((long) prediction - exact);
    }
}
