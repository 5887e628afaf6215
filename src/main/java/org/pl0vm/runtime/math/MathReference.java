package org.pl0vm.runtime.math;

/**
 * Deterministic fixed-point implementation of the unary math intrinsics.
 * <p>
 * The input is decoded, clamped into the operation's safe domain, passed through the
 * real function, clamped into the safe output range and re-encoded. The VM uses this
 * when no math provider is attached, and providers use it as their exact comparator.
 */
public final class MathReference {

    private MathReference() {}

    /**
     * Evaluates an intrinsic on a fixed-point input.
     *
     * @param op The operation.
     * @param input The fixed-point input.
     * @param scale The fixed-point scale.
     * @return The fixed-point result.
     */
    public static int evaluate(MathOp op, int input, int scale) {
        double x = FixedPointCodec.decode(input, scale);
        double y;
        switch (op) {
            case SIN -> y = Math.sin(clamp(x, -Math.PI, Math.PI));
            case COS -> y = Math.cos(clamp(x, -Math.PI, Math.PI));
            case TAN -> y = clamp(Math.tan(clamp(x, -1.3, 1.3)), -8, 8);
            case TANH -> y = Math.tanh(clamp(x, -3, 3));
            case SINH -> y = clamp(Math.sinh(clamp(x, -3, 3)), -8, 8);
            case COSH -> y = clamp(Math.cosh(clamp(x, -3, 3)), 0, 10);
            case LN -> {
                if (x <= 0) {
                    return FixedPointCodec.encode(-16, scale);
                }
                y = clamp(Math.log(clamp(x, 1e-6, 256)), -16, 16);
            }
            case LOG10 -> {
                if (x <= 0) {
                    return FixedPointCodec.encode(-16, scale);
                }
                y = clamp(Math.log10(clamp(x, 1e-6, 256)), -16, 16);
            }
            case EXP -> y = clamp(Math.exp(clamp(x, -8, 8)), 0, 256);
            case SQRT -> {
                double clamped = clamp(x, 0, 256);
                y = clamp(clamped <= 0 ? 0 : Math.sqrt(clamped), 0, 16);
            }
            default -> throw new IllegalArgumentException("Unsupported math operation: " + op);
        }
        return FixedPointCodec.encode(y, scale);
    }

    static double clamp(double x, double low, double high) {
        return Math.max(low, Math.min(high, x));
    }
}
