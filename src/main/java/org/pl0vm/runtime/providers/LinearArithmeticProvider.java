package org.pl0vm.runtime.providers;

import org.pl0vm.runtime.isa.ArithmeticOp;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * A linear model per operation over the feature vector
 * {@code [a, b, a+b, a-b, a*b, a/b, |b|]}, each feature divided by the scale and
 * clamped to {@code [-1,1]}.
 * <p>
 * The analytic weights select the matching feature, which makes ADD, SUB and MUL exact
 * as long as no feature saturates, and DIV exact up to floating point rounding of the
 * real quotient. Predictions are decoded by rounding, DIV by flooring.
 */
public class LinearArithmeticProvider extends MixingArithmeticProvider {

    /** Length of the feature vector. */
    public static final int FEATURES = 7;

    private static final int SUM = 2;
    private static final int DIFF = 3;
    private static final int PRODUCT = 4;
    private static final int QUOTIENT = 5;

    private final Map<ArithmeticOp, double[]> weights = new EnumMap<>(ArithmeticOp.class);
    private final Map<ArithmeticOp, Double> biases = new EnumMap<>(ArithmeticOp.class);

    public LinearArithmeticProvider(ProviderSettings settings) {
        super(settings);
        initAnalytic();
    }

    /**
     * Resets every operation to its analytic weights.
     */
    public final void initAnalytic() {
        setWeights(ArithmeticOp.ADD, unit(SUM), 0.0);
        setWeights(ArithmeticOp.SUB, unit(DIFF), 0.0);
        setWeights(ArithmeticOp.MUL, unit(PRODUCT), 0.0);
        setWeights(ArithmeticOp.DIV, unit(QUOTIENT), 0.0);
    }

    /**
     * Replaces the model of one operation, e.g. with trained weights.
     * @param op The operation.
     * @param w The weights, one per feature.
     * @param bias The bias.
     */
    public void setWeights(ArithmeticOp op, double[] w, double bias) {
        if (w.length != FEATURES) {
            throw new IllegalArgumentException("Expected " + FEATURES + " weights, got " + w.length);
        }
        weights.put(op, w.clone());
        biases.put(op, bias);
    }

    public double[] getWeights(ArithmeticOp op) {
        return weights.get(op).clone();
    }

    /**
     * Computes the normalized feature vector of an operand pair.
     * @param a The left operand.
     * @param b The right operand.
     * @param scale The normalization scale.
     * @return The features.
     */
    static double[] features(int a, int b, int scale) {
        double s = scale;
        return new double[] {
                clamp(a / s, -1, 1),
                clamp(b / s, -1, 1),
                clamp(((long) a + b) / s, -1, 1),
                clamp(((long) a - b) / s, -1, 1),
                clamp(((double) a * b) / s, -1, 1),
                b == 0 ? 0.0 : clamp(((double) a / b) / s, -1, 1),
                clamp(Math.abs((long) b) / s, 0, 1)
        };
    }

    @Override
    protected int predict(ArithmeticOp op, int a, int b) {
        double[] x = features(a, b, settings.scale());
        double[] w = weights.get(op);
        double y = biases.get(op);
        for (int i = 0; i < FEATURES; i++) {
            y += w[i] * x[i];
        }
        double decoded = clamp(y, -1, 1) * settings.scale();
        long value = op == ArithmeticOp.DIV ? (long) Math.floor(decoded) : Math.round(decoded);
        return saturate(value);
    }

    private static double[] unit(int index) {
        double[] w = new double[FEATURES];
        w[index] = 1.0;
        return w;
    }

    private static double clamp(double x, double low, double high) {
        return Math.max(low, Math.min(high, x));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("LinearArithmeticProvider{");
        weights.forEach((op, w) -> sb.append(op).append('=').append(Arrays.toString(w)).append(' '));
        return sb.append("mix=").append(settings.mix()).append('}').toString();
    }
}
