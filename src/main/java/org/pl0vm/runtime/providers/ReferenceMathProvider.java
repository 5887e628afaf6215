package org.pl0vm.runtime.providers;

import org.pl0vm.runtime.math.MathOp;
import org.pl0vm.runtime.math.MathReference;

/**
 * Unary provider whose prediction is the deterministic reference, re-expressed in
 * normalized space. With {@code mix = 1} the results match the reference up to the
 * resolution of the normalization round trip.
 */
public class ReferenceMathProvider extends MixingMathProvider {

    public ReferenceMathProvider(ProviderSettings settings) {
        super(settings);
    }

    @Override
    protected double predictNormalized(MathOp op, double inputNorm) {
        double x = op.inputLow() + inputNorm * (op.inputHigh() - op.inputLow());
        int scale = settings.scale();
        int fx = MathReference.evaluate(op, (int) Math.round(x * scale), scale);
        return op.normalizeOutput((double) fx / scale);
    }
}
