package org.pl0vm.runtime.providers;

import org.pl0vm.runtime.math.FixedPointCodec;
import org.pl0vm.runtime.math.MathOp;
import org.pl0vm.runtime.math.MathReference;
import org.pl0vm.runtime.spi.IMathProvider;
import org.pl0vm.runtime.spi.MathResult;

import java.util.Objects;

/**
 * Base class for unary providers. Mixing and fallback happen in the operation's
 * normalized output space: the exact reference and the prediction are both mapped
 * into {@code [0,1]} and blended with the mixing factor. The blend is replaced by the
 * exact value when the raw prediction is further than {@code fallbackAbsError} from it.
 */
public abstract class MixingMathProvider implements IMathProvider {

    protected final ProviderSettings settings;

    protected MixingMathProvider(ProviderSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Predicts an operation in normalized space.
     * @param op The operation.
     * @param inputNorm The input mapped into {@code [0,1]} over the operation's input domain.
     * @return The predicted output in {@code [0,1]} over the operation's output range.
     */
    protected abstract double predictNormalized(MathOp op, double inputNorm);

    @Override
    public MathResult compute(MathOp op, int input) {
        int scale = settings.scale();
        double x = FixedPointCodec.decode(input, scale);
        double predNorm = clamp01(predictNormalized(op, op.normalizeInput(x)));

        int exact = MathReference.evaluate(op, input, scale);
        double exactNorm = op.normalizeOutput(FixedPointCodec.decode(exact, scale));
        double mix = settings.mix();
        double outNorm = clamp01(exactNorm * (1.0 - mix) + predNorm * mix);

        boolean usedFallback = false;
        if (settings.safetyFallback() && Math.abs(predNorm - exactNorm) > settings.fallbackAbsError()) {
            outNorm = exactNorm;
            usedFallback = true;
        }

        int result = usedFallback ? exact : FixedPointCodec.encode(op.denormalizeOutput(outNorm), scale);
        int prediction = FixedPointCodec.encode(op.denormalizeOutput(predNorm), scale);
        return new MathResult(result, prediction, exact, usedFallback, outNorm, exactNorm, predNorm);
    }

    public ProviderSettings getSettings() {
        return settings;
    }

    private static double clamp01(double u) {
        if (Double.isNaN(u)) {
            throw new IllegalStateException("Provider produced NaN");
        }
        return Math.max(0.0, Math.min(1.0, u));
    }
}
