package org.pl0vm.runtime.providers;

import org.pl0vm.runtime.isa.ArithmeticOp;
import org.pl0vm.runtime.spi.ArithmeticResult;
import org.pl0vm.runtime.spi.IArithmeticProvider;

import java.util.Objects;

/**
 * Base class for binary providers. It owns the mixing and safety fallback policy;
 * subclasses only supply a raw prediction.
 * <p>
 * The blended value is {@code round(exact * (1 - mix) + prediction * mix)}. With the
 * safety fallback enabled, a blend further than {@code fallbackAbsError} from the exact
 * value is replaced by the exact value.
 */
public abstract class MixingArithmeticProvider implements IArithmeticProvider {

    protected final ProviderSettings settings;

    protected MixingArithmeticProvider(ProviderSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Predicts the result of an operation.
     * @param op The operation.
     * @param a The left operand.
     * @param b The right operand.
     * @return The raw prediction.
     */
    protected abstract int predict(ArithmeticOp op, int a, int b);

    @Override
    public ArithmeticResult compute(ArithmeticOp op, int a, int b) {
        int exact = op.exactGuarded(a, b);
        int prediction = predict(op, a, b);
        double mix = settings.mix();
        int mixed = saturate(Math.round(exact * (1.0 - mix) + prediction * mix));

        int result = mixed;
        boolean usedFallback = false;
        if (settings.safetyFallback() && Math.abs((long) mixed - exact) > settings.fallbackAbsError()) {
            result = exact;
            usedFallback = true;
        }
        return new ArithmeticResult(result, exact, prediction, mixed, usedFallback);
    }

    public ProviderSettings getSettings() {
        return settings;
    }

    static int saturate(long value) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }
}
