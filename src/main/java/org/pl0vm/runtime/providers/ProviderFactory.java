package org.pl0vm.runtime.providers;

import org.pl0vm.runtime.spi.IArithmeticProvider;
import org.pl0vm.runtime.spi.IMathProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Builds providers from their settings. A disabled provider yields {@code null},
 * which the virtual machine reads as "compute exactly".
 */
public final class ProviderFactory {

    private static final Logger LOG = LoggerFactory.getLogger(ProviderFactory.class);

    private ProviderFactory() {}

    /**
     * @param settings The arithmetic provider settings.
     * @return The provider, or {@code null} if disabled.
     * @throws IllegalArgumentException if the architecture is unknown.
     */
    public static IArithmeticProvider createArithmetic(ProviderSettings settings) {
        if (!settings.enabled()) {
            return null;
        }
        IArithmeticProvider provider = switch (settings.architecture().toLowerCase(Locale.ROOT)) {
            case "linear" -> new LinearArithmeticProvider(settings);
            default -> throw new IllegalArgumentException("Unknown arithmetic provider architecture: " + settings.architecture());
        };
        LOG.debug("Created arithmetic provider '{}' (mix={}, safetyFallback={}, threshold={})",
                settings.architecture(), settings.mix(), settings.safetyFallback(), settings.fallbackAbsError());
        return provider;
    }

    /**
     * @param settings The math provider settings.
     * @return The provider, or {@code null} if disabled.
     * @throws IllegalArgumentException if the architecture is unknown.
     */
    public static IMathProvider createMath(ProviderSettings settings) {
        if (!settings.enabled()) {
            return null;
        }
        IMathProvider provider = switch (settings.architecture().toLowerCase(Locale.ROOT)) {
            case "reference" -> new ReferenceMathProvider(settings);
            default -> throw new IllegalArgumentException("Unknown math provider architecture: " + settings.architecture());
        };
        LOG.debug("Created math provider '{}' (mix={}, safetyFallback={}, threshold={})",
                settings.architecture(), settings.mix(), settings.safetyFallback(), settings.fallbackAbsError());
        return provider;
    }
}
