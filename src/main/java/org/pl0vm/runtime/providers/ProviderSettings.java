package org.pl0vm.runtime.providers;

import com.typesafe.config.Config;

/**
 * Construction parameters of a computation provider.
 *
 * @param architecture The provider implementation to build, e.g. {@code linear} or {@code reference}.
 * @param enabled Whether the provider is attached at all.
 * @param mix Blend weight of the prediction, in {@code [0,1]}; 0 is pure exact, 1 is pure prediction.
 * @param safetyFallback Whether out-of-tolerance results are replaced by the exact value.
 * @param fallbackAbsError The tolerated absolute error; integer units for arithmetic,
 *                         normalized units for math.
 * @param scale The fixed-point scale used for normalization.
 */
public record ProviderSettings(String architecture, boolean enabled, double mix,
                               boolean safetyFallback, double fallbackAbsError, int scale) {

    public ProviderSettings {
        if (architecture == null || architecture.isBlank()) {
            throw new IllegalArgumentException("architecture must not be blank");
        }
        if (Double.isNaN(mix) || mix < 0.0 || mix > 1.0) {
            throw new IllegalArgumentException("mix must be within [0,1], got " + mix);
        }
        if (Double.isNaN(fallbackAbsError) || fallbackAbsError < 0.0) {
            throw new IllegalArgumentException("fallback-abs-error must not be negative, got " + fallbackAbsError);
        }
        if (scale <= 0) {
            throw new IllegalArgumentException("scale must be positive, got " + scale);
        }
    }

    /**
     * Reads a provider block such as {@code pl0vm.providers.arithmetic}.
     * @param config The provider block.
     * @return The validated settings.
     */
    public static ProviderSettings fromConfig(Config config) {
        return new ProviderSettings(
                config.getString("architecture"),
                config.getBoolean("enabled"),
                config.getDouble("mix"),
                config.getBoolean("safety-fallback"),
                config.getDouble("fallback-abs-error"),
                config.getInt("scale"));
    }

    public ProviderSettings withEnabled(boolean value) {
        return new ProviderSettings(architecture, value, mix, safetyFallback, fallbackAbsError, scale);
    }

    public ProviderSettings withMix(double value) {
        return new ProviderSettings(architecture, enabled, value, safetyFallback, fallbackAbsError, scale);
    }

    public ProviderSettings withFallback(boolean value, double threshold) {
        return new ProviderSettings(architecture, enabled, mix, value, threshold, scale);
    }

    public ProviderSettings withScale(int value) {
        return new ProviderSettings(architecture, enabled, mix, safetyFallback, fallbackAbsError, value);
    }
}
