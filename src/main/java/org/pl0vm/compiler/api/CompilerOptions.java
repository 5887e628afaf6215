package org.pl0vm.compiler.api;

import com.typesafe.config.Config;

/**
 * Settings of one compilation.
 *
 * @param scale The fixed-point scale used for float literals, constants and conversions.
 * @param memorySize The number of memory cells variables and temporaries must fit into.
 */
public record CompilerOptions(int scale, int memorySize) {

    public static final int DEFAULT_SCALE = 65536;
    public static final int DEFAULT_MEMORY_SIZE = 256;

    public CompilerOptions {
        if (scale <= 0) {
            throw new IllegalArgumentException("scale must be positive, got " + scale);
        }
        if (memorySize < 2) {
            throw new IllegalArgumentException("memorySize must be at least 2, got " + memorySize);
        }
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(DEFAULT_SCALE, DEFAULT_MEMORY_SIZE);
    }

    /**
     * Reads a {@code compiler} configuration block. Missing keys take their defaults.
     * @param config The block, e.g. {@code pl0vm.compiler}.
     * @return The options.
     */
    public static CompilerOptions fromConfig(Config config) {
        return new CompilerOptions(
                config.hasPath("fx-scale") ? config.getInt("fx-scale") : DEFAULT_SCALE,
                config.hasPath("memory-size") ? config.getInt("memory-size") : DEFAULT_MEMORY_SIZE);
    }

    public CompilerOptions withScale(int value) {
        return new CompilerOptions(value, memorySize);
    }
}
