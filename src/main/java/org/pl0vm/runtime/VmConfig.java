package org.pl0vm.runtime;

import com.typesafe.config.Config;

/**
 * Immutable sizing and limit settings of the virtual machine.
 *
 * @param registerCount Number of general purpose registers.
 * @param memorySize Number of memory cells.
 * @param dataStackSize Capacity of the data stack.
 * @param maxCallDepth Capacity of the call stack.
 * @param maxSteps Default step limit of a run.
 * @param scale Fixed-point scale used by the math reference.
 * @param trackStatistics Whether provider calls are accumulated into run statistics.
 */
public record VmConfig(int registerCount, int memorySize, int dataStackSize, int maxCallDepth,
                       long maxSteps, int scale, boolean trackStatistics) {

    public static final int DEFAULT_REGISTER_COUNT = 4;
    public static final int DEFAULT_MEMORY_SIZE = 256;
    public static final int DEFAULT_DATA_STACK_SIZE = 256;
    public static final int DEFAULT_CALL_STACK_DEPTH = 1024;
    public static final long DEFAULT_MAX_STEPS = 1_000_000L;
    public static final int DEFAULT_SCALE = 65536;

    public VmConfig {
        if (registerCount <= 0) {
            throw new IllegalArgumentException("registerCount must be positive, got " + registerCount);
        }
        if (memorySize <= 0) {
            throw new IllegalArgumentException("memorySize must be positive, got " + memorySize);
        }
        if (dataStackSize < 0 || maxCallDepth < 0) {
            throw new IllegalArgumentException("Stack sizes must not be negative");
        }
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got " + maxSteps);
        }
        if (scale <= 0) {
            throw new IllegalArgumentException("scale must be positive, got " + scale);
        }
    }

    public static VmConfig defaults() {
        return new VmConfig(DEFAULT_REGISTER_COUNT, DEFAULT_MEMORY_SIZE, DEFAULT_DATA_STACK_SIZE,
                DEFAULT_CALL_STACK_DEPTH, DEFAULT_MAX_STEPS, DEFAULT_SCALE, true);
    }

    /**
     * Reads the settings from a {@code vm} configuration block. Missing keys take their defaults.
     * @param config The block, e.g. {@code pl0vm.vm}.
     * @return The settings.
     */
    public static VmConfig fromConfig(Config config) {
        VmConfig d = defaults();
        return new VmConfig(
                config.hasPath("registers") ? config.getInt("registers") : d.registerCount(),
                config.hasPath("memory-size") ? config.getInt("memory-size") : d.memorySize(),
                config.hasPath("data-stack-size") ? config.getInt("data-stack-size") : d.dataStackSize(),
                config.hasPath("call-stack-depth") ? config.getInt("call-stack-depth") : d.maxCallDepth(),
                config.hasPath("max-steps") ? config.getLong("max-steps") : d.maxSteps(),
                config.hasPath("fx-scale") ? config.getInt("fx-scale") : d.scale(),
                !config.hasPath("track-statistics") || config.getBoolean("track-statistics"));
    }

    public VmConfig withMaxSteps(long steps) {
        return new VmConfig(registerCount, memorySize, dataStackSize, maxCallDepth, steps, scale, trackStatistics);
    }

    public VmConfig withScale(int newScale) {
        return new VmConfig(registerCount, memorySize, dataStackSize, maxCallDepth, maxSteps, newScale, trackStatistics);
    }
}
