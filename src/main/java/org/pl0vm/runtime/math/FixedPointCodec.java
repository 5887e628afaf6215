package org.pl0vm.runtime.math;

/**
 * Converts between real values and their scaled integer (fixed-point) representation.
 * <p>
 * A real value {@code v} is encoded as {@code round(v * scale)}, clamped to
 * {@code [-MAX_FIXED, MAX_FIXED]}. Decoding is the plain quotient {@code x / scale}.
 * With the default scale of 65536 this is a Q16.16 representation.
 * <p>
 * Instances are immutable and hold nothing but the scale.
 */
public final class FixedPointCodec {

    /** The default scale factor (Q16.16). */
    public static final int DEFAULT_SCALE = 65536;

    /** Largest magnitude an encoded value may have. */
    public static final int MAX_FIXED = Integer.MAX_VALUE;

    /** A codec using {@link #DEFAULT_SCALE}. */
    public static final FixedPointCodec DEFAULT = new FixedPointCodec(DEFAULT_SCALE);

    private final int scale;

    /**
     * Creates a codec for the given scale.
     * @param scale The scale factor, must be positive.
     */
    public FixedPointCodec(int scale) {
        if (scale <= 0) {
            throw new IllegalArgumentException("Fixed-point scale must be positive, got " + scale);
        }
        this.scale = scale;
    }

    /**
     * @return The scale factor of this codec.
     */
    public int scale() {
        return scale;
    }

    /**
     * Encodes a real value.
     * @param real The real value.
     * @return {@code round(real * scale)} clamped to the signed 32-bit safe range.
     */
    public int encode(double real) {
        return encode(real, scale);
    }

    /**
     * Decodes a fixed-point value.
     * @param fixed The encoded value.
     * @return {@code fixed / scale}.
     */
    public double decode(int fixed) {
        return decode(fixed, scale);
    }

    /**
     * Encodes a real value with an explicit scale.
     * @param real The real value.
     * @param scale The scale factor.
     * @return The clamped fixed-point encoding.
     */
    public static int encode(double real, int scale) {
        long rounded = Math.round(real * scale);
        return (int) Math.max(-MAX_FIXED, Math.min(MAX_FIXED, rounded));
    }

    /**
     * Decodes a fixed-point value with an explicit scale.
     * @param fixed The encoded value.
     * @param scale The scale factor.
     * @return The real value.
     */
    public static double decode(int fixed, int scale) {
        return (double) fixed / scale;
    }

    @Override
    public String toString() {
        return "FixedPointCodec{scale=" + scale + '}';
    }
}
