package org.pl0vm.runtime.math;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FixedPointCodec}.
 */
public class FixedPointCodecTest {

    @Test
    @Tag("unit")
    void testEncodeRoundsHalfUp() {
        FixedPointCodec codec = new FixedPointCodec(10);

        assertThat(codec.encode(1.25)).isEqualTo(13);
        assertThat(codec.encode(-1.25)).isEqualTo(-12);
        assertThat(codec.encode(0.04)).isZero();
    }

    @Test
    @Tag("unit")
    void testDefaultScaleIsQ16() {
        assertThat(FixedPointCodec.DEFAULT.encode(1.0)).isEqualTo(65536);
        assertThat(FixedPointCodec.DEFAULT.encode(Math.PI)).isEqualTo(205887);
        assertThat(FixedPointCodec.DEFAULT.decode(32768)).isEqualTo(0.5);
    }

    /**
     * Verifies that values beyond the 32-bit range saturate symmetrically.
     */
    @Test
    @Tag("unit")
    void testEncodeClamps() {
        assertThat(FixedPointCodec.encode(1e12, 65536)).isEqualTo(Integer.MAX_VALUE);
        assertThat(FixedPointCodec.encode(-1e12, 65536)).isEqualTo(-Integer.MAX_VALUE);
    }

    /**
     * Verifies that decoding an encoded value is off by at most half a unit of the scale,
     * for every value that does not saturate.
     */
    @Test
    @Tag("unit")
    void testRoundTripStaysWithinHalfAUnit() {
        double[] values = {0.0, -3.75, -1.5, -0.05, 0.05, 0.123456, 0.5, 2.5, -2.5, 1.05, 1000.3, -32767.25};
        for (int scale : new int[] {1, 10, 65536}) {
            double nearMax = (FixedPointCodec.MAX_FIXED - 0.4) / scale;
            double beyondMax = (FixedPointCodec.MAX_FIXED + 10.0) / scale;
            for (double v : append(values, nearMax, -nearMax)) {
                int encoded = FixedPointCodec.encode(v, scale);
                double error = Math.abs(FixedPointCodec.decode(encoded, scale) - v);
                assertThat(error)
                        .as("value %s at scale %d", v, scale)
                        .isLessThanOrEqualTo(0.5 / scale + 1e-9);
            }
            assertThat(FixedPointCodec.encode(beyondMax, scale)).isEqualTo(FixedPointCodec.MAX_FIXED);
            assertThat(FixedPointCodec.encode(-beyondMax, scale)).isEqualTo(-FixedPointCodec.MAX_FIXED);
        }
    }

    private static double[] append(double[] values, double... more) {
        double[] all = Arrays.copyOf(values, values.length + more.length);
        System.arraycopy(more, 0, all, values.length, more.length);
        return all;
    }

    @Test
    @Tag("unit")
    void testScaleMustBePositive() {
        assertThatThrownBy(() -> new FixedPointCodec(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
