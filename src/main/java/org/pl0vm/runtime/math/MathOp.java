package org.pl0vm.runtime.math;

import org.pl0vm.runtime.isa.Opcode;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of unary math intrinsics.
 * <p>
 * Each operation carries its safe input domain and output range. The deterministic
 * reference clamps to these bounds, and providers use them to normalize values into
 * {@code [0,1]}.
 */
public enum MathOp {
    SIN(Opcode.FSIN, -Math.PI, Math.PI, -1, 1),
    COS(Opcode.FCOS, -Math.PI, Math.PI, -1, 1),
    TAN(Opcode.FTAN, -1.3, 1.3, -8, 8),
    TANH(Opcode.FTANH, -3, 3, -1, 1),
    SINH(Opcode.FSINH, -3, 3, -8, 8),
    COSH(Opcode.FCOSH, -3, 3, 0, 10),
    LN(Opcode.FLN, 1e-6, 256, -16, 16),
    LOG10(Opcode.FLOG10, 1e-6, 256, -16, 16),
    EXP(Opcode.FEXP, -8, 8, 0, 256),
    SQRT(Opcode.FSQRT, 0, 256, 0, 16);

    private static final Map<String, MathOp> INTRINSIC_NAMES;

    static {
        Map<String, MathOp> names = new LinkedHashMap<>();
        names.put("sin", SIN);
        names.put("cos", COS);
        names.put("tan", TAN);
        names.put("tanh", TANH);
        names.put("sinh", SINH);
        names.put("cosh", COSH);
        names.put("ln", LN);
        names.put("log", LOG10);
        names.put("log10", LOG10);
        names.put("exp", EXP);
        names.put("sqrt", SQRT);
        INTRINSIC_NAMES = Collections.unmodifiableMap(names);
    }

    private final Opcode opcode;
    private final double inputLow;
    private final double inputHigh;
    private final double outputLow;
    private final double outputHigh;

    MathOp(Opcode opcode, double inputLow, double inputHigh, double outputLow, double outputHigh) {
        this.opcode = opcode;
        this.inputLow = inputLow;
        this.inputHigh = inputHigh;
        this.outputLow = outputLow;
        this.outputHigh = outputHigh;
    }

    public Opcode opcode() {
        return opcode;
    }

    public double inputLow() {
        return inputLow;
    }

    public double inputHigh() {
        return inputHigh;
    }

    public double outputLow() {
        return outputLow;
    }

    public double outputHigh() {
        return outputHigh;
    }

    /**
     * Maps a real input into {@code [0,1]} over this operation's input domain.
     * @param x The real input.
     * @return The normalized input.
     */
    public double normalizeInput(double x) {
        return normalize(x, inputLow, inputHigh);
    }

    /**
     * Maps a real output into {@code [0,1]} over this operation's output range.
     * @param y The real output.
     * @return The normalized output.
     */
    public double normalizeOutput(double y) {
        return normalize(y, outputLow, outputHigh);
    }

    /**
     * Maps a normalized value back onto this operation's output range.
     * @param u The normalized value, clamped to {@code [0,1]} first.
     * @return The real output.
     */
    public double denormalizeOutput(double u) {
        double clamped = Math.max(0, Math.min(1, u));
        return outputLow + clamped * (outputHigh - outputLow);
    }

    private static double normalize(double x, double low, double high) {
        if (!(high > low)) {
            return 0.5;
        }
        return Math.max(0, Math.min(1, (x - low) / (high - low)));
    }

    /**
     * Looks up the intrinsic bound to a source-level call name such as {@code sin} or {@code log}.
     * @param name The name, matched case-insensitively.
     * @return The operation, or empty if the name is not an intrinsic.
     */
    public static Optional<MathOp> forIntrinsicName(String name) {
        return Optional.ofNullable(INTRINSIC_NAMES.get(name.toLowerCase()));
    }

    /**
     * @return The source-level intrinsic names in declaration order.
     */
    public static Iterable<String> intrinsicNames() {
        return INTRINSIC_NAMES.keySet();
    }

    /**
     * Finds the operation executed by a unary math opcode.
     * @param opcode The opcode.
     * @return The operation, or empty if the opcode is not a math opcode.
     */
    public static Optional<MathOp> forOpcode(Opcode opcode) {
        return Arrays.stream(values()).filter(op -> op.opcode == opcode).findFirst();
    }
}
