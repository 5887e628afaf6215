package org.pl0vm.runtime.isa;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of machine opcodes.
 * <p>
 * {@link #LABEL} is a marker that keeps a label's position inside an instruction
 * sequence. It executes as a no-op.
 */
public enum Opcode {
    // Markers
    LABEL,

    // Data movement
    LOAD,
    STORE,
    PEEK,
    POKE,

    // Data stack
    PUSH,
    POP,

    // Binary arithmetic
    ADD,
    SUB,
    MUL,
    DIV,

    // Unary math intrinsics
    FSIN,
    FCOS,
    FTAN,
    FTANH,
    FSINH,
    FCOSH,
    FLN,
    FLOG10,
    FEXP,
    FSQRT,

    // Control flow
    JMP,
    JZ,
    JNZ,
    CALL,
    PL0CALL,
    RET,
    HALT;

    /**
     * @return The mnemonic used in the instruction text form.
     */
    public String mnemonic() {
        return name();
    }

    /**
     * Resolves a mnemonic, case-insensitively. {@link #LABEL} has no mnemonic.
     * @param mnemonic The mnemonic text.
     * @return The opcode, or empty if unknown.
     */
    public static Optional<Opcode> fromMnemonic(String mnemonic) {
        if (mnemonic == null) {
            return Optional.empty();
        }
        String upper = mnemonic.trim().toUpperCase(Locale.ROOT);
        for (Opcode opcode : values()) {
            if (opcode != LABEL && opcode.name().equals(upper)) {
                return Optional.of(opcode);
            }
        }
        return Optional.empty();
    }
}
