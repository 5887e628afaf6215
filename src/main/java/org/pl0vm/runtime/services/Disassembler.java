package org.pl0vm.runtime.services;

import org.pl0vm.runtime.isa.Instruction;
import org.pl0vm.runtime.model.Program;

import java.util.List;

/**
 * Renders instructions in the text form accepted by {@link Assembler}.
 */
public class Disassembler {

    /**
     * @param instruction The instruction.
     * @return Its text form, e.g. {@code ADD r0, r1} or {@code label_100:}.
     */
    public String disassemble(Instruction instruction) {
        return instruction.toString();
    }

    /**
     * Renders a sequence, one instruction per line.
     * @param instructions The instructions.
     * @param withIndex Whether to prefix each line with its instruction index. An indexed
     *                  listing is for display and is not accepted by {@link Assembler}.
     * @return The listing, terminated by a newline when not empty.
     */
    public String disassemble(List<Instruction> instructions, boolean withIndex) {
        StringBuilder sb = new StringBuilder();
        int width = String.valueOf(Math.max(0, instructions.size() - 1)).length();
        for (int i = 0; i < instructions.size(); i++) {
            if (withIndex) {
                sb.append(String.format("%" + width + "d  ", i));
            }
            sb.append(disassemble(instructions.get(i))).append('\n');
        }
        return sb.toString();
    }

    /**
     * Renders a program with a {@code ;} comment header naming it.
     * @param program The program.
     * @param withIndex Whether to prefix each line with its instruction index.
     * @return The listing.
     */
    public String disassemble(Program program, boolean withIndex) {
        return "; program " + program.name() + " (" + program.size() + " instructions)\n"
                + disassemble(program.instructions(), withIndex);
    }
}
