package org.pl0vm.runtime.services;

import org.pl0vm.runtime.isa.AddressOperand;
import org.pl0vm.runtime.isa.ImmediateOperand;
import org.pl0vm.runtime.isa.IndirectOperand;
import org.pl0vm.runtime.isa.Instruction;
import org.pl0vm.runtime.isa.LabelOperand;
import org.pl0vm.runtime.isa.Opcode;
import org.pl0vm.runtime.isa.ProgramOperand;
import org.pl0vm.runtime.isa.RegisterOperand;
import org.pl0vm.runtime.model.Program;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the instruction text form: {@link Assembler} and {@link Disassembler}.
 */
public class AssemblerTest {

    private final Assembler assembler = new Assembler();

    @Test
    @Tag("unit")
    void testOperandForms() {
        List<Instruction> code = assembler.parse("""
                start:
                  load R0, #-3

                  STORE r0, [30]
                  PEEK r1, [r0]
                  JZ r0, start
                  PL0CALL other
                  RET
                """);

        assertThat(code).containsExactly(
                Instruction.label("start"),
                Instruction.of(Opcode.LOAD, new RegisterOperand(0), new ImmediateOperand(-3)),
                Instruction.of(Opcode.STORE, new RegisterOperand(0), new AddressOperand(30)),
                Instruction.of(Opcode.PEEK, new RegisterOperand(1), new IndirectOperand(0)),
                Instruction.of(Opcode.JZ, new RegisterOperand(0), new LabelOperand("start")),
                Instruction.of(Opcode.PL0CALL, new ProgramOperand("other")),
                Instruction.of(Opcode.RET));
    }

    @Test
    @Tag("unit")
    void testProgramNamesMayLookLikeRegisters() {
        assertThat(assembler.parseLine("PL0CALL r1"))
                .isEqualTo(Instruction.of(Opcode.PL0CALL, new ProgramOperand("r1")));
        assertThat(assembler.parseLine("PUSH r1"))
                .isEqualTo(Instruction.of(Opcode.PUSH, new RegisterOperand(1)));
    }

    /**
     * Verifies that a malformed line is reported with its line number.
     */
    @Test
    @Tag("unit")
    void testErrorsNameTheLine() {
        assertThatThrownBy(() -> assembler.parse("HALT\nFROB r0"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Line 2: ");
        assertThatThrownBy(() -> assembler.parseLine("ADD r0"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expects 2");
        assertThatThrownBy(() -> assembler.parseLine("LOAD r0, [x]"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> assembler.parseLine("9bad:"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void testDisassemblerListing() {
        Program program = new Program("p", assembler.parse("LOAD r0, #1\nloop:\nJMP loop"));
        Disassembler disassembler = new Disassembler();

        assertThat(disassembler.disassemble(program, true)).isEqualTo(
                "; program p (3 instructions)\n0  LOAD r0, #1\n1  loop:\n2  JMP loop\n");
        assertThat(assembler.parse(disassembler.disassemble(program, false)))
                .isEqualTo(program.instructions());
    }
}
