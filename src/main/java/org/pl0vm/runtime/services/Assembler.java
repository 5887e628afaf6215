package org.pl0vm.runtime.services;

import org.pl0vm.runtime.isa.AddressOperand;
import org.pl0vm.runtime.isa.ImmediateOperand;
import org.pl0vm.runtime.isa.IndirectOperand;
import org.pl0vm.runtime.isa.Instruction;
import org.pl0vm.runtime.isa.LabelOperand;
import org.pl0vm.runtime.isa.Opcode;
import org.pl0vm.runtime.isa.Operand;
import org.pl0vm.runtime.isa.ProgramOperand;
import org.pl0vm.runtime.isa.RegisterOperand;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the instruction text form into instructions.
 * <p>
 * One instruction per line: a mnemonic followed by comma separated operands. A line
 * ending in {@code :} declares a label at its position; blank lines and lines starting
 * with {@code ;} are skipped.
 * Operands are {@code r<n>}, {@code #<int>}, {@code [<int>]}, {@code [r<n>]} or a bare
 * label or program name.
 */
public class Assembler {

    private static final Pattern REGISTER = Pattern.compile("[rR](\\d+)");
    private static final Pattern IMMEDIATE = Pattern.compile("#(-?\\d+)");
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Parses a whole listing.
     * @param text The listing, one instruction per line.
     * @return The instructions.
     * @throws IllegalArgumentException naming the offending line if the text is malformed.
     */
    public List<Instruction> parse(String text) {
        return parseLines(text.lines().toList());
    }

    /**
     * Parses a sequence of lines.
     * @param lines The lines.
     * @return The instructions, blank lines skipped.
     * @throws IllegalArgumentException naming the offending line if a line is malformed.
     */
    public List<Instruction> parseLines(List<String> lines) {
        List<Instruction> instructions = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith(";")) {
                continue;
            }
            try {
                instructions.add(parseLine(line));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Line " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return instructions;
    }

    /**
     * Parses a single non-blank line.
     * @param line The line.
     * @return The instruction.
     * @throws IllegalArgumentException if the line is malformed.
     */
    public Instruction parseLine(String line) {
        String trimmed = line.trim();
        if (trimmed.endsWith(":")) {
            String name = trimmed.substring(0, trimmed.length() - 1).trim();
            if (!NAME.matcher(name).matches()) {
                throw new IllegalArgumentException("Bad label name: '" + name + "'");
            }
            return Instruction.label(name);
        }

        String[] parts = trimmed.split("\\s+", 2);
        Opcode opcode = Opcode.fromMnemonic(parts[0])
                .orElseThrow(() -> new IllegalArgumentException("Unknown instruction '" + parts[0] + "'"));

        List<Operand> operands = new ArrayList<>();
        if (parts.length > 1) {
            for (String token : parts[1].split(",")) {
                String operand = token.trim();
                if (!operand.isEmpty()) {
                    operands.add(parseOperand(opcode, operand));
                }
            }
        }
        int expected = arity(opcode);
        if (operands.size() != expected) {
            throw new IllegalArgumentException(opcode + " expects " + expected + " operand(s), got " + operands.size() + ": '" + trimmed + "'");
        }
        return new Instruction(opcode, operands);
    }

    private Operand parseOperand(Opcode opcode, String token) {
        if (opcode == Opcode.PL0CALL && NAME.matcher(token).matches()) {
            return new ProgramOperand(token);
        }
        Matcher m = REGISTER.matcher(token);
        if (m.matches()) {
            return new RegisterOperand(Integer.parseInt(m.group(1)));
        }
        m = IMMEDIATE.matcher(token);
        if (m.matches()) {
            return new ImmediateOperand(Integer.parseInt(m.group(1)));
        }
        if (token.startsWith("[") && token.endsWith("]")) {
            String inner = token.substring(1, token.length() - 1).trim();
            Matcher reg = REGISTER.matcher(inner);
            if (reg.matches()) {
                return new IndirectOperand(Integer.parseInt(reg.group(1)));
            }
            try {
                return new AddressOperand(Integer.parseInt(inner));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Bad address literal: " + token, e);
            }
        }
        if (NAME.matcher(token).matches()) {
            return new LabelOperand(token);
        }
        throw new IllegalArgumentException("Bad operand: '" + token + "'");
    }

    private static int arity(Opcode opcode) {
        return switch (opcode) {
            case LOAD, STORE, PEEK, POKE, ADD, SUB, MUL, DIV, JZ, JNZ -> 2;
            case RET, HALT -> 0;
            default -> 1;
        };
    }
}
