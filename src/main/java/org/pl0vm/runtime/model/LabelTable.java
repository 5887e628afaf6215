package org.pl0vm.runtime.model;

import org.pl0vm.runtime.isa.Instruction;
import org.pl0vm.runtime.isa.LabelOperand;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Maps label names to instruction indices within one instruction sequence.
 * Labels are scoped to the sequence they were built from; when a name is defined
 * twice the later definition wins.
 */
public final class LabelTable {

    private final Map<String, Integer> indices;

    private LabelTable(Map<String, Integer> indices) {
        this.indices = Collections.unmodifiableMap(indices);
    }

    /**
     * Builds the label table of a program.
     * @param program The program.
     * @return The table of its label markers.
     */
    public static LabelTable of(Program program) {
        Map<String, Integer> indices = new HashMap<>();
        for (int i = 0; i < program.size(); i++) {
            Instruction instruction = program.get(i);
            if (instruction.isLabel() && instruction.operand(0) instanceof LabelOperand label) {
                indices.put(label.name(), i);
            }
        }
        return new LabelTable(indices);
    }

    /**
     * Resolves a label.
     * @param name The label name.
     * @return The index of the label marker, or empty if undefined.
     */
    public OptionalInt resolve(String name) {
        Integer index = indices.get(name);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public int size() {
        return indices.size();
    }

    public Map<String, Integer> asMap() {
        return indices;
    }
}
