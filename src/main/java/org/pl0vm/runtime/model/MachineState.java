package org.pl0vm.runtime.model;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * The mutable state of one execution run: register file, memory, data stack,
 * call stack, the active instruction sequence with its label table, the
 * instruction pointer and the running flag.
 * <p>
 * A fresh instance is created for every run and only the virtual machine mutates it.
 * After a run ends, normally or by a fatal error, the state stays inspectable.
 */
public class MachineState {

    private final int[] registers;
    private final int[] memory;
    private final DataStack dataStack;
    private final Deque<CallFrame> callStack = new ArrayDeque<>();
    private final int maxCallDepth;

    private Program program;
    private LabelTable labels;
    private int ip;
    private boolean running;
    private long steps;

    /**
     * Creates a zeroed machine state.
     * @param registerCount The number of general purpose registers.
     * @param memorySize The number of memory cells.
     * @param dataStackSize The data stack capacity.
     * @param maxCallDepth The call stack capacity.
     */
    public MachineState(int registerCount, int memorySize, int dataStackSize, int maxCallDepth) {
        if (registerCount <= 0 || memorySize <= 0) {
            throw new IllegalArgumentException("Register count and memory size must be positive");
        }
        this.registers = new int[registerCount];
        this.memory = new int[memorySize];
        this.dataStack = new DataStack(dataStackSize);
        this.maxCallDepth = maxCallDepth;
    }

    /**
     * Makes a program the active instruction sequence and rebuilds the label table.
     * The instruction pointer is reset to zero.
     * @param program The program to activate.
     */
    public void enter(Program program) {
        restore(program, LabelTable.of(program), 0);
    }

    /**
     * Re-activates a saved instruction sequence with its label table.
     * @param program The program.
     * @param labels Its label table.
     * @param ip The index to resume at.
     */
    public void restore(Program program, LabelTable labels, int ip) {
        this.program = program;
        this.labels = labels;
        this.ip = ip;
    }

    public int getRegisterCount() {
        return registers.length;
    }

    public boolean isValidRegister(int index) {
        return index >= 0 && index < registers.length;
    }

    public int getRegister(int index) {
        return registers[index];
    }

    public void setRegister(int index, int value) {
        registers[index] = value;
    }

    public int[] getRegisters() {
        return registers.clone();
    }

    public int getMemorySize() {
        return memory.length;
    }

    /**
     * Maps any address into {@code [0, memorySize)} by Euclidean modulo.
     * @param address The raw address.
     * @return The normalized address.
     */
    public int normalizeAddress(int address) {
        return Math.floorMod(address, memory.length);
    }

    public int read(int address) {
        return memory[normalizeAddress(address)];
    }

    public void write(int address, int value) {
        memory[normalizeAddress(address)] = value;
    }

    public int[] getMemory() {
        return memory.clone();
    }

    /**
     * @param from First address, inclusive.
     * @param to Last address, inclusive.
     * @return The cells in the range, each address normalized.
     */
    public int[] readRange(int from, int to) {
        if (to < from) {
            return new int[0];
        }
        int[] cells = new int[to - from + 1];
        for (int i = 0; i < cells.length; i++) {
            cells[i] = read(from + i);
        }
        return cells;
    }

    public DataStack getDataStack() {
        return dataStack;
    }

    public Deque<CallFrame> getCallStack() {
        return callStack;
    }

    public int getMaxCallDepth() {
        return maxCallDepth;
    }

    public Program getProgram() {
        return program;
    }

    public LabelTable getLabels() {
        return labels;
    }

    public int getIp() {
        return ip;
    }

    public void setIp(int ip) {
        this.ip = ip;
    }

    public boolean isRunning() {
        return running;
    }

    public void setRunning(boolean running) {
        this.running = running;
    }

    public long getSteps() {
        return steps;
    }

    public void incrementSteps() {
        steps++;
    }

    @Override
    public String toString() {
        return "MachineState{program=" + (program == null ? null : program.name())
                + ", ip=" + ip + ", running=" + running + ", steps=" + steps
                + ", registers=" + Arrays.toString(registers) + ", dataStack=" + dataStack
                + ", callDepth=" + callStack.size() + "}";
    }
}
