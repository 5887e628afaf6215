package org.pl0vm.runtime.internal.services;

import org.pl0vm.runtime.ProgramRegistry;
import org.pl0vm.runtime.isa.ArithmeticOp;
import org.pl0vm.runtime.isa.Instruction;
import org.pl0vm.runtime.math.MathOp;
import org.pl0vm.runtime.model.MachineState;
import org.pl0vm.runtime.model.OperationStatistics;
import org.pl0vm.runtime.spi.IArithmeticProvider;
import org.pl0vm.runtime.spi.IMathProvider;

/**
 * Encapsulates everything an executing instruction may touch.
 * This object is created by the VirtualMachine for each fetched instruction and passed
 * to the instruction families to avoid global access.
 */
public class ExecutionContext {

    private final MachineState state;
    private final Instruction instruction;
    private final int instructionPointer;
    private final ProgramRegistry registry;
    private final int scale;
    private final IArithmeticProvider arithmeticProvider;
    private final IMathProvider mathProvider;
    private final OperationStatistics<ArithmeticOp> arithmeticStatistics;
    private final OperationStatistics<MathOp> mathStatistics;

    /**
     * Constructs a new ExecutionContext.
     * @param state The machine state of the current run.
     * @param instruction The instruction being executed.
     * @param instructionPointer The index the instruction was fetched from.
     * @param registry The registry consulted by cross-program calls.
     * @param scale The fixed-point scale of the deterministic math reference.
     * @param arithmeticProvider The binary provider, or {@code null} for exact arithmetic.
     * @param mathProvider The unary provider, or {@code null} for the deterministic reference.
     * @param arithmeticStatistics Binary provider statistics, or {@code null} if not tracked.
     * @param mathStatistics Unary provider statistics, or {@code null} if not tracked.
     */
    public ExecutionContext(MachineState state, Instruction instruction, int instructionPointer,
                            ProgramRegistry registry, int scale,
                            IArithmeticProvider arithmeticProvider, IMathProvider mathProvider,
                            OperationStatistics<ArithmeticOp> arithmeticStatistics,
                            OperationStatistics<MathOp> mathStatistics) {
        this.state = state;
        this.instruction = instruction;
        this.instructionPointer = instructionPointer;
        this.registry = registry;
        this.scale = scale;
        this.arithmeticProvider = arithmeticProvider;
        this.mathProvider = mathProvider;
        this.arithmeticStatistics = arithmeticStatistics;
        this.mathStatistics = mathStatistics;
    }

    public MachineState getState() {
        return state;
    }

    public Instruction getInstruction() {
        return instruction;
    }

    /**
     * Returns the index the current instruction was fetched from. The machine's own
     * instruction pointer already points past it when the instruction executes.
     * @return The fetch index.
     */
    public int getInstructionPointer() {
        return instructionPointer;
    }

    public ProgramRegistry getRegistry() {
        return registry;
    }

    public int getScale() {
        return scale;
    }

    public IArithmeticProvider getArithmeticProvider() {
        return arithmeticProvider;
    }

    public IMathProvider getMathProvider() {
        return mathProvider;
    }

    public OperationStatistics<ArithmeticOp> getArithmeticStatistics() {
        return arithmeticStatistics;
    }

    public OperationStatistics<MathOp> getMathStatistics() {
        return mathStatistics;
    }
}
