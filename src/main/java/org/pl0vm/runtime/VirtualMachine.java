package org.pl0vm.runtime;

import org.pl0vm.runtime.api.ExecutionErrorCode;
import org.pl0vm.runtime.api.ExecutionException;
import org.pl0vm.runtime.internal.services.ExecutionContext;
import org.pl0vm.runtime.isa.ArithmeticOp;
import org.pl0vm.runtime.isa.Instruction;
import org.pl0vm.runtime.isa.InstructionHandler;
import org.pl0vm.runtime.isa.InstructionSet;
import org.pl0vm.runtime.isa.Opcode;
import org.pl0vm.runtime.isa.ProgramOperand;
import org.pl0vm.runtime.math.MathOp;
import org.pl0vm.runtime.model.MachineState;
import org.pl0vm.runtime.model.OperationStatistics;
import org.pl0vm.runtime.model.Program;
import org.pl0vm.runtime.spi.IArithmeticProvider;
import org.pl0vm.runtime.spi.IMathProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * The core of the execution environment.
 * <p>
 * Each run creates a fresh {@link MachineState} and executes one instruction at a time
 * against the active instruction sequence, dispatching every opcode to its family in
 * {@link InstructionSet}. Arithmetic and math instructions are delegated to the attached
 * providers when present; control flow and memory are always deterministic.
 * <p>
 * A run ends when the machine halts, when the instruction pointer leaves the active
 * sequence, or with an {@link ExecutionException}. In every case the final state stays
 * available through {@link #getState()}.
 */
public class VirtualMachine {

    private static final Logger LOG = LoggerFactory.getLogger(VirtualMachine.class);

    /** Name of the two-instruction sequence that invokes the entry program. */
    public static final String BOOTSTRAP_NAME = "<bootstrap>";

    private final ProgramRegistry registry;
    private final VmConfig config;
    private final IArithmeticProvider arithmeticProvider;
    private final IMathProvider mathProvider;
    private final OperationStatistics<ArithmeticOp> arithmeticStatistics = new OperationStatistics<>(ArithmeticOp.class);
    private final OperationStatistics<MathOp> mathStatistics = new OperationStatistics<>(MathOp.class);

    private MachineState state;

    /**
     * Creates a VM with default settings and exact arithmetic.
     * @param registry The registry cross-program calls are resolved against.
     */
    public VirtualMachine(ProgramRegistry registry) {
        this(registry, VmConfig.defaults(), null, null);
    }

    /**
     * Creates a VM.
     * @param registry The registry cross-program calls are resolved against.
     * @param config The machine settings.
     * @param arithmeticProvider The binary provider, or {@code null} for exact arithmetic.
     * @param mathProvider The unary provider, or {@code null} for the deterministic reference.
     */
    public VirtualMachine(ProgramRegistry registry, VmConfig config,
                          IArithmeticProvider arithmeticProvider, IMathProvider mathProvider) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        this.arithmeticProvider = arithmeticProvider;
        this.mathProvider = mathProvider;
    }

    /**
     * Runs a registered program with the configured step limit.
     * @param entry The entry program name.
     * @return The final machine state.
     * @throws ExecutionException if the run aborts.
     */
    public MachineState run(String entry) throws ExecutionException {
        return run(entry, config.maxSteps());
    }

    /**
     * Runs a registered program through the bootstrap sequence {@code PL0CALL entry; HALT}.
     * @param entry The entry program name.
     * @param maxSteps The maximum number of instructions to execute.
     * @return The final machine state.
     * @throws ExecutionException if the run aborts.
     */
    public MachineState run(String entry, long maxSteps) throws ExecutionException {
        Program bootstrap = new Program(BOOTSTRAP_NAME, List.of(
                Instruction.of(Opcode.PL0CALL, new ProgramOperand(entry)),
                Instruction.of(Opcode.HALT)));
        return execute(bootstrap, maxSteps);
    }

    /**
     * Executes an instruction sequence directly.
     * @param program The sequence to start with.
     * @param maxSteps The maximum number of instructions to execute.
     * @return The final machine state.
     * @throws ExecutionException if the run aborts.
     */
    public MachineState execute(Program program, long maxSteps) throws ExecutionException {
        state = new MachineState(config.registerCount(), config.memorySize(), config.dataStackSize(), config.maxCallDepth());
        arithmeticStatistics.clear();
        mathStatistics.clear();
        state.enter(program);
        state.setRunning(true);
        LOG.debug("Starting run of '{}' (maxSteps={}, arithmeticProvider={}, mathProvider={})",
                program.name(), maxSteps, arithmeticProvider != null, mathProvider != null);

        try {
            while (state.isRunning() && state.getIp() >= 0 && state.getIp() < state.getProgram().size()) {
                if (state.getSteps() >= maxSteps) {
                    Instruction next = state.getProgram().get(state.getIp());
                    throw new ExecutionException(ExecutionErrorCode.STEP_LIMIT_EXCEEDED,
                            "Execution aborted: exceeded maxSteps=" + maxSteps, next, state.getIp());
                }
                step();
            }
        } catch (ExecutionException e) {
            state.setRunning(false);
            LOG.debug("Run of '{}' aborted after {} steps: {}", program.name(), state.getSteps(), e.getMessage());
            throw e;
        }

        state.setRunning(false);
        LOG.debug("Run of '{}' finished after {} steps", program.name(), state.getSteps());
        return state;
    }

    private void step() throws ExecutionException {
        int ip = state.getIp();
        Instruction instruction = state.getProgram().get(ip);
        state.setIp(ip + 1);
        state.incrementSteps();

        InstructionHandler handler = InstructionSet.handlerFor(instruction.opcode());
        if (handler == null) {
            throw new ExecutionException(ExecutionErrorCode.UNKNOWN_OPCODE,
                    "Unknown instruction '" + instruction.opcode() + "'", instruction, ip);
        }
        ExecutionContext context = new ExecutionContext(state, instruction, ip, registry, config.scale(),
                arithmeticProvider, mathProvider,
                config.trackStatistics() ? arithmeticStatistics : null,
                config.trackStatistics() ? mathStatistics : null);
        handler.execute(context);
    }

    /**
     * @return The state of the most recent run, or {@code null} before the first run.
     */
    public MachineState getState() {
        return state;
    }

    public OperationStatistics<ArithmeticOp> getArithmeticStatistics() {
        return arithmeticStatistics;
    }

    public OperationStatistics<MathOp> getMathStatistics() {
        return mathStatistics;
    }

    public ProgramRegistry getRegistry() {
        return registry;
    }

    public VmConfig getConfig() {
        return config;
    }
}
