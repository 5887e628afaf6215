package org.pl0vm.runtime.internal.services;

import org.pl0vm.runtime.api.ExecutionErrorCode;
import org.pl0vm.runtime.api.ExecutionException;
import org.pl0vm.runtime.model.CallFrame;
import org.pl0vm.runtime.model.MachineState;
import org.pl0vm.runtime.model.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles the call stack side of {@code CALL}, {@code PL0CALL} and {@code RET}.
 * Intra-program calls save a bare return index; cross-program calls save the caller's
 * instruction sequence and label table so the matching return can restore them.
 */
public class ProgramCallHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramCallHandler.class);

    private final ExecutionContext context;

    /**
     * Constructs a new ProgramCallHandler.
     * @param context The execution context for the current instruction.
     */
    public ProgramCallHandler(ExecutionContext context) {
        this.context = context;
    }

    /**
     * Pushes a return address and jumps to a label index in the active sequence.
     * @param targetIndex The resolved index of the target label.
     * @throws ExecutionException if the call stack is full.
     */
    public void executeCall(int targetIndex) throws ExecutionException {
        MachineState state = context.getState();
        ensureCapacity(state);
        state.getCallStack().push(new CallFrame.ReturnAddress(context.getInstructionPointer() + 1));
        state.setIp(targetIndex);
    }

    /**
     * Saves the caller's context and switches to a registered program.
     * The callee's label table is rebuilt and execution starts at its first instruction.
     * @param programName The callee name.
     * @throws ExecutionException if the program is unknown or the call stack is full.
     */
    public void executeProgramCall(String programName) throws ExecutionException {
        MachineState state = context.getState();
        Program callee = context.getRegistry().find(programName)
                .orElseThrow(() -> new ExecutionException(ExecutionErrorCode.UNKNOWN_PROGRAM,
                        "No compiled program named '" + programName + "'",
                        context.getInstruction(), context.getInstructionPointer()));
        ensureCapacity(state);
        state.getCallStack().push(new CallFrame.ContextFrame(
                state.getProgram(), state.getLabels(), context.getInstructionPointer() + 1));
        state.enter(callee);
        LOG.trace("Entered program '{}' at depth {}", programName, state.getCallStack().size());
    }

    /**
     * Pops the top frame and resumes there. An empty call stack halts the machine.
     */
    public void executeReturn() {
        MachineState state = context.getState();
        if (state.getCallStack().isEmpty()) {
            state.setRunning(false);
            return;
        }
        CallFrame frame = state.getCallStack().pop();
        if (frame instanceof CallFrame.ContextFrame contextFrame) {
            state.restore(contextFrame.program(), contextFrame.labels(), contextFrame.returnIndex());
            LOG.trace("Returned to program '{}' at index {}", contextFrame.program().name(), contextFrame.returnIndex());
        } else {
            state.setIp(frame.returnIndex());
        }
    }

    private void ensureCapacity(MachineState state) throws ExecutionException {
        if (state.getCallStack().size() >= state.getMaxCallDepth()) {
            throw new ExecutionException(ExecutionErrorCode.CALL_STACK_OVERFLOW,
                    "Call stack overflow (max depth " + state.getMaxCallDepth() + ")",
                    context.getInstruction(), context.getInstructionPointer());
        }
    }
}
