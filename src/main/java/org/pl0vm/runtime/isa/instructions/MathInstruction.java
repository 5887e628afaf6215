package org.pl0vm.runtime.isa.instructions;

import org.pl0vm.runtime.api.ExecutionErrorCode;
import org.pl0vm.runtime.api.ExecutionException;
import org.pl0vm.runtime.internal.services.ExecutionContext;
import org.pl0vm.runtime.isa.InstructionHandler;
import org.pl0vm.runtime.math.MathOp;
import org.pl0vm.runtime.math.MathReference;
import org.pl0vm.runtime.model.MachineState;
import org.pl0vm.runtime.model.OperationStatistics;
import org.pl0vm.runtime.spi.IMathProvider;
import org.pl0vm.runtime.spi.MathResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles the unary math intrinsics {@code FSIN rX} ... {@code FSQRT rX}, which replace
 * the fixed-point value in {@code rX} by the function result.
 */
public class MathInstruction extends InstructionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(MathInstruction.class);

    @Override
    public void execute(ExecutionContext context) throws ExecutionException {
        MachineState state = context.getState();
        MathOp op = MathOp.forOpcode(context.getInstruction().opcode())
                .orElseThrow(() -> new IllegalStateException("MathInstruction cannot execute " + context.getInstruction().opcode()));
        int rX = register(context, 0);
        int input = state.getRegister(rX);

        IMathProvider provider = context.getMathProvider();
        if (provider == null) {
            state.setRegister(rX, MathReference.evaluate(op, input, context.getScale()));
            return;
        }

        MathResult result;
        try {
            result = provider.compute(op, input);
        } catch (RuntimeException e) {
            throw new ExecutionException(ExecutionErrorCode.PROVIDER_FAILURE,
                    "Math provider failed on " + op + "(" + input + "): " + e.getMessage(),
                    context.getInstruction(), context.getInstructionPointer(), e);
        }
        if (result == null) {
            throw fail(context, ExecutionErrorCode.PROVIDER_FAILURE, "Math provider returned no result for " + op);
        }
        if (result.usedFallback()) {
            LOG.trace("{}({}) fell back to exact value {}", op, input, result.exact());
        }

        OperationStatistics<MathOp> stats = context.getMathStatistics();
        if (stats != null) {
            stats.record(op, result.usedFallback(), result.absError());
        }
        state.setRegister(rX, result.result());
    }
}
