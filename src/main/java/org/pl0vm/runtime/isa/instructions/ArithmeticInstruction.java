package org.pl0vm.runtime.isa.instructions;

import org.pl0vm.runtime.api.ExecutionErrorCode;
import org.pl0vm.runtime.api.ExecutionException;
import org.pl0vm.runtime.internal.services.ExecutionContext;
import org.pl0vm.runtime.isa.ArithmeticOp;
import org.pl0vm.runtime.isa.InstructionHandler;
import org.pl0vm.runtime.model.MachineState;
import org.pl0vm.runtime.model.OperationStatistics;
import org.pl0vm.runtime.spi.ArithmeticResult;
import org.pl0vm.runtime.spi.IArithmeticProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles the binary arithmetic instructions {@code OP rX, rY}, which compute
 * {@code rX = rX OP rY}.
 * <p>
 * Without a provider the result is exact 32-bit integer arithmetic with floor division.
 * With a provider the VM adopts the provider's result and records its diagnostics.
 * Division by zero is fatal on both paths.
 */
public class ArithmeticInstruction extends InstructionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ArithmeticInstruction.class);

    @Override
    public void execute(ExecutionContext context) throws ExecutionException {
        MachineState state = context.getState();
        ArithmeticOp op = ArithmeticOp.forOpcode(context.getInstruction().opcode())
                .orElseThrow(() -> new IllegalStateException("ArithmeticInstruction cannot execute " + context.getInstruction().opcode()));
        int rX = register(context, 0);
        int rY = register(context, 1);
        int a = state.getRegister(rX);
        int b = state.getRegister(rY);

        if (op == ArithmeticOp.DIV && b == 0) {
            throw fail(context, ExecutionErrorCode.DIVISION_BY_ZERO, "Division by zero");
        }

        IArithmeticProvider provider = context.getArithmeticProvider();
        if (provider == null) {
            state.setRegister(rX, op.exact(a, b));
            return;
        }

        ArithmeticResult result;
        try {
            result = provider.compute(op, a, b);
        } catch (RuntimeException e) {
            throw new ExecutionException(ExecutionErrorCode.PROVIDER_FAILURE,
                    "Arithmetic provider failed on " + op + "(" + a + ", " + b + "): " + e.getMessage(),
                    context.getInstruction(), context.getInstructionPointer(), e);
        }
        if (result == null) {
            throw fail(context, ExecutionErrorCode.PROVIDER_FAILURE, "Arithmetic provider returned no result for " + op);
        }
        if (result.usedFallback()) {
            LOG.trace("{}({}, {}) fell back to exact value {} (mixed {})", op, a, b, result.exact(), result.mixed());
        }

        OperationStatistics<ArithmeticOp> stats = context.getArithmeticStatistics();
        if (stats != null) {
            stats.record(op, result.usedFallback(), result.absError());
        }
        state.setRegister(rX, result.result());
    }
}
