package org.pl0vm.e2e;

import org.pl0vm.compiler.Compiler;
import org.pl0vm.compiler.ProgramSourceSplitter;
import org.pl0vm.compiler.api.CompilationException;
import org.pl0vm.compiler.api.CompilationResult;
import org.pl0vm.runtime.ProgramRegistry;
import org.pl0vm.runtime.VirtualMachine;
import org.pl0vm.runtime.VmConfig;
import org.pl0vm.runtime.api.ExecutionErrorCode;
import org.pl0vm.runtime.api.ExecutionException;
import org.pl0vm.runtime.model.MachineState;
import org.pl0vm.runtime.providers.LinearArithmeticProvider;
import org.pl0vm.runtime.providers.ProviderSettings;
import org.pl0vm.testutils.TestPrograms;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Compiles PL/0 sources and runs them on the virtual machine.
 */
public class EndToEndTest {

    private ProgramRegistry registry;
    private Compiler compiler;

    @BeforeEach
    void setUp() {
        registry = new ProgramRegistry();
        compiler = new Compiler(registry);
    }

    private MachineState run(String entry) throws ExecutionException {
        return new VirtualMachine(registry).run(entry);
    }

    @Test
    @Tag("integration")
    void testArithmeticPrecedence() throws Exception {
        compiler.compile("program p; var x; begin x := 2 + 3 * 4; end.", 0);

        MachineState state = run("p");

        assertThat(state.read(0)).isEqualTo(14);
        assertThat(state.getDataStack().isEmpty()).isTrue();
    }

    /**
     * Three programs sharing a matrix in memory through the data stack.
     */
    @Test
    @Tag("integration")
    void testMatrixProgramsCommunicateThroughStackAndMemory() throws Exception {
        List<String> sources = ProgramSourceSplitter.split(TestPrograms.load("matrix.pl0")).stream()
                .map(ProgramSourceSplitter.ProgramSource::source)
                .toList();
        List<CompilationResult> results = compiler.compileAll(sources,
                Map.of("setElement", 0, "getElement", 0, "matrixTest", 20), Compiler.DEFAULT_BASE_STEP);

        MachineState state = run("matrixTest");

        assertThat(results).extracting(CompilationResult::programName)
                .containsExactly("setElement", "getElement", "matrixTest");
        assertThat(state.read(41)).isEqualTo(99);
        assertThat(state.readRange(20, 23)).containsExactly(4, 2, 3, 99);
        assertThat(state.getDataStack().toArray()).containsExactly(99);
    }

    @Test
    @Tag("integration")
    void testIntrinsicsUseFixedPoint() throws Exception {
        compiler.compile("program m; var c, d, n; begin c := cos(0.0); d := ln(1.0); n := fromfx(fx(3) * 2) end.", 0);

        MachineState state = run("m");

        assertThat(state.readRange(0, 2)).containsExactly(65536, 0, 6);
    }

    @Test
    @Tag("integration")
    void testMathFixture() throws Exception {
        compiler.compile(TestPrograms.load("math.pl0"), 0);

        MachineState state = run("mathTest");

        assertThat(state.getDataStack().toArray()).containsExactly(0, 65536, 0, 92682, 1);
    }

    @Test
    @Tag("integration")
    void testWhileLoopSumsToTen() throws Exception {
        compiler.compile("""
                program loop;
                var i, sum;
                begin
                  i := 4;
                  while i do
                  begin
                    sum := sum + i;
                    i := i - 1
                  end;
                  if sum - 10 then sum := 0;
                  push sum
                end.
                """, 0);

        MachineState state = run("loop");

        assertThat(state.getDataStack().toArray()).containsExactly(10);
    }

    @Test
    @Tag("integration")
    void testSaturatedProviderIsCorrectedByFallback() throws Exception {
        compiler.compile("program big; var x; x := 65536 + 65536 .", 0);
        LinearArithmeticProvider provider = new LinearArithmeticProvider(
                new ProviderSettings("linear", true, 1.0, true, 2, 65536));
        VirtualMachine vm = new VirtualMachine(registry, VmConfig.defaults(), provider, null);

        MachineState state = vm.run("big");

        assertThat(state.read(0)).isEqualTo(131072);
        assertThat(vm.getArithmeticStatistics().totalFallbacks()).isEqualTo(1);
    }

    @Test
    @Tag("integration")
    void testEndlessLoopHitsStepLimit() throws CompilationException {
        compiler.compile("program spin; var x; begin x := 1; while x do x := 1 end.", 0);

        assertThatThrownBy(() -> new VirtualMachine(registry).run("spin", 500))
                .isInstanceOfSatisfying(ExecutionException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ExecutionErrorCode.STEP_LIMIT_EXCEEDED));
    }
}
