package org.pl0vm.compiler;

import org.pl0vm.compiler.api.CompilationException;
import org.pl0vm.compiler.api.CompilationResult;
import org.pl0vm.compiler.api.CompilerErrorCode;
import org.pl0vm.compiler.api.CompilerOptions;
import org.pl0vm.compiler.frontend.parser.ast.ProgramNode;
import org.pl0vm.runtime.ProgramRegistry;
import org.pl0vm.runtime.isa.Instruction;
import org.pl0vm.runtime.isa.Opcode;
import org.pl0vm.testutils.TestPrograms;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the {@link Compiler} driver: registration, batches and base addresses.
 */
public class CompilerTest {

    private ProgramRegistry registry;
    private Compiler compiler;

    @BeforeEach
    void setUp() {
        registry = new ProgramRegistry();
        compiler = new Compiler(registry);
    }

    /**
     * Verifies that a compiled program ends with RET and is registered under its declared name.
     */
    @Test
    @Tag("unit")
    void testCompileRegistersProgram() throws CompilationException {
        CompilationResult result = compiler.compile("program p; var x, y; x := 2 + 3 * 4; .", 10);

        assertThat(result.programName()).isEqualTo("p");
        assertThat(result.baseAddress()).isEqualTo(10);
        assertThat(result.variables()).containsExactly(Map.entry("x", 10), Map.entry("y", 11));
        assertThat(result.temporaries()).isEqualTo(2);
        assertThat(result.instructions().get(result.instructions().size() - 1)).isEqualTo(Instruction.of(Opcode.RET));
        assertThat(registry.find("p")).hasValueSatisfying(p -> assertThat(p.instructions()).isEqualTo(result.instructions()));
    }

    @Test
    @Tag("unit")
    void testCompilationIsDeterministic() throws CompilationException {
        String source = "program p; var x; while x do begin if x then x := x - 1; end .";

        List<Instruction> first = compiler.compile(source, 0).instructions();
        List<Instruction> second = compiler.compile(source, 0).instructions();

        assertThat(second).isEqualTo(first);
        assertThat(first).extracting(Instruction::toString).contains("label_100:", "label_101:", "label_102:");
    }

    @Test
    @Tag("unit")
    void testRecompilingReplacesProgram() throws CompilationException {
        compiler.compile("program p; var x; x := 1; .", 0);
        compiler.compile("program p; var x; x := 2; .", 0);

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.find("p").orElseThrow().get(0).toString()).isEqualTo("LOAD r0, #2");
    }

    @Test
    @Tag("unit")
    void testCallMustTargetAKnownProgram() throws CompilationException {
        assertThatThrownBy(() -> compiler.compile("program a; call b; .", 0))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNKNOWN_PROGRAM));

        compiler.compile("program b; .", 0);
        assertThat(compiler.compile("program a; call b; .", 0).instructions())
                .extracting(Instruction::toString).containsExactly("PL0CALL b", "RET");
    }

    /**
     * Verifies that a batch may call forward into programs compiled later in the same batch.
     */
    @Test
    @Tag("unit")
    void testBatchAllowsForwardCalls() throws CompilationException {
        List<CompilationResult> results = compiler.compileAll(List.of(
                "program first; call second; .",
                "program second; var x; x := 1; ."));

        assertThat(results).extracting(CompilationResult::programName).containsExactly("first", "second");
        assertThat(registry.names()).containsExactly("first", "second");
    }

    @Test
    @Tag("unit")
    void testBatchBaseAddresses() throws CompilationException {
        List<CompilationResult> automatic = compiler.compileAll(List.of(
                "program a; var x; .", "program b; var x; .", "program c; var x; ."));
        assertThat(automatic).extracting(CompilationResult::baseAddress).containsExactly(0, 32, 64);

        List<CompilationResult> mapped = compiler.compileAll(List.of(
                "program a; var x; .", "program b; var x; .", "program c; var x; ."), Map.of("b", 100), 10);
        assertThat(mapped).extracting(CompilationResult::baseAddress).containsExactly(0, 100, 110);
    }

    @Test
    @Tag("unit")
    void testBatchStopsAtFirstError() {
        assertThatThrownBy(() -> compiler.compileAll(List.of(
                "program ok; .", "program bad; x := 1; .", "program never; .")))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNKNOWN_VARIABLE));

        assertThat(registry.names()).containsExactly("ok");
    }

    @Test
    @Tag("unit")
    void testBatchNamesDoNotLeakIntoLaterCompiles() throws CompilationException {
        assertThatThrownBy(() -> compiler.compileAll(List.of("program a; x := 1; .", "program b; .")))
                .isInstanceOf(CompilationException.class);

        assertThatThrownBy(() -> compiler.compile("program c; call b; .", 0))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNKNOWN_PROGRAM));
    }

    @Test
    @Tag("unit")
    void testCustomScaleAppliesToLiterals() throws CompilationException {
        Compiler small = new Compiler(registry, CompilerOptions.defaults().withScale(100));

        assertThat(small.compile("program p; var x; x := 1.5; .", 0).instructions().get(0).toString())
                .isEqualTo("LOAD r0, #150");
    }

    @Test
    @Tag("unit")
    void testParseDoesNotRegister() throws CompilationException {
        ProgramNode node = (ProgramNode) compiler.parse("program p; .", 0).node();

        assertThat(node.name()).isEqualTo("p");
        assertThat(registry.contains("p")).isFalse();
    }

    @Test
    @Tag("unit")
    void testMatrixFixtureCompiles() throws CompilationException {
        List<String> sources = ProgramSourceSplitter.split(TestPrograms.load("matrix.pl0")).stream()
                .map(ProgramSourceSplitter.ProgramSource::source).toList();

        List<CompilationResult> results = compiler.compileAll(sources,
                Map.of("setElement", 0, "getElement", 0, "matrixTest", 20), Compiler.DEFAULT_BASE_STEP);

        assertThat(results).extracting(CompilationResult::baseAddress).containsExactly(0, 0, 20);
        assertThat(results.get(2).variables()).containsEntry("val", 23);
    }

    /**
     * Verifies that stepped bases may run past the end of memory as long as no variable lands there.
     */
    @Test
    @Tag("unit")
    void testBatchBasesMayLeaveMemory() throws CompilationException {
        List<String> sources = IntStream.range(1, 10)
                .mapToObj(i -> "program p" + i + "; begin end.")
                .toList();

        List<CompilationResult> results = compiler.compileAll(sources);

        assertThat(results).hasSize(9);
        assertThat(results.get(8).baseAddress()).isEqualTo(256);
        assertThat(registry.contains("p9")).isTrue();

        List<String> withVariable = IntStream.range(1, 10)
                .mapToObj(i -> "program q" + i + "; var x; begin x := 1 end.")
                .toList();
        assertThatThrownBy(() -> compiler.compileAll(withVariable))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.ADDRESS_SPACE_EXHAUSTED));
    }
}
