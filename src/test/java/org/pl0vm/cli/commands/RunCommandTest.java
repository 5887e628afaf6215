package org.pl0vm.cli.commands;

import org.pl0vm.cli.Pl0CommandLine;
import org.pl0vm.config.LoggingConfigurator;
import org.pl0vm.testutils.TestPrograms;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives the {@code run} and {@code compile} subcommands through picocli.
 */
public class RunCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        commandLine = new CommandLine(new Pl0CommandLine());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(new StringWriter()));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private Path write(String name, String source) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, source);
        return file;
    }

    @Test
    @Tag("integration")
    void testRunMatrixPrograms() throws IOException {
        Path file = write("matrix.pl0", TestPrograms.load("matrix.pl0"));

        int exitCode = commandLine.execute("run", file.toString(), "--entry=matrixTest",
                "--base-map=setElement:0,getElement:0,matrixTest:20");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("Entry: matrixTest")
                .contains("fxScale: 65536")
                .contains("Memory [30..42): [0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 99]")
                .contains("Data stack: [99]");
    }

    @Test
    @Tag("integration")
    void testRunWithProviderPrintsStatistics() throws IOException {
        Path file = write("big.pl0", "program big; var x; begin x := 65536 + 65536; push x end.");

        int exitCode = commandLine.execute("run", file.toString(), "--arithmetic-provider", "--dump-mem=0:1");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("Memory [0..1): [131072]")
                .contains("Arithmetic provider ops executed: 1, fallbacks: 1");
    }

    @Test
    @Tag("integration")
    void testFailuresMapToExitCodes() throws IOException {
        Path broken = write("broken.pl0", "program broken; begin y := 1 end.");

        assertThat(commandLine.execute("run", broken.toString())).isEqualTo(1);
        assertThat(commandLine.execute("run", tempDir.resolve("missing.pl0").toString())).isEqualTo(2);

        Path ok = write("ok.pl0", "program ok; var x; begin x := 1 end.");
        assertThat(commandLine.execute("run", ok.toString(), "--entry=nope")).isEqualTo(1);
        assertThat(commandLine.execute("run", ok.toString())).isZero();
    }

    @Test
    @Tag("integration")
    void testCompileListsEveryProgram() throws IOException {
        Path file = write("matrix.pl0", TestPrograms.load("matrix.pl0"));

        int exitCode = commandLine.execute("compile", file.toString(), "--base-map=matrixTest:20");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("=== setElement (base 0")
                .contains("=== getElement (base 32")
                .contains("=== matrixTest (base 20")
                .contains("PL0CALL setElement")
                .contains("RET");
    }

    @Test
    @Tag("unit")
    void testParseBaseMapSkipsMalformedEntries() {
        assertThat(RunCommand.parseBaseMap("a:1, b : 2,c,d:x"))
                .containsExactly(Map.entry("a", 1), Map.entry("b", 2));
        assertThat(RunCommand.parseBaseMap(null)).isEmpty();
    }

    @Test
    @Tag("unit")
    void testParseRangeClampsIntoMemory() {
        assertThat(RunCommand.parseRange("30:42", 256)).containsExactly(30, 42);
        assertThat(RunCommand.parseRange("-5:999", 256)).containsExactly(0, 256);
        assertThat(RunCommand.parseRange("9:3", 256)).containsExactly(9, 9);
        assertThat(RunCommand.parseRange("junk", 256)).containsExactly(30, 42);
    }
}
