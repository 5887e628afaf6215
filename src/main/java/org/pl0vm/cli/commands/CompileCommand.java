package org.pl0vm.cli.commands;

import org.pl0vm.cli.Pl0CommandLine;
import org.pl0vm.compiler.Compiler;
import org.pl0vm.compiler.ProgramSourceSplitter;
import org.pl0vm.compiler.api.CompilationException;
import org.pl0vm.compiler.api.CompilationResult;
import org.pl0vm.compiler.api.CompilerOptions;
import org.pl0vm.config.ConfigLoader;
import org.pl0vm.runtime.ProgramRegistry;
import org.pl0vm.runtime.services.Disassembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "compile",
        mixinStandardHelpOptions = true,
        description = "Compiles every program in a PL/0 file and prints the assembly listings.")
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @CommandLine.ParentCommand
    private Pl0CommandLine parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "The PL/0 source file.")
    private File file;

    @Option(names = "--fx-scale", description = "Fixed-point scale for literals and conversions.")
    private Integer fxScale;

    @Option(names = "--base-step", defaultValue = "32", description = "Distance between automatic base addresses (default: ${DEFAULT-VALUE}).")
    private int baseStep;

    @Option(names = "--base-map", description = "Explicit base addresses, e.g. setElement:0,matrixTest:20.")
    private String baseMap;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            String text = Files.readString(file.toPath(), StandardCharsets.UTF_8);
            List<ProgramSourceSplitter.ProgramSource> programs = ProgramSourceSplitter.split(text);
            if (programs.isEmpty()) {
                log.error("No PL/0 programs found in '{}'. Expected 'program name; ... end.'", file);
                return 1;
            }

            CompilerOptions options = CompilerOptions.fromConfig(ConfigLoader.section(parent.getConfig(), "compiler"));
            if (fxScale != null) {
                options = options.withScale(fxScale);
            }
            Compiler compiler = new Compiler(new ProgramRegistry(), options);
            Map<String, Integer> bases = RunCommand.parseBaseMap(baseMap);
            List<CompilationResult> results = compiler.compileAll(
                    programs.stream().map(ProgramSourceSplitter.ProgramSource::source).toList(), bases, baseStep);

            Disassembler disassembler = new Disassembler();
            for (CompilationResult result : results) {
                out.printf("=== %s (base %d, variables %s) ===%n",
                        result.programName(), result.baseAddress(), result.variables());
                out.print(disassembler.disassemble(result.instructions(), true));
            }
            out.flush();
            return 0;
        } catch (CompilationException e) {
            log.error("Compilation error: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Cannot read '{}': {}", file, e.getMessage());
            return 2;
        }
    }
}
