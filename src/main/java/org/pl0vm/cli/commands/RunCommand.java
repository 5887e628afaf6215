package org.pl0vm.cli.commands;

import com.typesafe.config.Config;
import org.pl0vm.cli.Pl0CommandLine;
import org.pl0vm.compiler.Compiler;
import org.pl0vm.compiler.ProgramSourceSplitter;
import org.pl0vm.compiler.api.CompilationException;
import org.pl0vm.compiler.api.CompilerOptions;
import org.pl0vm.config.ConfigLoader;
import org.pl0vm.runtime.ProgramRegistry;
import org.pl0vm.runtime.VirtualMachine;
import org.pl0vm.runtime.VmConfig;
import org.pl0vm.runtime.api.ExecutionException;
import org.pl0vm.runtime.model.MachineState;
import org.pl0vm.runtime.model.OperationStatistics;
import org.pl0vm.runtime.providers.ProviderFactory;
import org.pl0vm.runtime.providers.ProviderSettings;
import org.pl0vm.runtime.services.Disassembler;
import org.pl0vm.runtime.spi.IArithmeticProvider;
import org.pl0vm.runtime.spi.IMathProvider;
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
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Command(name = "run",
        mixinStandardHelpOptions = true,
        description = "Compiles every program in a PL/0 file, runs the entry program and prints memory, data stack and provider statistics.")
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);
    private static final Pattern RANGE = Pattern.compile("^(-?\\d+)\\s*:\\s*(-?\\d+)$");
    static final int DEFAULT_DUMP_LOW = 30;
    static final int DEFAULT_DUMP_HIGH = 42;

    @CommandLine.ParentCommand
    private Pl0CommandLine parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "The PL/0 source file.")
    private File file;

    @Option(names = {"-e", "--entry"}, description = "Entry program (default: the first program in the file).")
    private String entry;

    @Option(names = "--fx-scale", description = "Fixed-point scale for literals, conversions and intrinsics.")
    private Integer fxScale;

    @Option(names = "--max-steps", description = "Maximum number of executed instructions.")
    private Long maxSteps;

    @Option(names = "--base-step", defaultValue = "32", description = "Distance between automatic base addresses (default: ${DEFAULT-VALUE}).")
    private int baseStep;

    @Option(names = "--base-map", description = "Explicit base addresses, e.g. setElement:0,getElement:0,matrixTest:20.")
    private String baseMap;

    @Option(names = "--dump-asm", description = "Print the assembly listing of every compiled program.")
    private boolean dumpAsm;

    @Option(names = "--dump-mem", defaultValue = "30:42", description = "Memory range lo:hi to print, hi exclusive (default: ${DEFAULT-VALUE}).")
    private String dumpMem;

    @Option(names = "--arithmetic-provider", arity = "0..1", fallbackValue = "linear",
            description = "Attach a binary arithmetic provider, optionally naming its architecture (default: linear).")
    private String arithmeticProvider;

    @Option(names = "--mix", description = "Arithmetic provider mix in [0,1].")
    private Double mix;

    @Option(names = "--no-fallback", description = "Disable the arithmetic safety fallback.")
    private boolean noFallback;

    @Option(names = "--fallback-abs", description = "Arithmetic fallback threshold in integer units.")
    private Double fallbackAbs;

    @Option(names = "--math-provider", arity = "0..1", fallbackValue = "reference",
            description = "Attach a unary math provider, optionally naming its architecture (default: reference).")
    private String mathProvider;

    @Option(names = "--math-mix", description = "Math provider mix in [0,1].")
    private Double mathMix;

    @Option(names = "--no-math-fallback", description = "Disable the math safety fallback.")
    private boolean noMathFallback;

    @Option(names = "--math-fallback-abs", description = "Math fallback threshold in normalized units.")
    private Double mathFallbackAbs;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            Config config = parent.getConfig();
            String text = Files.readString(file.toPath(), StandardCharsets.UTF_8);
            List<ProgramSourceSplitter.ProgramSource> programs = ProgramSourceSplitter.split(text);
            if (programs.isEmpty()) {
                log.error("No PL/0 programs found in '{}'. Expected 'program name; ... end.'", file);
                return 1;
            }

            CompilerOptions compilerOptions = CompilerOptions.fromConfig(ConfigLoader.section(config, "compiler"));
            VmConfig vmConfig = VmConfig.fromConfig(ConfigLoader.section(config, "vm"));
            if (fxScale != null) {
                compilerOptions = compilerOptions.withScale(fxScale);
                vmConfig = vmConfig.withScale(fxScale);
            }
            if (maxSteps != null) {
                vmConfig = vmConfig.withMaxSteps(maxSteps);
            }

            ProgramRegistry registry = new ProgramRegistry();
            Compiler compiler = new Compiler(registry, compilerOptions);
            compiler.compileAll(programs.stream().map(ProgramSourceSplitter.ProgramSource::source).toList(),
                    parseBaseMap(baseMap), baseStep);

            String entryName = entry != null ? entry : programs.get(0).name();
            if (!registry.contains(entryName)) {
                log.error("Entry program '{}' was not compiled. Available: {}", entryName, String.join(", ", registry.names()));
                return 1;
            }

            if (dumpAsm) {
                Disassembler disassembler = new Disassembler();
                for (String name : registry.names()) {
                    out.printf("%n=== %s (assembly) ===%n", name);
                    out.print(disassembler.disassemble(registry.find(name).orElseThrow(), true));
                }
            }

            VirtualMachine vm = new VirtualMachine(registry, vmConfig,
                    createArithmeticProvider(config), createMathProvider(config, vmConfig.scale()));
            try {
                vm.run(entryName);
            } catch (ExecutionException e) {
                log.error("Execution error at ip {} ({}): {}", e.getInstructionPointer(), e.getInstruction(), e.getMessage());
                printState(out, entryName, vmConfig, vm.getState());
                out.flush();
                return 1;
            }

            printState(out, entryName, vmConfig, vm.getState());
            printStatistics(out, "Arithmetic provider", vm.getArithmeticStatistics(), "|pred-exact|");
            printStatistics(out, "Math provider", vm.getMathStatistics(), "|predNorm-exactNorm|");
            out.flush();
            return 0;
        } catch (CompilationException e) {
            log.error("Compilation error: {}", e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            log.error("Invalid settings: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Cannot read '{}': {}", file, e.getMessage());
            return 2;
        }
    }

    private IArithmeticProvider createArithmeticProvider(Config config) {
        if (arithmeticProvider == null) {
            return ProviderFactory.createArithmetic(
                    ProviderSettings.fromConfig(ConfigLoader.section(config, "providers.arithmetic")));
        }
        ProviderSettings settings = ProviderSettings.fromConfig(ConfigLoader.section(config, "providers.arithmetic"));
        settings = new ProviderSettings(arithmeticProvider, true,
                mix != null ? mix : settings.mix(),
                settings.safetyFallback() && !noFallback,
                fallbackAbs != null ? fallbackAbs : settings.fallbackAbsError(),
                settings.scale());
        return ProviderFactory.createArithmetic(settings);
    }

    private IMathProvider createMathProvider(Config config, int scale) {
        ProviderSettings settings = ProviderSettings.fromConfig(ConfigLoader.section(config, "providers.math"))
                .withScale(scale);
        if (mathProvider == null) {
            return ProviderFactory.createMath(settings);
        }
        settings = new ProviderSettings(mathProvider, true,
                mathMix != null ? mathMix : settings.mix(),
                settings.safetyFallback() && !noMathFallback,
                mathFallbackAbs != null ? mathFallbackAbs : settings.fallbackAbsError(),
                scale);
        return ProviderFactory.createMath(settings);
    }

    private void printState(PrintWriter out, String entryName, VmConfig vmConfig, MachineState state) {
        int[] range = parseRange(dumpMem, vmConfig.memorySize());
        out.printf("%nEntry: %s%n", entryName);
        out.printf("fxScale: %d%n", vmConfig.scale());
        out.printf("Steps: %d%n", state.getSteps());
        out.printf("Memory [%d..%d): %s%n", range[0], range[1],
                Arrays.toString(Arrays.copyOfRange(state.getMemory(), range[0], range[1])));
        out.printf("Data stack: %s%n", Arrays.toString(state.getDataStack().toArray()));
    }

    private static <E extends Enum<E>> void printStatistics(PrintWriter out, String title,
                                                           OperationStatistics<E> statistics, String errorLabel) {
        if (statistics.isEmpty()) {
            return;
        }
        out.printf("%n%s ops executed: %d, fallbacks: %d%n", title, statistics.totalCount(), statistics.totalFallbacks());
        for (E op : statistics.operations()) {
            out.printf("  %-6s count=%d fallbacks=%d avg %s=%.6f%n", op, statistics.count(op),
                    statistics.fallbacks(op), errorLabel, statistics.meanAbsError(op));
        }
    }

    /**
     * Parses {@code name:addr,name:addr}. Malformed entries are skipped.
     * @param raw The option value, may be {@code null}.
     * @return Base address by program name.
     */
    static Map<String, Integer> parseBaseMap(String raw) {
        Map<String, Integer> bases = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return bases;
        }
        for (String part : raw.split(",")) {
            String[] kv = part.split(":");
            if (kv.length != 2 || kv[0].isBlank()) {
                log.warn("Ignoring malformed base-map entry '{}'", part);
                continue;
            }
            try {
                bases.put(kv[0].trim(), Integer.parseInt(kv[1].trim()));
            } catch (NumberFormatException e) {
                log.warn("Ignoring base-map entry '{}': {}", part, e.getMessage());
            }
        }
        return bases;
    }

    /**
     * Parses {@code lo:hi} and clamps it into memory; a malformed value yields the default range.
     * @return {@code [lo, hi)} with {@code 0 <= lo <= hi <= memorySize}.
     */
    static int[] parseRange(String raw, int memorySize) {
        int lo = DEFAULT_DUMP_LOW;
        int hi = DEFAULT_DUMP_HIGH;
        Matcher matcher = raw == null ? null : RANGE.matcher(raw.trim());
        if (matcher != null && matcher.matches()) {
            lo = Integer.parseInt(matcher.group(1));
            hi = Integer.parseInt(matcher.group(2));
        }
        int low = Math.max(0, Math.min(memorySize - 1, lo));
        int high = Math.max(low, Math.min(memorySize, hi));
        return new int[]{low, high};
    }
}
