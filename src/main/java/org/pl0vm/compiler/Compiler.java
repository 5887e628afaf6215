package org.pl0vm.compiler;

import org.pl0vm.compiler.api.CompilationException;
import org.pl0vm.compiler.api.CompilationResult;
import org.pl0vm.compiler.api.CompilerOptions;
import org.pl0vm.compiler.api.ICompiler;
import org.pl0vm.compiler.frontend.lexer.Lexer;
import org.pl0vm.compiler.frontend.lexer.Token;
import org.pl0vm.compiler.frontend.lexer.TokenType;
import org.pl0vm.compiler.frontend.parser.Parsed;
import org.pl0vm.compiler.frontend.parser.Parser;
import org.pl0vm.compiler.frontend.parser.ast.ProgramNode;
import org.pl0vm.runtime.ProgramRegistry;
import org.pl0vm.runtime.isa.Instruction;
import org.pl0vm.runtime.isa.Opcode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The main compiler implementation. It runs the pipeline lexer, parser/code generator,
 * appends the implicit {@code RET} and registers the program in the registry.
 * It is not thread-safe.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    /** Distance between automatic base addresses in a batch. */
    public static final int DEFAULT_BASE_STEP = 32;

    private final ProgramRegistry registry;
    private final CompilerOptions options;
    private final Set<String> pendingNames = new HashSet<>();

    /**
     * Creates a compiler with default options.
     * @param registry The registry compiled programs are stored in.
     */
    public Compiler(ProgramRegistry registry) {
        this(registry, CompilerOptions.defaults());
    }

    /**
     * @param registry The registry compiled programs are stored in.
     * @param options The compiler options.
     */
    public Compiler(ProgramRegistry registry, CompilerOptions options) {
        this.registry = registry;
        this.options = options;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public CompilationResult compile(String source, int baseAddress) throws CompilationException {
        Parser parser = newParser(source, baseAddress);
        Parsed parsed = parser.parseProgram();
        String name = ((ProgramNode) parsed.node()).name();

        List<Instruction> code = new ArrayList<>(parsed.code());
        code.add(Instruction.of(Opcode.RET));
        registry.register(name, code);

        LOG.debug("Compiled program '{}': {} instructions, {} variables at base {}, {} temporaries",
                name, code.size(), parser.getVariables().size(), baseAddress, parser.getTemporariesUsed());
        return new CompilationResult(name, code, parser.getVariables(), baseAddress, parser.getTemporariesUsed());
    }

    /**
     * Parses a program without registering it.
     * @param source The program source text.
     * @param baseAddress The memory address of the program's first variable.
     * @return The program AST and its code, without the trailing {@code RET}.
     * @throws CompilationException at the first error.
     */
    public Parsed parse(String source, int baseAddress) throws CompilationException {
        return newParser(source, baseAddress).parseProgram();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<CompilationResult> compileAll(List<String> sources, Map<String, Integer> baseAddresses, int baseStep)
            throws CompilationException {
        pendingNames.clear();
        for (String source : sources) {
            peekProgramName(source).ifPresent(pendingNames::add);
        }
        try {
            List<CompilationResult> results = new ArrayList<>();
            int nextBase = 0;
            for (String source : sources) {
                Optional<String> name = peekProgramName(source);
                int base = name.filter(baseAddresses::containsKey).map(baseAddresses::get).orElse(nextBase);
                results.add(compile(source, base));
                nextBase = base + baseStep;
            }
            LOG.debug("Compiled batch of {} programs", results.size());
            return results;
        } finally {
            pendingNames.clear();
        }
    }

    /**
     * Compiles a batch with automatic bases spaced by {@link #DEFAULT_BASE_STEP}.
     * @param sources The program sources, in compilation order.
     * @return The results in compilation order.
     * @throws CompilationException at the first error.
     */
    public List<CompilationResult> compileAll(List<String> sources) throws CompilationException {
        return compileAll(sources, Map.of(), DEFAULT_BASE_STEP);
    }

    public CompilerOptions getOptions() {
        return options;
    }

    private Parser newParser(String source, int baseAddress) throws CompilationException {
        List<Token> tokens = new Lexer(source).scanTokens();
        return new Parser(tokens, options, baseAddress,
                name -> registry.contains(name) || pendingNames.contains(name));
    }

    /**
     * Reads the name after the leading {@code program} keyword, if the source starts that way.
     */
    static Optional<String> peekProgramName(String source) {
        try {
            List<Token> tokens = new Lexer(source).scanTokens();
            if (tokens.size() > 1 && tokens.get(0).isKeyword("program")
                    && tokens.get(1).type() == TokenType.IDENTIFIER) {
                return Optional.of(tokens.get(1).text());
            }
        } catch (CompilationException e) {
            // the full compile reports it
            LOG.trace("Could not read program name: {}", e.getMessage());
        }
        return Optional.empty();
    }
}
