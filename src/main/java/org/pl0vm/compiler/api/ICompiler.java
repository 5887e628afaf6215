package org.pl0vm.compiler.api;

import java.util.List;
import java.util.Map;

/**
 * Defines the public interface of the PL/0 compiler.
 */
public interface ICompiler {

    /**
     * Compiles one program and registers it under its declared name, replacing any
     * program registered under that name before.
     *
     * @param source The program source text.
     * @param baseAddress The memory address of the program's first variable.
     * @return The compilation result.
     * @throws CompilationException at the first error.
     */
    CompilationResult compile(String source, int baseAddress) throws CompilationException;

    /**
     * Compiles several programs in order. Every program name of the batch may be the
     * target of a {@code call} in any program of the batch.
     *
     * @param sources The program sources, in compilation order.
     * @param baseAddresses Explicit base addresses by program name; programs not listed
     *                      get consecutive bases spaced by {@code baseStep}.
     * @param baseStep The distance between consecutive automatic base addresses.
     * @return The results in compilation order.
     * @throws CompilationException at the first error.
     */
    List<CompilationResult> compileAll(List<String> sources, Map<String, Integer> baseAddresses, int baseStep)
            throws CompilationException;
}
