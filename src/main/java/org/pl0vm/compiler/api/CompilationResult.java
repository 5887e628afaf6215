package org.pl0vm.compiler.api;

import org.pl0vm.runtime.isa.Instruction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The product of compiling one program.
 *
 * @param programName The declared program name, under which the code is registered.
 * @param instructions The instruction sequence, ending with the implicit {@code RET}.
 * @param variables Variable name to memory address, in declaration order.
 * @param baseAddress The address of the first variable.
 * @param temporaries The number of temporary cells allocated from the top of memory.
 */
public record CompilationResult(String programName, List<Instruction> instructions,
                                Map<String, Integer> variables, int baseAddress, int temporaries) {

    public CompilationResult {
        instructions = List.copyOf(instructions);
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }
}
