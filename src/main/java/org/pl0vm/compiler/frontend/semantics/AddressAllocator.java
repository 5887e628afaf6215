package org.pl0vm.compiler.frontend.semantics;

import org.pl0vm.compiler.api.CompilationException;
import org.pl0vm.compiler.api.CompilerErrorCode;
import org.pl0vm.compiler.frontend.lexer.Token;

/**
 * Hands out memory addresses for one compilation unit. Variables ascend from the base
 * address; temporaries descend from {@code memorySize - 2} and are never reused.
 * The two ranges must not meet: a temporary inside the allocated variable range is a
 * compile error. The base itself is unchecked, so a program without variables compiles
 * at any base.
 */
public class AddressAllocator {

    private final int baseAddress;
    private final int memorySize;
    private final int firstTemporary;
    private int nextVariable;
    private int nextTemporary;

    /**
     * @param baseAddress The address of the first variable.
     * @param memorySize The number of memory cells.
     */
    public AddressAllocator(int baseAddress, int memorySize) {
        this.baseAddress = baseAddress;
        this.memorySize = memorySize;
        this.firstTemporary = memorySize - 2;
        this.nextVariable = baseAddress;
        this.nextTemporary = firstTemporary;
    }

    /**
     * @param at The token the variable is declared by, for error reporting.
     * @return The next variable address.
     * @throws CompilationException if the address would leave memory.
     */
    public int allocateVariable(Token at) throws CompilationException {
        if (nextVariable < 0 || nextVariable >= memorySize) {
            throw new CompilationException(CompilerErrorCode.ADDRESS_SPACE_EXHAUSTED,
                    "Address " + nextVariable + " for variable '" + at.text() + "' is outside memory [0, " + memorySize + ")",
                    at.sourceInfo());
        }
        return nextVariable++;
    }

    /**
     * @param at The token of the operation needing the temporary, for error reporting.
     * @return A fresh temporary address.
     * @throws CompilationException if the temporary would overlap a variable.
     */
    public int allocateTemporary(Token at) throws CompilationException {
        int address = nextTemporary;
        if (address < 0 || (address >= baseAddress && address < nextVariable)) {
            throw new CompilationException(CompilerErrorCode.ADDRESS_SPACE_EXHAUSTED,
                    "Temporary address " + address + " would overlap variables ending at " + (nextVariable - 1),
                    at.sourceInfo());
        }
        nextTemporary--;
        return address;
    }

    public int getBaseAddress() {
        return baseAddress;
    }

    /**
     * @return The number of temporaries handed out so far.
     */
    public int temporariesUsed() {
        return firstTemporary - nextTemporary;
    }
}
