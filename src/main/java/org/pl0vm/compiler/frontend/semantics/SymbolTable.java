package org.pl0vm.compiler.frontend.semantics;

import org.pl0vm.compiler.api.CompilationException;
import org.pl0vm.compiler.api.CompilerErrorCode;
import org.pl0vm.compiler.frontend.lexer.Token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The variables of one compilation unit. There is a single flat scope: no shadowing
 * and no redeclaration. Names are case-sensitive.
 */
public class SymbolTable {

    private final Map<String, Integer> addresses = new LinkedHashMap<>();
    private final AddressAllocator allocator;

    /**
     * @param allocator The allocator handing out variable addresses.
     */
    public SymbolTable(AddressAllocator allocator) {
        this.allocator = allocator;
    }

    /**
     * Declares a variable at the next free address.
     * @param name The identifier token.
     * @return The assigned address.
     * @throws CompilationException if the name is already declared or memory is exhausted.
     */
    public int declare(Token name) throws CompilationException {
        if (addresses.containsKey(name.text())) {
            throw new CompilationException(CompilerErrorCode.DUPLICATE_VARIABLE,
                    "Variable '" + name.text() + "' already declared", name.sourceInfo());
        }
        int address = allocator.allocateVariable(name);
        addresses.put(name.text(), address);
        return address;
    }

    /**
     * @param name The identifier token.
     * @return The address of the variable.
     * @throws CompilationException if the variable was never declared.
     */
    public int resolve(Token name) throws CompilationException {
        Integer address = addresses.get(name.text());
        if (address == null) {
            throw new CompilationException(CompilerErrorCode.UNKNOWN_VARIABLE,
                    "Unknown variable '" + name.text() + "'", name.sourceInfo());
        }
        return address;
    }

    public boolean isDeclared(String name) {
        return addresses.containsKey(name);
    }

    /**
     * @return Name to address, in declaration order.
     */
    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(addresses);
    }
}
