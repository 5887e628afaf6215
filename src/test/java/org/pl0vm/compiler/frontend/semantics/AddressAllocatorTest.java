package org.pl0vm.compiler.frontend.semantics;

import org.pl0vm.compiler.api.CompilationException;
import org.pl0vm.compiler.api.CompilerErrorCode;
import org.pl0vm.compiler.frontend.lexer.Token;
import org.pl0vm.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AddressAllocator}, {@link SymbolTable} and {@link LabelGenerator}.
 */
public class AddressAllocatorTest {

    private static Token ident(String name) {
        return new Token(TokenType.IDENTIFIER, name, name, 1, 1, 0);
    }

    @Test
    @Tag("unit")
    void testVariablesAscendFromBaseAndTemporariesDescendFromTop() throws CompilationException {
        AddressAllocator allocator = new AddressAllocator(20, 256);

        assertThat(allocator.allocateVariable(ident("a"))).isEqualTo(20);
        assertThat(allocator.allocateVariable(ident("b"))).isEqualTo(21);
        assertThat(allocator.allocateTemporary(ident("+"))).isEqualTo(254);
        assertThat(allocator.allocateTemporary(ident("+"))).isEqualTo(253);
        assertThat(allocator.temporariesUsed()).isEqualTo(2);
        assertThat(allocator.getBaseAddress()).isEqualTo(20);
    }

    /**
     * Verifies that variables may fill memory up to its last cell, but not beyond.
     */
    @Test
    @Tag("unit")
    void testVariableBeyondMemoryIsRejected() throws CompilationException {
        AddressAllocator allocator = new AddressAllocator(6, 8);
        allocator.allocateVariable(ident("a"));
        allocator.allocateVariable(ident("b"));

        assertThatThrownBy(() -> allocator.allocateVariable(ident("c")))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.ADDRESS_SPACE_EXHAUSTED));
    }

    @Test
    @Tag("unit")
    void testTemporaryMayNotOverlapVariables() throws CompilationException {
        AddressAllocator allocator = new AddressAllocator(0, 8);
        for (int i = 0; i < 6; i++) {
            allocator.allocateVariable(ident("v" + i));
        }

        assertThat(allocator.allocateTemporary(ident("+"))).isEqualTo(6);
        assertThatThrownBy(() -> allocator.allocateTemporary(ident("+")))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.ADDRESS_SPACE_EXHAUSTED));
    }

    @Test
    @Tag("unit")
    void testBaseOutsideMemoryOnlyFailsOnVariables() throws CompilationException {
        AddressAllocator empty = new AddressAllocator(256, 256);
        assertThat(empty.allocateTemporary(ident("+"))).isEqualTo(254);

        assertThatThrownBy(() -> new AddressAllocator(256, 256).allocateVariable(ident("x")))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.ADDRESS_SPACE_EXHAUSTED));
        assertThatThrownBy(() -> new AddressAllocator(-1, 256).allocateVariable(ident("x")))
                .isInstanceOf(CompilationException.class);
    }

    @Test
    @Tag("unit")
    void testSymbolTableRejectsDuplicatesAndUnknownNames() throws CompilationException {
        SymbolTable symbols = new SymbolTable(new AddressAllocator(0, 256));
        symbols.declare(ident("x"));

        assertThat(symbols.isDeclared("x")).isTrue();
        assertThat(symbols.isDeclared("X")).isFalse();
        assertThatThrownBy(() -> symbols.declare(ident("x")))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.DUPLICATE_VARIABLE));
        assertThatThrownBy(() -> symbols.resolve(ident("X")))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNKNOWN_VARIABLE));
    }

    @Test
    @Tag("unit")
    void testLabelsAreNumberedFromOneHundred() {
        LabelGenerator labels = new LabelGenerator();

        assertThat(labels.next()).isEqualTo("label_100");
        assertThat(labels.next()).isEqualTo("label_101");
    }
}
