package org.pl0vm.runtime.isa;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ArithmeticOpTest {

    @Test
    @Tag("unit")
    void testExactSemantics() {
        assertThat(ArithmeticOp.ADD.exact(Integer.MAX_VALUE, 1)).isEqualTo(Integer.MIN_VALUE);
        assertThat(ArithmeticOp.SUB.exact(3, 5)).isEqualTo(-2);
        assertThat(ArithmeticOp.MUL.exact(-4, 6)).isEqualTo(-24);
        assertThat(ArithmeticOp.DIV.exact(-7, 2)).isEqualTo(-4);
        assertThat(ArithmeticOp.DIV.exact(7, -2)).isEqualTo(-4);
        assertThatThrownBy(() -> ArithmeticOp.DIV.exact(1, 0)).isInstanceOf(ArithmeticException.class);
    }

    @Test
    @Tag("unit")
    void testGuardedDivisionByZeroIsZero() {
        assertThat(ArithmeticOp.DIV.exactGuarded(5, 0)).isZero();
        assertThat(ArithmeticOp.DIV.exactGuarded(9, 2)).isEqualTo(4);
    }

    @Test
    @Tag("unit")
    void testOpcodeMapping() {
        assertThat(ArithmeticOp.forOpcode(Opcode.MUL)).contains(ArithmeticOp.MUL);
        assertThat(ArithmeticOp.forOpcode(Opcode.FSIN)).isEmpty();
    }
}
