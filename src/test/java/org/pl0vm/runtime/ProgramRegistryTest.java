package org.pl0vm.runtime;

import org.pl0vm.runtime.isa.Instruction;
import org.pl0vm.runtime.isa.Opcode;
import org.pl0vm.runtime.model.Program;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ProgramRegistryTest {

    @Test
    @Tag("unit")
    void testRegisterFindAndReplace() {
        ProgramRegistry registry = new ProgramRegistry();
        registry.register("a", List.of(Instruction.of(Opcode.HALT)));
        registry.register("b", List.of());
        Program replacement = registry.register("a", List.of(Instruction.of(Opcode.RET)));

        assertThat(registry.names()).containsExactly("a", "b");
        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.find("a")).contains(replacement);
        assertThat(registry.find("A")).isEmpty();
        assertThat(registry.contains("b")).isTrue();
    }

    /**
     * Verifies that separate registries do not share programs.
     */
    @Test
    @Tag("unit")
    void testRegistriesAreIndependent() {
        ProgramRegistry first = new ProgramRegistry();
        ProgramRegistry second = new ProgramRegistry();
        first.register("p", List.of());

        assertThat(second.contains("p")).isFalse();
    }
}
