package org.pl0vm.runtime;

import org.pl0vm.runtime.isa.Instruction;
import org.pl0vm.runtime.model.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps program names to their compiled instruction sequences.
 * <p>
 * One registry is shared by a compilation session and the virtual machines that run
 * its programs. Registering a name that already exists replaces the previous program.
 * <p>
 * This class is not thread-safe. Hosts that compile or execute concurrently against
 * the same registry must serialize access themselves.
 */
public class ProgramRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramRegistry.class);

    private final Map<String, Program> programs = new LinkedHashMap<>();

    /**
     * Registers a program, replacing any program with the same name.
     * @param program The program.
     */
    public void register(Program program) {
        Program previous = programs.put(program.name(), program);
        if (previous != null) {
            LOG.debug("Replaced program '{}' ({} -> {} instructions)", program.name(), previous.size(), program.size());
        }
    }

    /**
     * Registers an instruction sequence under a name.
     * @param name The program name.
     * @param instructions The instructions.
     * @return The registered program.
     */
    public Program register(String name, List<Instruction> instructions) {
        Program program = new Program(name, instructions);
        register(program);
        return program;
    }

    public Optional<Program> find(String name) {
        return Optional.ofNullable(programs.get(name));
    }

    public boolean contains(String name) {
        return programs.containsKey(name);
    }

    /**
     * @return The registered names in registration order.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(programs.keySet());
    }

    public int size() {
        return programs.size();
    }
}
