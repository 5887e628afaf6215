package org.pl0vm.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the {@code program <name>; ... end.} units of a source file.
 * <p>
 * A unit ends at the first {@code end} followed by {@code .}, so a float literal such as
 * {@code 2.5} does not end it early. Text between units is ignored.
 */
public final class ProgramSourceSplitter {

    private static final Pattern PROGRAM = Pattern.compile(
            "\\bprogram\\s+([A-Za-z][A-Za-z0-9_]*)\\s*;[\\s\\S]*?\\bend\\s*\\.",
            Pattern.CASE_INSENSITIVE);

    private ProgramSourceSplitter() {}

    /**
     * A program unit.
     * @param name The declared program name.
     * @param source The unit's source text.
     */
    public record ProgramSource(String name, String source) {}

    /**
     * @param text The whole file content.
     * @return The units in file order; empty if there are none.
     */
    public static List<ProgramSource> split(String text) {
        List<ProgramSource> out = new ArrayList<>();
        Matcher matcher = PROGRAM.matcher(text);
        while (matcher.find()) {
            out.add(new ProgramSource(matcher.group(1), matcher.group()));
        }
        return out;
    }
}
