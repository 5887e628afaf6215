package org.pl0vm.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param line The 1-based line number.
 * @param column The 1-based column number.
 * @param offset The 0-based character offset into the source text.
 */
public record SourceInfo(int line, int column, int offset) {

    @Override
    public String toString() {
        return "line " + line + ", column " + column + " (offset " + offset + ")";
    }
}
