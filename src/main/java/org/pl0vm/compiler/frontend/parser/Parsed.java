package org.pl0vm.compiler.frontend.parser;

import org.pl0vm.compiler.frontend.parser.ast.AstNode;
import org.pl0vm.runtime.isa.Instruction;

import java.util.List;

/**
 * What every grammar production returns: the AST fragment and the instructions
 * emitted for it.
 *
 * @param node The AST fragment.
 * @param code The emitted instructions.
 */
public record Parsed(AstNode node, List<Instruction> code) {

    public Parsed {
        code = List.copyOf(code);
    }
}
