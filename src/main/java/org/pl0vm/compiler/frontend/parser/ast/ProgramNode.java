package org.pl0vm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root node: {@code program name ; block .}
 *
 * @param name The declared program name.
 * @param block The program body.
 */
public record ProgramNode(String name, BlockNode block) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return List.of(block);
    }
}
