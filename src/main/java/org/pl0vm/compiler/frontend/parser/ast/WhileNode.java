package org.pl0vm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code while condition do statement}
 *
 * @param condition The loop condition; zero ends the loop.
 * @param body The loop body.
 */
public record WhileNode(AstNode condition, AstNode body) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }
}
