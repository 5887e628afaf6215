package org.pl0vm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code if condition then statement}
 *
 * @param condition The condition; zero is false.
 * @param thenBranch The guarded statement.
 */
public record IfNode(AstNode condition, AstNode thenBranch) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, thenBranch);
    }
}
