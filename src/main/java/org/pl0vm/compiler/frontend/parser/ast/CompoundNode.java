package org.pl0vm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code begin statement ; ... end}
 *
 * @param statements The statements in order.
 */
public record CompoundNode(List<AstNode> statements) implements AstNode {

    public CompoundNode {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return statements;
    }
}
