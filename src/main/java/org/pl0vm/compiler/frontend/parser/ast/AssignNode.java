package org.pl0vm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code name := expression ;}
 *
 * @param name The target variable.
 * @param expression The assigned value.
 */
public record AssignNode(String name, AstNode expression) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
