package org.pl0vm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param operator One of {@code + - * /}.
 * @param left The left operand.
 * @param right The right operand.
 */
public record BinaryOpNode(char operator, AstNode left, AstNode right) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
