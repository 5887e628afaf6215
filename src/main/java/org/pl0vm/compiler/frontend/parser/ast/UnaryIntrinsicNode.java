package org.pl0vm.compiler.frontend.parser.ast;

import org.pl0vm.runtime.math.MathOp;

import java.util.List;

/**
 * A math intrinsic call such as {@code sin(x)}.
 *
 * @param name The name as written.
 * @param op The intrinsic it resolves to.
 * @param argument The argument expression.
 */
public record UnaryIntrinsicNode(String name, MathOp op, AstNode argument) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return List.of(argument);
    }
}
