package org.pl0vm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code fx(e)} / {@code tofx(e)} (multiply by the scale) or {@code int(e)} /
 * {@code fromfx(e)} / {@code unfx(e)} (floor-divide by the scale).
 *
 * @param toFixed {@code true} for the multiplying forms.
 * @param argument The argument expression.
 */
public record FixedPointConvertNode(boolean toFixed, AstNode argument) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return List.of(argument);
    }
}
