package org.pl0vm.compiler.frontend.parser.ast;

/**
 * An AST node that represents a numeric literal as it is loaded into the accumulator.
 *
 * @param value The loaded value; float literals are already scaled.
 * @param raw The literal text.
 * @param fixedPoint {@code true} if the literal was a float desugared into fixed point.
 */
public record NumberLiteralNode(int value, String raw, boolean fixedPoint) implements AstNode {}
