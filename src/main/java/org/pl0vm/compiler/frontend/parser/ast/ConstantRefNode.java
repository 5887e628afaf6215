package org.pl0vm.compiler.frontend.parser.ast;

/**
 * A built-in real constant ({@code pi}, {@code tau}, {@code e}) in fixed point.
 *
 * @param name The constant name, lower case.
 * @param value The scaled value.
 */
public record ConstantRefNode(String name, int value) implements AstNode {}
