package org.pl0vm.compiler.frontend.parser.ast;

/**
 * {@code pop name ;}
 *
 * @param name The variable receiving the popped value.
 */
public record PopNode(String name) implements AstNode {}
