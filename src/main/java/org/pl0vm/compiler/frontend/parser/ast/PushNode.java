package org.pl0vm.compiler.frontend.parser.ast;

/**
 * {@code push name ;}
 *
 * @param name The variable whose value is pushed.
 */
public record PushNode(String name) implements AstNode {}
