package org.pl0vm.compiler.frontend.parser.ast;

/**
 * @param name The variable name.
 * @param address Its memory address.
 */
public record VariableRefNode(String name, int address) implements AstNode {}
