package org.pl0vm.compiler.frontend.parser.ast;

/**
 * @param name The variable name.
 * @param address The memory address assigned to it.
 */
public record VarDeclNode(String name, int address) implements AstNode {}
