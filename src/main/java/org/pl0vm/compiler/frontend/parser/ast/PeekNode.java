package org.pl0vm.compiler.frontend.parser.ast;

/**
 * {@code peek(destination, address) ;} reads the cell whose address is held in a variable.
 *
 * @param destination The variable receiving the value.
 * @param address The variable holding the address.
 */
public record PeekNode(String destination, String address) implements AstNode {}
