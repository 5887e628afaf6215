package org.pl0vm.compiler.frontend.parser.ast;

/**
 * {@code poke(address, value) ;} writes to the cell whose address is held in a variable.
 *
 * @param address The variable holding the address.
 * @param value The variable holding the value.
 */
public record PokeNode(String address, String value) implements AstNode {}
