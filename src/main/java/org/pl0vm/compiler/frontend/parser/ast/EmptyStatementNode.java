package org.pl0vm.compiler.frontend.parser.ast;

/**
 * A statement that compiles to nothing.
 */
public record EmptyStatementNode() implements AstNode {}
