package org.pl0vm.compiler.frontend.parser.ast;

/**
 * {@code call name ;}, an invocation of another compiled program.
 *
 * @param programName The callee.
 */
public record CallNode(String programName) implements AstNode {}
