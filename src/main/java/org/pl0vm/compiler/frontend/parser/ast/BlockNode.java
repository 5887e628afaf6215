package org.pl0vm.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Variable declarations followed by a single statement.
 *
 * @param declarations The declared variables, possibly empty.
 * @param statement The body statement.
 */
public record BlockNode(List<VarDeclNode> declarations, AstNode statement) implements AstNode {

    public BlockNode {
        declarations = List.copyOf(declarations);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(declarations);
        children.add(statement);
        return children;
    }
}
