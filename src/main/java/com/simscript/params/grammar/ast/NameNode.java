package com.simscript.params.grammar.ast;

import lombok.Value;

/**
 * Bare identifier: a field reference inside markers, a constant otherwise.
 */
@Value
public class NameNode implements ExprNode {
    String name;
    int position;

    @Override
    public <T> T accept(ExprNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
