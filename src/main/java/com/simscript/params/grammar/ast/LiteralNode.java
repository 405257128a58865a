package com.simscript.params.grammar.ast;

import lombok.Value;

/**
 * Number, boolean or quoted string constant.
 */
@Value
public class LiteralNode implements ExprNode {
    Object value;
    int position;

    @Override
    public <T> T accept(ExprNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
