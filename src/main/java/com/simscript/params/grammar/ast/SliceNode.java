package com.simscript.params.grammar.ast;

import lombok.Value;

/**
 * {@code start:stop:step} inside a subscript; omitted parts are null.
 */
@Value
public class SliceNode implements ExprNode {
    ExprNode start;
    ExprNode stop;
    ExprNode step;
    int position;

    @Override
    public <T> T accept(ExprNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
