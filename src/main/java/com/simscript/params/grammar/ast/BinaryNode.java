package com.simscript.params.grammar.ast;

import lombok.Value;

@Value
public class BinaryNode implements ExprNode {
    Operator operator;
    ExprNode left;
    ExprNode right;
    int position;

    @Override
    public <T> T accept(ExprNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
