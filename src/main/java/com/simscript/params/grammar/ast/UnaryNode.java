package com.simscript.params.grammar.ast;

import lombok.Value;

@Value
public class UnaryNode implements ExprNode {
    Operator operator;
    ExprNode operand;
    int position;

    @Override
    public <T> T accept(ExprNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
