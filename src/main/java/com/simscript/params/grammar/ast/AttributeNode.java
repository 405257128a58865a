package com.simscript.params.grammar.ast;

import lombok.Value;

/**
 * Attribute access, limited by the evaluator to {@code .T}, {@code .shape}, {@code .size}
 * and {@code .ndim}.
 */
@Value
public class AttributeNode implements ExprNode {
    ExprNode target;
    String attribute;
    int position;

    @Override
    public <T> T accept(ExprNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
