package com.simscript.params.grammar.ast;

import java.util.List;

import lombok.Value;

/**
 * Subscript {@code target[i, j]}; entries are expressions or {@link SliceNode}s.
 */
@Value
public class IndexNode implements ExprNode {
    ExprNode target;
    List<ExprNode> indices;
    int position;

    @Override
    public <T> T accept(ExprNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
