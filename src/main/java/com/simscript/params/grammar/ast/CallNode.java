package com.simscript.params.grammar.ast;

import java.util.List;

import lombok.Value;

/**
 * Call of a built-in function; user-defined functions do not exist.
 */
@Value
public class CallNode implements ExprNode {
    String function;
    List<ExprNode> arguments;
    int position;

    @Override
    public <T> T accept(ExprNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
