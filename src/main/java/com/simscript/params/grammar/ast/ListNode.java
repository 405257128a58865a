package com.simscript.params.grammar.ast;

import java.util.List;

import lombok.Value;

/**
 * Bracketed or parenthesized sequence {@code [a, b]}, {@code (a, b)}.
 */
@Value
public class ListNode implements ExprNode {
    List<ExprNode> items;
    int position;

    @Override
    public <T> T accept(ExprNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
