package com.simscript.params.grammar.ast;

/**
 * Visitor pattern interface for traversing expression trees.
 */
public interface ExprNodeVisitor<T> {
    T visit(LiteralNode literal);
    T visit(NameNode name);
    T visit(UnaryNode unary);
    T visit(BinaryNode binary);
    T visit(CallNode call);
    T visit(IndexNode index);
    T visit(SliceNode slice);
    T visit(AttributeNode attribute);
    T visit(ListNode list);
}
