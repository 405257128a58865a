package com.simscript.params.grammar;

import java.util.LinkedHashSet;
import java.util.Set;

import com.simscript.params.grammar.ast.AttributeNode;
import com.simscript.params.grammar.ast.BinaryNode;
import com.simscript.params.grammar.ast.CallNode;
import com.simscript.params.grammar.ast.ExprNode;
import com.simscript.params.grammar.ast.ExprNodeVisitor;
import com.simscript.params.grammar.ast.IndexNode;
import com.simscript.params.grammar.ast.ListNode;
import com.simscript.params.grammar.ast.LiteralNode;
import com.simscript.params.grammar.ast.NameNode;
import com.simscript.params.grammar.ast.SliceNode;
import com.simscript.params.grammar.ast.UnaryNode;

/**
 * Collects the bare identifiers of an expression, in first-seen order. Function names are
 * not identifiers.
 */
public class NameCollector implements ExprNodeVisitor<Void> {

    private final Set<String> names = new LinkedHashSet<>();

    public static Set<String> collect(ExprNode node) {
        NameCollector collector = new NameCollector();
        node.accept(collector);
        return collector.names;
    }

    @Override
    public Void visit(LiteralNode literal) {
        return null;
    }

    @Override
    public Void visit(NameNode name) {
        names.add(name.getName());
        return null;
    }

    @Override
    public Void visit(UnaryNode unary) {
        unary.getOperand().accept(this);
        return null;
    }

    @Override
    public Void visit(BinaryNode binary) {
        binary.getLeft().accept(this);
        binary.getRight().accept(this);
        return null;
    }

    @Override
    public Void visit(CallNode call) {
        call.getArguments().forEach(argument -> argument.accept(this));
        return null;
    }

    @Override
    public Void visit(IndexNode index) {
        index.getTarget().accept(this);
        index.getIndices().forEach(entry -> entry.accept(this));
        return null;
    }

    @Override
    public Void visit(SliceNode slice) {
        visitOptional(slice.getStart());
        visitOptional(slice.getStop());
        visitOptional(slice.getStep());
        return null;
    }

    @Override
    public Void visit(AttributeNode attribute) {
        attribute.getTarget().accept(this);
        return null;
    }

    @Override
    public Void visit(ListNode list) {
        list.getItems().forEach(item -> item.accept(this));
        return null;
    }

    private void visitOptional(ExprNode node) {
        if (node != null) {
            node.accept(this);
        }
    }
}
