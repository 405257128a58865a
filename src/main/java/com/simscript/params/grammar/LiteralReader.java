package com.simscript.params.grammar;

import java.util.ArrayList;
import java.util.List;

import com.simscript.params.exception.ExpressionSyntaxException;
import com.simscript.params.grammar.ast.AttributeNode;
import com.simscript.params.grammar.ast.BinaryNode;
import com.simscript.params.grammar.ast.CallNode;
import com.simscript.params.grammar.ast.ExprNode;
import com.simscript.params.grammar.ast.ExprNodeVisitor;
import com.simscript.params.grammar.ast.IndexNode;
import com.simscript.params.grammar.ast.ListNode;
import com.simscript.params.grammar.ast.LiteralNode;
import com.simscript.params.grammar.ast.NameNode;
import com.simscript.params.grammar.ast.Operator;
import com.simscript.params.grammar.ast.SliceNode;
import com.simscript.params.grammar.ast.UnaryNode;

/**
 * Reads literal syntax only: numbers, booleans, quoted strings, signed numbers and nested
 * sequences. Anything that would need evaluation is rejected.
 */
public class LiteralReader implements ExprNodeVisitor<Object> {

    private static final LiteralReader INSTANCE = new LiteralReader();

    public static Object read(String text) {
        return ExpressionParser.parse(text).accept(INSTANCE);
    }

    @Override
    public Object visit(LiteralNode literal) {
        return literal.getValue();
    }

    @Override
    public Object visit(UnaryNode unary) {
        Object operand = unary.getOperand().accept(this);
        if (!(operand instanceof Double number)) {
            throw notLiteral(unary);
        }
        return unary.getOperator() == Operator.NEGATE ? -number : number;
    }

    @Override
    public Object visit(ListNode list) {
        List<Object> items = new ArrayList<>(list.getItems().size());
        for (ExprNode item : list.getItems()) {
            items.add(item.accept(this));
        }
        return items;
    }

    @Override
    public Object visit(NameNode name) {
        throw notLiteral(name);
    }

    @Override
    public Object visit(BinaryNode binary) {
        throw notLiteral(binary);
    }

    @Override
    public Object visit(CallNode call) {
        throw notLiteral(call);
    }

    @Override
    public Object visit(IndexNode index) {
        throw notLiteral(index);
    }

    @Override
    public Object visit(SliceNode slice) {
        throw notLiteral(slice);
    }

    @Override
    public Object visit(AttributeNode attribute) {
        throw notLiteral(attribute);
    }

    private static ExpressionSyntaxException notLiteral(ExprNode node) {
        return new ExpressionSyntaxException("only literal values are allowed", node.getPosition());
    }
}
