package com.simscript.params.eval;

import java.util.ArrayList;
import java.util.List;

import com.simscript.params.exception.EvaluationException;
import com.simscript.params.exception.EvaluationException.Category;
import com.simscript.params.exception.ExpressionSyntaxException;
import com.simscript.params.grammar.ExpressionParser;
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
import com.simscript.params.value.NdArray;
import com.simscript.params.value.Slice;

/**
 * Computes an expression tree.
 *
 * Results are {@link Double}, {@link Boolean}, {@link String}, {@code List<Object>} or
 * {@link NdArray}; values bound by the {@link NameResolver} are returned as they are.
 */
public class ExpressionEvaluator implements ExprNodeVisitor<Object> {

    private final NameResolver resolver;
    private final MathFunctions functions;

    public ExpressionEvaluator(NameResolver resolver, MathFunctions functions) {
        this.resolver = resolver;
        this.functions = functions;
    }

    /**
     * @throws ExpressionSyntaxException when the text is not an expression
     * @throws EvaluationException when the expression cannot be computed
     */
    public Object evaluate(String text) {
        return evaluate(ExpressionParser.parse(text));
    }

    public Object evaluate(ExprNode node) {
        try {
            return node.accept(this);
        } catch (IndexOutOfBoundsException e) {
            throw new EvaluationException(Category.INDEX, e.getMessage(), e);
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new EvaluationException(Category.TYPE, e.getMessage(), e);
        }
    }

    @Override
    public Object visit(LiteralNode literal) {
        return literal.getValue();
    }

    @Override
    public Object visit(NameNode name) {
        return resolver.resolve(name.getName());
    }

    @Override
    public Object visit(UnaryNode unary) {
        return ValueOps.unary(unary.getOperator(), unary.getOperand().accept(this));
    }

    @Override
    public Object visit(BinaryNode binary) {
        Object left = binary.getLeft().accept(this);
        Object right = binary.getRight().accept(this);
        return ValueOps.binary(binary.getOperator(), left, right);
    }

    @Override
    public Object visit(CallNode call) {
        if (!functions.isFunction(call.getFunction())) {
            throw new EvaluationException(Category.UNKNOWN_NAME, "name '" + call.getFunction() + "' is not defined");
        }
        List<Object> arguments = new ArrayList<>(call.getArguments().size());
        for (ExprNode argument : call.getArguments()) {
            arguments.add(argument.accept(this));
        }
        return functions.call(call.getFunction(), arguments);
    }

    @Override
    public Object visit(IndexNode index) {
        Object target = index.getTarget().accept(this);
        List<Object> indices = new ArrayList<>(index.getIndices().size());
        for (ExprNode entry : index.getIndices()) {
            indices.add(entry instanceof SliceNode slice ? toSlice(slice) : (Object) ValueOps.toInt(entry.accept(this)));
        }
        if (target instanceof NdArray array) {
            return array.select(indices);
        }
        Object current = target;
        for (Object entry : indices) {
            current = selectSequence(current, entry);
        }
        return current;
    }

    private Slice toSlice(SliceNode slice) {
        return new Slice(optionalInt(slice.getStart()), optionalInt(slice.getStop()), optionalInt(slice.getStep()));
    }

    private Integer optionalInt(ExprNode node) {
        return node == null ? null : ValueOps.toInt(node.accept(this));
    }

    private static Object selectSequence(Object target, Object entry) {
        if (target instanceof List<?> items) {
            if (entry instanceof Slice slice) {
                List<Object> out = new ArrayList<>();
                for (int i : slice.indices(items.size())) {
                    out.add(items.get(i));
                }
                return out;
            }
            return items.get(position((Integer) entry, items.size()));
        }
        if (target instanceof CharSequence text) {
            if (entry instanceof Slice slice) {
                StringBuilder sb = new StringBuilder();
                for (int i : slice.indices(text.length())) {
                    sb.append(text.charAt(i));
                }
                return sb.toString();
            }
            return String.valueOf(text.charAt(position((Integer) entry, text.length())));
        }
        throw new EvaluationException(Category.TYPE, "'" + ValueOps.typeName(target) + "' object is not subscriptable");
    }

    private static int position(int index, int length) {
        int resolved = index < 0 ? index + length : index;
        if (resolved < 0 || resolved >= length) {
            throw new EvaluationException(Category.INDEX, "index " + index + " is out of range for length " + length);
        }
        return resolved;
    }

    @Override
    public Object visit(SliceNode slice) {
        throw new ExpressionSyntaxException("slices are only allowed inside subscripts", slice.getPosition());
    }

    @Override
    public Object visit(AttributeNode attribute) {
        Object target = attribute.getTarget().accept(this);
        switch (attribute.getAttribute()) {
            case "T":
                return ValueOps.isScalar(target) ? target : ValueOps.toArray(target).transpose();
            case "shape":
                return functions.call("shape", List.of(target));
            case "size":
                return functions.call("size", List.of(target));
            case "ndim":
                return ValueOps.isScalar(target) ? 0.0 : (double) ValueOps.toArray(target).ndim();
            default:
                throw new EvaluationException(Category.UNKNOWN_NAME, "'" + ValueOps.typeName(target)
                        + "' has no attribute '" + attribute.getAttribute() + "'");
        }
    }

    /**
     * Rectangular numeric nestings become arrays; flat or irregular sequences stay lists.
     */
    @Override
    public Object visit(ListNode list) {
        List<Object> items = new ArrayList<>(list.getItems().size());
        boolean nested = false;
        for (ExprNode item : list.getItems()) {
            Object value = item.accept(this);
            nested |= value instanceof List || value instanceof NdArray;
            items.add(value);
        }
        if (nested) {
            try {
                return NdArray.fromNested(items);
            } catch (IllegalArgumentException e) {
                return items;
            }
        }
        return items;
    }
}
