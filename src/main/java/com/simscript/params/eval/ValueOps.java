package com.simscript.params.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

import com.simscript.params.exception.EvaluationException;
import com.simscript.params.exception.EvaluationException.Category;
import com.simscript.params.grammar.ast.Operator;
import com.simscript.params.record.OrderedRecord;
import com.simscript.params.value.ErrorMarker;
import com.simscript.params.value.NdArray;
import com.simscript.params.value.PathValue;

/**
 * Arithmetic on expression values.
 *
 * Scalars are IEEE doubles (booleans count as 0 and 1). Arrays broadcast like numpy, lists
 * combine element-wise with scalars and with lists of the same length. {@code *} is always
 * element-wise; the matrix product is {@code @}.
 */
final class ValueOps {

    private ValueOps() {
        // Utility class
    }

    static Object binary(Operator operator, Object left, Object right) {
        return switch (operator) {
            case ADD -> add(left, right);
            case SUBTRACT -> combine(left, right, (a, b) -> a - b, operator.getSymbol());
            case MULTIPLY -> combine(left, right, (a, b) -> a * b, operator.getSymbol());
            case DIVIDE -> combine(left, right, (a, b) -> a / b, operator.getSymbol());
            case FLOOR_DIVIDE -> combine(left, right, (a, b) -> Math.floor(a / b), operator.getSymbol());
            case MODULO -> combine(left, right, ValueOps::floorMod, operator.getSymbol());
            case POWER -> combine(left, right, Math::pow, operator.getSymbol());
            case MATMUL -> LinearAlgebra.matmul(toArray(left), toArray(right));
            default -> throw new EvaluationException(Category.SYNTAX, "'" + operator.getSymbol()
                    + "' is not a binary operator");
        };
    }

    static Object unary(Operator operator, Object operand) {
        return switch (operator) {
            case NEGATE -> elementwise(operand, x -> -x);
            case IDENTITY -> elementwise(operand, x -> x);
            default -> throw new EvaluationException(Category.SYNTAX, "'" + operator.getSymbol()
                    + "' is not a unary operator");
        };
    }

    private static Object add(Object left, Object right) {
        if (left instanceof CharSequence && right instanceof CharSequence) {
            return left.toString() + right;
        }
        return combine(left, right, Double::sum, Operator.ADD.getSymbol());
    }

    /**
     * Remainder with the sign of the divisor.
     */
    static double floorMod(double a, double b) {
        if (b == 0.0) {
            return Double.NaN;
        }
        double r = a % b;
        if (r != 0.0 && (r < 0) != (b < 0)) {
            r += b;
        }
        return r;
    }

    static Object combine(Object left, Object right, DoubleBinaryOperator function, String symbol) {
        if (isScalar(left) && isScalar(right)) {
            return function.applyAsDouble(toDouble(left), toDouble(right));
        }
        if (left instanceof NdArray || right instanceof NdArray) {
            try {
                return NdArray.broadcast(toArray(left), toArray(right), function);
            } catch (IllegalArgumentException e) {
                throw new EvaluationException(Category.SHAPE, e.getMessage(), e);
            }
        }
        if (left instanceof List<?> items && isScalar(right)) {
            List<Object> out = new ArrayList<>(items.size());
            for (Object item : items) {
                out.add(combine(item, right, function, symbol));
            }
            return out;
        }
        if (isScalar(left) && right instanceof List<?> items) {
            List<Object> out = new ArrayList<>(items.size());
            for (Object item : items) {
                out.add(combine(left, item, function, symbol));
            }
            return out;
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            if (a.size() != b.size()) {
                throw new EvaluationException(Category.SHAPE, "operands have different lengths "
                        + a.size() + " and " + b.size());
            }
            List<Object> out = new ArrayList<>(a.size());
            for (int i = 0; i < a.size(); i++) {
                out.add(combine(a.get(i), b.get(i), function, symbol));
            }
            return out;
        }
        throw new EvaluationException(Category.TYPE, "unsupported operand types for "
                + symbol + ": '" + typeName(left) + "' and '" + typeName(right) + "'");
    }

    static Object elementwise(Object value, DoubleUnaryOperator function) {
        if (isScalar(value)) {
            return function.applyAsDouble(toDouble(value));
        }
        if (value instanceof NdArray array) {
            return array.map(function);
        }
        if (value instanceof List<?> items) {
            List<Object> out = new ArrayList<>(items.size());
            for (Object item : items) {
                out.add(elementwise(item, function));
            }
            return out;
        }
        throw new EvaluationException(Category.TYPE, "bad operand type '" + typeName(value) + "'");
    }

    static boolean isScalar(Object value) {
        return value instanceof Number || value instanceof Boolean;
    }

    static double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean flag) {
            return flag ? 1.0 : 0.0;
        }
        if (value instanceof NdArray array && array.size() == 1) {
            return array.flat(0);
        }
        throw new EvaluationException(Category.TYPE, "expected a number, got '" + typeName(value) + "'");
    }

    static int toInt(Object value) {
        double number = toDouble(value);
        if (number != Math.rint(number) || Double.isInfinite(number)) {
            throw new EvaluationException(Category.TYPE, "expected an integer, got " + number);
        }
        return (int) number;
    }

    static NdArray toArray(Object value) {
        try {
            return NdArray.fromNested(value);
        } catch (IllegalArgumentException e) {
            throw new EvaluationException(Category.TYPE, e.getMessage(), e);
        }
    }

    /**
     * Every numeric element of a scalar, list or array, in row-major order.
     */
    static List<Double> flatten(Object value) {
        List<Double> out = new ArrayList<>();
        collect(value, out);
        return out;
    }

    private static void collect(Object value, List<Double> out) {
        if (value instanceof NdArray array) {
            for (double element : array.toArray()) {
                out.add(element);
            }
        } else if (value instanceof List<?> items) {
            for (Object item : items) {
                collect(item, out);
            }
        } else {
            out.add(toDouble(value));
        }
    }

    static String typeName(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Double || value instanceof Float) {
            return "float";
        }
        if (value instanceof Number) {
            return "int";
        }
        if (value instanceof Boolean) {
            return "bool";
        }
        if (value instanceof PathValue) {
            return "path";
        }
        if (value instanceof CharSequence) {
            return "str";
        }
        if (value instanceof List) {
            return "list";
        }
        if (value instanceof NdArray) {
            return "array";
        }
        if (value instanceof OrderedRecord) {
            return "record";
        }
        if (value instanceof ErrorMarker) {
            return "error";
        }
        return value.getClass().getSimpleName();
    }
}
