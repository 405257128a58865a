package com.simscript.params.eval;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;

import com.simscript.params.exception.EvaluationException;
import com.simscript.params.exception.EvaluationException.Category;
import com.simscript.params.grammar.ast.Operator;
import com.simscript.params.value.NdArray;

import lombok.AllArgsConstructor;

/**
 * Fixed table of functions callable from expressions. Element-wise functions accept
 * scalars, lists and arrays.
 */
public class MathFunctions {

    private static final int DEFAULT_LINSPACE_POINTS = 50;

    private final Map<String, Builtin> functions = new HashMap<>();
    private final int maxRangeElements;

    public MathFunctions(int maxRangeElements) {
        this.maxRangeElements = maxRangeElements;
        registerElementwise();
        registerReductions();
        registerArrays();
        registerLinearAlgebra();
    }

    public boolean isFunction(String name) {
        return functions.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(functions.keySet());
    }

    /**
     * @throws EvaluationException for an unknown function, a wrong number of arguments or
     *         an argument the function cannot handle
     */
    public Object call(String name, List<Object> arguments) {
        Builtin builtin = functions.get(name);
        if (builtin == null) {
            throw new EvaluationException(Category.UNKNOWN_NAME, "name '" + name + "' is not defined");
        }
        int count = arguments.size();
        if (count < builtin.minArgs || count > builtin.maxArgs) {
            throw new EvaluationException(Category.ARITY, name + "() takes " + arityText(builtin)
                    + " argument(s), " + count + " given");
        }
        return builtin.body.apply(arguments);
    }

    private static String arityText(Builtin builtin) {
        if (builtin.minArgs == builtin.maxArgs) {
            return String.valueOf(builtin.minArgs);
        }
        if (builtin.maxArgs == Integer.MAX_VALUE) {
            return "at least " + builtin.minArgs;
        }
        return builtin.minArgs + " to " + builtin.maxArgs;
    }

    private void register(String name, int minArgs, int maxArgs, Function<List<Object>, Object> body) {
        functions.put(name, new Builtin(minArgs, maxArgs, body));
    }

    private void unary(String name, DoubleUnaryOperator operator) {
        register(name, 1, 1, args -> ValueOps.elementwise(args.get(0), operator));
    }

    private void binary(String name, DoubleBinaryOperator operator) {
        register(name, 2, 2, args -> ValueOps.combine(args.get(0), args.get(1), operator, name + "()"));
    }

    private void registerElementwise() {
        unary("abs", Math::abs);
        unary("sqrt", Math::sqrt);
        unary("exp", Math::exp);
        unary("log", Math::log);
        unary("log10", Math::log10);
        unary("log2", x -> Math.log(x) / Math.log(2.0));
        unary("sin", Math::sin);
        unary("cos", Math::cos);
        unary("tan", Math::tan);
        unary("asin", Math::asin);
        unary("acos", Math::acos);
        unary("atan", Math::atan);
        unary("sinh", Math::sinh);
        unary("cosh", Math::cosh);
        unary("tanh", Math::tanh);
        unary("floor", Math::floor);
        unary("ceil", Math::ceil);
        unary("degrees", Math::toDegrees);
        unary("radians", Math::toRadians);
        binary("atan2", Math::atan2);
        binary("hypot", Math::hypot);
        binary("pow", Math::pow);
        register("round", 1, 2, args -> {
            int digits = args.size() > 1 ? ValueOps.toInt(args.get(1)) : 0;
            return ValueOps.elementwise(args.get(0), x -> round(x, digits));
        });
    }

    /**
     * Half-even rounding to a number of decimals.
     */
    static double round(double value, int digits) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        if (digits == 0) {
            return Math.rint(value);
        }
        return BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_EVEN).doubleValue();
    }

    private void registerReductions() {
        register("min", 1, Integer.MAX_VALUE, args -> nonEmpty("min", args).stream()
                .mapToDouble(Double::doubleValue).min().getAsDouble());
        register("max", 1, Integer.MAX_VALUE, args -> nonEmpty("max", args).stream()
                .mapToDouble(Double::doubleValue).max().getAsDouble());
        register("sum", 1, 1, args -> ValueOps.flatten(args.get(0)).stream()
                .mapToDouble(Double::doubleValue).sum());
        register("mean", 1, 1, args -> ValueOps.flatten(args.get(0)).stream()
                .mapToDouble(Double::doubleValue).average().orElse(Double.NaN));
        register("prod", 1, 1, args -> ValueOps.flatten(args.get(0)).stream()
                .mapToDouble(Double::doubleValue).reduce(1.0, (a, b) -> a * b));
        register("len", 1, 1, args -> length(args.get(0)));
    }

    private static List<Double> nonEmpty(String name, List<Object> args) {
        List<Double> values = new ArrayList<>();
        for (Object arg : args) {
            values.addAll(ValueOps.flatten(arg));
        }
        if (values.isEmpty()) {
            throw new EvaluationException(Category.TYPE, name + "() arg is an empty sequence");
        }
        return values;
    }

    private static double length(Object value) {
        if (value instanceof List<?> items) {
            return items.size();
        }
        if (value instanceof NdArray array) {
            return array.dim(0);
        }
        if (value instanceof CharSequence text) {
            return text.length();
        }
        throw new EvaluationException(Category.TYPE, "object of type '" + ValueOps.typeName(value)
                + "' has no len()");
    }

    private void registerArrays() {
        register("array", 1, 1, args -> ValueOps.toArray(args.get(0)));
        register("zeros", 1, NdArray.MAX_DIMENSIONS,
                args -> NdArray.filled(0.0, boundedShape(shapeOf(args))));
        register("ones", 1, NdArray.MAX_DIMENSIONS,
                args -> NdArray.filled(1.0, boundedShape(shapeOf(args))));
        register("eye", 1, 1, args -> {
            int n = nonNegative(ValueOps.toInt(args.get(0)));
            return NdArray.identity(boundedShape(new int[] {n, n})[0]);
        });
        register("linspace", 2, 3, this::linspace);
        register("arange", 1, 3, this::arange);
        register("transpose", 1, 1, args -> ValueOps.toArray(args.get(0)).transpose());
        register("shape", 1, 1, args -> shapeList(args.get(0)));
        register("size", 1, 1, args -> (double) ValueOps.flatten(args.get(0)).size());
        register("reshape", 2, 1 + NdArray.MAX_DIMENSIONS, args -> {
            try {
                int[] shape = boundedShape(shapeOf(args.subList(1, args.size())));
                return ValueOps.toArray(args.get(0)).reshape(shape);
            } catch (IllegalArgumentException e) {
                throw new EvaluationException(Category.SHAPE, e.getMessage(), e);
            }
        });
    }

    private void registerLinearAlgebra() {
        register("matmul", 2, 2, args -> LinearAlgebra.matmul(ValueOps.toArray(args.get(0)),
                ValueOps.toArray(args.get(1))));
        register("dot", 2, 2, args -> {
            if (ValueOps.isScalar(args.get(0)) || ValueOps.isScalar(args.get(1))) {
                return ValueOps.binary(Operator.MULTIPLY, args.get(0), args.get(1));
            }
            return LinearAlgebra.dot(ValueOps.toArray(args.get(0)), ValueOps.toArray(args.get(1)));
        });
        register("inv", 1, 1, args -> LinearAlgebra.inv(ValueOps.toArray(args.get(0))));
        register("det", 1, 1, args -> LinearAlgebra.det(ValueOps.toArray(args.get(0))));
        register("eig", 1, 1, args -> LinearAlgebra.eigenvalues(ValueOps.toArray(args.get(0))));
        register("eigvec", 1, 1, args -> LinearAlgebra.eigenvectors(ValueOps.toArray(args.get(0))));
        register("norm", 1, 1, args -> LinearAlgebra.norm(ValueOps.toArray(args.get(0))));
    }

    /**
     * Shape from integer arguments or from a single sequence argument.
     */
    private static int[] shapeOf(List<Object> args) {
        List<Object> dims = args;
        if (args.size() == 1 && args.get(0) instanceof List<?> list) {
            dims = new ArrayList<>(list);
        }
        if (dims.isEmpty() || dims.size() > NdArray.MAX_DIMENSIONS) {
            throw new EvaluationException(Category.SHAPE, "a shape needs 1 to " + NdArray.MAX_DIMENSIONS
                    + " dimensions, got " + dims.size());
        }
        int[] shape = new int[dims.size()];
        for (int i = 0; i < shape.length; i++) {
            shape[i] = nonNegative(ValueOps.toInt(dims.get(i)));
        }
        return shape;
    }

    /**
     * @throws EvaluationException (RANGE) when the shape holds more elements than allowed
     */
    private int[] boundedShape(int[] shape) {
        for (int dim : shape) {
            if (dim == 0) {
                return shape;
            }
        }
        long count = 1;
        for (int dim : shape) {
            count *= dim;
            if (count > maxRangeElements) {
                throw new EvaluationException(Category.RANGE, "an array of shape " + NdArray.shapeText(shape)
                        + " exceeds the limit of " + maxRangeElements + " elements");
            }
        }
        return shape;
    }

    private static int nonNegative(int value) {
        if (value < 0) {
            throw new EvaluationException(Category.SHAPE, "negative dimensions are not allowed");
        }
        return value;
    }

    private static List<Object> shapeList(Object value) {
        List<Object> out = new ArrayList<>();
        if (ValueOps.isScalar(value)) {
            return out;
        }
        for (int dim : ValueOps.toArray(value).shape()) {
            out.add((double) dim);
        }
        return out;
    }

    private Object linspace(List<Object> args) {
        double start = ValueOps.toDouble(args.get(0));
        double stop = ValueOps.toDouble(args.get(1));
        int count = args.size() > 2 ? nonNegative(ValueOps.toInt(args.get(2))) : DEFAULT_LINSPACE_POINTS;
        checkRangeSize(count);
        double[] values = new double[count];
        double step = count > 1 ? (stop - start) / (count - 1) : 0.0;
        for (int i = 0; i < count; i++) {
            values[i] = start + i * step;
        }
        if (count > 1) {
            values[count - 1] = stop;
        }
        return NdArray.vector(values);
    }

    private Object arange(List<Object> args) {
        double start = args.size() > 1 ? ValueOps.toDouble(args.get(0)) : 0.0;
        double stop = ValueOps.toDouble(args.size() > 1 ? args.get(1) : args.get(0));
        double step = args.size() > 2 ? ValueOps.toDouble(args.get(2)) : 1.0;
        if (step == 0.0) {
            throw new EvaluationException(Category.RANGE, "arange() step cannot be zero");
        }
        double span = Math.ceil((stop - start) / step);
        int count = span > 0 ? (int) Math.min(span, Integer.MAX_VALUE) : 0;
        checkRangeSize(count);
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = start + i * step;
        }
        return NdArray.vector(values);
    }

    private void checkRangeSize(long count) {
        if (count > maxRangeElements) {
            throw new EvaluationException(Category.RANGE, "a range of " + count
                    + " elements exceeds the limit of " + maxRangeElements);
        }
    }

    @AllArgsConstructor
    private static final class Builtin {
        private final int minArgs;
        private final int maxArgs;
        private final Function<List<Object>, Object> body;
    }
}
