package com.simscript.params.value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Immutable rectangular numeric array with one to four dimensions, stored row-major.
 *
 * Vectors produced by the array-literal grammar are promoted to 1xN rows; plain 1-D arrays
 * only appear through functions such as {@code linspace} or {@code array}.
 */
public final class NdArray {

    public static final int MAX_DIMENSIONS = 4;

    private final int[] shape;
    private final double[] data;

    private NdArray(int[] shape, double[] data) {
        this.shape = shape;
        this.data = data;
    }

    public static NdArray of(int[] shape, double[] data) {
        if (shape.length == 0 || shape.length > MAX_DIMENSIONS) {
            throw new IllegalArgumentException("arrays must have between 1 and " + MAX_DIMENSIONS
                    + " dimensions, got " + shape.length);
        }
        for (int dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("negative dimension in shape " + shapeText(shape));
            }
        }
        if (elementCount(shape) != data.length) {
            throw new IllegalArgumentException("shape " + shapeText(shape) + " does not match "
                    + data.length + " elements");
        }
        return new NdArray(shape.clone(), data.clone());
    }

    public static NdArray vector(double... values) {
        return new NdArray(new int[] {values.length}, values.clone());
    }

    public static NdArray row(double... values) {
        return new NdArray(new int[] {1, values.length}, values.clone());
    }

    public static NdArray matrix(double[][] rows) {
        int cols = rows.length == 0 ? 0 : rows[0].length;
        double[] flat = new double[rows.length * cols];
        for (int r = 0; r < rows.length; r++) {
            if (rows[r].length != cols) {
                throw new IllegalArgumentException("ragged matrix: row " + r + " has " + rows[r].length
                        + " columns, expected " + cols);
            }
            System.arraycopy(rows[r], 0, flat, r * cols, cols);
        }
        return new NdArray(new int[] {rows.length, cols}, flat);
    }

    public static NdArray filled(double value, int... shape) {
        int size = elementCount(shape);
        double[] flat = new double[size];
        Arrays.fill(flat, value);
        return of(shape, flat);
    }

    public static NdArray identity(int n) {
        double[] flat = new double[elementCount(new int[] {n, n})];
        for (int i = 0; i < n; i++) {
            flat[i * n + i] = 1.0;
        }
        return new NdArray(new int[] {n, n}, flat);
    }

    /**
     * Number of elements of a shape.
     *
     * @throws IllegalArgumentException when the count does not fit in an int
     */
    public static int elementCount(int[] shape) {
        int size = 1;
        try {
            for (int dim : shape) {
                size = Math.multiplyExact(size, dim);
            }
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("shape " + shapeText(shape) + " is too large", e);
        }
        return size;
    }

    /**
     * Builds an array from a number, a (nested) list of numbers or an existing array.
     *
     * @throws IllegalArgumentException when the input is ragged, non-numeric or too deep
     */
    public static NdArray fromNested(Object nested) {
        if (nested instanceof NdArray array) {
            return array;
        }
        if (nested instanceof Number || nested instanceof Boolean) {
            return vector(toDouble(nested));
        }
        if (!(nested instanceof List<?> list)) {
            throw new IllegalArgumentException("cannot convert " + describeType(nested) + " to an array");
        }
        List<Integer> dims = new ArrayList<>();
        Object head = list;
        while (head instanceof List<?> level) {
            dims.add(level.size());
            head = level.isEmpty() ? null : level.get(0);
        }
        if (head instanceof NdArray inner) {
            for (int dim : inner.shape) {
                dims.add(dim);
            }
        }
        if (dims.size() > MAX_DIMENSIONS) {
            throw new IllegalArgumentException("arrays are limited to " + MAX_DIMENSIONS + " dimensions");
        }
        int[] shape = dims.stream().mapToInt(Integer::intValue).toArray();
        List<Double> flat = new ArrayList<>();
        flatten(list, 0, shape, flat);
        double[] values = new double[flat.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = flat.get(i);
        }
        return of(shape, values);
    }

    private static void flatten(Object node, int depth, int[] shape, List<Double> out) {
        if (depth == shape.length) {
            if (!(node instanceof Number || node instanceof Boolean)) {
                throw new IllegalArgumentException("array elements must be numeric, got " + describeType(node));
            }
            out.add(toDouble(node));
            return;
        }
        if (node instanceof NdArray inner) {
            int[] rest = Arrays.copyOfRange(shape, depth, shape.length);
            if (!Arrays.equals(rest, inner.shape)) {
                throw new IllegalArgumentException("ragged array: expected " + shapeText(rest)
                        + " but found " + shapeText(inner.shape));
            }
            for (double v : inner.data) {
                out.add(v);
            }
            return;
        }
        if (!(node instanceof List<?> list) || list.size() != shape[depth]) {
            throw new IllegalArgumentException("ragged array: expected " + shape[depth]
                    + " elements at depth " + depth);
        }
        for (Object item : list) {
            flatten(item, depth + 1, shape, out);
        }
    }

    private static double toDouble(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        return ((Number) value).doubleValue();
    }

    private static String describeType(Object value) {
        return value == null ? "None" : value.getClass().getSimpleName();
    }

    public int ndim() {
        return shape.length;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int dim(int axis) {
        return shape[axis];
    }

    public int size() {
        return data.length;
    }

    public double flat(int index) {
        return data[index];
    }

    public double[] toArray() {
        return data.clone();
    }

    public double get(int... index) {
        if (index.length != shape.length) {
            throw new IndexOutOfBoundsException("expected " + shape.length + " indices, got " + index.length);
        }
        int offset = 0;
        for (int axis = 0; axis < shape.length; axis++) {
            if (index[axis] < 0 || index[axis] >= shape[axis]) {
                throw new IndexOutOfBoundsException("index " + index[axis] + " out of bounds for axis "
                        + axis + " with size " + shape[axis]);
            }
            offset = offset * shape[axis] + index[axis];
        }
        return data[offset];
    }

    public boolean isMatrix() {
        return shape.length == 2;
    }

    public boolean isSquare() {
        return shape.length == 2 && shape[0] == shape[1];
    }

    /**
     * A 1-D array becomes a 1xN row; higher ranks are returned unchanged.
     */
    public NdArray atLeast2d() {
        if (shape.length >= 2) {
            return this;
        }
        return new NdArray(new int[] {1, shape[0]}, data);
    }

    /**
     * Reverses the axes (plain transpose for matrices, no-op for 1-D arrays).
     */
    public NdArray transpose() {
        if (shape.length == 1) {
            return this;
        }
        int n = shape.length;
        int[] target = new int[n];
        for (int i = 0; i < n; i++) {
            target[i] = shape[n - 1 - i];
        }
        double[] out = new double[data.length];
        int[] sourceStrides = strides(shape);
        int[] index = new int[n];
        for (int flat = 0; flat < out.length; flat++) {
            int offset = 0;
            for (int i = 0; i < n; i++) {
                offset += index[i] * sourceStrides[n - 1 - i];
            }
            out[flat] = data[offset];
            increment(index, target);
        }
        return new NdArray(target, out);
    }

    public NdArray reshape(int... newShape) {
        return of(newShape, data);
    }

    public NdArray map(DoubleUnaryOperator operator) {
        double[] out = new double[data.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = operator.applyAsDouble(data[i]);
        }
        return new NdArray(shape, out);
    }

    /**
     * Element-wise operation with numpy broadcasting rules (shapes aligned on the right,
     * each pair of dimensions equal or one of them 1).
     */
    public static NdArray broadcast(NdArray left, NdArray right, DoubleBinaryOperator operator) {
        int n = Math.max(left.shape.length, right.shape.length);
        int[] ls = padShape(left.shape, n);
        int[] rs = padShape(right.shape, n);
        int[] result = new int[n];
        for (int i = 0; i < n; i++) {
            if (ls[i] == rs[i] || rs[i] == 1) {
                result[i] = ls[i];
            } else if (ls[i] == 1) {
                result[i] = rs[i];
            } else {
                throw new IllegalArgumentException("cannot broadcast " + shapeText(left.shape)
                        + " with " + shapeText(right.shape));
            }
        }
        int[] lStrides = broadcastStrides(ls);
        int[] rStrides = broadcastStrides(rs);
        int size = 1;
        for (int dim : result) {
            size *= dim;
        }
        double[] out = new double[size];
        int[] index = new int[n];
        for (int flat = 0; flat < size; flat++) {
            int lo = 0;
            int ro = 0;
            for (int i = 0; i < n; i++) {
                lo += index[i] * lStrides[i];
                ro += index[i] * rStrides[i];
            }
            out[flat] = operator.applyAsDouble(left.data[lo], right.data[ro]);
            increment(index, result);
        }
        return new NdArray(result, out);
    }

    /**
     * Numpy-style basic indexing: each entry is an {@link Integer} or a {@link Slice};
     * missing trailing entries select whole axes.
     *
     * @return a {@link Double} when every axis is reduced, otherwise an array
     */
    public Object select(List<Object> indices) {
        if (indices.size() > shape.length) {
            throw new IndexOutOfBoundsException("too many indices for array with " + shape.length
                    + " dimension(s)");
        }
        int n = shape.length;
        int[][] positions = new int[n][];
        List<Integer> kept = new ArrayList<>();
        for (int axis = 0; axis < n; axis++) {
            Object index = axis < indices.size() ? indices.get(axis) : Slice.all();
            if (index instanceof Integer i) {
                int resolved = i < 0 ? i + shape[axis] : i;
                if (resolved < 0 || resolved >= shape[axis]) {
                    throw new IndexOutOfBoundsException("index " + i + " is out of bounds for axis "
                            + axis + " with size " + shape[axis]);
                }
                positions[axis] = new int[] {resolved};
            } else if (index instanceof Slice slice) {
                positions[axis] = slice.indices(shape[axis]);
                kept.add(positions[axis].length);
            } else {
                throw new IllegalArgumentException("unsupported index " + index);
            }
        }
        int[] strides = strides(shape);
        int[] counts = new int[n];
        int total = 1;
        for (int axis = 0; axis < n; axis++) {
            counts[axis] = positions[axis].length;
            total *= counts[axis];
        }
        double[] out = new double[total];
        int[] cursor = new int[n];
        for (int flat = 0; flat < total; flat++) {
            int offset = 0;
            for (int axis = 0; axis < n; axis++) {
                offset += positions[axis][cursor[axis]] * strides[axis];
            }
            out[flat] = data[offset];
            increment(cursor, counts);
        }
        if (kept.isEmpty()) {
            return out[0];
        }
        return new NdArray(kept.stream().mapToInt(Integer::intValue).toArray(), out);
    }

    /**
     * Nested {@code List<Double>} view matching the array shape.
     */
    public List<Object> toNestedList() {
        return nest(0, 0);
    }

    private List<Object> nest(int axis, int offset) {
        List<Object> out = new ArrayList<>(shape[axis]);
        int stride = strides(shape)[axis];
        for (int i = 0; i < shape[axis]; i++) {
            if (axis == shape.length - 1) {
                out.add(data[offset + i]);
            } else {
                out.add(nest(axis + 1, offset + i * stride));
            }
        }
        return out;
    }

    public static String shapeText(int[] shape) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < shape.length; i++) {
            if (i > 0) {
                sb.append('x');
            }
            sb.append(shape[i]);
        }
        return sb.toString();
    }

    private static int[] padShape(int[] shape, int n) {
        int[] out = new int[n];
        Arrays.fill(out, 1);
        System.arraycopy(shape, 0, out, n - shape.length, shape.length);
        return out;
    }

    private static int[] strides(int[] shape) {
        int[] strides = new int[shape.length];
        int stride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= shape[i];
        }
        return strides;
    }

    private static int[] broadcastStrides(int[] shape) {
        int[] strides = strides(shape);
        for (int i = 0; i < shape.length; i++) {
            if (shape[i] == 1) {
                strides[i] = 0;
            }
        }
        return strides;
    }

    private static void increment(int[] index, int[] bounds) {
        for (int i = index.length - 1; i >= 0; i--) {
            index[i]++;
            if (index[i] < bounds[i]) {
                return;
            }
            index[i] = 0;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NdArray other)) {
            return false;
        }
        return Arrays.equals(shape, other.shape) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return ValueFormatter.toText(this);
    }
}
