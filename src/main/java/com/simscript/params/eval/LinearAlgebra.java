package com.simscript.params.eval;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

import com.simscript.params.exception.EvaluationException;
import com.simscript.params.exception.EvaluationException.Category;
import com.simscript.params.value.NdArray;

/**
 * Dense linear algebra on small matrices.
 */
final class LinearAlgebra {

    private static final double SINGULARITY_TOLERANCE = 1e-12;
    private static final double SYMMETRY_TOLERANCE = 1e-9;
    private static final int MAX_JACOBI_SWEEPS = 100;

    private LinearAlgebra() {
        // Utility class
    }

    /**
     * Matrix product with numpy promotion of 1-D operands: a left vector is a row, a right
     * vector a column, and the promoted axis is dropped from the result.
     *
     * @return a {@link Double} for vector·vector, an array otherwise
     */
    static Object matmul(NdArray a, NdArray b) {
        if (a.ndim() > 2 || b.ndim() > 2) {
            throw new EvaluationException(Category.SHAPE, "the matrix product supports 1-D and 2-D operands, got "
                    + NdArray.shapeText(a.shape()) + " and " + NdArray.shapeText(b.shape()));
        }
        boolean leftVector = a.ndim() == 1;
        boolean rightVector = b.ndim() == 1;
        double[][] left = toMatrix(leftVector ? a.reshape(1, a.size()) : a);
        double[][] right = toMatrix(rightVector ? b.reshape(b.size(), 1) : b);
        int inner = left[0].length;
        if (inner != right.length) {
            throw new EvaluationException(Category.SHAPE, "shapes " + NdArray.shapeText(a.shape()) + " and "
                    + NdArray.shapeText(b.shape()) + " are not aligned for the matrix product");
        }
        int rows = left.length;
        int cols = right[0].length;
        double[][] product = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                double sum = 0.0;
                for (int k = 0; k < inner; k++) {
                    sum += left[i][k] * right[k][j];
                }
                product[i][j] = sum;
            }
        }
        NdArray result = NdArray.matrix(product);
        if (leftVector && rightVector) {
            return result.flat(0);
        }
        if (leftVector) {
            return result.reshape(cols);
        }
        if (rightVector) {
            return result.reshape(rows);
        }
        return result;
    }

    /**
     * Inner product of vectors, matrix product otherwise.
     */
    static Object dot(NdArray a, NdArray b) {
        if (a.ndim() == 1 && b.ndim() == 1) {
            if (a.size() != b.size()) {
                throw new EvaluationException(Category.SHAPE, "vectors of lengths " + a.size() + " and "
                        + b.size() + " have no inner product");
            }
            double sum = 0.0;
            for (int i = 0; i < a.size(); i++) {
                sum += a.flat(i) * b.flat(i);
            }
            return sum;
        }
        return matmul(a, b);
    }

    /**
     * Gauss-Jordan inversion with partial pivoting.
     */
    static NdArray inv(NdArray m) {
        double[][] a = toMatrix(requireSquare(m, "inv"));
        int n = a.length;
        double[][] inverse = toMatrix(NdArray.identity(n));
        double scale = maxAbs(a);
        for (int col = 0; col < n; col++) {
            int pivot = pivotRow(a, col);
            if (Math.abs(a[pivot][col]) <= SINGULARITY_TOLERANCE * Math.max(scale, 1.0)) {
                throw new EvaluationException(Category.DOMAIN, "singular matrix");
            }
            swap(a, col, pivot);
            swap(inverse, col, pivot);
            double p = a[col][col];
            for (int j = 0; j < n; j++) {
                a[col][j] /= p;
                inverse[col][j] /= p;
            }
            for (int row = 0; row < n; row++) {
                if (row != col && a[row][col] != 0.0) {
                    double factor = a[row][col];
                    for (int j = 0; j < n; j++) {
                        a[row][j] -= factor * a[col][j];
                        inverse[row][j] -= factor * inverse[col][j];
                    }
                }
            }
        }
        return NdArray.matrix(inverse);
    }

    /**
     * Determinant by LU elimination with partial pivoting.
     */
    static double det(NdArray m) {
        double[][] a = toMatrix(requireSquare(m, "det"));
        int n = a.length;
        double det = 1.0;
        for (int col = 0; col < n; col++) {
            int pivot = pivotRow(a, col);
            if (a[pivot][col] == 0.0) {
                return 0.0;
            }
            if (pivot != col) {
                swap(a, col, pivot);
                det = -det;
            }
            det *= a[col][col];
            for (int row = col + 1; row < n; row++) {
                double factor = a[row][col] / a[col][col];
                for (int j = col; j < n; j++) {
                    a[row][j] -= factor * a[col][j];
                }
            }
        }
        return det;
    }

    /**
     * Eigenvalues of a symmetric matrix, ascending.
     */
    static NdArray eigenvalues(NdArray m) {
        return NdArray.vector(jacobi(m).values);
    }

    /**
     * Unit eigenvectors of a symmetric matrix as columns, in the order of {@link #eigenvalues}.
     */
    static NdArray eigenvectors(NdArray m) {
        return NdArray.matrix(jacobi(m).vectors);
    }

    static double norm(NdArray x) {
        double sum = 0.0;
        for (double value : x.toArray()) {
            sum += value * value;
        }
        return Math.sqrt(sum);
    }

    private static Eigen jacobi(NdArray m) {
        double[][] a = toMatrix(requireSquare(m, "eig"));
        int n = a.length;
        double scale = Math.max(maxAbs(a), 1.0);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (Math.abs(a[i][j] - a[j][i]) > SYMMETRY_TOLERANCE * scale) {
                    throw new EvaluationException(Category.DOMAIN, "eig supports symmetric matrices only");
                }
            }
        }
        double[][] v = toMatrix(NdArray.identity(n));
        for (int sweep = 0; sweep < MAX_JACOBI_SWEEPS; sweep++) {
            double off = 0.0;
            for (int p = 0; p < n; p++) {
                for (int q = p + 1; q < n; q++) {
                    off += a[p][q] * a[p][q];
                }
            }
            if (off < 1e-30 * scale * scale) {
                break;
            }
            for (int p = 0; p < n; p++) {
                for (int q = p + 1; q < n; q++) {
                    if (a[p][q] != 0.0) {
                        rotate(a, v, p, q);
                    }
                }
            }
        }
        double[] diagonal = new double[n];
        for (int i = 0; i < n; i++) {
            diagonal[i] = a[i][i];
        }
        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> diagonal[i]));
        Eigen eigen = new Eigen(new double[n], new double[n][n]);
        for (int k = 0; k < n; k++) {
            eigen.values[k] = diagonal[order[k]];
            for (int row = 0; row < n; row++) {
                eigen.vectors[row][k] = v[row][order[k]];
            }
        }
        return eigen;
    }

    private static void rotate(double[][] a, double[][] v, int p, int q) {
        int n = a.length;
        double theta = (a[q][q] - a[p][p]) / (2.0 * a[p][q]);
        double t = (theta >= 0 ? 1.0 : -1.0) / (Math.abs(theta) + Math.sqrt(theta * theta + 1.0));
        double c = 1.0 / Math.sqrt(t * t + 1.0);
        double s = t * c;
        for (int k = 0; k < n; k++) {
            double akp = a[k][p];
            double akq = a[k][q];
            a[k][p] = c * akp - s * akq;
            a[k][q] = s * akp + c * akq;
        }
        for (int k = 0; k < n; k++) {
            double apk = a[p][k];
            double aqk = a[q][k];
            a[p][k] = c * apk - s * aqk;
            a[q][k] = s * apk + c * aqk;
        }
        for (int k = 0; k < n; k++) {
            double vkp = v[k][p];
            double vkq = v[k][q];
            v[k][p] = c * vkp - s * vkq;
            v[k][q] = s * vkp + c * vkq;
        }
    }

    private static NdArray requireSquare(NdArray m, String function) {
        if (!m.isSquare() || m.dim(0) == 0) {
            throw new EvaluationException(Category.SHAPE, function + " expects a non-empty square matrix, got "
                    + NdArray.shapeText(m.shape()));
        }
        return m;
    }

    private static double[][] toMatrix(NdArray m) {
        int rows = m.dim(0);
        int cols = m.dim(1);
        double[][] out = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                out[i][j] = m.flat(i * cols + j);
            }
        }
        return out;
    }

    private static int pivotRow(double[][] a, int col) {
        int pivot = col;
        for (int row = col + 1; row < a.length; row++) {
            if (Math.abs(a[row][col]) > Math.abs(a[pivot][col])) {
                pivot = row;
            }
        }
        return pivot;
    }

    private static void swap(double[][] a, int i, int j) {
        double[] tmp = a[i];
        a[i] = a[j];
        a[j] = tmp;
    }

    private static double maxAbs(double[][] a) {
        double max = 0.0;
        for (double[] row : a) {
            for (double value : row) {
                max = Math.max(max, Math.abs(value));
            }
        }
        return max;
    }

    private static final class Eigen {
        private final double[] values;
        private final double[][] vectors;

        private Eigen(double[] values, double[][] vectors) {
            this.values = values;
            this.vectors = vectors;
        }
    }
}
