package com.simscript.params.value;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NdArray, Slice and ValueFormatter.
 */
class NdArrayTest {

    private static final NdArray MATRIX = NdArray.matrix(new double[][] {{1, 2, 3}, {4, 5, 6}});

    @Test
    void testFromNested() {
        NdArray array = NdArray.fromNested(List.of(List.of(1, 2), List.of(3.5, true)));

        assertThat(array.shape()).containsExactly(2, 2);
        assertThat(array.toArray()).containsExactly(1.0, 2.0, 3.5, 1.0);
        assertThat(NdArray.fromNested(3)).isEqualTo(NdArray.vector(3));
        assertThat(NdArray.fromNested(MATRIX)).isSameAs(MATRIX);
    }

    @Test
    void testFromNestedRejectsBadInput() {
        assertThatThrownBy(() -> NdArray.fromNested(List.of(List.of(1, 2), List.of(3))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ragged");
        assertThatThrownBy(() -> NdArray.fromNested(List.of(1, "x")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NdArray.fromNested("text"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NdArray.of(new int[] {2}, new double[3]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testTranspose() {
        NdArray transposed = MATRIX.transpose();

        assertThat(transposed.shape()).containsExactly(3, 2);
        assertThat(transposed.toArray()).containsExactly(1, 4, 2, 5, 3, 6);
        assertThat(NdArray.vector(1, 2).transpose()).isEqualTo(NdArray.vector(1, 2));
    }

    @Test
    void testAtLeast2d() {
        assertThat(NdArray.vector(1, 2, 3).atLeast2d().shape()).containsExactly(1, 3);
        assertThat(MATRIX.atLeast2d()).isSameAs(MATRIX);
    }

    @Test
    void testSelect() {
        assertThat(MATRIX.select(List.of(1, 2))).isEqualTo(6.0);
        assertThat(MATRIX.select(List.of(-1))).isEqualTo(NdArray.vector(4, 5, 6));
        assertThat(MATRIX.select(List.of(0, new Slice(1, null, null)))).isEqualTo(NdArray.vector(2, 3));
        assertThat(MATRIX.select(List.of(Slice.all(), 0))).isEqualTo(NdArray.vector(1, 4));
    }

    @Test
    void testSelectOutOfBounds() {
        assertThatThrownBy(() -> MATRIX.select(List.of(5)))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> MATRIX.select(List.of(0, 0, 0)))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void testBroadcast() {
        NdArray column = NdArray.matrix(new double[][] {{1}, {2}});
        NdArray row = NdArray.row(10, 20, 30);

        NdArray sum = NdArray.broadcast(column, row, Double::sum);

        assertThat(sum.shape()).containsExactly(2, 3);
        assertThat(sum.toArray()).containsExactly(11, 21, 31, 12, 22, 32);
        assertThatThrownBy(() -> NdArray.broadcast(NdArray.vector(1, 2), NdArray.vector(1, 2, 3), Double::sum))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2 with 3");
    }

    @Test
    void testToNestedList() {
        assertThat(NdArray.matrix(new double[][] {{1, 2}, {3, 4}}).toNestedList())
                .isEqualTo(List.of(List.of(1.0, 2.0), List.of(3.0, 4.0)));
    }

    @Test
    void testSliceIndices() {
        assertThat(Slice.all().indices(3)).containsExactly(0, 1, 2);
        assertThat(new Slice(null, null, -1).indices(3)).containsExactly(2, 1, 0);
        assertThat(new Slice(-2, null, null).indices(4)).containsExactly(2, 3);
        assertThat(new Slice(5, 9, null).indices(4)).isEmpty();
        assertThatThrownBy(() -> new Slice(null, null, 0).indices(3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testToText() {
        assertThat(ValueFormatter.toText(null)).isEqualTo("None");
        assertThat(ValueFormatter.toText(true)).isEqualTo("True");
        assertThat(ValueFormatter.toText(3.0)).isEqualTo("3");
        assertThat(ValueFormatter.toText(0.1)).isEqualTo("0.1");
        assertThat(ValueFormatter.toText(1e20)).isEqualTo("1.0e20");
        assertThat(ValueFormatter.toText(Double.NaN)).isEqualTo("nan");
        assertThat(ValueFormatter.toText(NdArray.vector(1, 2.5))).isEqualTo("[1, 2.5]");
        assertThat(ValueFormatter.toText(List.of("a", 1))).isEqualTo("[\"a\", 1]");
        assertThat(ValueFormatter.expressionText(NdArray.vector(1, 2.5))).isEqualTo("array([1, 2.5])");
        assertThat(ValueFormatter.expressionText(List.of(1, 2))).isEqualTo("[1, 2]");
    }

    @Test
    void testDisplay() {
        assertThat(ValueFormatter.display(NdArray.vector(1, 2.5))).isEqualTo("[1 2.5]");
        assertThat(ValueFormatter.display(NdArray.matrix(new double[][] {{1}, {2}}))).isEqualTo("[1 2]T");
        assertThat(ValueFormatter.display(NdArray.identity(3))).isEqualTo("[3x3 matrix]");
        assertThat(ValueFormatter.display(NdArray.filled(0, 2, 2, 2))).isEqualTo("[2x2x2 array]");
        assertThat(ValueFormatter.display(NdArray.vector(12345.678))).isEqualTo("[1.235e+04]");
        assertThat(ValueFormatter.display(PathValue.of("a/b"))).isEqualTo("p\"a/b\"");
    }
}
