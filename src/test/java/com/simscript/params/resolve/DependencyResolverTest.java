package com.simscript.params.resolve;

import org.junit.jupiter.api.Test;

import com.simscript.params.eval.Evaluator;
import com.simscript.params.exception.OrderingFailureException;
import com.simscript.params.record.OrderedRecord;
import com.simscript.params.value.ErrorMarker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DependencyResolver.
 */
class DependencyResolverTest {

    private final DependencyResolver resolver = new DependencyResolver();
    private final Evaluator evaluator = new Evaluator();

    @Test
    void testStaticFieldsFirstThenLeftmostReady() {
        OrderedRecord record = OrderedRecord.of(
                "c", "${b}*2",
                "a", 1,
                "b", "${a}+1",
                "d", "${a}-1",
                "n", "text");

        OrderedRecord sorted = resolver.sort(record);

        assertThat(sorted.keys()).containsExactly("a", "n", "b", "c", "d");
        assertThat(record.keys()).containsExactly("c", "a", "b", "d", "n");
    }

    @Test
    void testStrictSortFailsOnUndefinedReference() {
        OrderedRecord record = OrderedRecord.of("b", "${a}");

        assertThatThrownBy(() -> resolver.sort(record, ResolutionMode.STRICT))
                .isInstanceOf(OrderingFailureException.class)
                .hasMessageContaining("1/1")
                .extracting("pendingNames").isEqualTo(List.of("b"));
    }

    @Test
    void testLenientSortConsumesEveryField() {
        OrderedRecord record = OrderedRecord.of("b", "${a}");

        OrderedRecord sorted = resolver.sort(record, ResolutionMode.LENIENT);
        OrderedRecord snapshot = evaluator.evaluate(sorted);

        assertThat(sorted.keys()).containsExactly("b");
        assertThat(snapshot.get("b")).isInstanceOf(ErrorMarker.class);
        assertThat(((ErrorMarker) snapshot.get("b")).getMissingName()).isEqualTo("a");
    }

    @Test
    void testLenientSortForcesLeftmostPendingAndContinues() {
        OrderedRecord record = OrderedRecord.of(
                "x", "${y}+1",
                "y", "${x}+1",
                "z", "${x}*0");

        OrderedRecord sorted = resolver.sort(record);

        assertThat(sorted.keys()).containsExactly("x", "y", "z");
        assertThat(sorted.size()).isEqualTo(record.size());
    }

    @Test
    void testConstantsAreNotDependencies() {
        OrderedRecord record = OrderedRecord.of("r", "2*${pi}", "s", "${r}");

        assertThat(resolver.isOrdered(record)).isTrue();
        assertThat(resolver.sort(record, ResolutionMode.STRICT).keys()).containsExactly("r", "s");
    }

    @Test
    void testShadowedConstantIsADependency() {
        OrderedRecord record = OrderedRecord.of("r", "2*${pi}", "pi", 3);

        assertThat(resolver.isOrdered(record)).isFalse();
        assertThat(resolver.sort(record).keys()).containsExactly("pi", "r");
    }

    @Test
    void testEscapedMarkersAreNotDependencies() {
        OrderedRecord record = OrderedRecord.of("later", "\\${x}", "x", 1);

        assertThat(resolver.isOrdered(record)).isTrue();
    }

    @Test
    void testEvaluationAfterSortIsOrderIndependent() {
        List<String> names = List.of("a", "b", "c", "d", "e", "f");
        List<Object> values = List.of(2, "${a}*3", "${b}+${a}", "${c}^2", "${v}", "${d} - ${c}");
        Random random = new Random(42);

        for (int round = 0; round < 20; round++) {
            List<Integer> order = new ArrayList<>(List.of(0, 1, 2, 3, 4, 5));
            Collections.shuffle(order, random);
            OrderedRecord record = OrderedRecord.of("v", List.of(1, 2));
            for (int i : order) {
                record.set(names.get(i), values.get(i));
            }

            OrderedRecord snapshot = evaluator.evaluate(resolver.sort(record, ResolutionMode.STRICT));

            assertThat(snapshot.values()).noneMatch(ErrorMarker.class::isInstance);
            assertThat(snapshot.get("f")).isEqualTo(56.0);
        }
    }
}
