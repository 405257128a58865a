package com.simscript.params.param;

import org.junit.jupiter.api.Test;

import com.simscript.params.record.OrderedRecord;
import com.simscript.params.value.ErrorMarker;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ParameterSet.
 */
class ParameterSetTest {

    private static ParameterSet outOfOrder(ParameterSet parameters) {
        return parameters.define("area", "${w}*${h}").define("w", 2).define("h", 3);
    }

    @Test
    void testAutoSortingEvaluatesDefinitionsInAnyOrder() {
        ParameterSet parameters = outOfOrder(ParameterSet.autoSorting());

        assertThat(parameters.isSortBeforeEvaluation()).isTrue();
        assertThat(parameters.value("area")).isEqualTo(6.0);
        assertThat(parameters).containsExactly("area", "w", "h");
        assertThat(parameters.get("area")).isEqualTo("${w}*${h}");
    }

    @Test
    void testWithoutSortingForwardReferencesAreUnresolved() {
        ParameterSet parameters = outOfOrder(new ParameterSet());

        assertThat(parameters.value("area")).isInstanceOf(ErrorMarker.class);
        assertThat(parameters.value("w")).isEqualTo(2);
    }

    @Test
    void testDefinitionsAreCopied() {
        OrderedRecord source = OrderedRecord.of("a", 1);
        ParameterSet parameters = new ParameterSet(source);

        source.set("a", 5);
        parameters.definitions().set("a", 7);

        assertThat(parameters.value("a")).isEqualTo(1);
    }

    @Test
    void testMergeOverridesInPlace() {
        ParameterSet base = new ParameterSet(OrderedRecord.of("a", 1, "b", "${a}*10"));
        ParameterSet overrides = new ParameterSet(OrderedRecord.of("a", 2, "c", "extra"));

        base.merge(overrides);

        assertThat(base).containsExactly("a", "b", "c");
        assertThat(base.value("b")).isEqualTo(20.0);
        assertThat(overrides.size()).isEqualTo(2);
    }

    @Test
    void testMergeRecord() {
        ParameterSet parameters = new ParameterSet().merge(OrderedRecord.of("x", 1.5));

        assertThat(parameters.has("x")).isTrue();
        assertThat(parameters.value("x")).isEqualTo(1.5);
    }

    @Test
    void testRemove() {
        ParameterSet parameters = new ParameterSet(OrderedRecord.of("a", 1, "b", 2));

        parameters.remove("a");

        assertThat(parameters.has("a")).isFalse();
        assertThat(parameters.size()).isEqualTo(1);
        assertThat(new ParameterSet().isEmpty()).isTrue();
    }

    @Test
    void testSubsetKeepsRequestedOrder() {
        ParameterSet parameters = new ParameterSet(OrderedRecord.of("a", 1, "b", "${a}+1", "c", 3));

        OrderedRecord subset = parameters.subset("b", "a");

        assertThat(subset.keys()).containsExactly("b", "a");
        assertThat(subset.get("b")).isEqualTo(2.0);
    }

    @Test
    void testFormat() {
        ParameterSet parameters = outOfOrder(ParameterSet.autoSorting());

        assertThat(parameters.format("w=${w}, area=${area}")).isEqualTo("w=2, area=6");
    }

    @Test
    void testFormatEvalAndInterpolate() {
        ParameterSet parameters = outOfOrder(ParameterSet.autoSorting());
        String template = "${area}*2\n% area ${area}";

        assertThat(parameters.formatEval(template)).isEqualTo("12\n# area 6");
        assertThat(parameters.formatInterpolate(template)).isEqualTo("6*2\n# area 6");
    }

    @Test
    void testToStringShowsDefinitionsAndValues() {
        ParameterSet parameters = new ParameterSet(OrderedRecord.of("a", 1, "b", "${a}+1"));

        assertThat(parameters.toString())
                .contains("         a: 1\n")
                .contains("         b: ${a}+1\n          = 2\n");
        assertThat(new ParameterSet().toString()).isEqualTo("empty record");
    }
}
