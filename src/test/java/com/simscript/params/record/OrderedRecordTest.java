package com.simscript.params.record;

import org.junit.jupiter.api.Test;

import com.simscript.params.exception.FieldNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for OrderedRecord.
 */
class OrderedRecordTest {

    @Test
    void testSetKeepsInsertionOrder() {
        OrderedRecord record = OrderedRecord.of("b", 1, "a", 2);

        record.set("b", 3);

        assertThat(record.keys()).containsExactly("b", "a");
        assertThat(record.get("b")).isEqualTo(3);
        assertThat(record.size()).isEqualTo(2);
    }

    @Test
    void testGetMissingFieldThrows() {
        OrderedRecord record = OrderedRecord.of("a", 1);

        assertThatThrownBy(() -> record.get("x"))
                .isInstanceOf(FieldNotFoundException.class)
                .hasMessageContaining("x");
        assertThatThrownBy(() -> record.delete("x"))
                .isInstanceOf(FieldNotFoundException.class);
    }

    @Test
    void testEmptyListDeletesExistingField() {
        OrderedRecord record = OrderedRecord.of("a", 1, "b", 2, "c", 3);

        record.set("b", List.of());

        assertThat(record.has("b")).isFalse();
        assertThat(record.keys()).containsExactly("a", "c");
        assertThat(record.keyAt(1)).isEqualTo("c");
    }

    @Test
    void testEmptyListIsStoredOnNewField() {
        OrderedRecord record = new OrderedRecord();

        record.set("a", new ArrayList<>());

        assertThat(record.has("a")).isTrue();
        assertThat(record.getList("a")).isEmpty();
    }

    @Test
    void testReservedNamesCannotBeAssignedOrDeleted() {
        OrderedRecord record = new OrderedRecord();

        assertThatThrownBy(() -> record.set("_protection", true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> record.delete("_evaluation"))
                .isInstanceOf(FieldNotFoundException.class);
        assertThatThrownBy(() -> record.set(" ", 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testUpdateSkipsReservedNames() {
        OrderedRecord record = new OrderedRecord();

        record.update(Map.of("_debug", true, "x", 1));

        assertThat(record.keys()).containsExactly("x");
    }

    @Test
    void testPositionalAccess() {
        OrderedRecord record = OrderedRecord.of("a", 1, "b", 2, "c", 3);

        assertThat(record.get(0)).isEqualTo(1);
        assertThat(record.get(-1)).isEqualTo(3);
        assertThat(record.keyAt(1)).isEqualTo("b");
        assertThat(record.slice(1, 3).keys()).containsExactly("b", "c");
        assertThat(record.slice(-2, 10).keys()).containsExactly("b", "c");
        assertThat(record.select(2, 0).keys()).containsExactly("c", "a");
        assertThat(record.subset("c", "a").values()).containsExactly(3, 1);

        record.setAt(-1, 9);
        assertThat(record.get("c")).isEqualTo(9);

        assertThatThrownBy(() -> record.get(5))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void testConcatRightOperandWins() {
        OrderedRecord left = OrderedRecord.of("a", 1, "b", 2);
        OrderedRecord right = OrderedRecord.of("b", 20, "c", 3);

        OrderedRecord merged = left.concat(right);

        assertThat(merged.keys()).containsExactly("a", "b", "c");
        assertThat(merged.get("b")).isEqualTo(right.get("b"));
        assertThat(merged.size()).isEqualTo(left.size() + right.size() - 1);
        assertThat(left.get("b")).isEqualTo(2);
        assertThat(right.keys()).containsExactly("b", "c");
    }

    @Test
    void testConcatThenDifference() {
        OrderedRecord result = OrderedRecord.of("a", 1, "b", 2)
                .concat(OrderedRecord.of("c", 3))
                .difference(OrderedRecord.of("a", 1));

        assertThat(result).isEqualTo(OrderedRecord.of("b", 2, "c", 3));
        assertThat(result.keys()).containsExactly("b", "c");
    }

    @Test
    void testInPlaceVariantsMutateReceiver() {
        OrderedRecord record = OrderedRecord.of("a", 1);

        record.concatInPlace(OrderedRecord.of("b", 2)).differenceInPlace(OrderedRecord.of("a", 0));

        assertThat(record.keys()).containsExactly("b");
    }

    @Test
    void testCheckFillsMissingAndBlankFields() {
        OrderedRecord record = OrderedRecord.of("a", null, "b", 5);

        record.check(OrderedRecord.of("a", 1, "b", 2, "c", 3));

        assertThat(record.toMap()).containsExactly(
                entry("a", 1), entry("b", 5), entry("c", 3));
    }

    @Test
    void testScanCollectsReferencedNames() {
        OrderedRecord names = OrderedRecord.scan("${a} + ${b[1]} + ${a} # ${ignored}");

        assertThat(names.keys()).containsExactly("a", "b");
        assertThat(names.values()).containsOnlyNulls();
    }

    @Test
    void testIsExpressionAndIsDefined() {
        OrderedRecord record = OrderedRecord.of(
                "a", 1,
                "b", "${a}+1",
                "c", "${d}*2",
                "d", 3);

        assertThat(record.isExpression().values()).containsExactly(false, true, true, false);
        assertThat(record.isDefined().values()).containsExactly(true, true, false, true);
    }

    @Test
    void testCopyIsDeep() {
        List<Object> items = new ArrayList<>(List.of(1, 2));
        OrderedRecord record = OrderedRecord.of("items", items, "nested", OrderedRecord.of("x", 1));

        OrderedRecord copy = record.copy();
        items.add(3);
        record.getRecord("nested").set("y", 2);

        assertThat(copy.getList("items")).hasSize(2);
        assertThat(copy.getRecord("nested").keys()).containsExactly("x");
    }

    @Test
    void testTypedAccessors() {
        OrderedRecord record = OrderedRecord.of("a", 1, "s", "text");

        assertThat(record.getDouble("a")).isEqualTo(1.0);
        assertThat(record.getString("s")).isEqualTo("text");
        assertThatThrownBy(() -> record.getString("a"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("\"a\"");
    }

    @Test
    void testFactories() {
        assertThat(OrderedRecord.fromKeys(List.of("x", "y")).values()).containsOnlyNulls();
        assertThat(OrderedRecord.fromKeysValues(List.of("x", "y"), List.of(1)).toMap())
                .containsEntry("x", 1)
                .containsEntry("y", null);
        assertThatThrownBy(() -> OrderedRecord.of("a"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testToStringRendersTable() {
        OrderedRecord record = OrderedRecord.of("a", 1, "long", "x".repeat(60));

        String table = record.toString();

        assertThat(table).contains("         a: 1");
        assertThat(table).contains(" [...] ");
        assertThat(new OrderedRecord().toString()).isEqualTo("empty record");
    }

    @Test
    void testTableShowsEvaluatedValues() {
        OrderedRecord definitions = OrderedRecord.of("a", 1, "b", "${a}+1", "s", "");
        OrderedRecord snapshot = OrderedRecord.of("a", 1, "b", 2.0, "s", "");

        String table = RecordTable.render(definitions, snapshot);

        assertThat(table).contains("         b: ${a}+1\n          = 2\n");
        assertThat(table).contains("<empty string>");
    }
}
