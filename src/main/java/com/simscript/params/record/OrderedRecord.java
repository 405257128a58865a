package com.simscript.params.record;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simscript.params.exception.FieldNotFoundException;
import com.simscript.params.grammar.ExpressionGrammar;
import com.simscript.params.value.NdArray;
import com.simscript.params.value.PathValue;

import lombok.Getter;
import lombok.Setter;

/**
 * Ordered collection of named fields.
 *
 * Names are unique and keep their insertion order; reassignment replaces a value in place.
 * Values are numbers, booleans, lists, {@link NdArray}s, strings (literal text or
 * expressions), {@link PathValue}s, nested records or null. Assigning an empty list to an
 * existing field deletes it.
 *
 * A record returned by the evaluator is flagged {@link #isEvaluated() evaluated} until one of
 * its fields is assigned or deleted; evaluating it again yields an identical copy.
 */
public class OrderedRecord implements Iterable<String> {
    private static final Logger log = LoggerFactory.getLogger(OrderedRecord.class);

    /** Engine bookkeeping names: never enumerated, cannot be assigned or deleted. */
    public static final Set<String> RESERVED_NAMES =
            Set.of("_protection", "_evaluation", "_debug", "_iter_", "_returnerror");

    private final List<String> names = new ArrayList<>();
    private final Map<String, Integer> positions = new HashMap<>();
    private final Map<String, Object> values = new HashMap<>();

    @Getter
    @Setter
    private boolean evaluated;

    public OrderedRecord() {
    }

    /**
     * Builds a record from alternating names and values: {@code of("a", 1, "b", "${a}+1")}.
     */
    public static OrderedRecord of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected name/value pairs, got " + namesAndValues.length + " arguments");
        }
        OrderedRecord record = new OrderedRecord();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            record.set((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return record;
    }

    public static OrderedRecord fromMap(Map<String, ?> map) {
        OrderedRecord record = new OrderedRecord();
        map.forEach(record::set);
        return record;
    }

    /**
     * Record whose fields are all null.
     */
    public static OrderedRecord fromKeys(Collection<String> keys) {
        OrderedRecord record = new OrderedRecord();
        keys.forEach(key -> record.set(key, null));
        return record;
    }

    /**
     * Pairs keys with values by position; keys without a value are null.
     */
    public static OrderedRecord fromKeysValues(List<String> keys, List<?> fieldValues) {
        if (fieldValues.size() > keys.size()) {
            throw new IllegalArgumentException("more values (" + fieldValues.size() + ") than keys (" + keys.size() + ")");
        }
        OrderedRecord record = new OrderedRecord();
        for (int i = 0; i < keys.size(); i++) {
            record.set(keys.get(i), i < fieldValues.size() ? fieldValues.get(i) : null);
        }
        return record;
    }

    // ---------------------------------------------------------------------
    // Field access
    // ---------------------------------------------------------------------

    /**
     * Assigns a field, appending it when new. An empty list deletes an existing field.
     *
     * @throws IllegalArgumentException for reserved or blank names
     */
    public OrderedRecord set(String name, Object value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("field names cannot be blank");
        }
        if (RESERVED_NAMES.contains(name)) {
            throw new IllegalArgumentException("\"" + name + "\" is a reserved name");
        }
        if (value instanceof List<?> list && list.isEmpty() && positions.containsKey(name)) {
            delete(name);
            return this;
        }
        if (!positions.containsKey(name)) {
            positions.put(name, names.size());
            names.add(name);
        }
        values.put(name, value);
        evaluated = false;
        return this;
    }

    /**
     * @throws FieldNotFoundException when the field does not exist
     */
    public Object get(String name) {
        if (!has(name)) {
            throw new FieldNotFoundException(name);
        }
        return values.get(name);
    }

    public Number getNumber(String name) {
        return typed(name, Number.class);
    }

    public double getDouble(String name) {
        return typed(name, Number.class).doubleValue();
    }

    public String getString(String name) {
        return typed(name, String.class);
    }

    public NdArray getArray(String name) {
        return typed(name, NdArray.class);
    }

    public List<?> getList(String name) {
        return typed(name, List.class);
    }

    public OrderedRecord getRecord(String name) {
        return typed(name, OrderedRecord.class);
    }

    public PathValue getPath(String name) {
        return typed(name, PathValue.class);
    }

    private <T> T typed(String name, Class<T> type) {
        Object value = get(name);
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("the definition \"" + name + "\" holds "
                    + (value == null ? "None" : value.getClass().getSimpleName())
                    + ", not " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public boolean has(String name) {
        return positions.containsKey(name);
    }

    /**
     * Membership test on names, same as {@link #has(String)}.
     */
    public boolean contains(String name) {
        return has(name);
    }

    /**
     * @throws FieldNotFoundException when the field is absent or reserved
     */
    public void delete(String name) {
        Integer position = positions.get(name);
        if (position == null) {
            throw new FieldNotFoundException(name);
        }
        names.remove((int) position);
        values.remove(name);
        positions.remove(name);
        reindexFrom(position);
        evaluated = false;
    }

    private void reindexFrom(int start) {
        for (int i = start; i < names.size(); i++) {
            positions.put(names.get(i), i);
        }
    }

    public List<String> keys() {
        return Collections.unmodifiableList(new ArrayList<>(names));
    }

    public List<Object> values() {
        List<Object> out = new ArrayList<>(names.size());
        for (String name : names) {
            out.add(values.get(name));
        }
        return out;
    }

    public List<Map.Entry<String, Object>> items() {
        List<Map.Entry<String, Object>> out = new ArrayList<>(names.size());
        for (String name : names) {
            out.add(new SimpleImmutableEntry<>(name, values.get(name)));
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Positional access
    // ---------------------------------------------------------------------

    /**
     * Value at a position of the key list; negative positions count from the end.
     */
    public Object get(int position) {
        return values.get(names.get(resolvePosition(position)));
    }

    public String keyAt(int position) {
        return names.get(resolvePosition(position));
    }

    public OrderedRecord setAt(int position, Object value) {
        return set(names.get(resolvePosition(position)), value);
    }

    private int resolvePosition(int position) {
        int resolved = position < 0 ? position + names.size() : position;
        if (resolved < 0 || resolved >= names.size()) {
            throw new IndexOutOfBoundsException("the index should be comprised between 0 and "
                    + (names.size() - 1) + ", got " + position);
        }
        return resolved;
    }

    /**
     * Fields between two positions of the key list (end excluded). Bounds are clamped and
     * may be negative, like list slicing.
     */
    public OrderedRecord slice(int from, int to) {
        int size = names.size();
        int start = clamp(from < 0 ? from + size : from, size);
        int end = clamp(to < 0 ? to + size : to, size);
        OrderedRecord out = new OrderedRecord();
        for (int i = start; i < end; i++) {
            out.set(names.get(i), copyValue(values.get(names.get(i))));
        }
        return out;
    }

    private static int clamp(int value, int size) {
        return Math.max(0, Math.min(value, size));
    }

    public OrderedRecord select(int... selected) {
        OrderedRecord out = new OrderedRecord();
        for (int position : selected) {
            String name = keyAt(position);
            out.set(name, copyValue(values.get(name)));
        }
        return out;
    }

    /**
     * Sub-record holding the named fields, in the requested order.
     *
     * @throws FieldNotFoundException when one of the names does not exist
     */
    public OrderedRecord subset(String... selected) {
        OrderedRecord out = new OrderedRecord();
        for (String name : selected) {
            out.set(name, copyValue(get(name)));
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Set algebra
    // ---------------------------------------------------------------------

    /**
     * New record with the fields of both operands; on a shared name the right operand wins
     * and the field keeps its left position.
     */
    public OrderedRecord concat(OrderedRecord other) {
        return copy().concatInPlace(other);
    }

    /**
     * New record without the names present in {@code other}.
     */
    public OrderedRecord difference(OrderedRecord other) {
        return copy().differenceInPlace(other);
    }

    public OrderedRecord concatInPlace(OrderedRecord other) {
        for (String name : other.names) {
            Object value = other.values.get(name);
            if (!(value instanceof List<?> list && list.isEmpty())) {
                set(name, copyValue(value));
            } else if (!has(name)) {
                set(name, new ArrayList<>());
            } else {
                values.put(name, new ArrayList<>());
                evaluated = false;
            }
        }
        return this;
    }

    public OrderedRecord differenceInPlace(OrderedRecord other) {
        for (String name : other.names) {
            if (has(name)) {
                delete(name);
            }
        }
        return this;
    }

    public int size() {
        return names.size();
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public void clear() {
        names.clear();
        positions.clear();
        values.clear();
        evaluated = false;
    }

    /**
     * Deep copy; the evaluated flag is preserved.
     */
    public OrderedRecord copy() {
        OrderedRecord out = new OrderedRecord();
        for (String name : names) {
            out.set(name, copyValue(values.get(name)));
        }
        out.evaluated = evaluated;
        return out;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String name : names) {
            map.put(name, values.get(name));
        }
        return map;
    }

    @Override
    public Iterator<String> iterator() {
        return keys().iterator();
    }

    // ---------------------------------------------------------------------
    // Bulk helpers
    // ---------------------------------------------------------------------

    /**
     * Assigns several fields at once; reserved names are skipped with a warning.
     */
    public OrderedRecord update(Map<String, ?> fields) {
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            if (RESERVED_NAMES.contains(entry.getKey())) {
                log.warn("Cannot update protected attribute '{}'", entry.getKey());
            } else {
                set(entry.getKey(), entry.getValue());
            }
        }
        return this;
    }

    /**
     * Fills missing fields, and fields holding null or an empty list, from {@code defaults}.
     */
    public OrderedRecord check(OrderedRecord defaults) {
        for (String name : defaults.names) {
            Object fallback = defaults.values.get(name);
            if (!has(name)) {
                set(name, copyValue(fallback));
            } else if (isBlankValue(values.get(name)) && !isBlankValue(fallback)) {
                set(name, copyValue(fallback));
            }
        }
        return this;
    }

    private static boolean isBlankValue(Object value) {
        return value == null || (value instanceof List<?> list && list.isEmpty());
    }

    /**
     * Names referenced by the markers of a text, as a record of null fields.
     */
    public static OrderedRecord scan(String text) {
        return fromKeys(ExpressionGrammar.references(text));
    }

    /**
     * Same names, each flagged true when the field holds an expression.
     */
    public OrderedRecord isExpression() {
        OrderedRecord out = new OrderedRecord();
        for (String name : names) {
            out.set(name, ExpressionGrammar.isDynamic(values.get(name)));
        }
        return out;
    }

    /**
     * Same names, each flagged true when the field is static or every name it references is
     * defined by an earlier field.
     */
    public OrderedRecord isDefined() {
        OrderedRecord out = new OrderedRecord();
        for (int i = 0; i < names.size(); i++) {
            Object value = values.get(names.get(i));
            boolean defined = true;
            if (ExpressionGrammar.isDynamic(value)) {
                List<String> earlier = names.subList(0, i);
                defined = earlier.containsAll(ExpressionGrammar.references(value.toString()));
            }
            out.set(names.get(i), defined);
        }
        return out;
    }

    /**
     * Deep copy of a field value; immutable values are shared.
     */
    public static Object copyValue(Object value) {
        if (value instanceof OrderedRecord record) {
            return record.copy();
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(copyValue(item));
            }
            return out;
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OrderedRecord other)) {
            return false;
        }
        return names.equals(other.names) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(names, values);
    }

    @Override
    public String toString() {
        return RecordTable.render(this, null);
    }
}
