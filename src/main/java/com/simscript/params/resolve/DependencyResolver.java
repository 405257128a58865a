package com.simscript.params.resolve;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simscript.params.exception.OrderingFailureException;
import com.simscript.params.grammar.ExpressionGrammar;
import com.simscript.params.record.OrderedRecord;

import lombok.NoArgsConstructor;

/**
 * Reorders the fields of a record so that every expression comes after the fields it
 * references.
 *
 * Static fields keep their relative order and come first. Expressions are then appended
 * one at a time, always taking the leftmost pending expression whose references are all
 * placed. Sorting always terminates and consumes every field.
 */
@NoArgsConstructor
public class DependencyResolver {
    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * Lenient sort.
     */
    public OrderedRecord sort(OrderedRecord record) {
        return sort(record, ResolutionMode.LENIENT);
    }

    /**
     * @return a new record with the same fields in dependency order
     * @throws OrderingFailureException in strict mode, when some expressions reference
     *         names that are never defined or depend on each other
     */
    public OrderedRecord sort(OrderedRecord record, ResolutionMode mode) {
        List<String> order = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        Map<String, Set<String>> pending = new LinkedHashMap<>();

        for (Map.Entry<String, Object> field : record.items()) {
            if (ExpressionGrammar.isDynamic(field.getValue())) {
                pending.put(field.getKey(), dependencies(field.getValue().toString(), record));
            } else {
                order.add(field.getKey());
                placed.add(field.getKey());
            }
        }

        boolean warned = false;
        while (!pending.isEmpty()) {
            String next = null;
            for (Map.Entry<String, Set<String>> candidate : pending.entrySet()) {
                if (placed.containsAll(candidate.getValue())) {
                    next = candidate.getKey();
                    break;
                }
            }
            if (next == null) {
                if (mode == ResolutionMode.STRICT) {
                    throw new OrderingFailureException(new ArrayList<>(pending.keySet()), record.size());
                }
                if (!warned) {
                    log.warn("unable to interpret {}/{} expressions in definitions: {}",
                            pending.size(), record.size(), pending.keySet());
                    warned = true;
                }
                next = pending.keySet().iterator().next();
            }
            pending.remove(next);
            order.add(next);
            placed.add(next);
        }

        OrderedRecord sorted = new OrderedRecord();
        for (String name : order) {
            sorted.set(name, OrderedRecord.copyValue(record.get(name)));
        }
        return sorted;
    }

    /**
     * True when every expression only references fields defined before it.
     */
    public boolean isOrdered(OrderedRecord record) {
        Set<String> seen = new HashSet<>();
        for (Map.Entry<String, Object> field : record.items()) {
            if (ExpressionGrammar.isDynamic(field.getValue())
                    && !seen.containsAll(dependencies(field.getValue().toString(), record))) {
                return false;
            }
            seen.add(field.getKey());
        }
        return true;
    }

    /**
     * Referenced names, minus constants that no field shadows.
     */
    private static Set<String> dependencies(String text, OrderedRecord record) {
        Set<String> names = ExpressionGrammar.references(text);
        names.removeIf(name -> ExpressionGrammar.CONSTANTS.containsKey(name) && !record.has(name));
        return names;
    }
}
