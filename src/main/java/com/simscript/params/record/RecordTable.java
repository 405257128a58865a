package com.simscript.params.record;

import java.util.Map;

import com.simscript.params.value.ValueFormatter;

/**
 * Two-column text table of a record, optionally followed on each row by the evaluated value.
 *
 * <pre>
 *   ----------:----------------------------------------
 *            a: 1
 *            b: ${a}+1
 *             = 2
 *   ----------:----------------------------------------
 * </pre>
 */
public final class RecordTable {

    static final int MAX_DISPLAY = 40;
    private static final int MIN_WIDTH = 10;

    private RecordTable() {
        // Utility class
    }

    /**
     * @param evaluated snapshot of {@code record}, or null to show definitions only
     */
    public static String render(OrderedRecord record, OrderedRecord evaluated) {
        if (record.isEmpty()) {
            return "empty record";
        }
        int width = MIN_WIDTH;
        for (String name : record.keys()) {
            width = Math.max(width, name.length() + 2);
        }
        String keyFormat = "%" + width + "s: %s\n";
        String line = String.format("%" + width + "s:%s\n", "-".repeat(width - 2), "-".repeat(Math.min(40, width * 5)));

        StringBuilder sb = new StringBuilder(line);
        for (Map.Entry<String, Object> item : record.items()) {
            Object value = item.getValue();
            sb.append(String.format(keyFormat, item.getKey(), truncate(display(value))));
            if (evaluated != null && value instanceof CharSequence && evaluated.has(item.getKey())) {
                Object result = evaluated.get(item.getKey());
                String shown = value.toString().isEmpty() ? "<empty string>" : display(result);
                sb.append(String.format("%" + width + "s= %s\n", "", truncate(shown)));
            }
        }
        sb.append(line);
        return sb.toString();
    }

    private static String display(Object value) {
        if (value instanceof OrderedRecord nested) {
            return "record with " + nested.size() + " definitions";
        }
        if (value instanceof String text && text.isEmpty()) {
            return "\"\"";
        }
        return ValueFormatter.display(value);
    }

    /**
     * Long texts keep their head and tail around a {@code [...]} mark.
     */
    static String truncate(String text) {
        if (text.length() <= MAX_DISPLAY) {
            return text;
        }
        int half = MAX_DISPLAY / 2;
        return text.substring(0, half) + " [...] " + text.substring(text.length() - half);
    }
}
