package com.simscript.params.record;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simscript.params.value.ErrorMarker;
import com.simscript.params.value.NdArray;
import com.simscript.params.value.PathValue;
import com.simscript.params.value.ValueFormatter;

/**
 * Reads and writes records as {@code name=value} text files.
 *
 * Format:
 * <pre>
 * # parameter list with 4 definitions
 *
 * a=1
 * b="${a}+1"
 * folder=path("runs/case1/")
 * box=array([[0.0, 1.0], [0.0, 2.0]])
 * </pre>
 * - Empty or {@code None} right-hand side: null value
 * - Numbers bare, {@code Long} values with an {@code L} suffix, booleans {@code True}/{@code False},
 *   strings double-quoted
 * - Lists {@code [1, "a"]}, arrays {@code array(...)}, paths {@code path("...")}
 * - Blank lines and {@code #} comments are ignored when reading
 *
 * Expressions are written as their text, never as their evaluated value. Nested records
 * are not written.
 */
public class RecordTextCodec {
    private static final Logger log = LoggerFactory.getLogger(RecordTextCodec.class);

    private static final Pattern INTEGER = Pattern.compile("([-+]?\\d+)(L?)");

    public void write(OrderedRecord record, Path file) throws IOException {
        Files.writeString(file, writeString(record), StandardCharsets.UTF_8);
        log.debug("Wrote {} definitions to {}", record.size(), file);
    }

    public String writeString(OrderedRecord record) {
        StringBuilder body = new StringBuilder();
        int written = 0;
        for (Map.Entry<String, Object> field : record.items()) {
            if (field.getValue() instanceof OrderedRecord) {
                log.warn("Nested record '{}' is not written", field.getKey());
                continue;
            }
            body.append(field.getKey()).append('=').append(valueText(field.getValue())).append('\n');
            written++;
        }
        return "# parameter list with " + written + " definitions\n\n" + body;
    }

    static String valueText(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Double || value instanceof Float) {
            return numberText(((Number) value).doubleValue());
        }
        if (value instanceof Long) {
            return value + "L";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return ValueFormatter.toText(value);
        }
        if (value instanceof PathValue path) {
            return "path(" + ValueFormatter.quote(path.toString()) + ")";
        }
        if (value instanceof NdArray array) {
            return "array(" + valueText(array.toNestedList()) + ")";
        }
        if (value instanceof List<?> items) {
            List<String> parts = new ArrayList<>(items.size());
            for (Object item : items) {
                parts.add(valueText(item));
            }
            return "[" + String.join(", ", parts) + "]";
        }
        if (value instanceof ErrorMarker marker) {
            return ValueFormatter.quote(marker.toString());
        }
        return ValueFormatter.quote(value.toString());
    }

    private static String numberText(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return ValueFormatter.formatNumber(value);
        }
        return Double.toString(value);
    }

    public OrderedRecord read(Path file) throws IOException {
        OrderedRecord record = readString(Files.readString(file, StandardCharsets.UTF_8));
        log.debug("Read {} definitions from {}", record.size(), file);
        return record;
    }

    /**
     * @throws IllegalArgumentException naming the line of the first malformed definition
     */
    public OrderedRecord readString(String text) {
        OrderedRecord record = new OrderedRecord();
        int lineNum = 0;
        for (String line : text.split("\n")) {
            lineNum++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            int equals = trimmed.indexOf('=');
            if (equals <= 0) {
                throw new IllegalArgumentException("Line " + lineNum + ": expected name=value but found: " + trimmed);
            }
            String name = trimmed.substring(0, equals).trim();
            String rhs = trimmed.substring(equals + 1).trim();
            try {
                record.set(name, rhs.isEmpty() || rhs.equals("None") ? null : new ValueReader(rhs).readAll());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Line " + lineNum + ": " + e.getMessage(), e);
            }
        }
        return record;
    }

    /**
     * Reader of the value syntax produced by {@link #valueText(Object)}.
     */
    private static final class ValueReader {
        private final String text;
        private int pos = 0;

        ValueReader(String text) {
            this.text = text;
        }

        Object readAll() {
            Object value = readValue();
            skipBlanks();
            if (pos < text.length()) {
                throw error("unexpected text after value");
            }
            return value;
        }

        private Object readValue() {
            skipBlanks();
            if (pos >= text.length()) {
                throw error("missing value");
            }
            char c = text.charAt(pos);
            if (c == '"') {
                return readString();
            }
            if (c == '[') {
                return readList();
            }
            if (text.startsWith("path(", pos)) {
                pos += "path(".length();
                skipBlanks();
                String path = readString();
                expect(')');
                return PathValue.of(path);
            }
            if (text.startsWith("array(", pos)) {
                pos += "array(".length();
                Object nested = readValue();
                expect(')');
                return NdArray.fromNested(nested);
            }
            return readAtom();
        }

        private String readString() {
            expect('"');
            StringBuilder sb = new StringBuilder();
            while (pos < text.length() && text.charAt(pos) != '"') {
                char c = text.charAt(pos++);
                if (c == '\\' && pos < text.length()) {
                    char next = text.charAt(pos++);
                    switch (next) {
                        case 'n' -> sb.append('\n');
                        case 't' -> sb.append('\t');
                        case '"', '\\' -> sb.append(next);
                        default -> sb.append(c).append(next);
                    }
                } else {
                    sb.append(c);
                }
            }
            expect('"');
            return sb.toString();
        }

        private List<Object> readList() {
            expect('[');
            List<Object> items = new ArrayList<>();
            skipBlanks();
            if (peekIs(']')) {
                pos++;
                return items;
            }
            while (true) {
                items.add(readValue());
                skipBlanks();
                if (peekIs(',')) {
                    pos++;
                } else {
                    expect(']');
                    return items;
                }
            }
        }

        private Object readAtom() {
            int start = pos;
            while (pos < text.length() && ",]) \t".indexOf(text.charAt(pos)) < 0) {
                pos++;
            }
            String atom = text.substring(start, pos);
            switch (atom) {
                case "None":
                    return null;
                case "True":
                    return Boolean.TRUE;
                case "False":
                    return Boolean.FALSE;
                case "nan":
                    return Double.NaN;
                case "inf":
                    return Double.POSITIVE_INFINITY;
                case "-inf":
                    return Double.NEGATIVE_INFINITY;
                default:
                    break;
            }
            Matcher integer = INTEGER.matcher(atom);
            if (integer.matches()) {
                return readInteger(integer.group(1), !integer.group(2).isEmpty());
            }
            try {
                return Double.valueOf(atom);
            } catch (NumberFormatException e) {
                throw error("cannot read value '" + atom + "'");
            }
        }

        /**
         * Integers read back as {@code Integer} when they fit, {@code Long} otherwise or when
         * suffixed with {@code L}.
         */
        private Object readInteger(String digits, boolean forceLong) {
            long value;
            try {
                value = Long.parseLong(digits.startsWith("+") ? digits.substring(1) : digits);
            } catch (NumberFormatException e) {
                throw error("integer " + digits + " is out of range");
            }
            if (!forceLong && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return (int) value;
            }
            return value;
        }

        private void skipBlanks() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        private boolean peekIs(char c) {
            return pos < text.length() && text.charAt(pos) == c;
        }

        private void expect(char c) {
            skipBlanks();
            if (!peekIs(c)) {
                throw error("expected '" + c + "'");
            }
            pos++;
        }

        private IllegalArgumentException error(String message) {
            return new IllegalArgumentException(message + " at column " + (pos + 1) + " in " + text);
        }
    }
}
