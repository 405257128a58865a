package com.simscript.params.value;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Textual forms of field values.
 *
 * {@link #toText(Object)} is the form substituted by interpolation: it must parse back to an
 * equivalent value. {@link #expressionText(Object)} is the form substituted into text that is
 * computed afterwards, where arrays must stay arrays. {@link #display(Object)} is a compact, human-oriented summary used by
 * record tables.
 */
public final class ValueFormatter {

    private static final int MAX_DISPLAY_ELEMENTS = 10;

    private ValueFormatter() {
        // Utility class
    }

    public static String toText(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Double || value instanceof Float) {
            return formatNumber(((Number) value).doubleValue());
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        if (value instanceof NdArray array) {
            return listText(array.toNestedList());
        }
        if (value instanceof List<?> list) {
            return listText(list);
        }
        return value.toString();
    }

    /**
     * Like {@link #toText(Object)}, but an array is written as an {@code array(...)} call.
     */
    public static String expressionText(Object value) {
        if (value instanceof NdArray array) {
            return "array(" + listText(array.toNestedList()) + ")";
        }
        return toText(value);
    }

    /**
     * Shortest decimal form; integral values are written without a fractional part.
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value).replace('E', 'e');
    }

    private static String listText(List<?> list) {
        return list.stream()
                .map(ValueFormatter::itemText)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private static String itemText(Object item) {
        if (item instanceof CharSequence text && !(item instanceof PathValue)) {
            return quote(text.toString());
        }
        return toText(item);
    }

    public static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Compact display used by record tables: long arrays are summarized by their shape.
     */
    public static String display(Object value) {
        if (value instanceof NdArray array) {
            return displayArray(array);
        }
        if (value instanceof PathValue path) {
            return "p\"" + path + "\"";
        }
        return toText(value);
    }

    private static String displayArray(NdArray array) {
        if (array.size() == 0) {
            return "[]";
        }
        int[] shape = array.shape();
        if (array.ndim() == 1 && array.size() <= MAX_DISPLAY_ELEMENTS) {
            return "[" + joinFlat(array) + "]";
        }
        if (array.ndim() == 2 && shape[0] == 1 && shape[1] <= MAX_DISPLAY_ELEMENTS) {
            return "[" + joinFlat(array) + "]";
        }
        if (array.ndim() == 2 && shape[1] == 1 && shape[0] <= MAX_DISPLAY_ELEMENTS) {
            return "[" + joinFlat(array) + "]T";
        }
        if (array.ndim() == 2) {
            return "[" + NdArray.shapeText(shape) + " matrix]";
        }
        return "[" + NdArray.shapeText(shape) + " array]";
    }

    private static String joinFlat(NdArray array) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < array.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(shortNumber(array.flat(i)));
        }
        return sb.toString();
    }

    private static String shortNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return formatNumber(value);
        }
        String text = String.format(Locale.ROOT, "%.4g", value).trim();
        int exp = text.indexOf('e');
        String mantissa = exp >= 0 ? text.substring(0, exp) : text;
        String exponent = exp >= 0 ? text.substring(exp) : "";
        if (mantissa.indexOf('.') >= 0) {
            mantissa = mantissa.replaceAll("0+$", "");
            if (mantissa.endsWith(".")) {
                mantissa = mantissa.substring(0, mantissa.length() - 1);
            }
        }
        return mantissa + exponent;
    }
}
