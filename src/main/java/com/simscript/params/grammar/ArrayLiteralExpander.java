package com.simscript.params.grammar;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.simscript.params.exception.EvaluationException;
import com.simscript.params.exception.EvaluationException.Category;
import com.simscript.params.value.NdArray;
import com.simscript.params.value.ValueFormatter;

/**
 * Rewrites Matlab-style array literals into the {@code array(...)} call of the expression
 * language.
 *
 * <pre>
 *   $[1 2 3]          -&gt; array([[1, 2, 3]])
 *   $[1;2;3]          -&gt; array([[1], [2], [3]])
 *   $[1:0.5:2]        -&gt; array([[1, 1.5, 2]])
 *   $[[1 2;3 4] [5 6;7 8]] -&gt; array([[[1, 2], [3, 4]], [[5, 6], [7, 8]]])
 * </pre>
 *
 * Elements are separated by blanks or commas, rows by {@code ;}, nested brackets add a
 * leading axis. A top-level vector is promoted to a 1xN row.
 */
public class ArrayLiteralExpander {

    private static final String OPENING = "$[";
    private static final String NUMBER = "[-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?";
    private static final Pattern RANGE = Pattern.compile(
            "(" + NUMBER + "):(" + NUMBER + ")(?::(" + NUMBER + "))?");
    private static final MathContext RANGE_PRECISION = new MathContext(12);

    private final int maxRangeElements;

    public ArrayLiteralExpander(int maxRangeElements) {
        this.maxRangeElements = maxRangeElements;
    }

    public static boolean containsArrayLiteral(String text) {
        int index = text.indexOf(OPENING);
        while (index >= 0) {
            if (index == 0 || text.charAt(index - 1) != '\\') {
                return true;
            }
            index = text.indexOf(OPENING, index + 1);
        }
        return false;
    }

    /**
     * Expands every array literal of the text; text outside literals is untouched.
     *
     * @throws EvaluationException for unbalanced brackets, more than four dimensions,
     *         inconsistent rows, a zero step or a range above the element limit
     */
    public String expand(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            int open = text.indexOf(OPENING, i);
            if (open < 0) {
                sb.append(text, i, text.length());
                break;
            }
            if (open > 0 && text.charAt(open - 1) == '\\') {
                sb.append(text, i, open + OPENING.length());
                i = open + OPENING.length();
                continue;
            }
            int close = matchingBracket(text, open + 1);
            sb.append(text, i, open);
            sb.append(convert(text.substring(open + 2, close)));
            i = close + 1;
        }
        return sb.toString();
    }

    private static int matchingBracket(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new EvaluationException(Category.SYNTAX, "unbalanced brackets in array literal "
                + text.substring(open - 1));
    }

    private String convert(String content) {
        if (content.isBlank()) {
            return "array([])";
        }
        Cursor cursor = new Cursor(content);
        Object block = parseBlock(cursor, false);
        if (depth(block) == 1) {
            block = List.of(block);
        }
        if (depth(block) > NdArray.MAX_DIMENSIONS) {
            throw new EvaluationException(Category.SHAPE, "array literals are limited to "
                    + NdArray.MAX_DIMENSIONS + " dimensions");
        }
        return "array(" + render(block) + ")";
    }

    /**
     * A block is a list of rows; the result is a vector (single row of scalars), a matrix
     * (several rows of scalars) or a nesting of sub-blocks.
     */
    private Object parseBlock(Cursor cursor, boolean nested) {
        List<List<Object>> rows = new ArrayList<>();
        List<Object> row = new ArrayList<>();
        rows.add(row);
        while (true) {
            cursor.skipSeparators();
            if (cursor.atEnd()) {
                if (nested) {
                    throw new EvaluationException(Category.SYNTAX, "unbalanced brackets in array literal");
                }
                break;
            }
            char c = cursor.peek();
            if (c == ']') {
                if (!nested) {
                    throw new EvaluationException(Category.SYNTAX, "unbalanced brackets in array literal");
                }
                cursor.advance();
                break;
            }
            if (c == ';') {
                cursor.advance();
                row = new ArrayList<>();
                rows.add(row);
            } else if (c == '[') {
                cursor.advance();
                row.add(parseBlock(cursor, true));
            } else {
                row.addAll(expandElement(cursor.readElement()));
            }
        }
        rows.removeIf(List::isEmpty);
        return assemble(rows);
    }

    private static Object assemble(List<List<Object>> rows) {
        if (rows.isEmpty()) {
            return new ArrayList<>();
        }
        boolean anyBlock = rows.stream().flatMap(List::stream).anyMatch(List.class::isInstance);
        boolean anyScalar = rows.stream().flatMap(List::stream).anyMatch(String.class::isInstance);
        if (anyBlock && anyScalar) {
            throw new EvaluationException(Category.SHAPE, "cannot mix numbers and bracketed blocks "
                    + "at the same level of an array literal");
        }
        if (rows.size() == 1) {
            return rows.get(0);
        }
        int width = rows.get(0).size();
        for (List<Object> row : rows) {
            if (row.size() != width) {
                throw new EvaluationException(Category.SHAPE, "inconsistent row lengths in array literal: "
                        + width + " and " + row.size());
            }
        }
        return new ArrayList<Object>(rows);
    }

    private List<String> expandElement(String element) {
        Matcher range = RANGE.matcher(element);
        if (!range.matches()) {
            return List.of(element);
        }
        double start = Double.parseDouble(range.group(1));
        double step = range.group(3) == null ? 1.0 : Double.parseDouble(range.group(2));
        double stop = Double.parseDouble(range.group(3) == null ? range.group(2) : range.group(3));
        if (step == 0.0) {
            throw new EvaluationException(Category.RANGE, "zero step in range " + element);
        }
        double count = Math.floor((stop - start) / step + 1e-10) + 1;
        if (count > maxRangeElements) {
            throw new EvaluationException(Category.RANGE, "range " + element + " would produce "
                    + (long) count + " elements, the limit is " + maxRangeElements);
        }
        List<String> values = new ArrayList<>();
        for (int k = 0; k < count; k++) {
            double value = new BigDecimal(start + k * step).round(RANGE_PRECISION).doubleValue();
            values.add(ValueFormatter.formatNumber(value));
        }
        return values;
    }

    private static int depth(Object block) {
        if (!(block instanceof List<?> list)) {
            return 0;
        }
        return 1 + (list.isEmpty() ? 0 : depth(list.get(0)));
    }

    private static String render(Object block) {
        if (block instanceof List<?> list) {
            List<String> parts = new ArrayList<>(list.size());
            for (Object item : list) {
                parts.add(render(item));
            }
            return "[" + String.join(", ", parts) + "]";
        }
        return block.toString();
    }

    private static final class Cursor {
        private final String text;
        private int pos = 0;

        Cursor(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        void advance() {
            pos++;
        }

        void skipSeparators() {
            while (!atEnd() && (Character.isWhitespace(peek()) || peek() == ',')) {
                pos++;
            }
        }

        String readElement() {
            int start = pos;
            while (!atEnd()) {
                char c = peek();
                if (Character.isWhitespace(c) || c == ',' || c == ';' || c == '[' || c == ']') {
                    break;
                }
                pos++;
            }
            return text.substring(start, pos);
        }
    }
}
