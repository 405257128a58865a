package com.simscript.params.value;

import java.util.ArrayList;
import java.util.List;

/**
 * String value flagged as a filesystem path. Paths always use POSIX separators so that
 * generated scripts stay portable.
 *
 * <pre>
 *   PathValue.of("this/is/mypath//").join("mylocalfolder/myfile.ext")
 *       -&gt; this/is/mypath/mylocalfolder/myfile.ext
 * </pre>
 *
 * A trailing separator is significant and is kept by normalization and by {@link #join}.
 */
public final class PathValue implements CharSequence, Comparable<PathValue> {

    private static final char SEPARATOR = '/';

    private final String text;

    private PathValue(String text) {
        this.text = text;
    }

    public static PathValue of(String text) {
        if (text == null) {
            throw new IllegalArgumentException("a path cannot be null");
        }
        return new PathValue(text);
    }

    /**
     * Normalized form: backslashes become '/', repeated separators collapse, '.' segments
     * disappear, a trailing separator is preserved.
     */
    public PathValue toPath() {
        return new PathValue(normalize(text));
    }

    /**
     * Joins two fragments with exactly one separator; a trailing separator carried by
     * {@code other} is preserved.
     */
    public PathValue join(CharSequence other) {
        String left = normalize(text);
        String right = normalize(other.toString());
        if (right.equals(".")) {
            return new PathValue(left);
        }
        while (right.startsWith("/")) {
            right = right.substring(1);
        }
        if (left.equals(".")) {
            return new PathValue(right.isEmpty() ? "." : right);
        }
        String base = left.endsWith("/") ? left : left + SEPARATOR;
        return new PathValue(base + right);
    }

    /**
     * Plain concatenation that keeps the path type.
     */
    public PathValue append(CharSequence suffix) {
        return new PathValue(text + suffix);
    }

    public boolean isAbsolute() {
        return text.startsWith("/") || text.startsWith("\\");
    }

    public boolean hasTrailingSeparator() {
        return text.endsWith("/") || text.endsWith("\\");
    }

    static String normalize(String raw) {
        String unified = raw.replace('\\', SEPARATOR);
        if (unified.isEmpty()) {
            return ".";
        }
        boolean absolute = unified.charAt(0) == SEPARATOR;
        boolean trailing = unified.length() > 1 && unified.charAt(unified.length() - 1) == SEPARATOR;
        List<String> segments = new ArrayList<>();
        for (String segment : unified.split("/+")) {
            if (!segment.isEmpty() && !segment.equals(".")) {
                segments.add(segment);
            }
        }
        String joined = String.join("/", segments);
        if (joined.isEmpty()) {
            return absolute ? "/" : ".";
        }
        String result = (absolute ? "/" : "") + joined;
        return trailing ? result + SEPARATOR : result;
    }

    @Override
    public int length() {
        return text.length();
    }

    @Override
    public char charAt(int index) {
        return text.charAt(index);
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return text.subSequence(start, end);
    }

    @Override
    public int compareTo(PathValue o) {
        return text.compareTo(o.text);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PathValue other && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
