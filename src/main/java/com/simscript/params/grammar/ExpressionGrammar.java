package com.simscript.params.grammar;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.simscript.params.exception.ExpressionSyntaxException;

/**
 * Lexical rules of textual field values: comments, escaping, interpolation markers,
 * classification and dependency extraction.
 *
 * <pre>
 *   ${name}  ${name[i]}  ${name[i,j]}  ${expr}   interpolation
 *   @{name}                                     array-coercing interpolation
 *   \${name}                                    escaped for one pass
 *   $text                                       literal, interpolation only
 *   !["a", ${b}]                                recursive literal list
 *   $[1 2;3 4]                                  array literal
 *   # comment                                   unless first non-blank character
 * </pre>
 */
public final class ExpressionGrammar {

    /** Named constants of the expression language; record fields shadow them inside markers. */
    public static final Map<String, Double> CONSTANTS = Map.of(
            "pi", Math.PI,
            "e", Math.E,
            "tau", 2 * Math.PI,
            "inf", Double.POSITIVE_INFINITY,
            "nan", Double.NaN);

    private static final char ESCAPE = '\\';
    private static final char PROTECTED_DOLLAR = '\u0000';

    private ExpressionGrammar() {
        // Utility class
    }

    /**
     * Removes trailing comments line by line. A {@code #} that is the first non-blank
     * character of its line is kept, {@code \#} is a literal {@code #}.
     */
    public static String stripComment(String text) {
        if (text.indexOf('#') < 0) {
            return text;
        }
        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(stripLineComment(lines[i]));
        }
        return sb.toString();
    }

    private static String stripLineComment(String line) {
        if (line.stripLeading().startsWith("#")) {
            return line;
        }
        StringBuilder sb = new StringBuilder(line.length());
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ESCAPE && i + 1 < line.length() && line.charAt(i + 1) == '#') {
                sb.append('#');
                i++;
            } else if (c == '#') {
                return sb.toString().stripTrailing();
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static boolean hasEscapedMarker(String text) {
        return text.contains("\\${") || text.contains("\\@{");
    }

    /**
     * Unescaped markers in text order. An unterminated marker is a syntax error.
     */
    public static List<Marker> findMarkers(String text) {
        return findMarkers(text, false);
    }

    /**
     * @param lenient stop at an unterminated marker instead of failing
     */
    public static List<Marker> findMarkers(String text, boolean lenient) {
        List<Marker> markers = new ArrayList<>();
        int i = 0;
        while (i < text.length() - 1) {
            char c = text.charAt(i);
            if ((c == '$' || c == '@') && text.charAt(i + 1) == '{' && !isEscaped(text, i)) {
                int close = text.indexOf('}', i + 2);
                if (close < 0) {
                    if (lenient) {
                        break;
                    }
                    throw new ExpressionSyntaxException("unterminated marker " + text.substring(i), i);
                }
                markers.add(new Marker(i, close + 1, text.substring(i + 2, close), c == '@'));
                i = close + 1;
            } else {
                i++;
            }
        }
        return markers;
    }

    private static boolean isEscaped(String text, int index) {
        return index > 0 && text.charAt(index - 1) == ESCAPE;
    }

    /**
     * Consumes the backslash of escaped markers so that they become live on the next pass.
     */
    public static String unescape(String text) {
        return text.replace("\\${", "${").replace("\\@{", "@{");
    }

    /**
     * Classifies a comment-free value; see {@link ExpressionKind}.
     */
    public static ExpressionKind classify(String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return ExpressionKind.EMPTY;
        }
        if (trimmed.startsWith("!")) {
            return ExpressionKind.RECURSIVE_LITERAL;
        }
        if (isLiteralText(trimmed)) {
            return ExpressionKind.LITERAL;
        }
        if (hasEscapedMarker(trimmed)) {
            return ExpressionKind.ESCAPED;
        }
        List<Marker> markers;
        try {
            markers = findMarkers(trimmed);
        } catch (ExpressionSyntaxException e) {
            return ExpressionKind.FULL_EVALUATION;
        }
        if (markers.isEmpty()) {
            return ExpressionKind.FULL_EVALUATION;
        }
        return markers.stream().allMatch(Marker::isReference)
                ? ExpressionKind.INTERPOLATION
                : ExpressionKind.LOCAL_EVALUATION;
    }

    /**
     * {@code $text} that is neither a marker nor an array literal.
     */
    public static boolean isLiteralText(String trimmed) {
        return trimmed.startsWith("$") && !trimmed.startsWith("${") && !trimmed.startsWith("$[");
    }

    /**
     * A value is dynamic when it is text holding at least one live marker.
     */
    public static boolean isDynamic(Object value) {
        if (!(value instanceof CharSequence text)) {
            return false;
        }
        String stripped = stripComment(text.toString());
        int dollar = stripped.indexOf("${");
        int at = stripped.indexOf("@{");
        if (dollar < 0 && at < 0) {
            return false;
        }
        try {
            return !findMarkers(stripped).isEmpty();
        } catch (ExpressionSyntaxException e) {
            return true;
        }
    }

    /**
     * Names referenced by the live markers of a text, in first-seen order. Marker
     * expressions contribute every identifier they use, constants included.
     */
    public static Set<String> references(String text) {
        Set<String> names = new LinkedHashSet<>();
        List<Marker> markers;
        try {
            markers = findMarkers(stripComment(text));
        } catch (ExpressionSyntaxException e) {
            return names;
        }
        for (Marker marker : markers) {
            try {
                names.addAll(NameCollector.collect(ExpressionParser.parse(marker.getContent())));
            } catch (ExpressionSyntaxException e) {
                String base = marker.baseName();
                if (base != null) {
                    names.add(base);
                }
            }
        }
        return names;
    }

    /**
     * Rewrites bare {@code $name} occurrences of known names into {@code ${name}}, longest
     * names first; {@code \$name} is left alone.
     */
    public static String protect(String text, Collection<String> names) {
        String work = text.replace("\\$", String.valueOf(PROTECTED_DOLLAR));
        List<String> sorted = new ArrayList<>(names);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        for (String name : sorted) {
            Pattern bare = Pattern.compile("\\$" + Pattern.quote(name) + "(?![A-Za-z0-9_])");
            work = bare.matcher(work).replaceAll(Matcher.quoteReplacement("${" + name + "}"));
        }
        return work.replace(String.valueOf(PROTECTED_DOLLAR), "\\$");
    }
}
