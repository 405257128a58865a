package com.simscript.params.grammar;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.Value;

/**
 * Unescaped interpolation marker {@code ${...}} or {@code @{...}} located in a text.
 */
@Value
public class Marker {

    private static final Pattern REFERENCE = Pattern.compile("\\s*([A-Za-z_]\\w*)\\s*(\\[[^\\[\\]]*\\])?\\s*");

    /** Offset of the '$' or '@'. */
    int start;
    /** Offset just after the closing brace. */
    int end;
    String content;
    boolean arrayCoercing;

    /**
     * True for {@code name}, {@code name[i]} and {@code name[i,j]} contents.
     */
    public boolean isReference() {
        return REFERENCE.matcher(content).matches();
    }

    /**
     * Leading field name of a reference marker, null for other expressions.
     */
    public String baseName() {
        Matcher matcher = REFERENCE.matcher(content);
        return matcher.matches() ? matcher.group(1) : null;
    }

    public String text() {
        return (arrayCoercing ? "@{" : "${") + content + "}";
    }
}
