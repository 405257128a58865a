package com.simscript.params.value;

import java.util.Objects;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Sentinel stored in a snapshot in place of a value that could not be evaluated.
 *
 * Markers are non-fatal: sibling fields keep evaluating. Their text form is stable and
 * greppable so that generated scripts show exactly where a definition failed.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ErrorMarker {

    public enum Kind {
        UNRESOLVED_REFERENCE,
        EVALUATION_ERROR
    }

    private final Kind kind;
    private final String cause;
    private final String missingName;
    private final String source;

    public static ErrorMarker unresolved(String missingName, String source) {
        return new ErrorMarker(Kind.UNRESOLVED_REFERENCE,
                "unresolved reference to `" + missingName + "`", missingName, source);
    }

    public static ErrorMarker error(String cause, String source) {
        return new ErrorMarker(Kind.EVALUATION_ERROR, cause, null, source);
    }

    /**
     * Marker for a field that references another failed field; keeps the root cause.
     */
    public static ErrorMarker propagate(ErrorMarker upstream, String source) {
        return new ErrorMarker(upstream.kind, upstream.cause, upstream.missingName, source);
    }

    public boolean isUnresolved() {
        return kind == Kind.UNRESOLVED_REFERENCE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ErrorMarker other)) {
            return false;
        }
        return kind == other.kind
                && cause.equals(other.cause)
                && Objects.equals(missingName, other.missingName)
                && Objects.equals(source, other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, cause, missingName, source);
    }

    @Override
    public String toString() {
        if (kind == Kind.UNRESOLVED_REFERENCE) {
            return "< undef definition \"${" + missingName + "}\" >";
        }
        return "< error: " + cause + " >";
    }
}
