package com.simscript.params.resolve;

/**
 * Behavior of dependency sorting when some expressions cannot be ordered.
 */
public enum ResolutionMode {
    /** Fail with an ordering exception. */
    STRICT,
    /** Warn once, then accept the leftmost pending field and continue. */
    LENIENT
}
