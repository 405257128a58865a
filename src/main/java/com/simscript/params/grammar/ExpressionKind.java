package com.simscript.params.grammar;

/**
 * Structural classification of a textual field value.
 */
public enum ExpressionKind {
    /** Blank text. */
    EMPTY,
    /** {@code $text}: interpolated, never computed. */
    LITERAL,
    /** {@code !list}: literal sequence whose string items are interpolated one by one. */
    RECURSIVE_LITERAL,
    /** Contains {@code \${..}}: interpolated once, escaped markers survive for a later pass. */
    ESCAPED,
    /** Plain {@code ${name}} / {@code ${name[i]}} / {@code @{name}} markers, then computed. */
    INTERPOLATION,
    /** At least one marker holds an expression such as {@code ${a*2}}. */
    LOCAL_EVALUATION,
    /** No marker: the text itself is an expression, or stays text. */
    FULL_EVALUATION
}
