package com.simscript.params.eval;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for the evaluator.
 */
@Data
@Builder
public class EvaluatorConfig {

    /**
     * Store an error marker, instead of the interpolated text, when a field is not a
     * well-formed expression or uses an unknown name.
     */
    private boolean strict;

    /**
     * Rewrite bare {@code $name} occurrences of known fields into {@code ${name}} before
     * interpolation.
     */
    private boolean protection;

    /**
     * When false, text fields are interpolated but never computed.
     */
    @Builder.Default
    private boolean evaluation = true;

    /**
     * Upper bound on the number of elements produced by one range ({@code a:b},
     * {@code arange}, {@code linspace}).
     */
    @Builder.Default
    private int maxRangeElements = 10_000;

    public static EvaluatorConfig defaults() {
        return EvaluatorConfig.builder().build();
    }
}
