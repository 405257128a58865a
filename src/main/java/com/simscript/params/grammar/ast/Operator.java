package com.simscript.params.grammar.ast;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Unary and binary operators of the expression language.
 */
@Getter
@AllArgsConstructor
public enum Operator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    FLOOR_DIVIDE("//"),
    MODULO("%"),
    POWER("**"),
    MATMUL("@"),
    NEGATE("-"),
    IDENTITY("+");

    private final String symbol;
}
