package com.simscript.params.grammar;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token of the arithmetic expression language.
 */
@Data
@AllArgsConstructor
public class ExpressionToken {
    private TokenType type;
    private String value;
    private int position;

    public enum TokenType {
        NUMBER,
        IDENTIFIER,
        STRING,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        DOUBLE_SLASH,
        PERCENT,
        POWER,
        AT,
        LPAREN,
        RPAREN,
        LBRACKET,
        RBRACKET,
        COMMA,
        COLON,
        DOT,
        EOF
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }
}
