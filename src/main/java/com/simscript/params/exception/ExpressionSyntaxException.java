package com.simscript.params.exception;

import lombok.Getter;

/**
 * Raised by the tokenizer and parser when a text is not a well-formed expression.
 */
@Getter
public class ExpressionSyntaxException extends EvaluationException {

    private static final long serialVersionUID = 1L;
    private final int position;

    public ExpressionSyntaxException(String message, int position) {
        super(Category.SYNTAX, position >= 0 ? message + " at position " + position : message);
        this.position = position;
    }
}
