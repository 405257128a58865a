package com.simscript.params.exception;

import lombok.Getter;

/**
 * Failure while computing an expression. Never escapes the evaluator: it is turned into an
 * error marker stored in the snapshot.
 */
@Getter
public class EvaluationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final Category category;

    public enum Category {
        SYNTAX("syntax error"),
        UNKNOWN_NAME("name error"),
        TYPE("type error"),
        INDEX("index error"),
        SHAPE("shape error"),
        ARITY("argument error"),
        DOMAIN("math error"),
        RANGE("range error");

        private final String label;

        Category(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    public EvaluationException(Category category, String message) {
        super(message);
        this.category = category;
    }

    public EvaluationException(Category category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    /**
     * Human-readable cause, e.g. {@code shape error: cannot broadcast 2x3 with 3x2}.
     */
    public String describe() {
        return category.getLabel() + ": " + getMessage();
    }
}
