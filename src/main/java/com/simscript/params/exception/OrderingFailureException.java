package com.simscript.params.exception;

import java.util.List;

import lombok.Getter;

/**
 * Strict dependency sorting could not place every expression.
 */
@Getter
public class OrderingFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> pendingNames;
    private final int totalFields;

    public OrderingFailureException(List<String> pendingNames, int totalFields) {
        super(String.format("could not order %d/%d expressions in definitions: %s",
                pendingNames.size(), totalFields, pendingNames));
        this.pendingNames = List.copyOf(pendingNames);
        this.totalFields = totalFields;
    }
}
