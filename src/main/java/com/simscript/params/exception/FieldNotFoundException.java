package com.simscript.params.exception;

import lombok.Getter;

/**
 * Raised by direct record access to a name that is absent or reserved.
 */
@Getter
public class FieldNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String fieldName;

    public FieldNotFoundException(String fieldName) {
        super("the definition \"" + fieldName + "\" does not exist");
        this.fieldName = fieldName;
    }
}
