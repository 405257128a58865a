package com.simscript.params.exception;

import lombok.Getter;

/**
 * An expression references a name that is not (yet) defined in the working snapshot.
 */
@Getter
public class UnresolvedReferenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String missingName;

    public UnresolvedReferenceException(String missingName) {
        super("unresolved reference to `" + missingName + "`");
        this.missingName = missingName;
    }
}
