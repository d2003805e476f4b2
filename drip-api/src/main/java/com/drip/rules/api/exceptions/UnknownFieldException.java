package com.drip.rules.api.exceptions;

/**
 * Thrown by a store when it cannot address a field path.
 */
public class UnknownFieldException extends RuleCompilationException {

    private final String field;

    public UnknownFieldException(String field, String reason) {
        super("Cannot resolve field '" + field + "': " + reason);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
