package com.drip.rules.api.exceptions;

/**
 * Thrown by a store when a literal cannot be compared with a field.
 */
public class InvalidValueException extends RuleCompilationException {

    private final String field;

    public InvalidValueException(String field, String message) {
        super(message);
        this.field = field;
    }

    public InvalidValueException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
