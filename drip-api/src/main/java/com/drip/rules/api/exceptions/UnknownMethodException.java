package com.drip.rules.api.exceptions;

/**
 * Thrown when a rule's method type is neither {@code filter} nor {@code exclude}
 * and the caller asked for strict handling.
 */
public class UnknownMethodException extends RuleCompilationException {

    private final String method;

    public UnknownMethodException(String method) {
        super("Unknown method type: " + method);
        this.method = method;
    }

    public String getMethod() {
        return method;
    }
}
