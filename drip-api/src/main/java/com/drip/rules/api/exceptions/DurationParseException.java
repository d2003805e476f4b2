package com.drip.rules.api.exceptions;

/**
 * Thrown when the duration part of a {@code now}/{@code today} value is malformed.
 */
public class DurationParseException extends RuleCompilationException {

    private final String input;

    public DurationParseException(String input) {
        super("Could not parse duration: '" + input + "'");
        this.input = input;
    }

    public DurationParseException(String input, Throwable cause) {
        super("Could not parse duration: '" + input + "'", cause);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
