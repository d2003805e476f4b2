package com.drip.rules.api.exceptions;

/**
 * Thrown when a rule names a lookup outside the fourteen supported operators.
 */
public class UnknownLookupException extends RuleCompilationException {

    private final String lookup;

    public UnknownLookupException(String lookup) {
        super("Unknown lookup type: " + lookup);
        this.lookup = lookup;
    }

    public String getLookup() {
        return lookup;
    }
}
