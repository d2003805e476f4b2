package com.drip.rules.api.validation;

import com.drip.rules.api.exceptions.DurationParseException;
import com.drip.rules.api.exceptions.InvalidValueException;
import com.drip.rules.api.exceptions.UnknownFieldException;
import com.drip.rules.api.exceptions.UnknownLookupException;
import com.drip.rules.api.exceptions.UnknownMethodException;

/**
 * Kind of configuration error found while validating a rule.
 */
public enum ErrorCategory {
    DURATION_PARSE,
    UNKNOWN_LOOKUP,
    UNKNOWN_METHOD,
    UNKNOWN_FIELD,
    INVALID_VALUE,
    UNEXPECTED;

    /**
     * Classifies an exception raised while applying a rule.
     */
    public static ErrorCategory of(Throwable error) {
        if (error instanceof DurationParseException) return DURATION_PARSE;
        if (error instanceof UnknownLookupException) return UNKNOWN_LOOKUP;
        if (error instanceof UnknownMethodException) return UNKNOWN_METHOD;
        if (error instanceof UnknownFieldException) return UNKNOWN_FIELD;
        if (error instanceof InvalidValueException) return INVALID_VALUE;
        return UNEXPECTED;
    }
}
