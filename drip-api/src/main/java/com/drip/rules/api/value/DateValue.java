package com.drip.rules.api.value;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A calendar date computed from a relative {@code today} expression.
 */
public record DateValue(LocalDate value) implements TypedValue {
    public DateValue {
        Objects.requireNonNull(value, "Date cannot be null");
    }
}
