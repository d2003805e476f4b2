package com.drip.rules.api.value;

import java.time.Instant;
import java.util.Objects;

/**
 * An absolute instant computed from a relative {@code now} expression.
 */
public record DateTimeValue(Instant value) implements TypedValue {
    public DateTimeValue {
        Objects.requireNonNull(value, "Instant cannot be null");
    }
}
