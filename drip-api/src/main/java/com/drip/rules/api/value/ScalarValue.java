package com.drip.rules.api.value;

import java.util.Objects;

/**
 * A literal kept verbatim; the store converts it to the compared field's type.
 */
public record ScalarValue(String value) implements TypedValue {
    public ScalarValue {
        Objects.requireNonNull(value, "Scalar cannot be null");
    }
}
