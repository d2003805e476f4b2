package com.drip.rules.api.value;

import java.util.Objects;

/**
 * A reference to another field of the row being compared.
 *
 * @param value the referenced field path
 */
public record FieldReference(String value) implements TypedValue {
    public FieldReference {
        Objects.requireNonNull(value, "Referenced field cannot be null");
    }

    public String fieldName() {
        return value;
    }

    @Override
    public boolean isDeferred() {
        return true;
    }
}
