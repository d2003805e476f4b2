package com.drip.rules.api.query;

import java.util.Objects;

/**
 * A named aggregate attached to each row so that it can be filtered like a field.
 */
public record Annotation(String alias, Aggregation aggregation) {
    public Annotation {
        Objects.requireNonNull(alias, "Alias cannot be null");
        Objects.requireNonNull(aggregation, "Aggregation cannot be null");
    }
}
