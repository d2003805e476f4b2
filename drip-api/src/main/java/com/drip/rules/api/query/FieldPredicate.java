/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.api.query;

import com.drip.rules.api.model.LookupType;
import com.drip.rules.api.value.TypedValue;

import java.util.Objects;

/**
 * A single-entry predicate: {@code field <lookup> value}.
 *
 * <p>This is the typed form of a {@code field__lookup=value} filter keyword. Store
 * adapters compile it into their own syntax.
 *
 * @param field     the effective field path (an annotation alias for count rules)
 * @param lookup    the comparison operator
 * @param value     the literal or the referenced field
 * @param separator the store's path separator, used by {@link #lookupKey()}
 */
public record FieldPredicate(
        String field,
        LookupType lookup,
        TypedValue value,
        String separator
) {
    public static final String DEFAULT_SEPARATOR = "__";

    public FieldPredicate {
        Objects.requireNonNull(field, "Field cannot be null");
        Objects.requireNonNull(lookup, "Lookup cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        if (separator == null) separator = DEFAULT_SEPARATOR;
    }

    public FieldPredicate(String field, LookupType lookup, TypedValue value) {
        this(field, lookup, value, DEFAULT_SEPARATOR);
    }

    /**
     * Returns the composite key, e.g. {@code num_orders__gt}.
     */
    public String lookupKey() {
        return field + separator + lookup.code();
    }

    @Override
    public String toString() {
        return lookupKey() + "=" + value;
    }
}
