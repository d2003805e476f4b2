/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.api.value;

/**
 * The interpreted right-hand side of a rule predicate.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link DateTimeValue}: an instant, from {@code now[+-duration]}</li>
 *   <li>{@link DateValue}: a calendar date, from {@code today[+-duration]}</li>
 *   <li>{@link FieldReference}: another field of the same row, from {@code F_<field>}</li>
 *   <li>{@link BooleanValue}: {@code True} or {@code False}</li>
 *   <li>{@link ScalarValue}: any other literal, coerced by the store</li>
 * </ul>
 * Store adapters dispatch on the concrete type.
 */
public interface TypedValue {

    /**
     * Returns the literal Java value, or the referenced field name for a field reference.
     */
    Object value();

    /**
     * Whether the value is resolved against the row rather than used as a literal.
     */
    default boolean isDeferred() {
        return false;
    }
}
