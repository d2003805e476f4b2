/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.api.query;

import java.util.List;
import java.util.Map;

/**
 * A lazy, composable collection of records.
 *
 * <p>Every narrowing or annotating call returns a new instance and leaves the receiver
 * untouched; nothing is evaluated until {@link #fetch()} or {@link #count()}.
 *
 * <p>Field names are checked when a predicate or annotation is added: implementations
 * throw {@link com.drip.rules.api.exceptions.UnknownFieldException} for a field they cannot
 * address and {@link com.drip.rules.api.exceptions.InvalidValueException} for a literal
 * that cannot be converted to the field's type.
 *
 * @param <T> the materialized row type
 */
public interface Queryable<T> {

    /**
     * Keeps only rows satisfying the predicate.
     */
    Queryable<T> filter(FieldPredicate predicate);

    /**
     * Removes rows satisfying the predicate. Rows for which the predicate cannot be
     * evaluated (for example a null field) are kept.
     */
    Queryable<T> exclude(FieldPredicate predicate);

    /**
     * Adds a derived per-row value that later predicates can address by its alias.
     *
     * <p>Re-adding an annotation identical to one already present is a no-op. Reusing an
     * alias for a different aggregation, or an alias that shadows a real field, fails with
     * {@link IllegalArgumentException}.
     */
    Queryable<T> annotate(Annotation annotation);

    /**
     * Returns the annotations added so far, keyed by alias.
     */
    Map<String, Annotation> annotations();

    default boolean hasAnnotation(String alias) {
        return annotations().containsKey(alias);
    }

    /**
     * Evaluates the query and returns the matching rows.
     */
    List<T> fetch();

    /**
     * Evaluates the query and returns the number of matching rows.
     */
    default long count() {
        return fetch().size();
    }
}
