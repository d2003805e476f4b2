/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.api;

import com.drip.rules.api.model.QuerySetRule;
import com.drip.rules.api.query.Queryable;

import java.time.Clock;

/**
 * Contract for turning one rule into a narrowing step over a queryable collection.
 */
public interface IRuleCompiler {

    /**
     * Applies a rule to a collection.
     *
     * @param rule       the rule to apply
     * @param collection the collection to narrow; never modified
     * @param clock      source of "now" for relative date values
     * @param <T>        row type
     * @return the narrowed collection
     * @throws com.drip.rules.api.exceptions.RuleCompilationException if the rule is malformed
     *         or the store rejects it
     */
    <T> Queryable<T> apply(QuerySetRule rule, Queryable<T> collection, Clock clock);
}
