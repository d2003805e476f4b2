/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.compiler;

import com.drip.rules.api.exceptions.RuleValidationException;
import com.drip.rules.api.model.Campaign;
import com.drip.rules.api.model.QuerySetRule;
import com.drip.rules.api.query.Queryable;
import com.drip.rules.api.validation.ErrorCategory;
import com.drip.rules.api.validation.ValidationResult;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * The ordered rules of one campaign.
 *
 * <p>Rules are applied in ascending sort order (then id, then declaration order), each
 * one narrowing the output of the previous. A rule set holds no mutable state and can be
 * applied concurrently.
 *
 * <h2>Usage</h2>
 * <pre>
 * RuleSet ruleSet = RuleSet.of(campaign, compiler, tracer);
 *
 * ValidationResult result = ruleSet.validate(users, clock);
 * if (result.isValid()) {
 *     List&lt;Map&lt;String, Object&gt;&gt; targets = ruleSet.apply(users, clock).fetch();
 * }
 * </pre>
 */
public class RuleSet {
    private static final Logger logger = Logger.getLogger(RuleSet.class.getName());

    private final String name;
    private final List<QuerySetRule> rules;
    private final PredicateCompiler compiler;
    private final Tracer tracer;

    public RuleSet(String name, List<QuerySetRule> rules, PredicateCompiler compiler, Tracer tracer) {
        this.name = name;
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        List<QuerySetRule> ordered = new ArrayList<>(Objects.requireNonNull(rules, "rules"));
        ordered.sort(QuerySetRule.APPLICATION_ORDER);
        this.rules = List.copyOf(ordered);
    }

    public static RuleSet of(Campaign campaign, PredicateCompiler compiler, Tracer tracer) {
        return new RuleSet(campaign.name(), campaign.rules(), compiler, tracer);
    }

    /**
     * Applies every rule in order.
     *
     * @param base  the collection to narrow
     * @param clock source of "now" shared by all rules of this evaluation
     * @return the narrowed collection; {@code base} itself when there are no rules
     * @throws com.drip.rules.api.exceptions.RuleCompilationException from the first rule that fails
     */
    public <T> Queryable<T> apply(Queryable<T> base, Clock clock) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(clock, "clock");
        if (rules.isEmpty()) {
            return base;
        }

        Span span = tracer.spanBuilder("apply-rule-set").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleSet", String.valueOf(name));
            span.setAttribute("ruleCount", rules.size());

            Queryable<T> current = base;
            for (QuerySetRule rule : rules) {
                current = compiler.apply(rule, current, clock);
            }
            return current;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Dry-runs the rules against a sample collection to find configuration errors.
     *
     * <p>Every rule is tried. A failing rule is reported and skipped; the following rules
     * continue from the last collection that was built successfully. Unknown method types
     * are reported here even though {@link #apply} tolerates them. No exception escapes.
     *
     * @param sample a representative collection; it may be empty
     * @param clock  source of "now"
     * @return the failures, one per failing rule
     */
    public <T> ValidationResult validate(Queryable<T> sample, Clock clock) {
        Span span = tracer.spanBuilder("validate-rule-set").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleSet", String.valueOf(name));
            span.setAttribute("ruleCount", rules.size());

            List<RuleValidationException> failures = new ArrayList<>();
            Queryable<T> current = sample;
            for (QuerySetRule rule : rules) {
                try {
                    current = compiler.apply(rule, current, clock, true);
                } catch (RuntimeException e) {
                    RuleValidationException failure = toFailure(rule, e);
                    failures.add(failure);
                    span.addEvent("rule-invalid");
                    logger.info("Rule set '" + name + "': rule " + rule.describe()
                            + " is invalid: " + failure.getMessage());
                }
            }
            span.setAttribute("failureCount", failures.size());
            return new ValidationResult(rules.size(), failures);
        } finally {
            span.end();
        }
    }

    /**
     * Checks a single rule against a sample collection, e.g. before saving it.
     *
     * @return the failure, or empty if the rule applies cleanly
     */
    public <T> Optional<RuleValidationException> validateRule(QuerySetRule rule, Queryable<T> sample, Clock clock) {
        try {
            compiler.apply(rule, sample, clock, true);
            return Optional.empty();
        } catch (RuntimeException e) {
            return Optional.of(toFailure(rule, e));
        }
    }

    private static RuleValidationException toFailure(QuerySetRule rule, RuntimeException e) {
        return new RuleValidationException(rule, ErrorCategory.of(e), e);
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the rules in application order.
     */
    public List<QuerySetRule> getRules() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public int size() {
        return rules.size();
    }
}
