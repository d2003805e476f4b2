/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.compiler;

import com.drip.rules.api.IRuleCompiler;
import com.drip.rules.api.exceptions.UnknownLookupException;
import com.drip.rules.api.exceptions.UnknownMethodException;
import com.drip.rules.api.model.LookupType;
import com.drip.rules.api.model.MethodType;
import com.drip.rules.api.model.QuerySetRule;
import com.drip.rules.api.query.FieldPredicate;
import com.drip.rules.api.query.Queryable;
import com.drip.rules.api.value.TypedValue;
import com.drip.rules.compiler.config.DripConfig;
import com.drip.rules.compiler.value.ValueParser;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Compiles a single rule into a filter or exclude step.
 *
 * <p>The compilation process:
 * <ol>
 *   <li>Resolve the lookup; anything outside the fourteen lookups is rejected.</li>
 *   <li>Resolve the effective field and add a count annotation if the field needs one.</li>
 *   <li>Parse the raw value (relative dates, field references, booleans, scalars).</li>
 *   <li>Build a {@link FieldPredicate} and apply it with the rule's method.</li>
 * </ol>
 * The input collection is never modified; store errors propagate unchanged.
 *
 * <p>A method type other than {@code filter}/{@code exclude} falls back to filter with a
 * warning, unless {@link DripConfig#isStrictMethodType()} is set.
 */
public class PredicateCompiler implements IRuleCompiler {
    private static final Logger logger = Logger.getLogger(PredicateCompiler.class.getName());

    private final DripConfig config;
    private final ValueParser valueParser;
    private final AnnotationResolver annotationResolver;
    private final Tracer tracer;

    public PredicateCompiler(DripConfig config, Tracer tracer) {
        this.config = Objects.requireNonNull(config, "config");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.valueParser = new ValueParser(config);
        this.annotationResolver = new AnnotationResolver(config);
    }

    public PredicateCompiler(Tracer tracer) {
        this(DripConfig.defaults(), tracer);
    }

    /**
     * Builds the typed predicate for a rule without touching any collection.
     *
     * @param rule  the rule
     * @param clock source of "now"
     * @return the predicate on the rule's effective field
     * @throws UnknownLookupException if the lookup is not recognized
     */
    public FieldPredicate buildPredicate(QuerySetRule rule, Clock clock) {
        LookupType lookup = resolveLookup(rule);
        ResolvedField resolved = annotationResolver.resolve(rule.fieldName());
        TypedValue value = valueParser.parse(rule.fieldValue(), clock);
        return new FieldPredicate(resolved.effectiveField(), lookup, value, config.getLookupSeparator());
    }

    @Override
    public <T> Queryable<T> apply(QuerySetRule rule, Queryable<T> collection, Clock clock) {
        return apply(rule, collection, clock, config.isStrictMethodType());
    }

    /**
     * Applies a rule, choosing how unknown method types are handled.
     *
     * @param strictMethod when true an unknown method type raises {@link UnknownMethodException}
     */
    public <T> Queryable<T> apply(QuerySetRule rule, Queryable<T> collection, Clock clock,
                                  boolean strictMethod) {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(clock, "clock");

        Span span = tracer.spanBuilder("apply-rule").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleId", String.valueOf(rule.id()));
            span.setAttribute("field", String.valueOf(rule.fieldName()));
            span.setAttribute("lookup", String.valueOf(rule.lookupType()));
            span.setAttribute("method", String.valueOf(rule.methodType()));

            MethodType method = resolveMethod(rule, strictMethod);
            LookupType lookup = resolveLookup(rule);

            ResolvedField resolved = annotationResolver.resolve(rule.fieldName());
            Queryable<T> annotated = annotationResolver.applyAnnotation(resolved, collection);

            TypedValue value = valueParser.parse(rule.fieldValue(), clock);
            FieldPredicate predicate = new FieldPredicate(
                    resolved.effectiveField(), lookup, value, config.getLookupSeparator());
            span.setAttribute("lookupKey", predicate.lookupKey());

            logger.fine(() -> "Applying rule " + rule.describe() + " as " + method + " " + predicate);

            return switch (method) {
                case FILTER -> annotated.filter(predicate);
                case EXCLUDE -> annotated.exclude(predicate);
            };
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private LookupType resolveLookup(QuerySetRule rule) {
        return rule.lookup().orElseThrow(() -> new UnknownLookupException(rule.lookupType()));
    }

    private MethodType resolveMethod(QuerySetRule rule, boolean strictMethod) {
        return rule.method().orElseGet(() -> {
            if (strictMethod) {
                throw new UnknownMethodException(rule.methodType());
            }
            logger.warning("Unknown method type '" + rule.methodType() + "' on rule "
                    + rule.describe() + ", applying as filter");
            return MethodType.FILTER;
        });
    }

    public DripConfig getConfig() {
        return config;
    }

    public ValueParser getValueParser() {
        return valueParser;
    }

    public AnnotationResolver getAnnotationResolver() {
        return annotationResolver;
    }
}
