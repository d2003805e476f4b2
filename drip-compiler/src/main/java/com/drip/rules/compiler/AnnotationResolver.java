/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.compiler;

import com.drip.rules.api.query.Aggregation;
import com.drip.rules.api.query.Annotation;
import com.drip.rules.api.query.Queryable;
import com.drip.rules.compiler.config.DripConfig;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Turns {@code <relation>__count} field names into a distinct-count annotation.
 *
 * <p>{@code orders__count} becomes the annotation {@code num_orders = COUNT(DISTINCT orders)}
 * and the predicate addresses {@code num_orders}. Nested relations keep their path in the
 * aggregation and flatten it in the alias: {@code orders__items__count} counts
 * {@code orders__items} as {@code num_orders_items}. Any other field name is returned
 * unchanged.
 */
public class AnnotationResolver {
    private static final Logger logger = Logger.getLogger(AnnotationResolver.class.getName());

    private final DripConfig config;

    public AnnotationResolver(DripConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public AnnotationResolver() {
        this(DripConfig.defaults());
    }

    /**
     * Resolves the effective field name of a rule.
     *
     * @param fieldName the rule's field name
     * @return the effective field and, for count fields, the annotation providing it
     */
    public ResolvedField resolve(String fieldName) {
        Objects.requireNonNull(fieldName, "fieldName");
        if (!isCountField(fieldName)) {
            return ResolvedField.direct(fieldName);
        }
        String relation = fieldName.substring(0, fieldName.length() - config.getCountSuffix().length());
        String alias = config.getAnnotationPrefix()
                + relation.replace(config.getLookupSeparator(), "_");
        return ResolvedField.annotated(new Annotation(alias, Aggregation.countDistinct(relation)));
    }

    public boolean isCountField(String fieldName) {
        return fieldName.endsWith(config.getCountSuffix());
    }

    /**
     * Adds the resolved annotation to a collection unless an annotation with the same
     * alias is already there.
     *
     * @return the annotated collection, or the input when nothing had to be added
     */
    public <T> Queryable<T> applyAnnotation(ResolvedField resolved, Queryable<T> collection) {
        if (resolved.annotation().isEmpty()) {
            return collection;
        }
        Annotation annotation = resolved.annotation().get();
        Annotation existing = collection.annotations().get(annotation.alias());
        if (annotation.equals(existing)) {
            logger.fine(() -> "Annotation '" + annotation.alias() + "' already present, skipping");
            return collection;
        }
        return collection.annotate(annotation);
    }
}
