/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.store.memory;

import com.drip.rules.api.query.Aggregation;
import com.drip.rules.api.query.Annotation;
import com.drip.rules.api.query.FieldPredicate;
import com.drip.rules.api.query.Queryable;
import com.drip.rules.store.schema.RecordSchema;
import com.drip.rules.store.schema.Relation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * {@link Queryable} over rows held in memory, one {@code Map} per record.
 *
 * <p>Related records are nested in the row under the relation name: a {@code Map} for a
 * single related record, a {@code Collection} of maps for many. Field names and literal
 * values are checked against the {@link RecordSchema} when a predicate is added; rows are
 * only read on {@link #fetch()}.
 *
 * <p>Instances are immutable. Fetched rows carry annotation values under their aliases.
 */
public final class InMemoryQueryable implements Queryable<Map<String, Object>> {
    private static final Logger logger = Logger.getLogger(InMemoryQueryable.class.getName());

    private final RecordSchema schema;
    private final List<Map<String, Object>> rows;
    private final String separator;
    private final Map<String, Annotation> annotations;
    private final List<Step> steps;

    private record Step(FieldPredicate predicate, Predicate<Map<String, Object>> test, boolean negated) {
        boolean keeps(Map<String, Object> row) {
            return test.test(row) != negated;
        }
    }

    private record CountAnnotation(Annotation annotation, List<Relation> relations, String idField) {
    }

    public InMemoryQueryable(RecordSchema schema, Collection<? extends Map<String, Object>> rows) {
        this(schema, rows, FieldPredicate.DEFAULT_SEPARATOR);
    }

    public InMemoryQueryable(RecordSchema schema, Collection<? extends Map<String, Object>> rows, String separator) {
        this(Objects.requireNonNull(schema, "schema"),
                List.copyOf(Objects.requireNonNull(rows, "rows")),
                Objects.requireNonNull(separator, "separator"),
                Map.of(),
                List.of());
    }

    private InMemoryQueryable(RecordSchema schema, List<Map<String, Object>> rows, String separator,
                              Map<String, Annotation> annotations, List<Step> steps) {
        this.schema = schema;
        this.rows = rows;
        this.separator = separator;
        this.annotations = annotations;
        this.steps = steps;
    }

    @Override
    public InMemoryQueryable filter(FieldPredicate predicate) {
        return withStep(predicate, false);
    }

    @Override
    public InMemoryQueryable exclude(FieldPredicate predicate) {
        return withStep(predicate, true);
    }

    private InMemoryQueryable withStep(FieldPredicate predicate, boolean negated) {
        Objects.requireNonNull(predicate, "predicate");
        Operand left = operand(predicate.field(), predicate.separator());
        String referenced = LookupMatcher.referencedField(predicate);
        Operand right = referenced == null ? null : operand(referenced, predicate.separator());

        Predicate<Map<String, Object>> test = LookupMatcher.compile(predicate, left, right);
        logger.fine(() -> schema.getName() + (negated ? ": exclude " : ": filter ") + predicate);

        List<Step> next = new ArrayList<>(steps);
        next.add(new Step(predicate, test, negated));
        return new InMemoryQueryable(schema, rows, separator, annotations, List.copyOf(next));
    }

    private Operand operand(String field, String pathSeparator) {
        Annotation annotation = annotations.get(field);
        if (annotation != null) {
            return Operand.annotation(annotation, schema.getZone());
        }
        return Operand.field(field, schema.resolve(field, pathSeparator), schema.getZone());
    }

    @Override
    public InMemoryQueryable annotate(Annotation annotation) {
        Objects.requireNonNull(annotation, "annotation");
        String alias = annotation.alias();

        Annotation existing = annotations.get(alias);
        if (existing != null) {
            if (existing.equals(annotation)) {
                return this;
            }
            throw new IllegalArgumentException("The annotation '" + alias + "' conflicts with an existing annotation");
        }
        if (schema.hasField(alias)) {
            throw new IllegalArgumentException("The annotation '" + alias + "' conflicts with a field on " + schema.getName());
        }
        if (annotation.aggregation().function() != Aggregation.Function.COUNT) {
            throw new IllegalArgumentException("Unsupported aggregation: " + annotation.aggregation());
        }
        schema.resolveRelations(annotation.aggregation().relationPath(), separator);

        logger.fine(() -> schema.getName() + ": annotate " + alias + "=" + annotation.aggregation());
        Map<String, Annotation> next = new LinkedHashMap<>(annotations);
        next.put(alias, annotation);
        return new InMemoryQueryable(schema, rows, separator, Collections.unmodifiableMap(next), steps);
    }

    @Override
    public Map<String, Annotation> annotations() {
        return annotations;
    }

    @Override
    public List<Map<String, Object>> fetch() {
        List<CountAnnotation> counts = countAnnotations();
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            Map<String, Object> annotated = annotate(row, counts);
            if (keeps(annotated)) {
                result.add(annotated);
            }
        }
        logger.fine(() -> schema.getName() + ": " + result.size() + " of " + rows.size() + " rows after "
                + steps.size() + " step(s)");
        return Collections.unmodifiableList(result);
    }

    private boolean keeps(Map<String, Object> row) {
        for (Step step : steps) {
            if (!step.keeps(row)) {
                return false;
            }
        }
        return true;
    }

    private List<CountAnnotation> countAnnotations() {
        List<CountAnnotation> counts = new ArrayList<>(annotations.size());
        for (Annotation annotation : annotations.values()) {
            List<Relation> relations = schema.resolveRelations(annotation.aggregation().relationPath(), separator);
            String idField = relations.get(relations.size() - 1).target().getIdField();
            counts.add(new CountAnnotation(annotation, relations, idField));
        }
        return counts;
    }

    private static Map<String, Object> annotate(Map<String, Object> row, List<CountAnnotation> counts) {
        if (counts.isEmpty()) {
            return row;
        }
        Map<String, Object> annotated = new LinkedHashMap<>(row);
        for (CountAnnotation count : counts) {
            annotated.put(count.annotation().alias(), countRelated(row, count));
        }
        return Collections.unmodifiableMap(annotated);
    }

    private static long countRelated(Map<String, Object> row, CountAnnotation count) {
        List<Map<String, Object>> related = RowPaths.follow(row, count.relations());
        if (!count.annotation().aggregation().distinct()) {
            return related.size();
        }
        Set<Object> ids = new HashSet<>();
        Set<Map<String, Object>> anonymous = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Map<String, Object> record : related) {
            Object id = record.get(count.idField());
            if (id != null) {
                ids.add(id);
            } else {
                anonymous.add(record);
            }
        }
        return ids.size() + anonymous.size();
    }

    public RecordSchema getSchema() {
        return schema;
    }

    /**
     * Returns the filter/exclude steps added so far, e.g. {@code [filter age__gte=18]}.
     */
    public List<String> describeSteps() {
        List<String> described = new ArrayList<>(steps.size());
        for (Step step : steps) {
            described.add((step.negated() ? "exclude " : "filter ") + step.predicate());
        }
        return described;
    }

    @Override
    public String toString() {
        return "InMemoryQueryable{" + schema.getName() + ", rows=" + rows.size()
                + ", annotations=" + annotations.keySet() + ", steps=" + describeSteps() + '}';
    }
}
