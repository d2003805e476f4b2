/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.store.sql;

import com.drip.rules.api.exceptions.InvalidValueException;
import com.drip.rules.api.model.LookupType;
import com.drip.rules.api.query.Annotation;
import com.drip.rules.api.query.FieldPredicate;
import com.drip.rules.api.value.FieldReference;
import com.drip.rules.api.value.TypedValue;
import com.drip.rules.store.schema.FieldType;
import com.drip.rules.store.schema.Literals;
import com.drip.rules.store.schema.RecordSchema;
import com.drip.rules.store.schema.Relation;
import com.drip.rules.store.schema.ResolvedPath;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One filter or exclude step, resolved against the schema and rendered as a WHERE term.
 *
 * <p>A field across relations becomes an {@code EXISTS} subquery, a count annotation a
 * correlated {@code COUNT} subquery. Exclude renders as {@code NOT COALESCE((term), FALSE)}
 * so that rows whose term is unknown (null) are kept.
 */
final class SqlCondition {

    /**
     * A column of the root table, a column reached through relations, or an annotation.
     */
    private record Target(String name, FieldType type, ResolvedPath path, Annotation annotation,
                          List<Relation> countRelations) {

        boolean isAnnotation() {
            return annotation != null;
        }

        boolean crossesRelations() {
            return path != null && !path.isLocal();
        }
    }

    private final FieldPredicate predicate;
    private final boolean negated;
    private final Target left;
    private final Target reference;
    private final Object operand;

    private SqlCondition(FieldPredicate predicate, boolean negated, Target left, Target reference, Object operand) {
        this.predicate = predicate;
        this.negated = negated;
        this.left = left;
        this.reference = reference;
        this.operand = operand;
    }

    /**
     * Resolves the predicate's field and prepares its operand.
     *
     * @throws com.drip.rules.api.exceptions.UnknownFieldException if a field does not resolve
     * @throws InvalidValueException if the literal does not fit the field
     */
    static SqlCondition of(FieldPredicate predicate, boolean negated, RecordSchema schema,
                           Map<String, Annotation> annotations, String separator) {
        Target left = target(predicate.field(), predicate.separator(), schema, annotations, separator);

        if (predicate.value() instanceof FieldReference ref) {
            Target reference = target(ref.fieldName(), predicate.separator(), schema, annotations, separator);
            if (reference.crossesRelations()) {
                throw new InvalidValueException(predicate.field(),
                        "Field reference '" + ref.fieldName() + "' crosses a relation, which SQL rules do not support");
            }
            LookupType.Kind kind = predicate.lookup().kind();
            boolean compares = kind == LookupType.Kind.ORDERING
                    || (kind == LookupType.Kind.EQUALITY && !predicate.lookup().isCaseInsensitive());
            if (compares && !left.type().isComparableWith(reference.type())) {
                throw new InvalidValueException(predicate.field(),
                        "Cannot compare " + left.type() + " field '" + left.name() + "' with "
                                + reference.type() + " field '" + reference.name() + "'");
            }
            return new SqlCondition(predicate, negated, left, reference, null);
        }

        return new SqlCondition(predicate, negated, left, null, operand(predicate, left, schema));
    }

    private static Target target(String field, String pathSeparator, RecordSchema schema,
                                 Map<String, Annotation> annotations, String annotationSeparator) {
        Annotation annotation = annotations.get(field);
        if (annotation != null) {
            List<Relation> relations = schema.resolveRelations(annotation.aggregation().relationPath(), annotationSeparator);
            return new Target(field, FieldType.INTEGER, null, annotation, relations);
        }
        ResolvedPath path = schema.resolve(field, pathSeparator);
        return new Target(field, path.type(), path, null, null);
    }

    private static Object operand(FieldPredicate predicate, Target left, RecordSchema schema) {
        LookupType lookup = predicate.lookup();
        TypedValue value = predicate.value();
        String text = Literals.text(value);

        switch (lookup.kind()) {
            case EQUALITY:
                if (lookup.isCaseInsensitive()) {
                    return text.toLowerCase(Locale.ROOT);
                }
                return Literals.coerce(predicate.field(), left.type(), value, schema.getZone());
            case ORDERING:
                return Literals.coerce(predicate.field(), left.type(), value, schema.getZone());
            case REGEX:
                Literals.pattern(predicate.field(), text, lookup.isCaseInsensitive());
                return text;
            default:
                String escaped = escapeLike(lookup.isCaseInsensitive() ? text.toLowerCase(Locale.ROOT) : text);
                return switch (lookup.kind()) {
                    case CONTAINS -> "%" + escaped + "%";
                    case STARTS_WITH -> escaped + "%";
                    default -> "%" + escaped;
                };
        }
    }

    private static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    // ========================================================================
    // RENDERING
    // ========================================================================

    void render(SqlQueryBuilder q, RecordSchema schema) {
        q.append(negated ? "NOT COALESCE((" : "(");
        if (left.crossesRelations()) {
            SqlQueryBuilder.RelationChain chain =
                    q.relationChain(schema, SqlQueryBuilder.ROOT_ALIAS, left.path().relations());
            q.append("EXISTS (SELECT 1").append(chain.sql()).append(" AND ");
            comparison(q, chain.lastAlias() + "." + SqlDialect.identifier(left.path().field()), schema);
            q.append(")");
        } else {
            comparison(q, expression(left, q, schema), schema);
        }
        q.append(negated ? "), FALSE)" : ")");
    }

    private void comparison(SqlQueryBuilder q, String leftExpression, RecordSchema schema) {
        LookupType lookup = predicate.lookup();
        SqlDialect dialect = q.dialect();
        String rightExpression = reference == null ? "?" : expression(reference, q, schema);

        String leftText = left.type() == FieldType.STRING ? leftExpression : dialect.asText(leftExpression);
        String rightText = reference == null || reference.type() == FieldType.STRING
                ? rightExpression
                : dialect.asText(rightExpression);
        if (lookup.isCaseInsensitive() && lookup.kind() != LookupType.Kind.REGEX) {
            leftText = "LOWER(" + leftText + ")";
            if (reference != null) {
                rightText = "LOWER(" + rightText + ")";
            }
        }

        switch (lookup.kind()) {
            case EQUALITY:
                if (lookup.isCaseInsensitive()) {
                    q.append(leftText + " = " + rightText);
                } else {
                    q.append(leftExpression + " = " + rightExpression);
                }
                break;
            case ORDERING:
                q.append(leftExpression + " " + operator(lookup) + " " + rightExpression);
                break;
            case REGEX:
                q.append(dialect.regexMatch(leftText, rightText, lookup.isCaseInsensitive()));
                break;
            default:
                if (reference == null) {
                    q.append(leftText + " LIKE ? ESCAPE '\\'");
                } else {
                    q.append(leftText + " LIKE " + likePattern(lookup, rightText));
                }
                break;
        }
        if (reference == null) {
            q.parameter(operand);
        }
    }

    private static String likePattern(LookupType lookup, String expression) {
        return switch (lookup.kind()) {
            case CONTAINS -> "CONCAT('%', " + expression + ", '%')";
            case STARTS_WITH -> "CONCAT(" + expression + ", '%')";
            default -> "CONCAT('%', " + expression + ")";
        };
    }

    private static String operator(LookupType lookup) {
        return switch (lookup) {
            case GT -> ">";
            case GTE -> ">=";
            case LT -> "<";
            case LTE -> "<=";
            default -> throw new IllegalArgumentException("Not an ordering lookup: " + lookup);
        };
    }

    private static String expression(Target target, SqlQueryBuilder q, RecordSchema schema) {
        if (target.isAnnotation()) {
            return countExpression(target.annotation(), target.countRelations(), q, schema);
        }
        return SqlQueryBuilder.ROOT_ALIAS + "." + SqlDialect.identifier(target.path().field());
    }

    /**
     * Renders the correlated subquery computing a count annotation for the root row.
     */
    static String countExpression(Annotation annotation, List<Relation> relations, SqlQueryBuilder q,
                                  RecordSchema schema) {
        SqlQueryBuilder.RelationChain chain = q.relationChain(schema, SqlQueryBuilder.ROOT_ALIAS, relations);
        RecordSchema counted = relations.get(relations.size() - 1).target();
        String distinct = annotation.aggregation().distinct() ? "DISTINCT " : "";
        return "(SELECT COUNT(" + distinct + chain.lastAlias() + "." + SqlDialect.identifier(counted.getIdField())
                + ")" + chain.sql() + ")";
    }

    FieldPredicate predicate() {
        return predicate;
    }

    boolean negated() {
        return negated;
    }
}
