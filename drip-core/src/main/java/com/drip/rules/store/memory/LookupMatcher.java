/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.store.memory;

import com.drip.rules.api.exceptions.InvalidValueException;
import com.drip.rules.api.model.LookupType;
import com.drip.rules.api.query.FieldPredicate;
import com.drip.rules.api.value.FieldReference;
import com.drip.rules.api.value.TypedValue;
import com.drip.rules.store.schema.Literals;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Compiles a {@link FieldPredicate} into a row test with relational-store semantics.
 *
 * <p>A missing (null) value never matches. When the field crosses a multi-valued
 * relation the row matches if any reachable value matches. Literals are coerced to the
 * field's type and regular expressions compiled up front, so bad input fails when the
 * predicate is added rather than when rows are fetched.
 */
final class LookupMatcher {

    private LookupMatcher() {
    }

    static Predicate<Map<String, Object>> compile(FieldPredicate predicate, Operand left, Operand reference) {
        if (reference != null) {
            BiPredicate<Object, Object> test = referenceTest(predicate, left, reference);
            return row -> {
                List<Object> leftValues = left.values(row);
                if (leftValues.isEmpty()) {
                    return false;
                }
                List<Object> rightValues = reference.values(row);
                for (Object l : leftValues) {
                    for (Object r : rightValues) {
                        if (test.test(l, r)) {
                            return true;
                        }
                    }
                }
                return false;
            };
        }

        Predicate<Object> test = literalTest(predicate, left);
        return row -> {
            for (Object value : left.values(row)) {
                if (test.test(value)) {
                    return true;
                }
            }
            return false;
        };
    }

    // ========================================================================
    // LITERAL OPERANDS
    // ========================================================================

    private static Predicate<Object> literalTest(FieldPredicate predicate, Operand left) {
        LookupType lookup = predicate.lookup();
        TypedValue value = predicate.value();
        ZoneId zone = left.zone();

        switch (lookup.kind()) {
            case EQUALITY: {
                if (lookup.isCaseInsensitive()) {
                    String expected = Literals.text(value);
                    return v -> text(v).equalsIgnoreCase(expected);
                }
                Object expected = Literals.coerce(predicate.field(), left.type(), value, zone);
                return v -> compare(v, expected, zone) == 0;
            }
            case ORDERING: {
                Object expected = Literals.coerce(predicate.field(), left.type(), value, zone);
                return v -> ordered(lookup, compare(v, expected, zone));
            }
            case REGEX: {
                Pattern pattern = Literals.pattern(predicate.field(), Literals.text(value), lookup.isCaseInsensitive());
                return v -> pattern.matcher(text(v)).find();
            }
            default: {
                String operand = Literals.text(value);
                return v -> textMatch(lookup, text(v), operand);
            }
        }
    }

    // ========================================================================
    // FIELD REFERENCES
    // ========================================================================

    private static BiPredicate<Object, Object> referenceTest(FieldPredicate predicate, Operand left, Operand right) {
        LookupType lookup = predicate.lookup();
        ZoneId zone = left.zone();

        switch (lookup.kind()) {
            case EQUALITY:
                if (lookup.isCaseInsensitive()) {
                    return (l, r) -> text(l).equalsIgnoreCase(text(r));
                }
                requireComparable(predicate, left, right);
                return (l, r) -> compare(l, r, zone) == 0;
            case ORDERING:
                requireComparable(predicate, left, right);
                return (l, r) -> ordered(lookup, compare(l, r, zone));
            case REGEX:
                return (l, r) -> Literals.pattern(predicate.field(), text(r), lookup.isCaseInsensitive())
                        .matcher(text(l)).find();
            default:
                return (l, r) -> textMatch(lookup, text(l), text(r));
        }
    }

    private static void requireComparable(FieldPredicate predicate, Operand left, Operand right) {
        if (!left.type().isComparableWith(right.type())) {
            throw new InvalidValueException(predicate.field(),
                    "Cannot compare " + left.type() + " field '" + left.field() + "' with "
                            + right.type() + " field '" + right.field() + "'");
        }
    }

    /**
     * Returns the referenced field name if the predicate compares against another field.
     */
    static String referencedField(FieldPredicate predicate) {
        return predicate.value() instanceof FieldReference ref ? ref.fieldName() : null;
    }

    // ========================================================================
    // COMPARISON HELPERS
    // ========================================================================

    private static boolean ordered(LookupType lookup, int cmp) {
        return switch (lookup) {
            case GT -> cmp > 0;
            case GTE -> cmp >= 0;
            case LT -> cmp < 0;
            case LTE -> cmp <= 0;
            default -> throw new IllegalArgumentException("Not an ordering lookup: " + lookup);
        };
    }

    private static boolean textMatch(LookupType lookup, String value, String operand) {
        if (lookup.isCaseInsensitive()) {
            value = value.toLowerCase(Locale.ROOT);
            operand = operand.toLowerCase(Locale.ROOT);
        }
        return switch (lookup.kind()) {
            case CONTAINS -> value.contains(operand);
            case STARTS_WITH -> value.startsWith(operand);
            case ENDS_WITH -> value.endsWith(operand);
            default -> throw new IllegalArgumentException("Not a text lookup: " + lookup);
        };
    }

    private static String text(Object canonical) {
        return Literals.valueText(canonical);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compare(Object a, Object b, ZoneId zone) {
        if (a instanceof Number && b instanceof Number) {
            return decimal(a).compareTo(decimal(b));
        }
        if (a instanceof LocalDate date && b instanceof Instant instant) {
            return date.atStartOfDay(zone).toInstant().compareTo(instant);
        }
        if (a instanceof Instant instant && b instanceof LocalDate date) {
            return instant.compareTo(date.atStartOfDay(zone).toInstant());
        }
        return ((Comparable) a).compareTo(b);
    }

    private static BigDecimal decimal(Object number) {
        if (number instanceof BigDecimal bd) return bd;
        if (number instanceof Long || number instanceof Integer) return BigDecimal.valueOf(((Number) number).longValue());
        return BigDecimal.valueOf(((Number) number).doubleValue());
    }
}
