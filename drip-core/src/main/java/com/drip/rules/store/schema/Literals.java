/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.store.schema;

import com.drip.rules.api.exceptions.InvalidValueException;
import com.drip.rules.api.value.BooleanValue;
import com.drip.rules.api.value.TypedValue;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Preparation of rule literals shared by the store adapters.
 */
public final class Literals {

    private Literals() {
    }

    /**
     * Coerces a literal to a field's canonical type.
     *
     * @throws InvalidValueException if the literal does not fit the field type
     */
    public static Object coerce(String field, FieldType type, TypedValue value, ZoneId zone) {
        Object literal = type == FieldType.STRING ? text(value) : value.value();
        try {
            return type.coerce(literal, zone);
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new InvalidValueException(field,
                    "Field '" + field + "' expected a " + type + " value but got '" + text(value) + "': "
                            + e.getMessage(), e);
        }
    }

    /**
     * Compiles a regular expression.
     *
     * @throws InvalidValueException if the pattern is malformed
     */
    public static Pattern pattern(String field, String regex, boolean caseInsensitive) {
        try {
            return caseInsensitive
                    ? Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                    : Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new InvalidValueException(field,
                    "Invalid regular expression '" + regex + "': " + e.getDescription(), e);
        }
    }

    /**
     * Text form of a rule literal as it was written, e.g. {@code True} for a boolean.
     */
    public static String text(TypedValue value) {
        if (value instanceof BooleanValue b) {
            return Boolean.TRUE.equals(b.value()) ? "True" : "False";
        }
        return String.valueOf(value.value());
    }

    /**
     * Text form of a canonical stored value.
     */
    public static String valueText(Object canonical) {
        if (canonical instanceof Boolean b) return b ? "True" : "False";
        if (canonical instanceof BigDecimal bd) return bd.toPlainString();
        return canonical.toString();
    }
}
