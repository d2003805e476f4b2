/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.store.memory;

import com.drip.rules.api.query.Annotation;
import com.drip.rules.store.schema.FieldType;
import com.drip.rules.store.schema.ResolvedPath;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One side of a comparison: a field path or annotation alias, read from a row as a list
 * of canonical values. Nulls are dropped, so an empty list means "no value".
 */
record Operand(String field, FieldType type, ResolvedPath path, ZoneId zone) {

    static Operand annotation(Annotation annotation, ZoneId zone) {
        return new Operand(annotation.alias(), FieldType.INTEGER, null, zone);
    }

    static Operand field(String field, ResolvedPath path, ZoneId zone) {
        return new Operand(field, path.type(), path, zone);
    }

    List<Object> values(Map<String, Object> row) {
        List<Object> raw = path == null
                ? singleton(row.get(field))
                : RowPaths.leafValues(row, path);

        List<Object> values = new ArrayList<>(raw.size());
        for (Object value : raw) {
            values.add(canonical(value));
        }
        return values;
    }

    private Object canonical(Object value) {
        try {
            return type.coerce(value, zone);
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new IllegalStateException(
                    "Stored value of '" + field + "' is not a valid " + type + ": " + e.getMessage(), e);
        }
    }

    private static List<Object> singleton(Object value) {
        return value == null ? List.of() : List.of(value);
    }
}
