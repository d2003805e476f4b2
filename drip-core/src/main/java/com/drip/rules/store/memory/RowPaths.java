/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.store.memory;

import com.drip.rules.store.schema.Relation;
import com.drip.rules.store.schema.ResolvedPath;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Row traversal along resolved relation paths.
 */
final class RowPaths {

    private RowPaths() {
    }

    /**
     * Returns the non-null leaf values reachable from the row.
     */
    static List<Object> leafValues(Map<String, Object> row, ResolvedPath path) {
        List<Object> values = new ArrayList<>();
        for (Map<String, Object> record : follow(row, path.relations())) {
            Object value = record.get(path.field());
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    /**
     * Returns the records reached by following the relations from the row.
     */
    static List<Map<String, Object>> follow(Map<String, Object> row, List<Relation> relations) {
        List<Map<String, Object>> current = List.of(row);
        for (Relation relation : relations) {
            List<Map<String, Object>> next = new ArrayList<>();
            for (Map<String, Object> record : current) {
                collect(record.get(relation.name()), relation, next);
            }
            current = next;
        }
        return current;
    }

    @SuppressWarnings("unchecked")
    private static void collect(Object related, Relation relation, List<Map<String, Object>> into) {
        if (related == null) {
            return;
        }
        if (related instanceof Map<?, ?> map) {
            into.add((Map<String, Object>) map);
        } else if (related instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element instanceof Map<?, ?> map) {
                    into.add((Map<String, Object>) map);
                } else if (element != null) {
                    throw new IllegalStateException("Relation '" + relation.name()
                            + "' holds a " + element.getClass().getSimpleName() + ", expected a record map");
                }
            }
        } else {
            throw new IllegalStateException("Relation '" + relation.name()
                    + "' holds a " + related.getClass().getSimpleName() + ", expected a record map or collection");
        }
    }
}
