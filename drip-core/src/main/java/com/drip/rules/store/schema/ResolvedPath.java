/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.store.schema;

import java.util.List;

/**
 * A field path resolved against a schema: the relations traversed, then the leaf field.
 *
 * @param relations relations in traversal order; empty for a field of the record itself
 * @param field     the leaf field on the last schema reached
 * @param type      the leaf field's type
 */
public record ResolvedPath(List<Relation> relations, String field, FieldType type) {

    public ResolvedPath {
        relations = List.copyOf(relations);
    }

    public static ResolvedPath local(String field, FieldType type) {
        return new ResolvedPath(List.of(), field, type);
    }

    public boolean isLocal() {
        return relations.isEmpty();
    }

    /**
     * Whether more than one value can be reached from a single record.
     */
    public boolean isMultiValued() {
        return relations.stream().anyMatch(Relation::isMultiValued);
    }
}
