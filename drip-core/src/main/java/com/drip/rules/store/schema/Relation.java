/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.store.schema;

import java.util.Objects;

/**
 * A named link from one record type to another.
 *
 * @param name        the path segment that traverses the relation
 * @param target      schema of the related records
 * @param cardinality whether a record has one or many related records
 * @param foreignKey  for {@link Cardinality#MANY} the column on the target holding the
 *                    owner's id; for {@link Cardinality#ONE} the column on the owner
 *                    holding the target's id
 */
public record Relation(String name, RecordSchema target, Cardinality cardinality, String foreignKey) {

    public enum Cardinality {
        ONE,
        MANY
    }

    public Relation {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(cardinality, "cardinality");
        Objects.requireNonNull(foreignKey, "foreignKey");
    }

    public boolean isMultiValued() {
        return cardinality == Cardinality.MANY;
    }
}
