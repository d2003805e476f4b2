package com.drip.rules.api.query;

import java.util.Objects;

/**
 * An aggregate computed over a related collection of each row.
 *
 * @param function     the aggregate function
 * @param relationPath the related collection, in the store's path syntax
 * @param distinct     whether duplicates are counted once
 */
public record Aggregation(Function function, String relationPath, boolean distinct) {

    public enum Function {
        COUNT
    }

    public Aggregation {
        Objects.requireNonNull(function, "Function cannot be null");
        Objects.requireNonNull(relationPath, "Relation path cannot be null");
    }

    public static Aggregation countDistinct(String relationPath) {
        return new Aggregation(Function.COUNT, relationPath, true);
    }
}
