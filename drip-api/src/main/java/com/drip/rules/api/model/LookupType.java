/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The fourteen comparison operators a rule may use.
 *
 * <p>Codes follow the store's lookup naming, so a rule on {@code age} with lookup
 * {@code gte} addresses {@code age__gte}.
 */
public enum LookupType {
    EXACT("exact", "exactly", Kind.EQUALITY, false),
    IEXACT("iexact", "exactly (case insensitive)", Kind.EQUALITY, true),
    CONTAINS("contains", "contains", Kind.CONTAINS, false),
    ICONTAINS("icontains", "contains (case insensitive)", Kind.CONTAINS, true),
    REGEX("regex", "regex", Kind.REGEX, false),
    IREGEX("iregex", "regex (case insensitive)", Kind.REGEX, true),
    GT("gt", "greater than", Kind.ORDERING, false),
    GTE("gte", "greater than or equal to", Kind.ORDERING, false),
    LT("lt", "less than", Kind.ORDERING, false),
    LTE("lte", "less than or equal to", Kind.ORDERING, false),
    STARTSWITH("startswith", "starts with", Kind.STARTS_WITH, false),
    ISTARTSWITH("istartswith", "starts with (case insensitive)", Kind.STARTS_WITH, true),
    ENDSWITH("endswith", "ends with", Kind.ENDS_WITH, false),
    IENDSWITH("iendswith", "ends with (case insensitive)", Kind.ENDS_WITH, true);

    /**
     * Comparison family, shared by the case-sensitive and case-insensitive variants.
     */
    public enum Kind {
        EQUALITY, CONTAINS, REGEX, ORDERING, STARTS_WITH, ENDS_WITH
    }

    private final String code;
    private final String label;
    private final Kind kind;
    private final boolean caseInsensitive;

    LookupType(String code, String label, Kind kind, boolean caseInsensitive) {
        this.code = code;
        this.label = label;
        this.kind = kind;
        this.caseInsensitive = caseInsensitive;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    /**
     * Checks if this lookup compares values by their natural ordering.
     */
    public boolean isOrdering() {
        return kind == Kind.ORDERING;
    }

    /**
     * Checks if this lookup only makes sense on textual values.
     */
    public boolean isTextual() {
        return kind == Kind.CONTAINS || kind == Kind.REGEX
                || kind == Kind.STARTS_WITH || kind == Kind.ENDS_WITH;
    }

    /**
     * Safely converts a stored lookup code to a LookupType.
     *
     * @param text the lookup code (e.g., "icontains")
     * @return the matching LookupType, or empty if the code is not one of the fourteen lookups
     */
    public static Optional<LookupType> fromCode(String text) {
        if (text == null) return Optional.empty();
        for (LookupType type : values()) {
            if (type.code.equals(text)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
