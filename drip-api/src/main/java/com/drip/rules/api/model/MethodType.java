/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Whether the rows matched by a rule are kept or removed.
 */
public enum MethodType {
    /** Keep matching rows. */
    FILTER("filter", "Filter"),

    /** Remove matching rows. */
    EXCLUDE("exclude", "Exclude");

    private final String code;
    private final String label;

    MethodType(String code, String label) {
        this.code = code;
        this.label = label;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    /**
     * Safely converts a stored method code to a MethodType.
     *
     * @param text the method code (e.g., "filter")
     * @return the matching MethodType, or empty if the code is not recognized
     */
    public static Optional<MethodType> fromCode(String text) {
        if (text == null) return Optional.empty();
        for (MethodType type : values()) {
            if (type.code.equals(text)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
