/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.store.sql;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * SQL differences between the supported databases.
 */
public enum SqlDialect {
    H2 {
        @Override
        String regexMatch(String expression, String pattern, boolean caseInsensitive) {
            return "REGEXP_LIKE(" + expression + ", " + pattern + ", '" + (caseInsensitive ? "i" : "c") + "')";
        }
    },
    POSTGRESQL {
        @Override
        String regexMatch(String expression, String pattern, boolean caseInsensitive) {
            return expression + (caseInsensitive ? " ~* " : " ~ ") + pattern;
        }
    };

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Renders a regular expression search (not a full match) of {@code pattern} in
     * {@code expression}.
     */
    abstract String regexMatch(String expression, String pattern, boolean caseInsensitive);

    /**
     * Renders an expression as text, for text lookups on non-text columns.
     */
    String asText(String expression) {
        return "CAST(" + expression + " AS VARCHAR)";
    }

    /**
     * Checks that a table or column name can be inlined into SQL unquoted.
     *
     * @throws IllegalArgumentException for anything but a plain identifier
     */
    static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a valid SQL identifier: " + name);
        }
        return name;
    }

    /**
     * Picks the dialect from the connection's database product name.
     *
     * @throws IllegalArgumentException for an unsupported database
     */
    public static SqlDialect detect(Connection connection) throws SQLException {
        String product = connection.getMetaData().getDatabaseProductName();
        String normalized = product == null ? "" : product.toLowerCase(Locale.ROOT);
        if (normalized.contains("h2")) {
            return H2;
        }
        if (normalized.contains("postgres")) {
            return POSTGRESQL;
        }
        throw new IllegalArgumentException("Unsupported database: " + product);
    }
}
