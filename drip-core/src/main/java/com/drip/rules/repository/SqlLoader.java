/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.repository;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads named SQL statements and DDL scripts from classpath resources.
 *
 * <p><b>Query Format:</b>
 * <pre>
 * -- @name: query_name
 * SELECT * FROM table WHERE id = ?;
 * </pre>
 */
public final class SqlLoader {

    private static final Logger logger = Logger.getLogger(SqlLoader.class.getName());
    private static final String NAME_MARKER = "-- @name:";

    private SqlLoader() {
    }

    /**
     * Loads all named queries from a resource file.
     *
     * @param resourcePath path to SQL file (e.g., "sql/drip-queries.sql")
     * @return map of query names to SQL strings, without trailing semicolons
     */
    public static Map<String, String> loadQueries(String resourcePath) {
        Map<String, String> queries = new HashMap<>();
        String currentQueryName = null;
        StringBuilder currentQuery = new StringBuilder();

        for (String rawLine : readLines(resourcePath)) {
            String line = rawLine.trim();

            if (line.startsWith(NAME_MARKER)) {
                putQuery(queries, currentQueryName, currentQuery);
                currentQueryName = line.substring(NAME_MARKER.length()).trim();
                currentQuery = new StringBuilder();
            } else if (line.startsWith("--") || line.isEmpty()) {
                continue;
            } else if (currentQueryName != null) {
                if (currentQuery.length() > 0) {
                    currentQuery.append(' ');
                }
                currentQuery.append(line);
            }
        }
        putQuery(queries, currentQueryName, currentQuery);

        logger.info("Loaded " + queries.size() + " SQL queries from " + resourcePath);
        return queries;
    }

    private static void putQuery(Map<String, String> queries, String name, StringBuilder query) {
        if (name == null || query.length() == 0) {
            return;
        }
        String sql = query.toString().trim();
        if (sql.endsWith(";")) {
            sql = sql.substring(0, sql.length() - 1).trim();
        }
        queries.put(name, sql);
    }

    /**
     * Loads a DDL script and splits it into statements.
     *
     * @param resourcePath path to SQL file (e.g., "sql/drip-schema.sql")
     * @return the statements in file order, comments removed
     */
    public static List<String> loadStatements(String resourcePath) {
        StringBuilder script = new StringBuilder();
        for (String line : readLines(resourcePath)) {
            if (!line.trim().startsWith("--")) {
                script.append(line).append('\n');
            }
        }

        List<String> statements = new ArrayList<>();
        for (String statement : script.toString().split(";")) {
            String trimmed = statement.trim();
            if (!trimmed.isEmpty()) {
                statements.add(trimmed);
            }
        }
        logger.info("Loaded " + statements.size() + " SQL statements from " + resourcePath);
        return statements;
    }

    private static List<String> readLines(String resourcePath) {
        InputStream is = SqlLoader.class.getClassLoader().getResourceAsStream(resourcePath);
        if (is == null) {
            throw new IllegalStateException("SQL resource not found: " + resourcePath);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            List<String> lines = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
            return lines;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to read SQL resource " + resourcePath, e);
            throw new UncheckedIOException("Failed to read SQL resource " + resourcePath, e);
        }
    }
}
