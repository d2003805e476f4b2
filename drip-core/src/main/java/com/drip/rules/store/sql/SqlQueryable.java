/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.store.sql;

import com.drip.rules.api.query.Aggregation;
import com.drip.rules.api.query.Annotation;
import com.drip.rules.api.query.FieldPredicate;
import com.drip.rules.api.query.Queryable;
import com.drip.rules.store.schema.RecordSchema;
import com.drip.rules.store.schema.Relation;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC-backed {@link Queryable} for H2 or PostgreSQL.
 *
 * <p>Each filter/exclude step is resolved against the {@link RecordSchema} when it is
 * added, so unknown fields and bad literals fail immediately. Nothing touches the
 * database until {@link #fetch()} or {@link #count()}, which run one parameterized
 * statement each.
 *
 * <p>Fetched rows are maps keyed by lower-case column label. Timestamps come back as
 * {@link Instant} and dates as {@link LocalDate}; count annotations appear under their
 * aliases.
 *
 * <p><b>Thread Safety:</b> instances are immutable; every query borrows its own
 * connection from the {@link DataSource}.
 */
public final class SqlQueryable implements Queryable<Map<String, Object>> {
    private static final Logger logger = Logger.getLogger(SqlQueryable.class.getName());

    private final DataSource dataSource;
    private final SqlDialect dialect;
    private final RecordSchema schema;
    private final String separator;
    private final Map<String, Annotation> annotations;
    private final List<SqlCondition> conditions;

    public SqlQueryable(DataSource dataSource, SqlDialect dialect, RecordSchema schema) {
        this(dataSource, dialect, schema, FieldPredicate.DEFAULT_SEPARATOR);
    }

    public SqlQueryable(DataSource dataSource, SqlDialect dialect, RecordSchema schema, String separator) {
        this(Objects.requireNonNull(dataSource, "dataSource"),
                Objects.requireNonNull(dialect, "dialect"),
                Objects.requireNonNull(schema, "schema"),
                Objects.requireNonNull(separator, "separator"),
                Map.of(),
                List.of());
        SqlDialect.identifier(schema.getName());
    }

    private SqlQueryable(DataSource dataSource, SqlDialect dialect, RecordSchema schema, String separator,
                         Map<String, Annotation> annotations, List<SqlCondition> conditions) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.schema = schema;
        this.separator = separator;
        this.annotations = annotations;
        this.conditions = conditions;
    }

    @Override
    public SqlQueryable filter(FieldPredicate predicate) {
        return withCondition(predicate, false);
    }

    @Override
    public SqlQueryable exclude(FieldPredicate predicate) {
        return withCondition(predicate, true);
    }

    private SqlQueryable withCondition(FieldPredicate predicate, boolean negated) {
        Objects.requireNonNull(predicate, "predicate");
        SqlCondition condition = SqlCondition.of(predicate, negated, schema, annotations, separator);
        logger.fine(() -> schema.getName() + (negated ? ": exclude " : ": filter ") + predicate);

        List<SqlCondition> next = new ArrayList<>(conditions);
        next.add(condition);
        return new SqlQueryable(dataSource, dialect, schema, separator, annotations, List.copyOf(next));
    }

    @Override
    public SqlQueryable annotate(Annotation annotation) {
        Objects.requireNonNull(annotation, "annotation");
        String alias = annotation.alias();

        Annotation existing = annotations.get(alias);
        if (existing != null) {
            if (existing.equals(annotation)) {
                return this;
            }
            throw new IllegalArgumentException("The annotation '" + alias + "' conflicts with an existing annotation");
        }
        if (schema.hasField(alias)) {
            throw new IllegalArgumentException("The annotation '" + alias + "' conflicts with a field on " + schema.getName());
        }
        if (annotation.aggregation().function() != Aggregation.Function.COUNT) {
            throw new IllegalArgumentException("Unsupported aggregation: " + annotation.aggregation());
        }
        SqlDialect.identifier(alias);
        schema.resolveRelations(annotation.aggregation().relationPath(), separator);

        logger.fine(() -> schema.getName() + ": annotate " + alias + "=" + annotation.aggregation());
        Map<String, Annotation> next = new LinkedHashMap<>(annotations);
        next.put(alias, annotation);
        return new SqlQueryable(dataSource, dialect, schema, separator, Collections.unmodifiableMap(next), conditions);
    }

    @Override
    public Map<String, Annotation> annotations() {
        return annotations;
    }

    // ========================================================================
    // RENDERING
    // ========================================================================

    /**
     * Renders the SELECT this queryable runs on {@link #fetch()}.
     */
    public SqlQuery toSql() {
        SqlQueryBuilder q = new SqlQueryBuilder(dialect);
        q.append("SELECT " + SqlQueryBuilder.ROOT_ALIAS + ".*");
        for (Annotation annotation : annotations.values()) {
            List<Relation> relations = schema.resolveRelations(annotation.aggregation().relationPath(), separator);
            q.append(", " + SqlCondition.countExpression(annotation, relations, q, schema) + " AS " + annotation.alias());
        }
        appendFromWhere(q);
        q.append(" ORDER BY " + SqlQueryBuilder.ROOT_ALIAS + "." + SqlDialect.identifier(schema.getIdField()));
        return q.build();
    }

    /**
     * Renders the SELECT COUNT(*) this queryable runs on {@link #count()}.
     */
    public SqlQuery toCountSql() {
        SqlQueryBuilder q = new SqlQueryBuilder(dialect);
        q.append("SELECT COUNT(*)");
        appendFromWhere(q);
        return q.build();
    }

    private void appendFromWhere(SqlQueryBuilder q) {
        q.append(" FROM " + SqlDialect.identifier(schema.getName()) + " " + SqlQueryBuilder.ROOT_ALIAS);
        for (int i = 0; i < conditions.size(); i++) {
            q.append(i == 0 ? " WHERE " : " AND ");
            conditions.get(i).render(q, schema);
        }
    }

    // ========================================================================
    // EXECUTION
    // ========================================================================

    @Override
    public List<Map<String, Object>> fetch() {
        SqlQuery query = toSql();
        logger.fine(() -> "Executing: " + query.sql() + " " + query.parameters());

        List<Map<String, Object>> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, query);
             ResultSet rs = stmt.executeQuery()) {

            ResultSetMetaData meta = rs.getMetaData();
            while (rs.next()) {
                rows.add(mapRow(rs, meta));
            }
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to fetch " + schema.getName() + ": " + query.sql(), e);
            throw new IllegalStateException("Failed to fetch " + schema.getName(), e);
        }
        return Collections.unmodifiableList(rows);
    }

    @Override
    public long count() {
        SqlQuery query = toCountSql();
        logger.fine(() -> "Executing: " + query.sql() + " " + query.parameters());

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, query);
             ResultSet rs = stmt.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to count " + schema.getName() + ": " + query.sql(), e);
            throw new IllegalStateException("Failed to count " + schema.getName(), e);
        }
    }

    private static PreparedStatement prepare(Connection conn, SqlQuery query) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(query.sql());
        try {
            int idx = 1;
            for (Object parameter : query.parameters()) {
                stmt.setObject(idx++, toJdbc(parameter));
            }
            return stmt;
        } catch (SQLException e) {
            stmt.close();
            throw e;
        }
    }

    private static Object toJdbc(Object value) {
        if (value instanceof Instant instant) return Timestamp.from(instant);
        if (value instanceof LocalDate date) return Date.valueOf(date);
        return value;
    }

    private static Map<String, Object> mapRow(ResultSet rs, ResultSetMetaData meta) throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            String label = meta.getColumnLabel(i).toLowerCase(Locale.ROOT);
            row.put(label, fromJdbc(rs.getObject(i)));
        }
        return Collections.unmodifiableMap(row);
    }

    private static Object fromJdbc(Object value) {
        if (value instanceof Timestamp ts) return ts.toInstant();
        if (value instanceof OffsetDateTime odt) return odt.toInstant();
        if (value instanceof Date date) return date.toLocalDate();
        return value;
    }

    public RecordSchema getSchema() {
        return schema;
    }

    public SqlDialect getDialect() {
        return dialect;
    }

    @Override
    public String toString() {
        return "SqlQueryable{" + schema.getName() + ", dialect=" + dialect
                + ", annotations=" + annotations.keySet() + ", steps=" + conditions.size() + '}';
    }
}
