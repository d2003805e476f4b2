/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.store.sql;

import com.drip.rules.store.schema.RecordSchema;
import com.drip.rules.store.schema.Relation;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates SQL text and parameters while a query is rendered.
 */
final class SqlQueryBuilder {
    static final String ROOT_ALIAS = "t0";

    private final StringBuilder sql = new StringBuilder();
    private final List<Object> parameters = new ArrayList<>();
    private final SqlDialect dialect;
    private int aliasCounter;

    SqlQueryBuilder(SqlDialect dialect) {
        this.dialect = dialect;
    }

    SqlDialect dialect() {
        return dialect;
    }

    SqlQueryBuilder append(String text) {
        sql.append(text);
        return this;
    }

    /**
     * Appends a {@code ?} placeholder bound to the value.
     */
    SqlQueryBuilder bind(Object value) {
        sql.append('?');
        return parameter(value);
    }

    /**
     * Adds a parameter for a {@code ?} already appended as part of a larger fragment.
     */
    SqlQueryBuilder parameter(Object value) {
        parameters.add(value);
        return this;
    }

    String nextAlias() {
        return "r" + (++aliasCounter);
    }

    /**
     * A {@code FROM ... JOIN ... WHERE <link to owner>} clause over a relation chain.
     *
     * @param sql       the clause, with a leading space
     * @param lastAlias alias of the last table joined
     */
    record RelationChain(String sql, String lastAlias) {
    }

    /**
     * Renders the tables reached from {@code ownerAlias} by following the relations.
     * The clause takes no parameters.
     */
    RelationChain relationChain(RecordSchema owner, String ownerAlias, List<Relation> relations) {
        StringBuilder chain = new StringBuilder();
        RecordSchema current = owner;
        String previousAlias = ownerAlias;
        String firstLink = null;

        for (int i = 0; i < relations.size(); i++) {
            Relation relation = relations.get(i);
            String alias = nextAlias();
            String link = link(current, previousAlias, relation, alias);
            String table = SqlDialect.identifier(relation.target().getName());
            if (i == 0) {
                chain.append(" FROM ").append(table).append(' ').append(alias);
                firstLink = link;
            } else {
                chain.append(" JOIN ").append(table).append(' ').append(alias).append(" ON ").append(link);
            }
            current = relation.target();
            previousAlias = alias;
        }
        chain.append(" WHERE ").append(firstLink);
        return new RelationChain(chain.toString(), previousAlias);
    }

    private static String link(RecordSchema owner, String ownerAlias, Relation relation, String targetAlias) {
        String foreignKey = SqlDialect.identifier(relation.foreignKey());
        if (relation.isMultiValued()) {
            return targetAlias + "." + foreignKey + " = " + ownerAlias + "." + SqlDialect.identifier(owner.getIdField());
        }
        return targetAlias + "." + SqlDialect.identifier(relation.target().getIdField())
                + " = " + ownerAlias + "." + foreignKey;
    }

    SqlQuery build() {
        return new SqlQuery(sql.toString(), parameters);
    }
}
