/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.store.schema;

import com.drip.rules.api.exceptions.UnknownFieldException;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Declares the fields and relations of one record type, e.g. {@code users}.
 *
 * <p>The schema name doubles as the table name for the SQL adapter. Field paths are
 * resolved segment by segment: every segment but the last must name a relation, the last
 * one a field. A path ending on a relation addresses the related record's id.
 *
 * <pre>{@code
 * RecordSchema orders = RecordSchema.builder("orders")
 *     .field("total", FieldType.DECIMAL)
 *     .build();
 *
 * RecordSchema users = RecordSchema.builder("users")
 *     .field("email", FieldType.STRING)
 *     .field("age", FieldType.INTEGER)
 *     .hasMany("orders", orders, "user_id")
 *     .build();
 * }</pre>
 */
public final class RecordSchema {

    private final String name;
    private final String idField;
    private final Map<String, FieldType> fields;
    private final Map<String, Relation> relations;
    private final ZoneId zone;

    private RecordSchema(Builder builder) {
        this.name = builder.name;
        this.idField = builder.idField;
        Map<String, FieldType> declared = new LinkedHashMap<>();
        declared.put(builder.idField, builder.idType);
        declared.putAll(builder.fields);
        this.fields = Collections.unmodifiableMap(declared);
        this.relations = Collections.unmodifiableMap(new LinkedHashMap<>(builder.relations));
        this.zone = builder.zone;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Resolves a separator-joined field path.
     *
     * @throws UnknownFieldException if a segment names neither a field nor a relation
     */
    public ResolvedPath resolve(String path, String separator) {
        List<String> segments = split(path, separator);
        List<Relation> traversed = new ArrayList<>();
        RecordSchema current = this;

        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            boolean last = i == segments.size() - 1;

            if (last) {
                FieldType type = current.fields.get(segment);
                if (type != null) {
                    return new ResolvedPath(traversed, segment, type);
                }
            }
            Relation relation = current.relations.get(segment);
            if (relation == null) {
                throw new UnknownFieldException(path, unknownSegment(current, segment));
            }
            traversed.add(relation);
            current = relation.target();
        }
        // Path ended on a relation: compare against the related record's id
        return new ResolvedPath(traversed, current.idField, current.idType());
    }

    /**
     * Resolves a path made of relations only, as used by count annotations.
     *
     * @throws UnknownFieldException if a segment is not a relation
     */
    public List<Relation> resolveRelations(String path, String separator) {
        List<Relation> traversed = new ArrayList<>();
        RecordSchema current = this;
        for (String segment : split(path, separator)) {
            Relation relation = current.relations.get(segment);
            if (relation == null) {
                String reason = current.fields.containsKey(segment)
                        ? "'" + segment + "' is a field, not a relation that can be counted"
                        : unknownSegment(current, segment);
                throw new UnknownFieldException(path, reason);
            }
            traversed.add(relation);
            current = relation.target();
        }
        return List.copyOf(traversed);
    }

    private static List<String> split(String path, String separator) {
        if (path == null || path.isEmpty()) {
            throw new UnknownFieldException(String.valueOf(path), "empty field name");
        }
        List<String> segments = List.of(path.split(Pattern.quote(separator), -1));
        if (segments.stream().anyMatch(String::isEmpty)) {
            throw new UnknownFieldException(path, "empty path segment");
        }
        return segments;
    }

    private static String unknownSegment(RecordSchema schema, String segment) {
        List<String> choices = new ArrayList<>(schema.fields.keySet());
        choices.addAll(schema.relations.keySet());
        return "'" + segment + "' is not a field of " + schema.name + ". Choices are: " + String.join(", ", choices);
    }

    public boolean hasField(String field) {
        return fields.containsKey(field) || relations.containsKey(field);
    }

    public Optional<FieldType> fieldType(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    public Optional<Relation> relation(String name) {
        return Optional.ofNullable(relations.get(name));
    }

    public String getName() {
        return name;
    }

    public String getIdField() {
        return idField;
    }

    public FieldType idType() {
        return fields.get(idField);
    }

    public Map<String, FieldType> getFields() {
        return fields;
    }

    public Map<String, Relation> getRelations() {
        return relations;
    }

    /**
     * Zone used to convert between dates and instants for this record type.
     */
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public String toString() {
        return "RecordSchema{" + name + ", fields=" + fields.keySet() + ", relations=" + relations.keySet() + '}';
    }

    public static final class Builder {
        private final String name;
        private String idField = "id";
        private FieldType idType = FieldType.INTEGER;
        private final Map<String, FieldType> fields = new LinkedHashMap<>();
        private final Map<String, Relation> relations = new LinkedHashMap<>();
        private ZoneId zone = ZoneOffset.UTC;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder id(String field, FieldType type) {
            this.idField = Objects.requireNonNull(field, "field");
            this.idType = Objects.requireNonNull(type, "type");
            return this;
        }

        public Builder field(String field, FieldType type) {
            fields.put(Objects.requireNonNull(field, "field"), Objects.requireNonNull(type, "type"));
            return this;
        }

        public Builder hasMany(String relation, RecordSchema target, String foreignKey) {
            relations.put(relation, new Relation(relation, target, Relation.Cardinality.MANY, foreignKey));
            return this;
        }

        public Builder hasOne(String relation, RecordSchema target, String foreignKey) {
            relations.put(relation, new Relation(relation, target, Relation.Cardinality.ONE, foreignKey));
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone, "zone");
            return this;
        }

        public RecordSchema build() {
            for (String relation : relations.keySet()) {
                if (fields.containsKey(relation) || relation.equals(idField)) {
                    throw new IllegalArgumentException(
                            "Relation '" + relation + "' clashes with a field of " + name);
                }
            }
            return new RecordSchema(this);
        }
    }
}
