/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.store.schema;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Locale;

/**
 * Storage type of a record field.
 *
 * <p>{@link #coerce} converts both stored values and rule literals to one canonical Java
 * type per field type, so that comparisons never mix representations:
 * <ul>
 *   <li>STRING → {@link String}</li>
 *   <li>INTEGER → {@link Long}</li>
 *   <li>DECIMAL → {@link BigDecimal}</li>
 *   <li>BOOLEAN → {@link Boolean}</li>
 *   <li>DATE → {@link LocalDate}</li>
 *   <li>DATETIME → {@link Instant}</li>
 * </ul>
 */
public enum FieldType {
    STRING,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    DATE,
    DATETIME;

    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL;
    }

    public boolean isTemporal() {
        return this == DATE || this == DATETIME;
    }

    /**
     * Whether values of the two types can be ordered against each other.
     */
    public boolean isComparableWith(FieldType other) {
        return this == other
                || (isNumeric() && other.isNumeric())
                || (isTemporal() && other.isTemporal());
    }

    /**
     * Converts a value to this type's canonical representation.
     *
     * @param value the value; null stays null
     * @param zone  zone used to convert between dates and instants
     * @return the canonical value
     * @throws IllegalArgumentException if the value cannot be represented in this type
     */
    public Object coerce(Object value, ZoneId zone) {
        if (value == null) return null;
        return switch (this) {
            case STRING -> value.toString();
            case INTEGER -> toLong(value);
            case DECIMAL -> toDecimal(value);
            case BOOLEAN -> toBoolean(value);
            case DATE -> toDate(value, zone);
            case DATETIME -> toInstant(value, zone);
        };
    }

    private static Long toLong(Object value) {
        if (value instanceof Long l) return l;
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigDecimal bd) return bd.longValueExact();
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d)) {
                throw new IllegalArgumentException("'" + value + "' is not an integer");
            }
            return (long) d;
        }
        if (value instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'" + s + "' is not an integer", e);
            }
        }
        throw new IllegalArgumentException("Cannot convert " + value.getClass().getSimpleName() + " to an integer");
    }

    private static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal bd) return bd;
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number n) return BigDecimal.valueOf(n.doubleValue());
        if (value instanceof String s) {
            try {
                return new BigDecimal(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'" + s + "' is not a number", e);
            }
        }
        throw new IllegalArgumentException("Cannot convert " + value.getClass().getSimpleName() + " to a number");
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) {
            long l = n.longValue();
            if (l == 0 || l == 1) return l == 1;
        }
        if (value instanceof String s) {
            switch (s.trim().toLowerCase(Locale.ROOT)) {
                case "true", "t", "1":
                    return true;
                case "false", "f", "0":
                    return false;
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("'" + value + "' value must be either True or False");
    }

    private static LocalDate toDate(Object value, ZoneId zone) {
        if (value instanceof LocalDate d) return d;
        if (value instanceof LocalDateTime dt) return dt.toLocalDate();
        if (value instanceof java.sql.Date d) return d.toLocalDate();
        if (value instanceof String s) {
            String text = s.trim();
            try {
                return LocalDate.parse(text);
            } catch (DateTimeParseException e) {
                return toInstant(text, zone).atZone(zone).toLocalDate();
            }
        }
        return toInstant(value, zone).atZone(zone).toLocalDate();
    }

    private static Instant toInstant(Object value, ZoneId zone) {
        if (value instanceof Instant i) return i;
        if (value instanceof OffsetDateTime odt) return odt.toInstant();
        if (value instanceof ZonedDateTime zdt) return zdt.toInstant();
        if (value instanceof LocalDateTime ldt) return ldt.atZone(zone).toInstant();
        if (value instanceof LocalDate d) return d.atStartOfDay(zone).toInstant();
        if (value instanceof Timestamp ts) return ts.toInstant();
        if (value instanceof java.sql.Date d) return d.toLocalDate().atStartOfDay(zone).toInstant();
        if (value instanceof Date d) return d.toInstant();
        if (value instanceof String s) {
            String text = s.trim();
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException ignored) {
                // not offset-qualified; try the naive forms below
            }
            try {
                return LocalDateTime.parse(text.replace(' ', 'T')).atZone(zone).toInstant();
            } catch (DateTimeParseException ignored) {
                // not a datetime; try a bare date
            }
            try {
                return LocalDate.parse(text).atStartOfDay(zone).toInstant();
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("'" + s + "' value has an invalid date/time format", e);
            }
        }
        throw new IllegalArgumentException("Cannot convert " + value.getClass().getSimpleName() + " to a date/time");
    }
}
