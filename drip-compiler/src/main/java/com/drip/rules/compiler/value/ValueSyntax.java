/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.compiler.value;

import com.drip.rules.api.exceptions.DurationParseException;
import com.drip.rules.api.value.BooleanValue;
import com.drip.rules.api.value.DateTimeValue;
import com.drip.rules.api.value.DateValue;
import com.drip.rules.api.value.FieldReference;
import com.drip.rules.api.value.ScalarValue;
import com.drip.rules.api.value.TypedValue;
import com.drip.rules.compiler.config.DripConfig;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;

/**
 * The grammars a rule's raw field value can be written in, in priority order.
 *
 * <p>{@link ValueParser} picks the first constant whose {@link #accepts} returns true;
 * {@link #SCALAR} accepts everything.
 */
public enum ValueSyntax {

    /** {@code now[duration]}: the current instant shifted by a signed duration. */
    RELATIVE_DATETIME {
        private static final String PREFIX = "now";

        @Override
        boolean accepts(String raw, DripConfig config) {
            return raw.startsWith(PREFIX);
        }

        @Override
        TypedValue interpret(String raw, Clock clock, DripConfig config) {
            String duration = raw.substring(PREFIX.length());
            Duration offset = DurationParser.parse(duration);
            try {
                return new DateTimeValue(clock.instant().plus(offset));
            } catch (DateTimeException | ArithmeticException e) {
                throw outOfRange(duration, e);
            }
        }
    },

    /**
     * {@code today[duration]}: today's date in the clock's zone shifted by the whole days
     * of a signed duration. Partial days round towards the past, so {@code today-12:00:00}
     * is yesterday.
     */
    RELATIVE_DATE {
        private static final String PREFIX = "today";
        private static final long SECONDS_PER_DAY = 86_400L;

        @Override
        boolean accepts(String raw, DripConfig config) {
            return raw.startsWith(PREFIX);
        }

        @Override
        TypedValue interpret(String raw, Clock clock, DripConfig config) {
            String duration = raw.substring(PREFIX.length());
            Duration offset = DurationParser.parse(duration);
            long days = Math.floorDiv(offset.getSeconds(), SECONDS_PER_DAY);
            try {
                return new DateValue(LocalDate.now(clock).plusDays(days));
            } catch (DateTimeException | ArithmeticException e) {
                throw outOfRange(duration, e);
            }
        }
    },

    /** {@code F_<field>}: compare against another field of the same row. */
    FIELD_REFERENCE {
        @Override
        boolean accepts(String raw, DripConfig config) {
            return raw.startsWith(config.getFieldReferencePrefix());
        }

        @Override
        TypedValue interpret(String raw, Clock clock, DripConfig config) {
            return new FieldReference(raw.substring(config.getFieldReferencePrefix().length()));
        }
    },

    /** Exactly {@code True} or {@code False}. */
    BOOLEAN {
        @Override
        boolean accepts(String raw, DripConfig config) {
            return "True".equals(raw) || "False".equals(raw);
        }

        @Override
        TypedValue interpret(String raw, Clock clock, DripConfig config) {
            return BooleanValue.of("True".equals(raw));
        }
    },

    /** Anything else, passed to the store verbatim. */
    SCALAR {
        @Override
        boolean accepts(String raw, DripConfig config) {
            return true;
        }

        @Override
        TypedValue interpret(String raw, Clock clock, DripConfig config) {
            return new ScalarValue(raw);
        }
    };

    abstract boolean accepts(String raw, DripConfig config);

    /** A duration that parses but moves the date outside the supported range. */
    private static DurationParseException outOfRange(String duration, RuntimeException cause) {
        return new DurationParseException(duration, cause);
    }

    abstract TypedValue interpret(String raw, Clock clock, DripConfig config);
}
