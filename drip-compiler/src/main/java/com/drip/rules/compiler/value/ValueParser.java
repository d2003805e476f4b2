/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.compiler.value;

import com.drip.rules.api.value.TypedValue;
import com.drip.rules.compiler.config.DripConfig;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Interprets the raw value of a rule.
 *
 * <p>Grammars are tried in the order of {@link ValueSyntax}: relative instant
 * ({@code now}), relative date ({@code today}), field reference ({@code F_}), boolean,
 * then passthrough scalar. The clock is always supplied by the caller so repeated
 * evaluations with the same clock give the same values.
 */
public class ValueParser {
    private static final Logger logger = Logger.getLogger(ValueParser.class.getName());

    private final DripConfig config;

    public ValueParser(DripConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public ValueParser() {
        this(DripConfig.defaults());
    }

    /**
     * Parses a raw rule value.
     *
     * @param raw   the stored field value
     * @param clock source of the current instant and zone
     * @return the typed value
     * @throws com.drip.rules.api.exceptions.DurationParseException if a {@code now}/{@code today}
     *         value carries a malformed duration
     */
    public TypedValue parse(String raw, Clock clock) {
        Objects.requireNonNull(raw, "raw value");
        Objects.requireNonNull(clock, "clock");

        ValueSyntax syntax = syntaxOf(raw);
        TypedValue value = syntax.interpret(raw, clock, config);
        logger.fine(() -> "Parsed '" + raw + "' as " + syntax + ": " + value);
        return value;
    }

    /**
     * Returns the grammar a raw value will be parsed with.
     */
    public ValueSyntax syntaxOf(String raw) {
        for (ValueSyntax syntax : ValueSyntax.values()) {
            if (syntax.accepts(raw, config)) {
                return syntax;
            }
        }
        return ValueSyntax.SCALAR;
    }
}
