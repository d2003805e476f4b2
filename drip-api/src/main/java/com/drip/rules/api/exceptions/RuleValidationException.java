/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.api.exceptions;

import com.drip.rules.api.model.QuerySetRule;
import com.drip.rules.api.validation.ErrorCategory;

import java.util.Objects;

/**
 * A rule that failed a dry run, with the category and cause of the failure.
 *
 * <p>Produced by rule set validation only; the message mirrors the form shown to
 * operators: {@code "<ExceptionType> raised trying to apply rule: <message>"}.
 */
public class RuleValidationException extends RuleCompilationException {

    private final QuerySetRule rule;
    private final ErrorCategory category;

    public RuleValidationException(QuerySetRule rule, ErrorCategory category, Throwable cause) {
        super(formatMessage(cause), cause);
        this.rule = Objects.requireNonNull(rule, "Rule cannot be null");
        this.category = Objects.requireNonNull(category, "Category cannot be null");
    }

    private static String formatMessage(Throwable cause) {
        return cause.getClass().getSimpleName() + " raised trying to apply rule: " + cause.getMessage();
    }

    public QuerySetRule getRule() {
        return rule;
    }

    public Long getRuleId() {
        return rule.id();
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
