/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.api.validation;

import com.drip.rules.api.exceptions.RuleValidationException;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a rule set dry run.
 *
 * @param rulesChecked number of rules that were tried
 * @param failures     one entry per failing rule, in application order
 */
public record ValidationResult(int rulesChecked, List<RuleValidationException> failures) {

    public ValidationResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static ValidationResult success(int rulesChecked) {
        return new ValidationResult(rulesChecked, List.of());
    }

    public boolean isValid() {
        return failures.isEmpty();
    }

    public Optional<RuleValidationException> failureFor(Long ruleId) {
        return failures.stream()
                .filter(f -> ruleId != null && ruleId.equals(f.getRuleId()))
                .findFirst();
    }

    /**
     * Returns the operator-facing messages, one per failing rule.
     */
    public List<String> messages() {
        return failures.stream().map(RuleValidationException::getMessage).toList();
    }
}
