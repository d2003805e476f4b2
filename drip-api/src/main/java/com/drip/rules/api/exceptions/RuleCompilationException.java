/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.api.exceptions;

/**
 * Base exception for rules that cannot be turned into a query.
 *
 * This is a RuntimeException to avoid forcing checked exception handling
 * through every query-building call, while still giving callers a single
 * type to catch for configuration errors.
 */
public class RuleCompilationException extends RuntimeException {

    public RuleCompilationException(String message) {
        super(message);
    }

    public RuleCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
