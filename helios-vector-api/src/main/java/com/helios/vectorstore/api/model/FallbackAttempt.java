/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Diagnostic record of one fallback scan in which at least one candidate failed.
 *
 * @param providers    candidates in the order they were tried
 * @param successIndex index into {@code providers} of the candidate that served the
 *                     call, or {@code -1} when every candidate failed
 * @param errors       one message per failed candidate, in try order
 */
public record FallbackAttempt(
        Instant timestamp,
        String operation,
        List<String> providers,
        int successIndex,
        List<String> errors,
        Duration duration
) {

    public FallbackAttempt {
        providers = List.copyOf(providers);
        errors = List.copyOf(errors);
    }

    public boolean succeeded() {
        return successIndex >= 0;
    }
}
