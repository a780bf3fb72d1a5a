/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.composition;

import java.util.Locale;

/**
 * How a {@link FallbackChain} chooses where to start scanning.
 */
public enum FallbackPolicy {
    /**
     * Scan from the current position. A member that failed once is not tried again
     * until {@link FallbackChain#reset()} or {@link FallbackChain#recheck}.
     */
    STICKY,
    /**
     * Scan from the first member on every call, so a recovered member is used again
     * as soon as it succeeds.
     */
    RETRY_FROM_FIRST;

    public static FallbackPolicy fromKey(String value) {
        if (value == null || value.isBlank()) {
            return STICKY;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
