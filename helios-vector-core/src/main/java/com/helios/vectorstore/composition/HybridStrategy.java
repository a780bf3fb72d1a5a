/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.composition;

import java.util.Locale;

/**
 * Member selection policy of a {@link HybridRouter}.
 */
public enum HybridStrategy {
    /** Always the first member. No failure detection. */
    FAILOVER,
    /** Cycles through members on every selection, regardless of outcome. */
    ROUND_ROBIN,
    /** Alias for {@link #ROUND_ROBIN}; no load signal is consulted. */
    LOAD_BALANCE,
    /** Routes by operation using {@link HybridRouting#routes()}. */
    OPERATION_BASED;

    public static HybridStrategy fromKey(String value) {
        if (value == null || value.isBlank()) {
            return FAILOVER;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
