/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.management;

/**
 * Lifecycle of a {@link VectorProviderManager}.
 *
 * <pre>
 * UNINITIALIZED -> INITIALIZING -> READY -> (SWITCHING)* -> SHUTTING_DOWN -> SHUT_DOWN
 * </pre>
 *
 * A failed initialization returns to {@code UNINITIALIZED}.
 */
public enum ManagerState {
    UNINITIALIZED,
    INITIALIZING,
    READY,
    /** A switch is in progress; request operations keep flowing to the current instance. */
    SWITCHING,
    SHUTTING_DOWN,
    SHUT_DOWN;

    public boolean acceptsRequests() {
        return this == READY || this == SWITCHING;
    }
}
