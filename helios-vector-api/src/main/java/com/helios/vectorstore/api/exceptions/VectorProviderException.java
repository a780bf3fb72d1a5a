/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.exceptions;

/**
 * Base type for every error raised by the provider orchestration layer.
 *
 * <p>All errors are unchecked. Configuration and registration errors are raised
 * synchronously and are never retried; operational errors carry the failing
 * provider's name where one is known.
 */
public class VectorProviderException extends RuntimeException {

    public VectorProviderException(String message) {
        super(message);
    }

    public VectorProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    public VectorProviderException(Throwable cause) {
        super(cause);
    }
}
