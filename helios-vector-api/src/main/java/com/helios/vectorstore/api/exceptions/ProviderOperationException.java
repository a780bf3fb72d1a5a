/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.exceptions;

/**
 * A backend failure passed through with the failing provider's name attached.
 *
 * <p>The backend's own exception is kept unmodified as the cause.
 */
public class ProviderOperationException extends VectorProviderException {

    private final String providerName;
    private final String operation;

    public ProviderOperationException(String providerName, String operation, Throwable cause) {
        super(String.format("Provider %s failed to %s: %s", providerName, operation, cause.getMessage()), cause);
        this.providerName = providerName;
        this.operation = operation;
    }

    public String getProviderName() {
        return providerName;
    }

    public String getOperation() {
        return operation;
    }
}
