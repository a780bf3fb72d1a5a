/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.exceptions;

/**
 * Raised when an operation observes a cancelled or expired context.
 */
public class OperationCancelledException extends VectorProviderException {

    public OperationCancelledException(String message) {
        super(message);
    }
}
