/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.exceptions;

public class NoActiveProviderException extends VectorProviderException {

    public NoActiveProviderException(String message) {
        super(message);
    }
}
