/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.exceptions;

/**
 * Raised when a provider instance cannot be produced.
 *
 * <p>The {@link Stage} identifies which step of the creation pipeline failed, so
 * callers can tell a typo in a type name from a backend that refused its settings.
 */
public class ProviderCreationException extends VectorProviderException {

    /**
     * Steps of the creation pipeline, in execution order.
     */
    public enum Stage {
        TYPE_LOOKUP,
        AUTO_CONFIGURATION,
        VALIDATION,
        CONSTRUCTION,
        INSTRUMENTATION,
        COMPOSITION
    }

    private final String providerType;
    private final Stage stage;

    public ProviderCreationException(String providerType, Stage stage, String message) {
        super(format(providerType, stage, message));
        this.providerType = providerType;
        this.stage = stage;
    }

    public ProviderCreationException(String providerType, Stage stage, String message, Throwable cause) {
        super(format(providerType, stage, message), cause);
        this.providerType = providerType;
        this.stage = stage;
    }

    public String getProviderType() {
        return providerType;
    }

    public Stage getStage() {
        return stage;
    }

    private static String format(String providerType, Stage stage, String message) {
        return String.format("Failed to create provider %s at stage %s: %s", providerType, stage, message);
    }
}
