/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.exceptions;

import java.util.List;

/**
 * Raised when provider settings fail schema or construction-time validation.
 */
public class ConfigurationInvalidException extends ProviderCreationException {

    private final List<String> violations;

    public ConfigurationInvalidException(String providerType, List<String> violations) {
        super(providerType, Stage.VALIDATION, String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ConfigurationInvalidException(String providerType, String message, Throwable cause) {
        super(providerType, Stage.VALIDATION, message, cause);
        this.violations = List.of(message);
    }

    public List<String> getViolations() {
        return violations;
    }
}
