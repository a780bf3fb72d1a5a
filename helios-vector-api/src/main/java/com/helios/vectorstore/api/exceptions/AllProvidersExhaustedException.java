/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.exceptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raised when every candidate of a composite provider failed an operation.
 *
 * <p>The message enumerates each attempted candidate with its error, in the order
 * the candidates were tried. The individual errors are also attached as suppressed
 * exceptions.
 */
public class AllProvidersExhaustedException extends VectorProviderException {

    /**
     * A single failed attempt.
     */
    public record Failure(String providerName, Throwable error) {

        public String describe() {
            return String.format("%s: %s", providerName, error.getMessage());
        }
    }

    private final String operation;
    private final List<Failure> failures;

    public AllProvidersExhaustedException(String operation, List<Failure> failures) {
        super(buildMessage(operation, failures));
        this.operation = operation;
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
        for (Failure failure : failures) {
            addSuppressed(failure.error());
        }
    }

    public String getOperation() {
        return operation;
    }

    public List<Failure> getFailures() {
        return failures;
    }

    private static String buildMessage(String operation, List<Failure> failures) {
        if (failures.isEmpty()) {
            return String.format("No providers available to %s", operation);
        }
        List<String> parts = new ArrayList<>(failures.size());
        for (Failure failure : failures) {
            parts.add(failure.describe());
        }
        return String.format("All %d providers failed to %s: [%s]",
                failures.size(), operation, String.join("; ", parts));
    }
}
