/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.registry;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One typed key of a provider configuration schema.
 *
 * @param defaultValue value used when the key is absent, may be {@code null}
 */
public record ConfigProperty(String name, Type type, boolean required, Object defaultValue, String description) {

    public enum Type {
        STRING, INTEGER, DECIMAL, BOOLEAN, LIST, MAP
    }

    public ConfigProperty {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Property name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Property type cannot be null");
        }
    }

    /**
     * Converts {@code raw} to this property's Java representation.
     *
     * @return the coerced value, or empty when {@code raw} cannot be represented
     */
    Optional<Object> coerce(Object raw) {
        return switch (type) {
            case STRING -> raw instanceof Map || raw instanceof List
                    ? Optional.empty()
                    : Optional.of(raw.toString());
            case INTEGER -> toLong(raw).map(v -> (Object) v);
            case DECIMAL -> toDouble(raw).map(v -> (Object) v);
            case BOOLEAN -> toBoolean(raw).map(v -> (Object) v);
            case LIST -> raw instanceof List<?> ? Optional.of(raw) : Optional.empty();
            case MAP -> raw instanceof Map<?, ?> ? Optional.of(raw) : Optional.empty();
        };
    }

    private static Optional<Long> toLong(Object raw) {
        if (raw instanceof Number number) {
            double d = number.doubleValue();
            return d == Math.rint(d) ? Optional.of(number.longValue()) : Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(raw.toString().trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Double> toDouble(Object raw) {
        if (raw instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        try {
            return Optional.of(Double.parseDouble(raw.toString().trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Boolean> toBoolean(Object raw) {
        if (raw instanceof Boolean bool) {
            return Optional.of(bool);
        }
        String s = raw.toString().trim();
        if ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s)) {
            return Optional.of(Boolean.parseBoolean(s));
        }
        return Optional.empty();
    }
}
