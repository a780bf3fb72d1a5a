/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.config;

import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Typed lookups over an environment-style key function. Malformed values are
 * logged and ignored.
 */
final class ConfigValues {

    private static final Logger logger = Logger.getLogger(ConfigValues.class.getName());

    private ConfigValues() {
        throw new AssertionError("No instances");
    }

    /**
     * Environment variable first, then system property of the same name.
     */
    static String systemLookup(String key) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value;
    }

    static Optional<String> string(Function<String, String> env, String key) {
        String value = env.apply(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    static Optional<Boolean> bool(Function<String, String> env, String key) {
        return string(env, key).flatMap(v -> {
            if ("true".equalsIgnoreCase(v) || "false".equalsIgnoreCase(v)) {
                return Optional.of(Boolean.parseBoolean(v));
            }
            logger.warning(String.format("Invalid boolean for %s: %s", key, v));
            return Optional.empty();
        });
    }

    static Optional<Long> longValue(Function<String, String> env, String key) {
        return string(env, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                logger.warning(String.format("Invalid number for %s: %s", key, v));
                return Optional.empty();
            }
        });
    }
}
