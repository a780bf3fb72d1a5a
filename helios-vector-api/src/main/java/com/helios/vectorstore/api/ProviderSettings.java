/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated, immutable configuration handed to a provider.
 *
 * <p>Values have already been checked and coerced against the provider type's
 * schema, so typed getters only fail for keys the schema does not describe.
 */
public final class ProviderSettings {

    /** Setting carrying the instance name a provider should report from {@code name()}. */
    public static final String NAME_KEY = "name";

    private static final ProviderSettings EMPTY = new ProviderSettings("", Map.of());

    private final String providerType;
    private final Map<String, Object> values;

    private ProviderSettings(String providerType, Map<String, Object> values) {
        this.providerType = providerType;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ProviderSettings of(String providerType, Map<String, ?> values) {
        if (providerType == null) {
            throw new IllegalArgumentException("Provider type cannot be null");
        }
        return new ProviderSettings(providerType, values == null ? Map.of() : copyOf(values));
    }

    public static ProviderSettings empty() {
        return EMPTY;
    }

    public String providerType() {
        return providerType;
    }

    /**
     * Instance name from {@value #NAME_KEY}, falling back to the provider type.
     */
    public String instanceName() {
        return getString(NAME_KEY, providerType);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Setting %s of provider %s is not an integer: %s", key, providerType, value), e);
        }
    }

    public long getLong(String key, long defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Setting %s of provider %s is not an integer: %s", key, providerType, value), e);
        }
    }

    public double getDouble(String key, double defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Setting %s of provider %s is not a number: %s", key, providerType, value), e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return (List<Object>) list;
        }
        throw new IllegalArgumentException(
                String.format("Setting %s of provider %s is not a list", key, providerType));
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new IllegalArgumentException(
                String.format("Setting %s of provider %s is not a map", key, providerType));
    }

    /**
     * Returns the raw settings as an unmodifiable map.
     */
    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Returns a copy with {@code overrides} applied on top of these settings.
     */
    public ProviderSettings withOverrides(Map<String, ?> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(values);
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return new ProviderSettings(providerType, merged);
    }

    private static Map<String, Object> copyOf(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v);
            }
        });
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProviderSettings other)) {
            return false;
        }
        return providerType.equals(other.providerType) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return 31 * providerType.hashCode() + values.hashCode();
    }

    @Override
    public String toString() {
        return String.format("ProviderSettings{type=%s, keys=%s}", providerType, values.keySet());
    }
}
