/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.registry;

import com.helios.vectorstore.api.ProviderSettings;
import com.helios.vectorstore.api.exceptions.ConfigurationInvalidException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Declared configuration of a provider type.
 *
 * <p>The factory validates the merged configuration map against the schema once,
 * at the boundary, and hands the backend a {@link ProviderSettings} whose declared
 * keys are already type-correct. Keys the schema does not declare pass through
 * untouched unless the schema is {@linkplain Builder#strict() strict}. Keys the
 * factory itself injects ({@link #RESERVED_KEYS}) are accepted by every schema.
 *
 * <pre>{@code
 * ProviderConfigSchema schema = ProviderConfigSchema.builder()
 *         .required("host", ConfigProperty.Type.STRING)
 *         .optional("port", ConfigProperty.Type.INTEGER, 6333)
 *         .build();
 * }</pre>
 */
public final class ProviderConfigSchema {

    public static final Set<String> RESERVED_KEYS = Set.of(ProviderSettings.NAME_KEY, "timeout_seconds", "max_retries");

    private static final ProviderConfigSchema PERMISSIVE = new ProviderConfigSchema(Map.of(), false);

    private final Map<String, ConfigProperty> properties;
    private final boolean strict;

    private ProviderConfigSchema(Map<String, ConfigProperty> properties, boolean strict) {
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.strict = strict;
    }

    /**
     * Schema that declares nothing and accepts any key.
     */
    public static ProviderConfigSchema permissive() {
        return PERMISSIVE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Collection<ConfigProperty> properties() {
        return properties.values();
    }

    public Optional<ConfigProperty> property(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Default values of every property that declares one, in declaration order.
     */
    public Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        for (ConfigProperty property : properties.values()) {
            if (property.defaultValue() != null) {
                defaults.put(property.name(), property.defaultValue());
            }
        }
        return defaults;
    }

    /**
     * Validates {@code config} and produces typed settings.
     *
     * <p>All violations are collected before failing, so a caller sees every
     * problem in one error.
     *
     * @throws ConfigurationInvalidException if any declared key is missing or mistyped
     */
    public ProviderSettings validate(String providerType, Map<String, ?> config) {
        Map<String, Object> source = config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>();
        Map<String, Object> validated = new LinkedHashMap<>();
        List<String> violations = new ArrayList<>();

        for (ConfigProperty property : properties.values()) {
            Object raw = source.remove(property.name());
            if (raw == null) {
                raw = property.defaultValue();
            }
            if (raw == null) {
                if (property.required()) {
                    violations.add(String.format("missing required setting '%s'", property.name()));
                }
                continue;
            }
            Optional<Object> coerced = property.coerce(raw);
            if (coerced.isEmpty()) {
                violations.add(String.format("setting '%s' must be %s but was '%s'",
                        property.name(), property.type(), raw));
                continue;
            }
            validated.put(property.name(), coerced.get());
        }

        if (strict) {
            Set<String> unknown = new LinkedHashSet<>(source.keySet());
            unknown.removeAll(RESERVED_KEYS);
            if (!unknown.isEmpty()) {
                violations.add(String.format("unknown settings %s", unknown));
            }
        }
        validated.putAll(source);

        if (!violations.isEmpty()) {
            throw new ConfigurationInvalidException(providerType, violations);
        }
        return ProviderSettings.of(providerType, validated);
    }

    public static final class Builder {
        private final Map<String, ConfigProperty> properties = new LinkedHashMap<>();
        private boolean strict;

        private Builder() {
        }

        public Builder required(String name, ConfigProperty.Type type) {
            return property(new ConfigProperty(name, type, true, null, null));
        }

        public Builder optional(String name, ConfigProperty.Type type, Object defaultValue) {
            return property(new ConfigProperty(name, type, false, defaultValue, null));
        }

        public Builder property(ConfigProperty property) {
            if (properties.putIfAbsent(property.name(), property) != null) {
                throw new IllegalArgumentException("Property declared twice: " + property.name());
            }
            return this;
        }

        /**
         * Rejects keys the schema does not declare.
         */
        public Builder strict() {
            this.strict = true;
            return this;
        }

        public ProviderConfigSchema build() {
            return new ProviderConfigSchema(properties, strict);
        }
    }
}
