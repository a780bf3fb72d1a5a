/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.registry;

import com.helios.vectorstore.api.ProviderSettings;
import com.helios.vectorstore.api.exceptions.ConfigurationInvalidException;
import com.helios.vectorstore.api.exceptions.ProviderCreationException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderConfigSchemaTest {

    private final ProviderConfigSchema schema = ProviderConfigSchema.builder()
            .required("host", ConfigProperty.Type.STRING)
            .optional("port", ConfigProperty.Type.INTEGER, 6333L)
            .optional("tls", ConfigProperty.Type.BOOLEAN, false)
            .optional("weights", ConfigProperty.Type.LIST, null)
            .build();

    @Test
    void validate_coercesAndAppliesDefaults() {
        ProviderSettings settings = schema.validate("qdrant", Map.of("host", "db", "port", "7000", "tls", "TRUE"));

        assertThat(settings.providerType()).isEqualTo("qdrant");
        assertThat(settings.asMap())
                .containsEntry("host", "db")
                .containsEntry("port", 7000L)
                .containsEntry("tls", true)
                .doesNotContainKey("weights");
    }

    @Test
    void validate_keepsUndeclaredKeysWhenPermissive() {
        ProviderSettings settings = schema.validate("qdrant", Map.of("host", "db", "extra", 1));

        assertThat(settings.asMap()).containsEntry("extra", 1).containsEntry("port", 6333L);
    }

    @Test
    void validate_collectsEveryViolation() {
        Map<String, Object> config = new HashMap<>();
        config.put("port", 12.5);
        config.put("tls", "maybe");
        config.put("weights", "not-a-list");

        assertThatThrownBy(() -> schema.validate("qdrant", config))
                .isInstanceOfSatisfying(ConfigurationInvalidException.class, e -> {
                    assertThat(e.getStage()).isEqualTo(ProviderCreationException.Stage.VALIDATION);
                    assertThat(e.getViolations()).containsExactly(
                            "missing required setting 'host'",
                            "setting 'port' must be INTEGER but was '12.5'",
                            "setting 'tls' must be BOOLEAN but was 'maybe'",
                            "setting 'weights' must be LIST but was 'not-a-list'");
                });
    }

    @Test
    void strictSchema_rejectsUnknownKeysButAllowsReservedOnes() {
        ProviderConfigSchema strict = ProviderConfigSchema.builder()
                .optional("dimension", ConfigProperty.Type.INTEGER, 0L)
                .strict()
                .build();

        ProviderSettings accepted = strict.validate("memory",
                Map.of(ProviderSettings.NAME_KEY, "cache", "timeout_seconds", 30L, "max_retries", 3));
        assertThat(accepted.instanceName()).isEqualTo("cache");

        assertThatThrownBy(() -> strict.validate("memory", Map.of("dimensoin", 3)))
                .isInstanceOf(ConfigurationInvalidException.class)
                .hasMessageContaining("unknown settings [dimensoin]");
    }

    @Test
    void permissiveSchema_acceptsAnything() {
        ProviderSettings settings = ProviderConfigSchema.permissive()
                .validate("custom", Map.of("anything", List.of(1, 2)));

        assertThat(settings.getList("anything")).containsExactly(1, 2);
        assertThat(ProviderConfigSchema.permissive().defaults()).isEmpty();
    }

    @Test
    void duplicatePropertyDeclaration_isRejected() {
        ProviderConfigSchema.Builder builder = ProviderConfigSchema.builder()
                .optional("port", ConfigProperty.Type.INTEGER, 1L);

        assertThatThrownBy(() -> builder.required("port", ConfigProperty.Type.INTEGER))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaults_followDeclarationOrder() {
        assertThat(schema.defaults()).containsExactly(Map.entry("port", 6333L), Map.entry("tls", false));
    }
}
