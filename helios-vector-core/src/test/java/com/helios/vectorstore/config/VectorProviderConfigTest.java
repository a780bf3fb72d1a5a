/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.config;

import com.helios.vectorstore.api.Operation;
import com.helios.vectorstore.composition.FallbackPolicy;
import com.helios.vectorstore.composition.HybridStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VectorProviderConfigTest {

    private static Path fixture() throws URISyntaxException {
        return Path.of(VectorProviderConfigTest.class.getClassLoader()
                .getResource("config/providers-full.json").toURI());
    }

    @Test
    @DisplayName("Should load every section of a JSON configuration")
    void loadFromJson_readsAllSections() throws URISyntaxException {
        // When
        VectorProviderConfig config = VectorProviderConfig.loadFromJson(fixture(), Map.<String, String>of()::get);

        // Then
        assertThat(config.activeProvider()).isEqualTo("primary");
        assertThat(config.providers()).containsOnlyKeys("primary", "secondary", "archive");
        assertThat(config.enabledProviders()).containsOnlyKeys("primary", "secondary");
        assertThat(config.providers().get("primary").tags()).containsExactly("hot");
        assertThat(config.providers().get("secondary").config()).containsEntry("metric", "euclidean");

        assertThat(config.fallbackOrder()).containsExactly("primary", "secondary");
        assertThat(config.fallbackPolicy()).isEqualTo(FallbackPolicy.RETRY_FROM_FIRST);

        assertThat(config.hybridRoles()).containsEntry("reader", "primary").containsEntry("writer", "secondary");
        assertThat(config.hybridRouting().strategy()).isEqualTo(HybridStrategy.OPERATION_BASED);
        assertThat(config.hybridRouting().routes())
                .containsEntry(Operation.SEARCH, "reader")
                .containsEntry(Operation.FIND_SIMILAR, "reader")
                .containsEntry(Operation.STORE, "writer");
        assertThat(config.hybridRouting().defaultRole()).isEqualTo("writer");

        assertThat(config.healthCheckEnabled()).isFalse();
        assertThat(config.healthCheckInterval()).isEqualTo(Duration.ofSeconds(5));

        assertThat(config.factoryConfig().failFast()).isTrue();
        assertThat(config.factoryConfig().maxRetries()).isEqualTo(5);
        assertThat(config.factoryConfig().customConfigFor("memory"))
                .containsEntry("max_vectors_per_collection", 500);

        assertThat(config.alertThresholds().threshold(AlertThresholds.ERROR_RATE)).isEqualTo(0.5);
        assertThat(config.alertThresholds().threshold(AlertThresholds.AVERAGE_LATENCY_MS)).isNull();
    }

    @Test
    void environment_overridesDocument() throws URISyntaxException {
        Map<String, String> env = Map.of(
                "VECTOR_ACTIVE_PROVIDER", "secondary",
                "VECTOR_HEALTH_CHECK_ENABLED", "true",
                "VECTOR_HEALTH_CHECK_INTERVAL_SECONDS", "12",
                "VECTOR_FALLBACK_POLICY", "sticky",
                "VECTOR_FACTORY_FAIL_FAST", "false");

        VectorProviderConfig config = VectorProviderConfig.loadFromJson(fixture(), env::get);

        assertThat(config.activeProvider()).isEqualTo("secondary");
        assertThat(config.healthCheckEnabled()).isTrue();
        assertThat(config.healthCheckInterval()).isEqualTo(Duration.ofSeconds(12));
        assertThat(config.fallbackPolicy()).isEqualTo(FallbackPolicy.STICKY);
        assertThat(config.factoryConfig().failFast()).isFalse();
        assertThat(config.factoryConfig().maxRetries()).isEqualTo(5);
    }

    @Test
    void invalidEnvironmentValues_areIgnored() {
        Map<String, String> env = Map.of(
                "VECTOR_HEALTH_CHECK_ENABLED", "sometimes",
                "VECTOR_HEALTH_CHECK_INTERVAL_SECONDS", "soon",
                "VECTOR_FALLBACK_POLICY", "random");

        VectorProviderConfig config = VectorProviderConfig.builder().applyEnvironment(env::get).build();

        assertThat(config.healthCheckEnabled()).isTrue();
        assertThat(config.healthCheckInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.fallbackPolicy()).isEqualTo(FallbackPolicy.STICKY);
    }

    @Test
    void loadDefault_readsBundledResource() {
        VectorProviderConfig config = VectorProviderConfig.loadDefault();

        assertThat(config.providers()).containsKey("local");
        assertThat(config.providers().get("local").type()).isEqualTo("memory");
    }

    @Test
    void builder_defaults() {
        VectorProviderConfig config = VectorProviderConfig.builder().build();

        assertThat(config.providers()).isEmpty();
        assertThat(config.activeProvider()).isNull();
        assertThat(config.fallbackPolicy()).isEqualTo(FallbackPolicy.STICKY);
        assertThat(config.hybridRouting().strategy()).isEqualTo(HybridStrategy.FAILOVER);
        assertThat(config.healthCheckEnabled()).isTrue();
        assertThat(config.alertThresholds().thresholds()).isEmpty();
    }

    @Test
    void unknownReferences_areRejected() {
        assertThatThrownBy(() -> VectorProviderConfig.builder()
                .provider("a", ProviderSpec.of("memory"))
                .fallbackOrder(List.of("a", "b"))
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Fallback order references unknown provider: b");

        assertThatThrownBy(() -> VectorProviderConfig.builder()
                .hybridRole("reader", "ghost")
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Hybrid role reader references unknown provider: ghost");
    }

    @Test
    void nonPositiveInterval_isRejectedOnlyWhenHealthChecksRun() {
        assertThatThrownBy(() -> VectorProviderConfig.builder().healthCheckInterval(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);

        VectorProviderConfig disabled = VectorProviderConfig.builder()
                .healthCheckEnabled(false)
                .healthCheckInterval(Duration.ZERO)
                .build();
        assertThat(disabled.healthCheckEnabled()).isFalse();
    }

    @Test
    void malformedDocument_failsWithUncheckedIo(@TempDir Path dir) throws IOException {
        Path broken = Files.writeString(dir.resolve("broken.json"), "{ \"providers\": [");

        assertThatThrownBy(() -> VectorProviderConfig.loadFromJson(broken, Map.<String, String>of()::get))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("broken.json");
    }

    @Test
    void toBuilder_copiesEverything() throws URISyntaxException {
        VectorProviderConfig original = VectorProviderConfig.loadFromJson(fixture(), Map.<String, String>of()::get);

        VectorProviderConfig copy = original.toBuilder().activeProvider("secondary").build();

        assertThat(copy.activeProvider()).isEqualTo("secondary");
        assertThat(copy.providers()).isEqualTo(original.providers());
        assertThat(copy.hybridRoles()).isEqualTo(original.hybridRoles());
        assertThat(copy.factoryConfig()).isSameAs(original.factoryConfig());
    }
}
