/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FactoryConfigTest {

    @Test
    void defaults() {
        FactoryConfig config = FactoryConfig.defaults();

        assertThat(config.defaultTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.maxRetries()).isEqualTo(3);
        assertThat(config.validationEnabled()).isTrue();
        assertThat(config.autoConfigEnabled()).isTrue();
        assertThat(config.failFast()).isFalse();
        assertThat(config.builtInDefaults())
                .containsEntry(FactoryConfig.TIMEOUT_SECONDS_KEY, 30L)
                .containsEntry(FactoryConfig.MAX_RETRIES_KEY, 3);
    }

    @Test
    void applyEnvironment_overridesEachSwitch() {
        Map<String, String> env = Map.of(
                "VECTOR_FACTORY_VALIDATION", "false",
                "VECTOR_FACTORY_AUTO_CONFIG", "false",
                "VECTOR_FACTORY_FAIL_FAST", "true",
                "VECTOR_FACTORY_TIMEOUT_SECONDS", "10",
                "VECTOR_FACTORY_MAX_RETRIES", "7");

        FactoryConfig config = FactoryConfig.builder().applyEnvironment(env::get).build();

        assertThat(config.validationEnabled()).isFalse();
        assertThat(config.autoConfigEnabled()).isFalse();
        assertThat(config.failFast()).isTrue();
        assertThat(config.defaultTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.maxRetries()).isEqualTo(7);
    }

    @Test
    void invalidValues_areRejected() {
        assertThatThrownBy(() -> FactoryConfig.builder().defaultTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("defaultTimeout");
        assertThatThrownBy(() -> FactoryConfig.builder().maxRetries(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxRetries");
    }

    @Test
    void customConfigs_areCopiedPerType() {
        FactoryConfig config = FactoryConfig.builder()
                .customConfig("memory", Map.of("dimension", 8))
                .build();

        assertThat(config.customConfigFor("memory")).containsEntry("dimension", 8);
        assertThat(config.customConfigFor("qdrant")).isEmpty();
        assertThat(config.toBuilder().failFast(true).build().customConfigFor("memory")).containsEntry("dimension", 8);
    }
}
