/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.registry;

import com.helios.vectorstore.api.IVectorProvider;
import com.helios.vectorstore.api.ProviderCapabilities;
import com.helios.vectorstore.api.ProviderSettings;
import com.helios.vectorstore.api.exceptions.DuplicateProviderTypeException;
import com.helios.vectorstore.api.exceptions.ProviderCreationException;
import com.helios.vectorstore.api.exceptions.UnknownProviderTypeException;
import com.helios.vectorstore.api.exceptions.VectorProviderException;
import com.helios.vectorstore.api.model.CostInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class ProviderRegistryTest {

    private ProviderRegistry registry;
    private IVectorProvider instance;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry();
        instance = mock(IVectorProvider.class);
    }

    private static ProviderDescriptor descriptor(String type, boolean cloud, double cost, String... capabilities) {
        return ProviderDescriptor.builder(type)
                .cloud(cloud)
                .costInfo(CostInfo.monthly(cost))
                .capabilities(Set.of(capabilities))
                .build();
    }

    @Test
    void register_thenCreate_invokesConstructor() {
        List<ProviderSettings> seen = new ArrayList<>();
        registry.register("fake", settings -> {
            seen.add(settings);
            return instance;
        });

        ProviderSettings settings = ProviderSettings.of("fake", Map.of("k", "v"));
        IVectorProvider created = registry.create("fake", settings);

        assertThat(created).isSameAs(instance);
        assertThat(seen).containsExactly(settings);
        assertThat(registry.isRegistered("fake")).isTrue();
        assertThat(registry.requireDescriptor("fake").category()).isEqualTo(ProviderCategory.UNKNOWN);
    }

    @Test
    void duplicateRegistration_isRejected() {
        registry.register("fake", settings -> instance);

        assertThatThrownBy(() -> registry.register("fake", settings -> instance))
                .isInstanceOf(DuplicateProviderTypeException.class)
                .hasMessage("Provider type fake is already registered");
    }

    @Test
    void unknownType_failsOnCreateAndUnregister() {
        assertThatThrownBy(() -> registry.create("ghost", ProviderSettings.empty()))
                .isInstanceOf(UnknownProviderTypeException.class)
                .hasMessage("Unknown provider type: ghost");
        assertThatThrownBy(() -> registry.unregister("ghost"))
                .isInstanceOf(UnknownProviderTypeException.class);
        assertThat(registry.descriptor("ghost")).isEmpty();
    }

    @Test
    void unregister_removesType() {
        registry.register("fake", settings -> instance);

        registry.unregister("fake");

        assertThat(registry.registeredTypes()).isEmpty();
    }

    @Test
    void constructorFailure_isWrappedAtConstructionStage() {
        registry.register("broken", settings -> {
            throw new IllegalStateException("no driver");
        });

        assertThatThrownBy(() -> registry.create("broken", ProviderSettings.empty()))
                .isInstanceOfSatisfying(ProviderCreationException.class, e -> {
                    assertThat(e.getStage()).isEqualTo(ProviderCreationException.Stage.CONSTRUCTION);
                    assertThat(e.getMessage()).contains("no driver");
                    assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
                });
    }

    @Test
    void taxonomyErrors_propagateUnwrapped() {
        VectorProviderException failure = new VectorProviderException("backend refused");
        registry.register("refusing", settings -> {
            throw failure;
        });

        assertThatThrownBy(() -> registry.create("refusing", ProviderSettings.empty())).isSameAs(failure);
    }

    @Test
    void nullInstance_isRejected() {
        registry.register("empty", settings -> null);

        assertThatThrownBy(() -> registry.create("empty", ProviderSettings.empty()))
                .isInstanceOf(ProviderCreationException.class)
                .hasMessageContaining("constructor returned null");
    }

    @Test
    @DisplayName("Compatible types filter on capabilities, locality and cost")
    void compatibleTypes_filtersDescriptors() {
        registry.register(descriptor("local-db", false, 0, ProviderCapabilities.VECTOR_STORAGE,
                ProviderCapabilities.BACKUP), settings -> instance);
        registry.register(descriptor("cheap-cloud", true, 10, ProviderCapabilities.VECTOR_STORAGE), settings -> instance);
        registry.register(descriptor("pricey-cloud", true, 500, ProviderCapabilities.VECTOR_STORAGE,
                ProviderCapabilities.BACKUP), settings -> instance);

        assertThat(registry.compatibleTypes(null)).containsExactly("local-db", "cheap-cloud", "pricey-cloud");
        assertThat(registry.compatibleTypes(ProviderRequirements.withCapabilities(ProviderCapabilities.BACKUP)))
                .containsExactly("local-db", "pricey-cloud");
        assertThat(registry.compatibleTypes(ProviderRequirements.any().cloudOnly()))
                .containsExactly("cheap-cloud", "pricey-cloud");
        assertThat(registry.compatibleTypes(ProviderRequirements.any().cloudOnly().costAtMost(100)))
                .containsExactly("cheap-cloud");
        assertThat(registry.compatibleTypes(ProviderRequirements.withCapabilities(ProviderCapabilities.BACKUP).localOnly()))
                .containsExactly("local-db");
    }

    @Test
    void statistics_countByLocalityAndCategory() {
        registry.register(ProviderDescriptor.builder("qdrant").cloud(false).build(), settings -> instance);
        registry.register(ProviderDescriptor.builder("pinecone").cloud(true).build(), settings -> instance);
        registry.register(ProviderDescriptor.builder("memgpt").cloud(true).build(), settings -> instance);

        RegistryStatistics stats = registry.statistics();

        assertThat(stats.totalProviders()).isEqualTo(3);
        assertThat(stats.cloudProviders()).isEqualTo(2);
        assertThat(stats.localProviders()).isEqualTo(1);
        assertThat(stats.providersByCategory())
                .containsEntry(ProviderCategory.VECTOR_DATABASE, 2)
                .containsEntry(ProviderCategory.AI_MEMORY, 1);
    }

    @Test
    void defaultConfig_prefersSchemaDefaultsThenCannedDefaults() {
        registry.register(ProviderDescriptor.builder("qdrant").build(), settings -> instance);
        registry.register(ProviderDescriptor.builder("tuned")
                .schema(ProviderConfigSchema.builder()
                        .optional("batch_size", ConfigProperty.Type.INTEGER, 64L)
                        .build())
                .build(), settings -> instance);

        assertThat(registry.defaultConfig("qdrant")).containsEntry("host", "localhost").containsEntry("port", 6333);
        assertThat(registry.defaultConfig("tuned")).containsOnly(Map.entry("batch_size", 64L));
        assertThat(registry.defaultConfig("never-heard-of")).isEmpty();
    }

    @Test
    void defaultRegistry_discoversMemoryProvider() {
        assertThat(ProviderRegistry.defaultRegistry().isRegistered("memory")).isTrue();
        assertThat(ProviderRegistry.defaultRegistry()).isSameAs(ProviderRegistry.defaultRegistry());
    }

    @Test
    void concurrentRegistration_keepsEveryType() throws InterruptedException {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int i = 0; i < threads; i++) {
            String type = "type-" + i;
            executor.submit(() -> {
                start.await();
                registry.register(type, settings -> instance);
                return null;
            });
        }

        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(registry.registeredTypes()).hasSize(threads);
    }
}
