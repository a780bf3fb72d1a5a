/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.factory;

import com.helios.vectorstore.api.IVectorProvider;
import com.helios.vectorstore.api.Operation;
import com.helios.vectorstore.api.OperationContext;
import com.helios.vectorstore.api.ProviderSettings;
import com.helios.vectorstore.api.exceptions.ConfigurationInvalidException;
import com.helios.vectorstore.api.exceptions.ProviderCreationException;
import com.helios.vectorstore.api.exceptions.ProviderCreationException.Stage;
import com.helios.vectorstore.api.exceptions.UnknownProviderTypeException;
import com.helios.vectorstore.composition.FallbackChain;
import com.helios.vectorstore.composition.FallbackPolicy;
import com.helios.vectorstore.composition.HybridRouter;
import com.helios.vectorstore.composition.HybridRouting;
import com.helios.vectorstore.composition.HybridStrategy;
import com.helios.vectorstore.config.FactoryConfig;
import com.helios.vectorstore.config.HybridConfig;
import com.helios.vectorstore.config.ProviderSpec;
import com.helios.vectorstore.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.helios.vectorstore.monitoring.MonitoredVectorProvider;
import com.helios.vectorstore.provider.memory.InMemoryProviderRegistration;
import com.helios.vectorstore.provider.memory.InMemoryVectorProvider;
import com.helios.vectorstore.registry.ProviderRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderFactoryTest {

    private ProviderRegistry registry;
    private InMemoryMetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry();
        InMemoryProviderRegistration memory = new InMemoryProviderRegistration();
        registry.register(memory.descriptor(), memory);
        registry.register("broken", settings -> {
            throw new IllegalStateException("driver missing");
        });
        metrics = new InMemoryMetricsRegistry();
    }

    private ProviderFactory factory(FactoryConfig config) {
        return new ProviderFactory(registry, config, metrics);
    }

    private static ProviderCreationException.Stage stageOf(Throwable e) {
        return ((ProviderCreationException) e).getStage();
    }

    @Test
    @DisplayName("Should build a monitored provider with merged settings")
    void create_buildsMonitoredProvider() {
        // When
        MonitoredVectorProvider provider = factory(FactoryConfig.defaults()).create("memory", Map.of("dimension", 3));

        // Then
        assertThat(provider.name()).isEqualTo("memory");
        assertThat(provider.type()).isEqualTo("memory");
        assertThat(provider.delegate()).isInstanceOf(InMemoryVectorProvider.class);
        assertThat(provider.settings().asMap())
                .containsEntry("dimension", 3L)
                .containsEntry("metric", "cosine")
                .containsEntry(FactoryConfig.TIMEOUT_SECONDS_KEY, 30L)
                .containsEntry(FactoryConfig.MAX_RETRIES_KEY, 3);
    }

    @Test
    void create_withSpec_usesInstanceName() {
        ProviderSpec spec = new ProviderSpec("memory", true, Map.of("dimension", 4), List.of("hot"));

        MonitoredVectorProvider provider = factory(FactoryConfig.defaults()).create("cache", spec);

        assertThat(provider.name()).isEqualTo("cache");
        assertThat(provider.settings().instanceName()).isEqualTo("cache");
    }

    @Test
    void customConfig_winsOverCallerOverrides() {
        FactoryConfig config = FactoryConfig.builder()
                .customConfig("memory", Map.of("max_vectors_per_collection", 500))
                .build();

        ProviderSettings settings = factory(config).resolveSettings("memory",
                Map.of("max_vectors_per_collection", 1000, "metric", "dot"));

        assertThat(settings.getLong("max_vectors_per_collection", 0)).isEqualTo(500);
        assertThat(settings.getString("metric", null)).isEqualTo("dot");
    }

    @Test
    void disabledAutoConfig_skipsBuiltInDefaults() {
        FactoryConfig config = FactoryConfig.builder()
                .autoConfigEnabled(false)
                .customConfig("memory", Map.of("max_vectors_per_collection", 500))
                .build();

        ProviderSettings settings = factory(config).resolveSettings("memory", Map.of());

        assertThat(settings.asMap()).doesNotContainKey(FactoryConfig.TIMEOUT_SECONDS_KEY);
        assertThat(settings.getLong("max_vectors_per_collection", 0)).isEqualTo(100_000L);
    }

    @Test
    void createWithDefaults_usesOnlyDefaults() {
        MonitoredVectorProvider provider = factory(FactoryConfig.defaults()).createWithDefaults("memory");

        assertThat(provider.settings().getInt("dimension", -1)).isZero();
    }

    @Test
    void unknownType_failsAtTypeLookup() {
        assertThatThrownBy(() -> factory(FactoryConfig.defaults()).create("ghost", Map.of()))
                .isInstanceOf(ProviderCreationException.class)
                .satisfies(e -> assertThat(stageOf(e)).isEqualTo(Stage.TYPE_LOOKUP))
                .hasCauseInstanceOf(UnknownProviderTypeException.class);
    }

    @Test
    void mistypedSetting_failsAtValidation() {
        assertThatThrownBy(() -> factory(FactoryConfig.defaults()).create("memory", Map.of("dimension", "three")))
                .isInstanceOfSatisfying(ConfigurationInvalidException.class, e ->
                        assertThat(e.getViolations()).containsExactly("setting 'dimension' must be INTEGER but was 'three'"));
    }

    @Test
    void probeInstance_rejectsBadMetric() {
        assertThatThrownBy(() -> factory(FactoryConfig.defaults()).create("memory", Map.of("metric", "hamming")))
                .isInstanceOf(ConfigurationInvalidException.class)
                .hasMessageContaining("Unsupported metric: hamming")
                .satisfies(e -> assertThat(stageOf(e)).isEqualTo(Stage.VALIDATION));
    }

    @Test
    void withoutValidation_constructionFailureIsReported() {
        FactoryConfig config = FactoryConfig.builder().validationEnabled(false).build();

        assertThatThrownBy(() -> factory(config).create("broken", Map.of()))
                .isInstanceOf(ProviderCreationException.class)
                .hasMessageContaining("driver missing")
                .satisfies(e -> assertThat(stageOf(e)).isEqualTo(Stage.CONSTRUCTION));
    }

    @Test
    void createdProvider_reportsToMetricsRegistry() {
        OperationContext ctx = OperationContext.background();
        MonitoredVectorProvider provider = factory(FactoryConfig.defaults()).create("memory", Map.of());
        provider.initialize(ctx, provider.settings());
        provider.start(ctx);

        provider.retrieve(ctx, List.of("absent"));

        assertThat(metrics.getTimerRecordings(MonitoredVectorProvider.TIMER_NAME,
                "provider", "memory", "operation", Operation.RETRIEVE.key())).hasSize(1);
    }

    @Test
    @DisplayName("Chains name members by type and position and skip failing members")
    void createChain_skipsFailingMembers() {
        FallbackChain chain = factory(FactoryConfig.defaults()).createChain(List.of(
                ProviderSpec.of("memory"),
                ProviderSpec.of("broken"),
                ProviderSpec.of("memory").disabled(),
                ProviderSpec.of("memory")), FallbackPolicy.RETRY_FROM_FIRST);

        assertThat(chain.name()).isEqualTo(FallbackChain.DEFAULT_NAME);
        assertThat(chain.policy()).isEqualTo(FallbackPolicy.RETRY_FROM_FIRST);
        assertThat(chain.members()).extracting(IVectorProvider::name).containsExactly("memory-1", "memory-4");
    }

    @Test
    void createChain_failFastAbortsOnFirstFailure() {
        FactoryConfig config = FactoryConfig.builder().failFast(true).build();

        assertThatThrownBy(() -> factory(config).createChain(List.of(ProviderSpec.of("memory"), ProviderSpec.of("broken"))))
                .isInstanceOf(ConfigurationInvalidException.class)
                .hasMessageContaining("driver missing");
    }

    @Test
    void createChain_withoutEnabledMembers_fails() {
        assertThatThrownBy(() -> factory(FactoryConfig.defaults()).createChain(List.of(ProviderSpec.of("memory").disabled())))
                .isInstanceOf(ProviderCreationException.class)
                .hasMessageContaining("no enabled members")
                .satisfies(e -> assertThat(stageOf(e)).isEqualTo(Stage.COMPOSITION));
    }

    @Test
    void createChain_whenEveryMemberFails_listsFailures() {
        assertThatThrownBy(() -> factory(FactoryConfig.defaults()).createChain(List.of(ProviderSpec.of("broken"))))
                .isInstanceOf(ProviderCreationException.class)
                .hasMessageContaining("no member could be created: broken:");
    }

    @Test
    void createHybrid_buildsOneMemberPerRole() {
        Map<String, ProviderSpec> members = new LinkedHashMap<>();
        members.put("reader", ProviderSpec.of("memory"));
        members.put("writer", ProviderSpec.of("memory"));
        HybridConfig hybrid = new HybridConfig(
                HybridRouting.operationBased(Map.of(Operation.SEARCH, "reader"), "writer"), members);

        HybridRouter router = factory(FactoryConfig.defaults()).createHybrid(hybrid);

        assertThat(router.strategy()).isEqualTo(HybridStrategy.OPERATION_BASED);
        assertThat(router.members()).containsOnlyKeys("reader", "writer");
        assertThat(router.select(Operation.SEARCH).name()).isEqualTo("reader");
        assertThat(router.select(Operation.STORE).name()).isEqualTo("writer");
    }

    @Test
    void createHybrid_routeToUnknownRole_failsAtComposition() {
        HybridConfig hybrid = new HybridConfig(
                HybridRouting.operationBased(Map.of(Operation.SEARCH, "ghost"), null),
                Map.of("writer", ProviderSpec.of("memory")));

        assertThatThrownBy(() -> factory(FactoryConfig.defaults()).createHybrid(hybrid))
                .isInstanceOf(ProviderCreationException.class)
                .hasMessageContaining("unknown role ghost")
                .satisfies(e -> assertThat(stageOf(e)).isEqualTo(Stage.COMPOSITION));
    }

    @Test
    void nullRegistry_isRejected() {
        assertThatThrownBy(() -> new ProviderFactory(null, FactoryConfig.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
