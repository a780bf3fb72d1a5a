/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.management;

import com.helios.vectorstore.api.IVectorProvider;
import com.helios.vectorstore.api.Operation;
import com.helios.vectorstore.api.OperationContext;
import com.helios.vectorstore.api.exceptions.NoActiveProviderException;
import com.helios.vectorstore.api.exceptions.OperationCancelledException;
import com.helios.vectorstore.api.exceptions.ProviderCreationException;
import com.helios.vectorstore.api.exceptions.ProviderNotFoundException;
import com.helios.vectorstore.api.exceptions.ProviderOperationException;
import com.helios.vectorstore.api.exceptions.ProviderUnhealthyException;
import com.helios.vectorstore.api.model.CostInfo;
import com.helios.vectorstore.api.model.HealthState;
import com.helios.vectorstore.api.model.HealthStatus;
import com.helios.vectorstore.api.model.ProviderHealth;
import com.helios.vectorstore.api.model.ProviderInfo;
import com.helios.vectorstore.api.model.VectorData;
import com.helios.vectorstore.composition.HybridRouting;
import com.helios.vectorstore.config.AlertThresholds;
import com.helios.vectorstore.config.FactoryConfig;
import com.helios.vectorstore.config.ProviderSpec;
import com.helios.vectorstore.config.VectorProviderConfig;
import com.helios.vectorstore.factory.ProviderFactory;
import com.helios.vectorstore.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.helios.vectorstore.infra.telemetry.TracingService;
import com.helios.vectorstore.provider.memory.InMemoryProviderRegistration;
import com.helios.vectorstore.registry.ProviderRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VectorProviderManagerTest {

    private final OperationContext ctx = OperationContext.background();

    private ProviderRegistry registry;
    private InMemoryMetricsRegistry metrics;
    private IVectorProvider remote;
    private IVectorProvider flaky;
    private VectorProviderManager manager;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry();
        InMemoryProviderRegistration memory = new InMemoryProviderRegistration();
        registry.register(memory.descriptor(), memory);

        remote = stub("remote", true);
        flaky = stub("flaky", false);
        registry.register("remote-db", settings -> remote);
        registry.register("flaky-db", settings -> flaky);

        metrics = new InMemoryMetricsRegistry();
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.shutdown(ctx);
        }
    }

    private static IVectorProvider stub(String name, boolean cloud) {
        IVectorProvider provider = mock(IVectorProvider.class);
        when(provider.name()).thenReturn(name);
        when(provider.type()).thenReturn(name + "-db");
        when(provider.isCloud()).thenReturn(cloud);
        when(provider.capabilities()).thenReturn(Set.of());
        when(provider.costInfo()).thenReturn(cloud ? CostInfo.monthly(20) : CostInfo.free());
        when(provider.health(any())).thenReturn(HealthStatus.healthy());
        return provider;
    }

    private VectorProviderManager manager(VectorProviderConfig.Builder config) {
        ProviderFactory factory = new ProviderFactory(registry,
                FactoryConfig.builder().validationEnabled(false).build(), metrics);
        manager = new VectorProviderManager(config.healthCheckEnabled(false).build(), factory,
                TracingService.noop().getTracer(), metrics);
        return manager;
    }

    private static VectorData vector(String id) {
        return VectorData.of(id, new float[]{1f, 0f, 0f}, Map.of("source", "test"));
    }

    @Nested
    class Initialization {

        @Test
        @DisplayName("Should start every enabled provider and use the configured active one")
        void initialize_usesConfiguredActiveProvider() {
            // Given
            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("primary", ProviderSpec.of("memory", Map.of("dimension", 3)))
                    .provider("remote", ProviderSpec.of("remote-db"))
                    .provider("archive", ProviderSpec.of("memory").disabled())
                    .activeProvider("remote"));

            // When
            m.initialize(ctx);

            // Then
            assertThat(m.state()).isEqualTo(ManagerState.READY);
            assertThat(m.getActiveProviderName()).contains("remote");
            assertThat(m.listProviders()).containsOnlyKeys("primary", "remote");
            ProviderInfo info = m.listProviders().get("remote");
            assertThat(info.active()).isTrue();
            assertThat(info.cloud()).isTrue();
            assertThat(info.healthy()).isTrue();
            verify(remote).start(any());
        }

        @Test
        void unhealthyConfiguredProvider_fallsBackToHealthyOne() {
            when(flaky.health(any())).thenReturn(HealthStatus.of(HealthState.UNHEALTHY, "disk full"));

            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("flaky", ProviderSpec.of("flaky-db"))
                    .provider("remote", ProviderSpec.of("remote-db"))
                    .activeProvider("flaky"));
            m.initialize(ctx);

            assertThat(m.getActiveProviderName()).contains("remote");
        }

        @Test
        void autoSelection_prefersLocalProviders() {
            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("remote", ProviderSpec.of("remote-db"))
                    .provider("local", ProviderSpec.of("memory")));
            m.initialize(ctx);

            assertThat(m.getActiveProviderName()).contains("local");
        }

        @Test
        void autoSelection_skipsUnhealthyLocalProvider() {
            when(flaky.health(any())).thenReturn(HealthStatus.of(HealthState.UNHEALTHY, "disk full"));

            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("flaky", ProviderSpec.of("flaky-db"))
                    .provider("remote", ProviderSpec.of("remote-db")));
            m.initialize(ctx);

            assertThat(m.getActiveProviderName()).contains("remote");
        }

        @Test
        void noHealthyProvider_startsDegradedWithFirst() {
            when(flaky.health(any())).thenThrow(new IllegalStateException("connection refused"));
            when(remote.health(any())).thenReturn(HealthStatus.of(HealthState.DEGRADED, "slow"));

            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("flaky", ProviderSpec.of("flaky-db"))
                    .provider("remote", ProviderSpec.of("remote-db")));
            m.initialize(ctx);

            assertThat(m.state()).isEqualTo(ManagerState.READY);
            assertThat(m.getActiveProviderName()).contains("flaky");
        }

        @Test
        void withoutProviders_managerIsReadyButHasNoActiveProvider() {
            VectorProviderManager m = manager(VectorProviderConfig.builder());
            m.initialize(ctx);

            assertThat(m.state()).isEqualTo(ManagerState.READY);
            assertThat(m.getActiveProviderName()).isEmpty();
            assertThatThrownBy(() -> m.store(ctx, List.of(vector("a"))))
                    .isInstanceOf(NoActiveProviderException.class)
                    .hasMessageContaining("No active provider");
        }

        @Test
        void failedCreation_stopsStartedProvidersAndResetsState() {
            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("remote", ProviderSpec.of("remote-db"))
                    .provider("ghost", ProviderSpec.of("unregistered")));

            assertThatThrownBy(() -> m.initialize(ctx))
                    .isInstanceOf(ProviderCreationException.class);

            assertThat(m.state()).isEqualTo(ManagerState.UNINITIALIZED);
            verify(remote).stop(any());
            assertThat(m.listProviders()).isEmpty();
        }

        @Test
        void secondInitialize_isRejected() {
            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("local", ProviderSpec.of("memory")));
            m.initialize(ctx);

            assertThatThrownBy(() -> m.initialize(ctx))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("READY");
        }

        @Test
        void compositesAreBuiltFromConfiguration() {
            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("primary", ProviderSpec.of("memory"))
                    .provider("remote", ProviderSpec.of("remote-db"))
                    .provider("archive", ProviderSpec.of("memory").disabled())
                    .fallbackOrder(List.of("primary", "archive", "remote"))
                    .hybridRole("reader", "remote")
                    .hybridRole("writer", "primary")
                    .hybridRouting(HybridRouting.operationBased(Map.of(Operation.SEARCH, "reader"), "writer")));
            m.initialize(ctx);

            assertThat(m.fallbackChain()).hasValueSatisfying(chain ->
                    assertThat(chain.members()).extracting(IVectorProvider::name).containsExactly("primary", "remote"));
            assertThat(m.hybridRouter()).hasValueSatisfying(router -> {
                assertThat(router.select(Operation.SEARCH).name()).isEqualTo("remote");
                assertThat(router.select(Operation.STORE).name()).isEqualTo("primary");
            });
            assertThat(m.fallbackHistory()).isEmpty();
        }
    }

    @Nested
    class RequestPath {

        @Test
        void storeAndRetrieve_goThroughActiveProvider() {
            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("local", ProviderSpec.of("memory", Map.of("dimension", 3))));
            m.initialize(ctx);

            m.store(ctx, List.of(vector("a"), vector("b")));

            assertThat(m.retrieve(ctx, List.of("a", "b"))).extracting(VectorData::id).containsExactly("a", "b");
            assertThat(m.findSimilar(ctx, new float[]{1f, 0f, 0f}, 1, Map.of())).hasSize(1);
            assertThat(m.getProviderPerformance().get("local").totalOperations()).isEqualTo(3);
        }

        @Test
        void providerFailure_isWrappedAndRecorded() {
            when(remote.retrieve(any(), anyList())).thenThrow(new IllegalStateException("timeout"));
            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("remote", ProviderSpec.of("remote-db")));
            m.initialize(ctx);

            assertThatThrownBy(() -> m.retrieve(ctx, List.of("a")))
                    .isInstanceOf(ProviderOperationException.class)
                    .hasMessage("Provider remote failed to retrieve: timeout")
                    .hasCauseInstanceOf(IllegalStateException.class);
            assertThat(m.getProviderPerformance().get("remote").failedOperations()).isEqualTo(1);
        }

        @Test
        void cancelledContext_isNotWrapped() {
            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("local", ProviderSpec.of("memory")));
            m.initialize(ctx);
            OperationContext cancelled = OperationContext.background();
            cancelled.cancel();

            assertThatThrownBy(() -> m.store(cancelled, List.of(vector("a"))))
                    .isInstanceOf(OperationCancelledException.class);
        }

        @Test
        void cancellationInsideProvider_isNotCountedAsFailure() {
            OperationContext caller = OperationContext.background();
            when(remote.retrieve(any(), anyList())).thenAnswer(invocation -> {
                caller.cancel();
                caller.checkCancelled("retrieve");
                return List.of();
            });
            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("remote", ProviderSpec.of("remote-db"))
                    .alertThresholds(new AlertThresholds(Map.of(AlertThresholds.ERROR_RATE, 0.1))));
            m.initialize(ctx);

            assertThatThrownBy(() -> m.retrieve(caller, List.of("a")))
                    .isInstanceOf(OperationCancelledException.class);

            assertThat(m.activePerformanceAlerts()).isEmpty();
            assertThat(m.getProviderPerformance()).doesNotContainKey("remote");
        }

        @Test
        void errorRateAlert_isRaisedAndCleared() {
            when(remote.retrieve(any(), anyList()))
                    .thenThrow(new IllegalStateException("timeout"))
                    .thenReturn(List.of());
            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("remote", ProviderSpec.of("remote-db"))
                    .alertThresholds(new AlertThresholds(Map.of(AlertThresholds.ERROR_RATE, 0.1))));
            m.initialize(ctx);

            assertThatThrownBy(() -> m.retrieve(ctx, List.of("a"))).isInstanceOf(ProviderOperationException.class);
            assertThat(m.activePerformanceAlerts()).containsEntry("remote", Set.of(AlertThresholds.ERROR_RATE));

            for (int i = 0; i < 10; i++) {
                m.retrieve(ctx, List.of("a"));
            }
            assertThat(m.activePerformanceAlerts()).isEmpty();
        }
    }

    @Nested
    class Switching {

        private VectorProviderManager m;

        @BeforeEach
        void start() {
            m = manager(VectorProviderConfig.builder()
                    .provider("local", ProviderSpec.of("memory"))
                    .provider("remote", ProviderSpec.of("remote-db"))
                    .provider("flaky", ProviderSpec.of("flaky-db"))
                    .activeProvider("local"));
            m.initialize(ctx);
        }

        @Test
        void switchToHealthyProvider_changesActive() {
            m.switchProvider(ctx, "remote");

            assertThat(m.getActiveProviderName()).contains("remote");
            assertThat(m.state()).isEqualTo(ManagerState.READY);
            m.store(ctx, List.of(vector("a")));
            verify(remote).store(any(), anyList());
        }

        @Test
        void switchToUnhealthyProvider_isRejected() {
            when(flaky.health(any())).thenReturn(HealthStatus.of(HealthState.UNHEALTHY, "disk full"));

            assertThatThrownBy(() -> m.switchProvider(ctx, "flaky"))
                    .isInstanceOf(ProviderUnhealthyException.class)
                    .hasMessage("Provider flaky is not healthy: disk full");

            assertThat(m.getActiveProviderName()).contains("local");
            assertThat(m.state()).isEqualTo(ManagerState.READY);
        }

        @Test
        void switchToUnreachableProvider_isRejected() {
            when(flaky.health(any())).thenThrow(new IllegalStateException("connection refused"));

            assertThatThrownBy(() -> m.switchProvider(ctx, "flaky"))
                    .isInstanceOf(ProviderUnhealthyException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);

            assertThat(m.getActiveProviderName()).contains("local");
        }

        @Test
        void switchToUnknownProvider_isRejected() {
            assertThatThrownBy(() -> m.switchProvider(ctx, "nowhere"))
                    .isInstanceOf(ProviderNotFoundException.class)
                    .hasMessage("Provider nowhere not found");
            assertThat(m.getActiveProviderName()).contains("local");
        }
    }

    @Nested
    class Health {

        @Test
        @DisplayName("Health map reflects each provider and feeds the health gauge")
        void providerHealth_isPublished() {
            when(flaky.health(any())).thenThrow(new IllegalStateException("connection refused"));
            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("local", ProviderSpec.of("memory"))
                    .provider("flaky", ProviderSpec.of("flaky-db")));
            m.initialize(ctx);

            Map<String, ProviderHealth> health = m.getProviderHealth(ctx);

            assertThat(health.get("local").healthy()).isTrue();
            ProviderHealth unreachable = health.get("flaky");
            assertThat(unreachable.status()).isEqualTo(HealthState.UNREACHABLE);
            assertThat(unreachable.errorMessage()).isEqualTo("connection refused");
            assertThat(unreachable.errorCount()).isEqualTo(1);
            assertThat(metrics.getGaugeValue(VectorProviderManager.HEALTH_GAUGE, "provider", "local")).isEqualTo(1.0);
            assertThat(metrics.getGaugeValue(VectorProviderManager.HEALTH_GAUGE, "provider", "flaky")).isZero();
            assertThat(m.listProviders().get("flaky").healthy()).isFalse();
        }

        @Test
        void recoveredProvider_keepsItsErrorHistory() {
            when(remote.health(any()))
                    .thenReturn(HealthStatus.of(HealthState.UNHEALTHY, "starting"))
                    .thenReturn(HealthStatus.healthy());
            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("remote", ProviderSpec.of("remote-db")));
            m.initialize(ctx);

            ProviderHealth recovered = m.getProviderHealth(ctx).get("remote");

            assertThat(recovered.healthy()).isTrue();
            assertThat(recovered.errorCount()).isEqualTo(1);
            assertThat(recovered.errorMessage()).isNull();
        }
    }

    @Nested
    class Shutdown {

        @Test
        void shutdown_stopsProvidersOnceAndRejectsRequests() {
            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("remote", ProviderSpec.of("remote-db")));
            m.initialize(ctx);

            m.shutdown(ctx);
            m.shutdown(ctx);

            assertThat(m.state()).isEqualTo(ManagerState.SHUT_DOWN);
            verify(remote, times(1)).stop(any());
            assertThat(m.listProviders()).isEmpty();
            assertThat(m.getProviderPerformance()).isEmpty();
            assertThatThrownBy(() -> m.retrieve(ctx, List.of("a")))
                    .isInstanceOf(NoActiveProviderException.class)
                    .hasMessageContaining("SHUT_DOWN");
            assertThatThrownBy(() -> m.initialize(ctx)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Shutdown during initialization stays terminal and stops what was started")
        void shutdownDuringInitialize_winsOverInitialization() throws Exception {
            // Given
            IVectorProvider slow = stub("slow", false);
            CountDownLatch constructing = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            registry.register("slow-db", settings -> {
                constructing.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return slow;
            });
            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("slow", ProviderSpec.of("slow-db")));
            CompletableFuture<Void> init = CompletableFuture.runAsync(() -> m.initialize(ctx));
            assertThat(constructing.await(5, TimeUnit.SECONDS)).isTrue();

            // When
            m.shutdown(ctx);
            release.countDown();

            // Then
            assertThatThrownBy(() -> init.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
            assertThat(m.state()).isEqualTo(ManagerState.SHUT_DOWN);
            assertThat(m.listProviders()).isEmpty();
            assertThat(m.getActiveProviderName()).isEmpty();
            verify(slow).stop(any());
        }

        @Test
        void providerStopFailure_doesNotAbortShutdown() {
            doThrow(new IllegalStateException("stuck")).when(flaky).stop(any());
            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("flaky", ProviderSpec.of("flaky-db"))
                    .provider("remote", ProviderSpec.of("remote-db")));
            m.initialize(ctx);

            m.close();

            assertThat(m.state()).isEqualTo(ManagerState.SHUT_DOWN);
            verify(remote).stop(any());
        }

        @Test
        void shutdownBeforeInitialize_isAllowed() {
            VectorProviderManager m = manager(VectorProviderConfig.builder()
                    .provider("remote", ProviderSpec.of("remote-db")));

            m.shutdown(ctx);

            assertThat(m.state()).isEqualTo(ManagerState.SHUT_DOWN);
            verify(remote, never()).stop(any());
        }
    }

    @Test
    void nullArguments_areRejected() {
        ProviderFactory factory = new ProviderFactory(registry, FactoryConfig.defaults(), metrics);

        assertThatThrownBy(() -> new VectorProviderManager(null, factory, null, metrics))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new VectorProviderManager(VectorProviderConfig.builder().build(), null, null, metrics))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
