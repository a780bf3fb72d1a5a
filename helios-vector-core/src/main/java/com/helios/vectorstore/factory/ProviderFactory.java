/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.factory;

import com.helios.vectorstore.api.IVectorProvider;
import com.helios.vectorstore.api.ProviderSettings;
import com.helios.vectorstore.api.exceptions.ConfigurationInvalidException;
import com.helios.vectorstore.api.exceptions.ProviderCreationException;
import com.helios.vectorstore.api.exceptions.ProviderCreationException.Stage;
import com.helios.vectorstore.api.exceptions.UnknownProviderTypeException;
import com.helios.vectorstore.api.exceptions.VectorProviderException;
import com.helios.vectorstore.composition.FallbackChain;
import com.helios.vectorstore.composition.FallbackPolicy;
import com.helios.vectorstore.composition.HybridRouter;
import com.helios.vectorstore.config.FactoryConfig;
import com.helios.vectorstore.config.HybridConfig;
import com.helios.vectorstore.config.ProviderSpec;
import com.helios.vectorstore.infra.metrics.MetricsRegistry;
import com.helios.vectorstore.monitoring.MonitoredVectorProvider;
import com.helios.vectorstore.registry.ProviderDescriptor;
import com.helios.vectorstore.registry.ProviderRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds ready-to-use, monitored providers from a type identifier and overrides.
 *
 * <p>Creation runs in fixed stages; a failure at any stage surfaces as a
 * {@link ProviderCreationException} naming that stage:
 * <ol>
 *   <li>{@code TYPE_LOOKUP}: the type must be registered</li>
 *   <li>{@code AUTO_CONFIGURATION}: merge built-in defaults, registry defaults,
 *       caller overrides and per-type custom configuration, in increasing priority</li>
 *   <li>{@code VALIDATION}: check the merged map against the type's schema and,
 *       when enabled, build and discard a probe instance</li>
 *   <li>{@code CONSTRUCTION}: build the real instance</li>
 *   <li>{@code INSTRUMENTATION}: wrap it in a {@link MonitoredVectorProvider}</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProviderFactory factory = new ProviderFactory(ProviderRegistry.defaultRegistry(), FactoryConfig.fromEnvironment());
 * MonitoredVectorProvider memory = factory.create("memory", Map.of("dimension", 384));
 *
 * FallbackChain chain = factory.createChain(List.of(
 *         ProviderSpec.of("qdrant", Map.of("host", "localhost")),
 *         ProviderSpec.of("memory")));
 * }</pre>
 *
 * <p>Batch builders ({@link #createChain}, {@link #createHybrid}) honor
 * {@link FactoryConfig#failFast()}: with fail-fast the first member failure aborts
 * the batch, otherwise failing members are logged and skipped.
 */
public final class ProviderFactory {

    private static final Logger logger = Logger.getLogger(ProviderFactory.class.getName());

    private final ProviderRegistry registry;
    private final FactoryConfig config;
    private final MetricsRegistry metricsRegistry;

    public ProviderFactory(ProviderRegistry registry, FactoryConfig config) {
        this(registry, config, MetricsRegistry.getInstance());
    }

    public ProviderFactory(ProviderRegistry registry, FactoryConfig config, MetricsRegistry metricsRegistry) {
        if (registry == null) {
            throw new IllegalArgumentException("Provider registry cannot be null");
        }
        this.registry = registry;
        this.config = config != null ? config : FactoryConfig.defaults();
        this.metricsRegistry = metricsRegistry != null ? metricsRegistry : MetricsRegistry.getInstance();
    }

    public ProviderRegistry registry() {
        return registry;
    }

    public FactoryConfig config() {
        return config;
    }

    // ----------------------------------------------------------------- single providers

    /**
     * Creates a provider of {@code type}. The instance is named after its type.
     */
    public MonitoredVectorProvider create(String type, Map<String, ?> overrides) {
        return build(type, overrides);
    }

    /**
     * Creates the provider described by {@code spec} under the instance name {@code name}.
     */
    public MonitoredVectorProvider create(String name, ProviderSpec spec) {
        Map<String, Object> overrides = new LinkedHashMap<>(spec.config());
        overrides.put(ProviderSettings.NAME_KEY, name);
        if (!spec.tags().isEmpty()) {
            logger.fine(() -> String.format("Creating provider %s (%s) tagged %s", name, spec.type(), spec.tags()));
        }
        return build(spec.type(), overrides);
    }

    /**
     * Creates a provider of {@code type} with nothing but default configuration.
     */
    public MonitoredVectorProvider createWithDefaults(String type) {
        return build(type, Map.of());
    }

    /**
     * Runs the type lookup, auto-configuration and schema validation stages only.
     */
    public ProviderSettings resolveSettings(String type, Map<String, ?> overrides) {
        ProviderDescriptor descriptor = lookup(type);
        Map<String, Object> merged = autoConfigure(type, overrides);
        return descriptor.schema().validate(type, merged);
    }

    private MonitoredVectorProvider build(String type, Map<String, ?> overrides) {
        long start = System.nanoTime();
        ProviderSettings settings = resolveSettings(type, overrides);

        if (config.validationEnabled()) {
            probe(type, settings);
        }

        IVectorProvider provider = construct(type, settings);

        MonitoredVectorProvider monitored;
        try {
            monitored = new MonitoredVectorProvider(provider, settings, metricsRegistry);
        } catch (RuntimeException e) {
            throw new ProviderCreationException(type, Stage.INSTRUMENTATION, describe(e), e);
        }

        logger.info(String.format("Created provider %s (type=%s) in %.2fms",
                monitored.name(), type, (System.nanoTime() - start) / 1_000_000.0));
        return monitored;
    }

    private ProviderDescriptor lookup(String type) {
        if (type == null || type.isBlank()) {
            throw new ProviderCreationException(String.valueOf(type), Stage.TYPE_LOOKUP, "provider type is blank");
        }
        return registry.descriptor(type).orElseThrow(() -> new ProviderCreationException(
                type, Stage.TYPE_LOOKUP, "provider type not registered", new UnknownProviderTypeException(type)));
    }

    private Map<String, Object> autoConfigure(String type, Map<String, ?> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>();
        try {
            if (config.autoConfigEnabled()) {
                merged.putAll(config.builtInDefaults());
                merged.putAll(registry.defaultConfig(type));
            }
            if (overrides != null) {
                overrides.forEach((key, value) -> {
                    if (key != null && value != null) {
                        merged.put(key, value);
                    }
                });
            }
            if (config.autoConfigEnabled()) {
                merged.putAll(config.customConfigFor(type));
            }
        } catch (RuntimeException e) {
            throw new ProviderCreationException(type, Stage.AUTO_CONFIGURATION, describe(e), e);
        }
        return merged;
    }

    private void probe(String type, ProviderSettings settings) {
        IVectorProvider probe;
        try {
            probe = registry.create(type, settings);
        } catch (ConfigurationInvalidException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConfigurationInvalidException(type, "validation instance rejected configuration: " + describe(rootOf(e)), e);
        }
        if (probe instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                logger.log(Level.FINE, "Failed to close validation instance of " + type, e);
            }
        }
    }

    private IVectorProvider construct(String type, ProviderSettings settings) {
        try {
            return registry.create(type, settings);
        } catch (ProviderCreationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderCreationException(type, Stage.CONSTRUCTION, describe(e), e);
        }
    }

    // ----------------------------------------------------------------- composites

    public FallbackChain createChain(List<ProviderSpec> specs) {
        return createChain(specs, FallbackPolicy.STICKY);
    }

    /**
     * Builds a chain over {@code specs} in order. Disabled specs are skipped.
     *
     * @throws ProviderCreationException at stage {@code COMPOSITION} if no member could be built
     */
    public FallbackChain createChain(List<ProviderSpec> specs, FallbackPolicy policy) {
        List<IVectorProvider> members = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        int position = 0;
        for (ProviderSpec spec : specs) {
            position++;
            if (!spec.enabled()) {
                continue;
            }
            String name = memberName(spec.type(), position, specs.size());
            try {
                members.add(create(name, spec));
            } catch (VectorProviderException e) {
                handleMemberFailure(FallbackChain.TYPE, name, e, failures);
            }
        }
        if (members.isEmpty()) {
            throw new ProviderCreationException(FallbackChain.TYPE, Stage.COMPOSITION, noMembersMessage(failures));
        }
        logger.info(String.format("Created fallback chain with %d members (%d skipped)", members.size(), failures.size()));
        return new FallbackChain(FallbackChain.DEFAULT_NAME, members, policy, FallbackChain.DEFAULT_HISTORY_CAPACITY);
    }

    /**
     * Builds a hybrid router with one member per role. Disabled specs are skipped.
     *
     * @throws ProviderCreationException at stage {@code COMPOSITION} if no member could
     *                                   be built or the routing references a missing role
     */
    public HybridRouter createHybrid(HybridConfig hybrid) {
        Map<String, IVectorProvider> members = new LinkedHashMap<>();
        List<String> failures = new ArrayList<>();
        for (Map.Entry<String, ProviderSpec> entry : hybrid.members().entrySet()) {
            if (!entry.getValue().enabled()) {
                continue;
            }
            try {
                members.put(entry.getKey(), create(entry.getKey(), entry.getValue()));
            } catch (VectorProviderException e) {
                handleMemberFailure(HybridRouter.TYPE, entry.getKey(), e, failures);
            }
        }
        if (members.isEmpty()) {
            throw new ProviderCreationException(HybridRouter.TYPE, Stage.COMPOSITION, noMembersMessage(failures));
        }
        try {
            HybridRouter router = new HybridRouter(members, hybrid.routing());
            logger.info(String.format("Created hybrid router %s with roles %s", router.name(), members.keySet()));
            return router;
        } catch (IllegalArgumentException e) {
            throw new ProviderCreationException(HybridRouter.TYPE, Stage.COMPOSITION, e.getMessage(), e);
        }
    }

    private void handleMemberFailure(String compositeType, String member, VectorProviderException e, List<String> failures) {
        if (config.failFast()) {
            throw e;
        }
        failures.add(String.format("%s: %s", member, e.getMessage()));
        logger.log(Level.WARNING, String.format("Skipping %s member %s: %s", compositeType, member, e.getMessage()), e);
    }

    private static String memberName(String type, int position, int total) {
        return total > 1 ? type + "-" + position : type;
    }

    private static String noMembersMessage(List<String> failures) {
        return failures.isEmpty()
                ? "no enabled members"
                : "no member could be created: " + String.join("; ", failures);
    }

    private static Throwable rootOf(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
