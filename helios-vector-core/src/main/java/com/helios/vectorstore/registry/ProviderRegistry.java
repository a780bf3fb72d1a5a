/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.registry;

import com.helios.vectorstore.api.IVectorProvider;
import com.helios.vectorstore.api.ProviderSettings;
import com.helios.vectorstore.api.exceptions.DuplicateProviderTypeException;
import com.helios.vectorstore.api.exceptions.ProviderCreationException;
import com.helios.vectorstore.api.exceptions.UnknownProviderTypeException;
import com.helios.vectorstore.api.exceptions.VectorProviderException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * Catalog mapping a provider type identifier to its descriptor and constructor.
 *
 * <p>A registry is an ordinary object: whoever assembles a factory or manager
 * owns one. {@link #defaultRegistry()} offers a lazily built process-wide instance
 * populated from {@link ProviderRegistration} services for callers that want one.
 *
 * <p>Thread-safe. Lookups share a read lock; {@link #register} and
 * {@link #unregister} take the write lock. Constructors run outside the lock.
 */
public final class ProviderRegistry {

    private static final Logger logger = Logger.getLogger(ProviderRegistry.class.getName());

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Registration> registrations = new LinkedHashMap<>();

    private record Registration(ProviderDescriptor descriptor, ProviderConstructor constructor) {
    }

    public ProviderRegistry() {
    }

    /**
     * Process-wide registry with every {@link ProviderRegistration} found on the
     * class path. Built on first call; safe under concurrent first use.
     */
    public static ProviderRegistry defaultRegistry() {
        return DefaultHolder.INSTANCE;
    }

    private static final class DefaultHolder {
        static final ProviderRegistry INSTANCE = loadServices(new ProviderRegistry());
    }

    /**
     * Registers every {@link ProviderRegistration} visible to the service loader.
     * Types already present are skipped with a warning.
     */
    public static ProviderRegistry loadServices(ProviderRegistry registry) {
        for (ProviderRegistration registration : ServiceLoader.load(ProviderRegistration.class)) {
            try {
                registry.register(registration.descriptor(), registration);
            } catch (DuplicateProviderTypeException e) {
                logger.warning(String.format("Skipping duplicate provider registration %s from %s",
                        e.getProviderType(), registration.getClass().getName()));
            }
        }
        logger.info(String.format("Provider registry loaded %d built-in types: %s",
                registry.registeredTypes().size(), registry.registeredTypes()));
        return registry;
    }

    /**
     * Registers a type with a minimal descriptor.
     *
     * @throws DuplicateProviderTypeException if the type is already registered
     */
    public void register(String type, ProviderConstructor constructor) {
        register(ProviderDescriptor.minimal(type), constructor);
    }

    /**
     * @throws DuplicateProviderTypeException if the type is already registered
     */
    public void register(ProviderDescriptor descriptor, ProviderConstructor constructor) {
        if (descriptor == null || constructor == null) {
            throw new IllegalArgumentException("Descriptor and constructor are required");
        }
        lock.writeLock().lock();
        try {
            if (registrations.containsKey(descriptor.type())) {
                throw new DuplicateProviderTypeException(descriptor.type());
            }
            registrations.put(descriptor.type(), new Registration(descriptor, constructor));
        } finally {
            lock.writeLock().unlock();
        }
        logger.fine(() -> "Registered provider type " + descriptor.type());
    }

    /**
     * @throws UnknownProviderTypeException if the type is not registered
     */
    public void unregister(String type) {
        lock.writeLock().lock();
        try {
            if (registrations.remove(type) == null) {
                throw new UnknownProviderTypeException(type);
            }
        } finally {
            lock.writeLock().unlock();
        }
        logger.fine(() -> "Unregistered provider type " + type);
    }

    /**
     * Invokes the registered constructor.
     *
     * <p>Errors from the taxonomy propagate as they are; anything else is wrapped in a
     * {@link ProviderCreationException} at stage {@code CONSTRUCTION}.
     *
     * @throws UnknownProviderTypeException if the type is not registered
     */
    public IVectorProvider create(String type, ProviderSettings settings) {
        Registration registration = lookup(type);
        IVectorProvider provider;
        try {
            provider = registration.constructor().create(settings);
        } catch (VectorProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderCreationException(type, ProviderCreationException.Stage.CONSTRUCTION,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        }
        if (provider == null) {
            throw new ProviderCreationException(type, ProviderCreationException.Stage.CONSTRUCTION,
                    "constructor returned null");
        }
        return provider;
    }

    /**
     * Default configuration for a type: the registered schema's defaults when it
     * declares any, otherwise the canned defaults for well-known type names,
     * otherwise an empty map. Never fails.
     *
     * @return a fresh mutable map
     */
    public Map<String, Object> defaultConfig(String type) {
        Optional<ProviderDescriptor> descriptor = descriptor(type);
        if (descriptor.isPresent()) {
            Map<String, Object> declared = descriptor.get().schema().defaults();
            if (!declared.isEmpty()) {
                return declared;
            }
        }
        return ProviderDefaults.configFor(type);
    }

    /**
     * Types whose descriptors satisfy {@code requirements}, in registration order.
     * Reads descriptors only; never constructs a backend.
     */
    public List<String> compatibleTypes(ProviderRequirements requirements) {
        ProviderRequirements effective = requirements != null ? requirements : ProviderRequirements.any();
        lock.readLock().lock();
        try {
            List<String> matches = new ArrayList<>();
            for (Registration registration : registrations.values()) {
                if (effective.matches(registration.descriptor())) {
                    matches.add(registration.descriptor().type());
                }
            }
            return matches;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<ProviderDescriptor> descriptor(String type) {
        lock.readLock().lock();
        try {
            Registration registration = registrations.get(type);
            return registration != null ? Optional.of(registration.descriptor()) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @throws UnknownProviderTypeException if the type is not registered
     */
    public ProviderDescriptor requireDescriptor(String type) {
        return lookup(type).descriptor();
    }

    public boolean isRegistered(String type) {
        lock.readLock().lock();
        try {
            return registrations.containsKey(type);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> registeredTypes() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(registrations.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public RegistryStatistics statistics() {
        lock.readLock().lock();
        try {
            int cloud = 0;
            Map<ProviderCategory, Integer> byCategory = new EnumMap<>(ProviderCategory.class);
            for (Registration registration : registrations.values()) {
                ProviderDescriptor descriptor = registration.descriptor();
                if (descriptor.cloud()) {
                    cloud++;
                }
                byCategory.merge(descriptor.category(), 1, Integer::sum);
            }
            int total = registrations.size();
            return new RegistryStatistics(total, cloud, total - cloud, byCategory);
        } finally {
            lock.readLock().unlock();
        }
    }

    private Registration lookup(String type) {
        lock.readLock().lock();
        try {
            Registration registration = registrations.get(type);
            if (registration == null) {
                throw new UnknownProviderTypeException(type);
            }
            return registration;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return String.format("ProviderRegistry{types=%s}", registeredTypes());
    }
}
