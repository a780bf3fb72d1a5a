/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.registry;

/**
 * Service Provider Interface for built-in provider types.
 *
 * <p>Implementations listed in
 * {@code META-INF/services/com.helios.vectorstore.registry.ProviderRegistration}
 * are registered into {@link ProviderRegistry#defaultRegistry()} on first use.
 * They must have a public no-arg constructor.
 */
public interface ProviderRegistration extends ProviderConstructor {

    ProviderDescriptor descriptor();
}
