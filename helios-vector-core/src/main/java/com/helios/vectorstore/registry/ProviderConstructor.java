/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.registry;

import com.helios.vectorstore.api.IVectorProvider;
import com.helios.vectorstore.api.ProviderSettings;

/**
 * Builds an unstarted provider instance from validated settings.
 *
 * <p>Constructors must not connect to anything: the factory may build throwaway
 * instances to validate settings. Network work belongs in
 * {@link IVectorProvider#initialize} and {@link IVectorProvider#start}.
 */
@FunctionalInterface
public interface ProviderConstructor {

    IVectorProvider create(ProviderSettings settings);
}
