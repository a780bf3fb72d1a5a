/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api;

import com.helios.vectorstore.api.exceptions.OperationCancelledException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellable execution context passed to every provider operation.
 *
 * <p>The orchestration layer never imposes a timeout of its own: it forwards the
 * caller's context unchanged and only checks {@link #isCancelled()} between
 * candidates of a composite provider. Backends decide how to honour the deadline.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * OperationContext ctx = OperationContext.withTimeout(Duration.ofSeconds(5));
 * manager.store(ctx, List.of(vector));
 *
 * // From another thread
 * ctx.cancel();
 * }</pre>
 *
 * <p>Thread-safe. A child context is cancelled when its parent is.
 */
public final class OperationContext {

    private final OperationContext parent;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private OperationContext(OperationContext parent, Instant deadline) {
        this.parent = parent;
        this.deadline = deadline;
    }

    /**
     * Creates a root context with no deadline.
     */
    public static OperationContext background() {
        return new OperationContext(null, null);
    }

    public static OperationContext withTimeout(Duration timeout) {
        return background().childWithTimeout(timeout);
    }

    public static OperationContext withDeadline(Instant deadline) {
        return new OperationContext(null, deadline);
    }

    /**
     * Derives a child that inherits this context's cancellation and deadline.
     */
    public OperationContext child() {
        return new OperationContext(this, null);
    }

    /**
     * Derives a child whose deadline is the earlier of this context's deadline and
     * {@code now + timeout}.
     */
    public OperationContext childWithTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be non-negative: " + timeout);
        }
        Instant candidate = Instant.now().plus(timeout);
        Optional<Instant> inherited = deadline();
        Instant effective = inherited.filter(d -> d.isBefore(candidate)).orElse(candidate);
        return new OperationContext(this, effective);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        if (cancelled.get()) {
            return true;
        }
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            return true;
        }
        return parent != null && parent.isCancelled();
    }

    public Optional<Instant> deadline() {
        if (deadline != null) {
            return Optional.of(deadline);
        }
        return parent != null ? parent.deadline() : Optional.empty();
    }

    /**
     * Time left before the deadline, or empty when there is none.
     */
    public Optional<Duration> remaining() {
        return deadline().map(d -> {
            Duration left = Duration.between(Instant.now(), d);
            return left.isNegative() ? Duration.ZERO : left;
        });
    }

    /**
     * @throws OperationCancelledException if this context is cancelled or expired
     */
    public void checkCancelled(String operation) {
        if (isCancelled()) {
            throw new OperationCancelledException(
                    String.format("Operation %s cancelled", operation));
        }
    }
}
