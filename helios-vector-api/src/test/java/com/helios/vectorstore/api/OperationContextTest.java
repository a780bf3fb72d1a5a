/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api;

import com.helios.vectorstore.api.exceptions.OperationCancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationContextTest {

    @Test
    void background_isNeverCancelled() {
        OperationContext ctx = OperationContext.background();

        assertThat(ctx.isCancelled()).isFalse();
        assertThat(ctx.deadline()).isEmpty();
        assertThatCode(() -> ctx.checkCancelled("store")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Cancelling a parent cancels every child")
    void cancel_propagatesToChildren() {
        OperationContext parent = OperationContext.background();
        OperationContext child = parent.child();

        parent.cancel();

        assertThat(child.isCancelled()).isTrue();
        assertThatThrownBy(() -> child.checkCancelled("search"))
                .isInstanceOf(OperationCancelledException.class)
                .hasMessage("Operation search cancelled");
    }

    @Test
    void cancellingChild_doesNotAffectParent() {
        OperationContext parent = OperationContext.background();
        OperationContext child = parent.child();

        child.cancel();

        assertThat(parent.isCancelled()).isFalse();
    }

    @Test
    void expiredDeadline_countsAsCancelled() {
        OperationContext ctx = OperationContext.withDeadline(Instant.now().minusSeconds(1));

        assertThat(ctx.isCancelled()).isTrue();
        assertThat(ctx.remaining()).contains(Duration.ZERO);
    }

    @Test
    @DisplayName("Child timeout never extends the inherited deadline")
    void childWithTimeout_keepsEarlierDeadline() {
        OperationContext parent = OperationContext.withTimeout(Duration.ofSeconds(1));
        OperationContext child = parent.childWithTimeout(Duration.ofHours(1));

        assertThat(child.deadline()).isEqualTo(parent.deadline());
    }

    @Test
    void negativeTimeout_isRejected() {
        assertThatThrownBy(() -> OperationContext.withTimeout(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
