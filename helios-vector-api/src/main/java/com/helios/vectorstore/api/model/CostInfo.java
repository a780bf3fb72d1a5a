/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cost model declared or reported by a provider.
 */
public record CostInfo(
        @JsonProperty("currency") String currency,
        @JsonProperty("compute_cost") double computeCost,
        @JsonProperty("transfer_cost") double transferCost,
        @JsonProperty("storage_cost") double storageCost,
        @JsonProperty("total_cost") double totalCost,
        @JsonProperty("billing_period") String billingPeriod,
        @JsonProperty("free_tier_used") boolean freeTierUsed,
        @JsonProperty("free_tier_limit") double freeTierLimit
) {

    public static final String DEFAULT_CURRENCY = "USD";
    public static final String DEFAULT_BILLING_PERIOD = "monthly";

    private static final CostInfo FREE =
            new CostInfo(DEFAULT_CURRENCY, 0, 0, 0, 0, DEFAULT_BILLING_PERIOD, false, 0);

    public CostInfo {
        currency = currency != null ? currency : DEFAULT_CURRENCY;
        billingPeriod = billingPeriod != null ? billingPeriod : DEFAULT_BILLING_PERIOD;
    }

    public static CostInfo free() {
        return FREE;
    }

    /**
     * Flat monthly cost with everything attributed to storage.
     */
    public static CostInfo monthly(double storageCost) {
        return new CostInfo(DEFAULT_CURRENCY, 0, 0, storageCost, storageCost, DEFAULT_BILLING_PERIOD, false, 0);
    }

    /**
     * Field-wise sum. Currency and billing period are taken from this instance.
     */
    public CostInfo plus(CostInfo other) {
        if (other == null) {
            return this;
        }
        return new CostInfo(
                currency,
                computeCost + other.computeCost,
                transferCost + other.transferCost,
                storageCost + other.storageCost,
                totalCost + other.totalCost,
                billingPeriod,
                freeTierUsed || other.freeTierUsed,
                freeTierLimit + other.freeTierLimit);
    }
}
