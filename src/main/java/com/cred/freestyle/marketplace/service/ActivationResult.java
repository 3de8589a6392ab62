package com.cred.freestyle.marketplace.service;

import java.time.Instant;

/**
 * Outcome of activating the entitlement behind a completed transaction.
 *
 * @author Marketplace Team
 */
public class ActivationResult {

    public static final String SUBSCRIPTION = "subscription";
    public static final String AD_BOOST = "ad_boost";

    private final String entitlementType;
    private final String entitlementId;
    private final String tier;
    private final Instant validUntil;

    public ActivationResult(String entitlementType, String entitlementId, String tier, Instant validUntil) {
        this.entitlementType = entitlementType;
        this.entitlementId = entitlementId;
        this.tier = tier;
        this.validUntil = validUntil;
    }

    public String getEntitlementType() {
        return entitlementType;
    }

    public String getEntitlementId() {
        return entitlementId;
    }

    public String getTier() {
        return tier;
    }

    public Instant getValidUntil() {
        return validUntil;
    }
}
