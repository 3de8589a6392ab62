package com.cred.freestyle.marketplace.service;

import com.cred.freestyle.marketplace.domain.model.AdBoost.BoostType;
import com.cred.freestyle.marketplace.domain.model.PremiumSubscription.SubscriptionType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Prices subscriptions and boosts from a fixed unit-price table.
 *
 * Unit prices (KES):
 * - Subscriptions, per 30 days: BASIC 0, PREMIUM 999, PRO 2499, ENTERPRISE 4999
 * - Boosts, per 7 days: VIP 499, TOP 299, BOOSTED 199, FEATURED 399
 *
 * Other durations are prorated linearly and rounded half-up to 2 decimals,
 * e.g. PREMIUM for 15 days = 499.50.
 *
 * @author Marketplace Team
 */
@Component
public class PricingCalculator {

    public static final int SUBSCRIPTION_PERIOD_DAYS = 30;
    public static final int BOOST_PERIOD_DAYS = 7;

    private static final Map<SubscriptionType, BigDecimal> SUBSCRIPTION_UNIT_PRICES;
    private static final Map<BoostType, BigDecimal> BOOST_UNIT_PRICES;

    static {
        Map<SubscriptionType, BigDecimal> subscriptions = new EnumMap<>(SubscriptionType.class);
        subscriptions.put(SubscriptionType.BASIC, new BigDecimal("0"));
        subscriptions.put(SubscriptionType.PREMIUM, new BigDecimal("999"));
        subscriptions.put(SubscriptionType.PRO, new BigDecimal("2499"));
        subscriptions.put(SubscriptionType.ENTERPRISE, new BigDecimal("4999"));
        SUBSCRIPTION_UNIT_PRICES = Collections.unmodifiableMap(subscriptions);

        Map<BoostType, BigDecimal> boosts = new EnumMap<>(BoostType.class);
        boosts.put(BoostType.VIP, new BigDecimal("499"));
        boosts.put(BoostType.TOP, new BigDecimal("299"));
        boosts.put(BoostType.BOOSTED, new BigDecimal("199"));
        boosts.put(BoostType.FEATURED, new BigDecimal("399"));
        BOOST_UNIT_PRICES = Collections.unmodifiableMap(boosts);
    }

    /**
     * Price a subscription.
     *
     * @param type Subscription type
     * @param durationDays Paid duration in days (must be positive)
     * @return Amount in KES with scale 2
     */
    public BigDecimal subscriptionAmount(SubscriptionType type, int durationDays) {
        return prorate(SUBSCRIPTION_UNIT_PRICES.get(type), durationDays, SUBSCRIPTION_PERIOD_DAYS);
    }

    /**
     * Price an ad boost.
     *
     * @param type Boost type
     * @param durationDays Paid duration in days (must be positive)
     * @return Amount in KES with scale 2
     */
    public BigDecimal boostAmount(BoostType type, int durationDays) {
        return prorate(BOOST_UNIT_PRICES.get(type), durationDays, BOOST_PERIOD_DAYS);
    }

    private BigDecimal prorate(BigDecimal unitPrice, int durationDays, int periodDays) {
        if (unitPrice == null) {
            throw new IllegalArgumentException("No price defined for the requested type");
        }
        if (durationDays <= 0) {
            throw new IllegalArgumentException("duration_days must be positive, got " + durationDays);
        }
        return unitPrice.multiply(BigDecimal.valueOf(durationDays))
                .divide(BigDecimal.valueOf(periodDays), 2, RoundingMode.HALF_UP);
    }
}
