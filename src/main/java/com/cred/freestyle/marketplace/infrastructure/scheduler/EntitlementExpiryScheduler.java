package com.cred.freestyle.marketplace.infrastructure.scheduler;

import com.cred.freestyle.marketplace.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.marketplace.service.EntitlementExpiryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Scheduled sweep that expires lapsed subscriptions and boosts.
 *
 * Each run:
 * 1. Finds ACTIVE subscriptions and boosts whose end_date is before now
 * 2. Expires each one in its own transaction (see {@link EntitlementExpiryService})
 * 3. Records an error metric for any entitlement that fails, and moves on
 *
 * Re-running the sweep is safe: an entitlement that is no longer lapsed is skipped.
 * Max lag between end_date and the flags being cleared is one sweep interval.
 *
 * @author Marketplace Team
 */
@Service
public class EntitlementExpiryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(EntitlementExpiryScheduler.class);

    private final EntitlementExpiryService expiryService;
    private final CloudWatchMetricsService metricsService;

    @Value("${marketplace.entitlement.expiry-scheduler.enabled:true}")
    private boolean schedulerEnabled = true;

    public EntitlementExpiryScheduler(
            EntitlementExpiryService expiryService,
            CloudWatchMetricsService metricsService
    ) {
        this.expiryService = expiryService;
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${marketplace.entitlement.expiry-scheduler.interval-ms:60000}")
    public void expireLapsedEntitlements() {
        if (!schedulerEnabled) {
            logger.debug("Entitlement expiry scheduler is disabled");
            return;
        }

        long startTime = System.currentTimeMillis();
        try {
            int expired = sweep(Instant.now());
            if (expired > 0) {
                logger.info("Expiry sweep completed: {} entitlements expired, duration: {}ms",
                        expired, System.currentTimeMillis() - startTime);
            }
        } catch (Exception e) {
            logger.error("Error in entitlement expiry scheduler", e);
            metricsService.recordError("ENTITLEMENT_EXPIRY_SCHEDULER_ERROR", "expireLapsedEntitlements");
        }
    }

    /**
     * Manual trigger for the sweep (admin operation, used for testing).
     *
     * @return Number of entitlements expired
     */
    public int triggerSweepNow() {
        logger.info("Manual expiry sweep triggered");
        int expired = sweep(Instant.now());
        logger.info("Manual expiry sweep completed: {} entitlements expired", expired);
        return expired;
    }

    private int sweep(Instant now) {
        int expired = 0;
        int failed = 0;

        List<String> subscriptionIds = expiryService.findLapsedSubscriptionIds(now);
        for (String subscriptionId : subscriptionIds) {
            try {
                if (expiryService.expireSubscription(subscriptionId, now)) {
                    expired++;
                }
            } catch (Exception e) {
                failed++;
                logger.error("Error expiring subscription: {}", subscriptionId, e);
                metricsService.recordError("SUBSCRIPTION_EXPIRY_ERROR", "expireSubscription");
            }
        }

        List<String> boostIds = expiryService.findLapsedBoostIds(now);
        for (String boostId : boostIds) {
            try {
                if (expiryService.expireBoost(boostId, now)) {
                    expired++;
                }
            } catch (Exception e) {
                failed++;
                logger.error("Error expiring boost: {}", boostId, e);
                metricsService.recordError("BOOST_EXPIRY_ERROR", "expireBoost");
            }
        }

        if (failed > 0) {
            logger.warn("Expiry sweep: {} of {} lapsed entitlements failed",
                    failed, subscriptionIds.size() + boostIds.size());
        }
        return expired;
    }
}
