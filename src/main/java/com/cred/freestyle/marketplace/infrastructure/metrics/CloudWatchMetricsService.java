package com.cred.freestyle.marketplace.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * CloudWatch metrics service for monitoring and observability.
 * Publishes custom metrics to AWS CloudWatch via Micrometer.
 *
 * Key Metrics:
 * - Transaction created / completed / failed counts and duplicate callbacks
 * - Entitlement activations and expirations
 * - Revenue per transaction type
 * - Callback and listing latency (p50, p95, p99)
 * - Cache hit/miss rates and error counts
 *
 * @author Marketplace Team
 */
@Service
public class CloudWatchMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "marketplace.";
    private static final String TRANSACTION_PREFIX = METRIC_PREFIX + "transaction.";
    private static final String ENTITLEMENT_PREFIX = METRIC_PREFIX + "entitlement.";
    private static final String SUBSCRIPTION_PREFIX = METRIC_PREFIX + "subscription.";
    private static final String CACHE_PREFIX = METRIC_PREFIX + "cache.";
    private static final String ADS_PREFIX = METRIC_PREFIX + "ads.";

    public CloudWatchMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a newly created pending transaction.
     *
     * @param transactionType Transaction type (e.g., "SUBSCRIPTION", "AD_BOOST")
     * @param paymentMethod Payment method (e.g., "MPESA", "CARD")
     */
    public void recordTransactionCreated(String transactionType, String paymentMethod) {
        Counter.builder(TRANSACTION_PREFIX + "created")
                .tag("transaction_type", transactionType)
                .tag("payment_method", paymentMethod)
                .description("Transactions created")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded transaction created: type={}, method={}", transactionType, paymentMethod);
    }

    /**
     * Record a transaction settled as COMPLETED.
     *
     * @param transactionType Transaction type
     */
    public void recordTransactionCompleted(String transactionType) {
        Counter.builder(TRANSACTION_PREFIX + "completed")
                .tag("transaction_type", transactionType)
                .description("Transactions completed")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded transaction completed: type={}", transactionType);
    }

    /**
     * Record a transaction settled as FAILED.
     *
     * @param transactionType Transaction type
     */
    public void recordTransactionFailed(String transactionType) {
        Counter.builder(TRANSACTION_PREFIX + "failed")
                .tag("transaction_type", transactionType)
                .description("Transactions failed")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded transaction failed: type={}", transactionType);
    }

    /**
     * Record a repeated gateway callback that was ignored.
     *
     * @param status Callback status (e.g., "COMPLETED")
     */
    public void recordDuplicateCallback(String status) {
        Counter.builder(TRANSACTION_PREFIX + "callback.duplicate")
                .tag("status", status)
                .description("Repeated gateway callbacks ignored")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record gateway callback processing latency.
     *
     * @param durationMs Duration in milliseconds
     */
    public void recordCallbackLatency(long durationMs) {
        Timer.builder(TRANSACTION_PREFIX + "callback.latency")
                .description("Payment callback processing latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record business metric: revenue from a completed transaction.
     *
     * @param transactionType Transaction type
     * @param currency Currency code
     * @param amount Amount paid
     */
    public void recordRevenue(String transactionType, String currency, double amount) {
        Counter.builder(METRIC_PREFIX + "revenue")
                .tag("transaction_type", transactionType)
                .tag("currency", currency)
                .description("Revenue from completed transactions")
                .register(meterRegistry)
                .increment(amount);
        logger.debug("Recorded revenue: type={}, amount={} {}", transactionType, amount, currency);
    }

    /**
     * Record an entitlement activation.
     *
     * @param entitlementType "subscription" or "ad_boost"
     * @param tier Subscription type or boost type
     */
    public void recordEntitlementActivated(String entitlementType, String tier) {
        Counter.builder(ENTITLEMENT_PREFIX + "activated")
                .tag("entitlement_type", entitlementType)
                .tag("tier", tier)
                .description("Entitlements activated")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded entitlement activated: {} {}", entitlementType, tier);
    }

    /**
     * Record an entitlement moved to EXPIRED by the sweep.
     *
     * @param entitlementType "subscription" or "ad_boost"
     */
    public void recordEntitlementExpired(String entitlementType) {
        Counter.builder(ENTITLEMENT_PREFIX + "expired")
                .tag("entitlement_type", entitlementType)
                .description("Entitlements expired")
                .register(meterRegistry)
                .increment();
    }

    public void recordSubscriptionCancelled(String subscriptionType) {
        Counter.builder(SUBSCRIPTION_PREFIX + "cancelled")
                .tag("subscription_type", subscriptionType)
                .description("Subscriptions cancelled by their owner")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record cache hit.
     *
     * @param cacheType Type of cache (e.g., "pricing_plans")
     */
    public void recordCacheHit(String cacheType) {
        Counter.builder(CACHE_PREFIX + "hit")
                .tag("cache_type", cacheType)
                .description("Cache hits")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record cache miss.
     *
     * @param cacheType Type of cache
     */
    public void recordCacheMiss(String cacheType) {
        Counter.builder(CACHE_PREFIX + "miss")
                .tag("cache_type", cacheType)
                .description("Cache misses")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record ad listing query latency.
     *
     * @param durationMs Duration in milliseconds
     */
    public void recordAdListingLatency(long durationMs) {
        Timer.builder(ADS_PREFIX + "listing.latency")
                .description("Ad listing query latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record error occurrence.
     *
     * @param errorType Error type (e.g., "CALLBACK_PROCESSING_ERROR")
     * @param operation Operation where error occurred
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("System errors")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded error: type={}, operation={}", errorType, operation);
    }
}
