package com.cred.freestyle.marketplace.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Premium subscription bought by a user.
 *
 * Lifecycle:
 * - PENDING: created at purchase time, waiting for payment
 * - ACTIVE: payment completed, valid until end_date
 * - CANCELLED: cancelled by its owner while active
 * - EXPIRED: end_date passed, moved by the expiry sweep
 *
 * Validity is always derived through {@link #isActiveAt(Instant)}, so a lapsed
 * subscription stops counting as active even before the sweep runs.
 *
 * @author Marketplace Team
 */
@Entity
@Table(name = "premium_subscriptions", indexes = {
    @Index(name = "idx_subscriptions_user_status", columnList = "user_id, status"),
    @Index(name = "idx_subscriptions_status_end", columnList = "status, end_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PremiumSubscription {

    public static final int DEFAULT_DURATION_DAYS = 30;

    @Id
    @Column(name = "subscription_id", nullable = false, length = 36)
    private String subscriptionId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "subscription_type", nullable = false, length = 20)
    private SubscriptionType subscriptionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private SubscriptionStatus status = SubscriptionStatus.PENDING;

    @Column(name = "amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    @Builder.Default
    private String currency = "KES";

    /**
     * Length of the paid period, taken from the purchase request.
     */
    @Column(name = "duration_days", nullable = false)
    @Builder.Default
    private Integer durationDays = DEFAULT_DURATION_DAYS;

    @Column(name = "start_date")
    private Instant startDate;

    /**
     * Null until the subscription is activated.
     */
    @Column(name = "end_date")
    private Instant endDate;

    @Column(name = "auto_renew", nullable = false)
    @Builder.Default
    private Boolean autoRenew = false;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (subscriptionId == null) {
            subscriptionId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = Instant.now();

        if (status == null) {
            status = SubscriptionStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Activate the subscription for its paid duration starting at {@code now}.
     *
     * @param now Activation time
     */
    public void activate(Instant now) {
        this.status = SubscriptionStatus.ACTIVE;
        this.startDate = now;
        this.endDate = now.plus(durationDays != null ? durationDays : DEFAULT_DURATION_DAYS, ChronoUnit.DAYS);
    }

    /**
     * Cancel the subscription. Auto-renew is switched off as well.
     *
     * @param now Cancellation time
     */
    public void cancel(Instant now) {
        this.status = SubscriptionStatus.CANCELLED;
        this.autoRenew = false;
        this.cancelledAt = now;
    }

    public void expire() {
        this.status = SubscriptionStatus.EXPIRED;
    }

    /**
     * Check if the subscription is active at the given instant.
     *
     * @param now Instant to evaluate
     * @return true if status is ACTIVE and the end date (if any) has not passed
     */
    public boolean isActiveAt(Instant now) {
        return status == SubscriptionStatus.ACTIVE
                && (endDate == null || !now.isAfter(endDate));
    }

    public boolean isActive() {
        return isActiveAt(Instant.now());
    }

    /**
     * Subscription tier.
     */
    public enum SubscriptionType {
        BASIC,
        PREMIUM,
        PRO,
        ENTERPRISE;

        public static SubscriptionType fromValue(String value) {
            return EnumValues.parse(SubscriptionType.class, value, "subscription_type");
        }
    }

    /**
     * Subscription status enum.
     */
    public enum SubscriptionStatus {
        PENDING,
        ACTIVE,
        EXPIRED,
        CANCELLED
    }
}
