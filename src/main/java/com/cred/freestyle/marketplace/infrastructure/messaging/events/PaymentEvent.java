package com.cred.freestyle.marketplace.infrastructure.messaging.events;

import com.cred.freestyle.marketplace.domain.model.AdBoost;
import com.cred.freestyle.marketplace.domain.model.PremiumSubscription;
import com.cred.freestyle.marketplace.domain.model.Transaction;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Payment or entitlement lifecycle event, published to the payment events topic
 * keyed by user ID so that one user's events stay ordered.
 *
 * Event Types:
 * - TRANSACTION_CREATED: purchase initiated, transaction pending
 * - TRANSACTION_COMPLETED: gateway confirmed payment, entitlement activated
 * - TRANSACTION_FAILED: gateway reported failure, nothing activated
 * - SUBSCRIPTION_CANCELLED: owner cancelled an active subscription
 * - SUBSCRIPTION_EXPIRED / BOOST_EXPIRED: expiry sweep moved a lapsed entitlement
 *
 * @author Marketplace Team
 */
public class PaymentEvent {

    private EventType eventType;
    private String userId;
    private String transactionReference;
    private String entitlementType;
    private String entitlementId;
    private String status;
    private BigDecimal amount;
    private String currency;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public PaymentEvent() {
    }

    public PaymentEvent(
            EventType eventType,
            String userId,
            String transactionReference,
            String entitlementType,
            String entitlementId,
            String status,
            BigDecimal amount,
            String currency
    ) {
        this.eventType = eventType;
        this.userId = userId;
        this.transactionReference = transactionReference;
        this.entitlementType = entitlementType;
        this.entitlementId = entitlementId;
        this.status = status;
        this.amount = amount;
        this.currency = currency;
        this.timestamp = Instant.now();
    }

    /**
     * Build an event describing a transaction.
     *
     * @param transaction Transaction
     * @param eventType Event type
     * @return Event
     */
    public static PaymentEvent forTransaction(Transaction transaction, EventType eventType) {
        String entitlementType = null;
        String entitlementId = null;
        if (transaction.getSubscription() != null) {
            entitlementType = "subscription";
            entitlementId = transaction.getSubscription().getSubscriptionId();
        } else if (transaction.getAdBoost() != null) {
            entitlementType = "ad_boost";
            entitlementId = transaction.getAdBoost().getBoostId();
        }
        return new PaymentEvent(
                eventType,
                transaction.getUserId(),
                transaction.getTransactionReference(),
                entitlementType,
                entitlementId,
                transaction.getStatus().name(),
                transaction.getAmount(),
                transaction.getCurrency()
        );
    }

    public static PaymentEvent forSubscription(PremiumSubscription subscription, EventType eventType) {
        return new PaymentEvent(
                eventType,
                subscription.getUserId(),
                null,
                "subscription",
                subscription.getSubscriptionId(),
                subscription.getStatus().name(),
                subscription.getAmount(),
                subscription.getCurrency()
        );
    }

    public static PaymentEvent forBoost(AdBoost boost, EventType eventType) {
        return new PaymentEvent(
                eventType,
                boost.getAd().getSellerId(),
                null,
                "ad_boost",
                boost.getBoostId(),
                boost.getStatus().name(),
                boost.getAmount(),
                boost.getCurrency()
        );
    }

    // Getters and setters
    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getTransactionReference() {
        return transactionReference;
    }

    public void setTransactionReference(String transactionReference) {
        this.transactionReference = transactionReference;
    }

    public String getEntitlementType() {
        return entitlementType;
    }

    public void setEntitlementType(String entitlementType) {
        this.entitlementType = entitlementType;
    }

    public String getEntitlementId() {
        return entitlementId;
    }

    public void setEntitlementId(String entitlementId) {
        this.entitlementId = entitlementId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "PaymentEvent{" +
                "eventType=" + eventType +
                ", userId='" + userId + '\'' +
                ", transactionReference='" + transactionReference + '\'' +
                ", entitlementType='" + entitlementType + '\'' +
                ", entitlementId='" + entitlementId + '\'' +
                ", status='" + status + '\'' +
                '}';
    }

    /**
     * Payment event types.
     */
    public enum EventType {
        TRANSACTION_CREATED,
        TRANSACTION_COMPLETED,
        TRANSACTION_FAILED,
        SUBSCRIPTION_CANCELLED,
        SUBSCRIPTION_EXPIRED,
        BOOST_EXPIRED
    }
}
