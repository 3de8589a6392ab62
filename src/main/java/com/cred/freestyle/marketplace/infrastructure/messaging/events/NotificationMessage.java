package com.cred.freestyle.marketplace.infrastructure.messaging.events;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Request to notify a user, consumed by the notification dispatcher.
 * Delivery is best-effort; no confirmation flows back to this service.
 *
 * @author Marketplace Team
 */
public class NotificationMessage {

    public static final String PAYMENT_COMPLETED = "payment_completed";
    public static final String PAYMENT_FAILED = "payment_failed";
    public static final String SUBSCRIPTION_CANCELLED = "subscription_cancelled";
    public static final String SUBSCRIPTION_EXPIRED = "subscription_expired";
    public static final String BOOST_EXPIRED = "boost_expired";

    private String userId;
    private String template;
    private Map<String, Object> params;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public NotificationMessage() {
        this.params = new HashMap<>();
    }

    public NotificationMessage(String userId, String template, Map<String, Object> params) {
        this.userId = userId;
        this.template = template;
        this.params = params != null ? new HashMap<>(params) : new HashMap<>();
        this.timestamp = Instant.now();
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getTemplate() {
        return template;
    }

    public void setTemplate(String template) {
        this.template = template;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public void setParams(Map<String, Object> params) {
        this.params = params;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
}
