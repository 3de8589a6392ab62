package com.cred.freestyle.marketplace.api.dto;

import com.cred.freestyle.marketplace.domain.model.EnumValues;
import com.cred.freestyle.marketplace.domain.model.PremiumSubscription;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a premium subscription.
 * {@code isActive} is derived from status and end date at read time.
 *
 * @author Marketplace Team
 */
public class SubscriptionResponse {

    private String subscriptionId;
    private String userId;
    private String subscriptionType;
    private String status;
    private BigDecimal amount;
    private String currency;
    private Integer durationDays;
    private Instant startDate;
    private Instant endDate;
    private Boolean autoRenew;
    private Instant cancelledAt;
    private Instant createdAt;
    private Boolean isActive;

    public SubscriptionResponse() {
    }

    public static SubscriptionResponse fromEntity(PremiumSubscription subscription) {
        SubscriptionResponse response = new SubscriptionResponse();
        response.setSubscriptionId(subscription.getSubscriptionId());
        response.setUserId(subscription.getUserId());
        response.setSubscriptionType(EnumValues.toValue(subscription.getSubscriptionType()));
        response.setStatus(EnumValues.toValue(subscription.getStatus()));
        response.setAmount(subscription.getAmount());
        response.setCurrency(subscription.getCurrency());
        response.setDurationDays(subscription.getDurationDays());
        response.setStartDate(subscription.getStartDate());
        response.setEndDate(subscription.getEndDate());
        response.setAutoRenew(subscription.getAutoRenew());
        response.setCancelledAt(subscription.getCancelledAt());
        response.setCreatedAt(subscription.getCreatedAt());
        response.setIsActive(subscription.isActive());
        return response;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public void setSubscriptionId(String subscriptionId) {
        this.subscriptionId = subscriptionId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getSubscriptionType() {
        return subscriptionType;
    }

    public void setSubscriptionType(String subscriptionType) {
        this.subscriptionType = subscriptionType;
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

    public Integer getDurationDays() {
        return durationDays;
    }

    public void setDurationDays(Integer durationDays) {
        this.durationDays = durationDays;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public void setStartDate(Instant startDate) {
        this.startDate = startDate;
    }

    public Instant getEndDate() {
        return endDate;
    }

    public void setEndDate(Instant endDate) {
        this.endDate = endDate;
    }

    public Boolean getAutoRenew() {
        return autoRenew;
    }

    public void setAutoRenew(Boolean autoRenew) {
        this.autoRenew = autoRenew;
    }

    public Instant getCancelledAt() {
        return cancelledAt;
    }

    public void setCancelledAt(Instant cancelledAt) {
        this.cancelledAt = cancelledAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Boolean getIsActive() {
        return isActive;
    }

    public void setIsActive(Boolean isActive) {
        this.isActive = isActive;
    }
}
