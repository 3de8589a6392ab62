package com.cred.freestyle.marketplace.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for purchasing a premium subscription.
 * Enum-valued fields are accepted case-insensitively ("premium", "mpesa").
 *
 * @author Marketplace Team
 */
public class SubscriptionPurchaseRequest {

    @NotBlank(message = "Subscription type is required")
    private String subscriptionType;

    @Min(value = 1, message = "Duration must be at least 1 day")
    @Max(value = 365, message = "Duration must be at most 365 days")
    private Integer durationDays = 30;

    @NotBlank(message = "Payment method is required")
    private String paymentMethod;

    private Boolean autoRenew = false;

    public SubscriptionPurchaseRequest() {
    }

    public SubscriptionPurchaseRequest(String subscriptionType, Integer durationDays,
                                       String paymentMethod, Boolean autoRenew) {
        this.subscriptionType = subscriptionType;
        this.durationDays = durationDays;
        this.paymentMethod = paymentMethod;
        this.autoRenew = autoRenew;
    }

    public String getSubscriptionType() {
        return subscriptionType;
    }

    public void setSubscriptionType(String subscriptionType) {
        this.subscriptionType = subscriptionType;
    }

    public Integer getDurationDays() {
        return durationDays;
    }

    public void setDurationDays(Integer durationDays) {
        this.durationDays = durationDays;
    }

    public String getPaymentMethod() {
        return paymentMethod;
    }

    public void setPaymentMethod(String paymentMethod) {
        this.paymentMethod = paymentMethod;
    }

    public Boolean getAutoRenew() {
        return autoRenew;
    }

    public void setAutoRenew(Boolean autoRenew) {
        this.autoRenew = autoRenew;
    }
}
