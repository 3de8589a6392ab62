package com.cred.freestyle.marketplace.api.dto;

import com.cred.freestyle.marketplace.domain.model.PremiumSubscription;

public class SubscriptionCancelResponse {

    private String message;
    private SubscriptionResponse subscription;

    public SubscriptionCancelResponse() {
    }

    public static SubscriptionCancelResponse of(String message, PremiumSubscription subscription) {
        SubscriptionCancelResponse response = new SubscriptionCancelResponse();
        response.setMessage(message);
        response.setSubscription(SubscriptionResponse.fromEntity(subscription));
        return response;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public SubscriptionResponse getSubscription() {
        return subscription;
    }

    public void setSubscription(SubscriptionResponse subscription) {
        this.subscription = subscription;
    }
}
