package com.cred.freestyle.marketplace.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for boosting one of the caller's ads.
 *
 * @author Marketplace Team
 */
public class BoostPurchaseRequest {

    @NotBlank(message = "Ad ID is required")
    private String adId;

    @NotBlank(message = "Boost type is required")
    private String boostType;

    @Min(value = 1, message = "Duration must be at least 1 day")
    @Max(value = 30, message = "Duration must be at most 30 days")
    private Integer durationDays = 7;

    @NotBlank(message = "Payment method is required")
    private String paymentMethod;

    public BoostPurchaseRequest() {
    }

    public BoostPurchaseRequest(String adId, String boostType, Integer durationDays, String paymentMethod) {
        this.adId = adId;
        this.boostType = boostType;
        this.durationDays = durationDays;
        this.paymentMethod = paymentMethod;
    }

    public String getAdId() {
        return adId;
    }

    public void setAdId(String adId) {
        this.adId = adId;
    }

    public String getBoostType() {
        return boostType;
    }

    public void setBoostType(String boostType) {
        this.boostType = boostType;
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
}
