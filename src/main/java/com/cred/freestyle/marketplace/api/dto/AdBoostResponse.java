package com.cred.freestyle.marketplace.api.dto;

import com.cred.freestyle.marketplace.domain.model.AdBoost;
import com.cred.freestyle.marketplace.domain.model.EnumValues;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for an ad boost.
 *
 * @author Marketplace Team
 */
public class AdBoostResponse {

    private String boostId;
    private String adId;
    private String adTitle;
    private String boostType;
    private String status;
    private BigDecimal amount;
    private String currency;
    private Integer durationDays;
    private Instant startDate;
    private Instant endDate;
    private Instant createdAt;
    private Boolean isActive;

    public AdBoostResponse() {
    }

    public static AdBoostResponse fromEntity(AdBoost boost) {
        AdBoostResponse response = new AdBoostResponse();
        response.setBoostId(boost.getBoostId());
        if (boost.getAd() != null) {
            response.setAdId(boost.getAd().getAdId());
            response.setAdTitle(boost.getAd().getTitle());
        }
        response.setBoostType(EnumValues.toValue(boost.getBoostType()));
        response.setStatus(EnumValues.toValue(boost.getStatus()));
        response.setAmount(boost.getAmount());
        response.setCurrency(boost.getCurrency());
        response.setDurationDays(boost.getDurationDays());
        response.setStartDate(boost.getStartDate());
        response.setEndDate(boost.getEndDate());
        response.setCreatedAt(boost.getCreatedAt());
        response.setIsActive(boost.isActive());
        return response;
    }

    public String getBoostId() {
        return boostId;
    }

    public void setBoostId(String boostId) {
        this.boostId = boostId;
    }

    public String getAdId() {
        return adId;
    }

    public void setAdId(String adId) {
        this.adId = adId;
    }

    public String getAdTitle() {
        return adTitle;
    }

    public void setAdTitle(String adTitle) {
        this.adTitle = adTitle;
    }

    public String getBoostType() {
        return boostType;
    }

    public void setBoostType(String boostType) {
        this.boostType = boostType;
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
