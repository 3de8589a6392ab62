package com.cred.freestyle.marketplace.api.dto;

import com.cred.freestyle.marketplace.domain.model.EnumValues;
import com.cred.freestyle.marketplace.domain.model.PricingPlan;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for a pricing plan.
 *
 * @author Marketplace Team
 */
public class PricingPlanResponse {

    private String planId;
    private String name;
    private String planType;
    private String description;
    private BigDecimal price;
    private String currency;
    private Integer durationDays;
    private List<String> features;
    private Boolean isActive;
    private Integer displayOrder;

    public PricingPlanResponse() {
    }

    public static PricingPlanResponse fromEntity(PricingPlan plan) {
        PricingPlanResponse response = new PricingPlanResponse();
        response.setPlanId(plan.getPlanId());
        response.setName(plan.getName());
        response.setPlanType(EnumValues.toValue(plan.getPlanType()));
        response.setDescription(plan.getDescription());
        response.setPrice(plan.getPrice());
        response.setCurrency(plan.getCurrency());
        response.setDurationDays(plan.getDurationDays());
        response.setFeatures(plan.getFeatures() == null ? new ArrayList<>() : new ArrayList<>(plan.getFeatures()));
        response.setIsActive(plan.getIsActive());
        response.setDisplayOrder(plan.getDisplayOrder());
        return response;
    }

    public String getPlanId() {
        return planId;
    }

    public void setPlanId(String planId) {
        this.planId = planId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPlanType() {
        return planType;
    }

    public void setPlanType(String planType) {
        this.planType = planType;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
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

    public List<String> getFeatures() {
        return features;
    }

    public void setFeatures(List<String> features) {
        this.features = features;
    }

    public Boolean getIsActive() {
        return isActive;
    }

    public void setIsActive(Boolean isActive) {
        this.isActive = isActive;
    }

    public Integer getDisplayOrder() {
        return displayOrder;
    }

    public void setDisplayOrder(Integer displayOrder) {
        this.displayOrder = displayOrder;
    }
}
