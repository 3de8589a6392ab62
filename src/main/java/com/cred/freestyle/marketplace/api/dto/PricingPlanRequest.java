package com.cred.freestyle.marketplace.api.dto;

import com.cred.freestyle.marketplace.domain.model.PricingPlan;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Admin request DTO for creating or replacing a pricing plan.
 *
 * @author Marketplace Team
 */
public class PricingPlanRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must be at most 100 characters")
    private String name;

    @NotBlank(message = "Plan type is required")
    private String planType;

    private String description;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0.00", message = "Price must be zero or greater")
    private BigDecimal price;

    @Size(min = 3, max = 3, message = "Currency must be a 3-letter code")
    private String currency;

    @NotNull(message = "Duration is required")
    @Min(value = 1, message = "Duration must be at least 1 day")
    private Integer durationDays;

    private List<String> features = new ArrayList<>();

    private Boolean isActive;

    private Integer displayOrder;

    public PricingPlanRequest() {
    }

    /**
     * Build an unsaved plan carrying this request's values.
     *
     * @return PricingPlan
     * @throws IllegalArgumentException if the plan type is unknown
     */
    public PricingPlan toEntity() {
        PricingPlan plan = new PricingPlan();
        plan.setName(name);
        plan.setPlanType(PricingPlan.PlanType.fromValue(planType));
        plan.setDescription(description);
        plan.setPrice(price);
        if (currency != null) {
            plan.setCurrency(currency.toUpperCase(Locale.ROOT));
        }
        plan.setDurationDays(durationDays);
        plan.setFeatures(features == null ? new ArrayList<>() : new ArrayList<>(features));
        if (isActive != null) {
            plan.setIsActive(isActive);
        }
        if (displayOrder != null) {
            plan.setDisplayOrder(displayOrder);
        }
        return plan;
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
