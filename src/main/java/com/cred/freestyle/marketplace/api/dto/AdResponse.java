package com.cred.freestyle.marketplace.api.dto;

import com.cred.freestyle.marketplace.domain.model.Ad;
import com.cred.freestyle.marketplace.domain.model.EnumValues;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for an ad in the public listing and detail views.
 *
 * @author Marketplace Team
 */
public class AdResponse {

    private String adId;
    private String title;
    private String slug;
    private String description;
    private BigDecimal price;
    private String currency;
    private String condition;
    private String categoryId;
    private String categoryName;
    private String categorySlug;
    private String city;
    private String county;
    private String sellerId;
    private String status;
    private String premiumType;
    private Boolean isPremium;
    private Boolean isNegotiable;
    private Integer viewsCount;
    private Instant expiresAt;
    private Instant createdAt;

    public AdResponse() {
    }

    public static AdResponse fromEntity(Ad ad) {
        AdResponse response = new AdResponse();
        response.setAdId(ad.getAdId());
        response.setTitle(ad.getTitle());
        response.setSlug(ad.getSlug());
        response.setDescription(ad.getDescription());
        response.setPrice(ad.getPrice());
        response.setCurrency(ad.getCurrency());
        response.setCondition(EnumValues.toValue(ad.getCondition()));
        if (ad.getCategory() != null) {
            response.setCategoryId(ad.getCategory().getCategoryId());
            response.setCategoryName(ad.getCategory().getName());
            response.setCategorySlug(ad.getCategory().getSlug());
        }
        if (ad.getLocation() != null) {
            response.setCity(ad.getLocation().getCity());
            response.setCounty(ad.getLocation().getCounty());
        }
        response.setSellerId(ad.getSellerId());
        response.setStatus(EnumValues.toValue(ad.getStatus()));
        response.setPremiumType(EnumValues.toValue(ad.getPremiumType()));
        response.setIsPremium(ad.isPremium());
        response.setIsNegotiable(ad.getIsNegotiable());
        response.setViewsCount(ad.getViewsCount());
        response.setExpiresAt(ad.getExpiresAt());
        response.setCreatedAt(ad.getCreatedAt());
        return response;
    }

    public String getAdId() {
        return adId;
    }

    public void setAdId(String adId) {
        this.adId = adId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getSlug() {
        return slug;
    }

    public void setSlug(String slug) {
        this.slug = slug;
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

    public String getCondition() {
        return condition;
    }

    public void setCondition(String condition) {
        this.condition = condition;
    }

    public String getCategoryId() {
        return categoryId;
    }

    public void setCategoryId(String categoryId) {
        this.categoryId = categoryId;
    }

    public String getCategoryName() {
        return categoryName;
    }

    public void setCategoryName(String categoryName) {
        this.categoryName = categoryName;
    }

    public String getCategorySlug() {
        return categorySlug;
    }

    public void setCategorySlug(String categorySlug) {
        this.categorySlug = categorySlug;
    }

    public String getCity() {
        return city;
    }

    public void setCity(String city) {
        this.city = city;
    }

    public String getCounty() {
        return county;
    }

    public void setCounty(String county) {
        this.county = county;
    }

    public String getSellerId() {
        return sellerId;
    }

    public void setSellerId(String sellerId) {
        this.sellerId = sellerId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getPremiumType() {
        return premiumType;
    }

    public void setPremiumType(String premiumType) {
        this.premiumType = premiumType;
    }

    public Boolean getIsPremium() {
        return isPremium;
    }

    public void setIsPremium(Boolean isPremium) {
        this.isPremium = isPremium;
    }

    public Boolean getIsNegotiable() {
        return isNegotiable;
    }

    public void setIsNegotiable(Boolean isNegotiable) {
        this.isNegotiable = isNegotiable;
    }

    public Integer getViewsCount() {
        return viewsCount;
    }

    public void setViewsCount(Integer viewsCount) {
        this.viewsCount = viewsCount;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
