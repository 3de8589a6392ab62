package com.cred.freestyle.marketplace.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Catalogue entry shown on the pricing page.
 * Plans are display data only: purchases are priced by the pricing calculator
 * and transactions never reference a plan.
 *
 * @author Marketplace Team
 */
@Entity
@Table(name = "pricing_plans", indexes = {
    @Index(name = "idx_pricing_plans_type_active", columnList = "plan_type, is_active"),
    @Index(name = "idx_pricing_plans_display_order", columnList = "display_order, price")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingPlan {

    @Id
    @Column(name = "plan_id", nullable = false, length = 36)
    private String planId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "plan_type", nullable = false, length = 20)
    private PlanType planType;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "currency", nullable = false, length = 3)
    @Builder.Default
    private String currency = "KES";

    @Column(name = "duration_days", nullable = false)
    @Builder.Default
    private Integer durationDays = 30;

    /**
     * Feature bullet points, kept in display order.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "pricing_plan_features", joinColumns = @JoinColumn(name = "plan_id"))
    @OrderColumn(name = "feature_order")
    @Column(name = "feature", length = 255)
    @Builder.Default
    private List<String> features = new ArrayList<>();

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @Column(name = "display_order", nullable = false)
    @Builder.Default
    private Integer displayOrder = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (planId == null) {
            planId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public void deactivate() {
        this.isActive = false;
    }

    /**
     * What a plan sells.
     */
    public enum PlanType {
        SUBSCRIPTION,
        AD_BOOST;

        public static PlanType fromValue(String value) {
            return EnumValues.parse(PlanType.class, value, "plan_type");
        }
    }
}
