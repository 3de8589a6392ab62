package com.cred.freestyle.marketplace.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Paid visibility boost on a single ad.
 * On activation the boosted ad takes the boost type as its premium tier.
 *
 * @author Marketplace Team
 */
@Entity
@Table(name = "ad_boosts", indexes = {
    @Index(name = "idx_ad_boosts_ad_status", columnList = "ad_id, status"),
    @Index(name = "idx_ad_boosts_status_end", columnList = "status, end_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdBoost {

    public static final int DEFAULT_DURATION_DAYS = 7;

    @Id
    @Column(name = "boost_id", nullable = false, length = 36)
    private String boostId;

    @ManyToOne
    @JoinColumn(name = "ad_id", nullable = false)
    private Ad ad;

    @Enumerated(EnumType.STRING)
    @Column(name = "boost_type", nullable = false, length = 20)
    private BoostType boostType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private BoostStatus status = BoostStatus.PENDING;

    @Column(name = "amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    @Builder.Default
    private String currency = "KES";

    @Column(name = "duration_days", nullable = false)
    @Builder.Default
    private Integer durationDays = DEFAULT_DURATION_DAYS;

    @Column(name = "start_date")
    private Instant startDate;

    @Column(name = "end_date")
    private Instant endDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (boostId == null) {
            boostId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = Instant.now();

        if (status == null) {
            status = BoostStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Activate the boost for its paid duration starting at {@code now}.
     *
     * @param now Activation time
     */
    public void activate(Instant now) {
        this.status = BoostStatus.ACTIVE;
        this.startDate = now;
        this.endDate = now.plus(durationDays != null ? durationDays : DEFAULT_DURATION_DAYS, ChronoUnit.DAYS);
    }

    public void expire() {
        this.status = BoostStatus.EXPIRED;
    }

    public boolean isActiveAt(Instant now) {
        return status == BoostStatus.ACTIVE
                && (endDate == null || !now.isAfter(endDate));
    }

    public boolean isActive() {
        return isActiveAt(Instant.now());
    }

    /**
     * Boost tier. Each tier maps onto the ad premium tier of the same name.
     */
    public enum BoostType {
        VIP,
        TOP,
        BOOSTED,
        FEATURED;

        public Ad.PremiumType toPremiumType() {
            return Ad.PremiumType.valueOf(name());
        }

        public static BoostType fromValue(String value) {
            return EnumValues.parse(BoostType.class, value, "boost_type");
        }
    }

    /**
     * Boost status enum.
     */
    public enum BoostStatus {
        PENDING,
        ACTIVE,
        EXPIRED
    }
}
