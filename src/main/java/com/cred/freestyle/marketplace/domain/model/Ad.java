package com.cred.freestyle.marketplace.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.text.Normalizer;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.Locale;
import java.util.UUID;

/**
 * Classified ad listed by a seller.
 * The premium tier is written by boost activation and read by the listing ranking.
 *
 * @author Marketplace Team
 */
@Entity
@Table(name = "ads", indexes = {
    @Index(name = "idx_ads_slug", columnList = "slug", unique = true),
    @Index(name = "idx_ads_seller_id", columnList = "seller_id"),
    @Index(name = "idx_ads_status", columnList = "status"),
    @Index(name = "idx_ads_premium_created", columnList = "premium_type, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Ad {

    /**
     * Days an active ad stays listed before it lapses.
     */
    public static final int EXPIRATION_DAYS = 30;

    private static final SecureRandom SLUG_RANDOM = new SecureRandom();

    @Id
    @Column(name = "ad_id", nullable = false, length = 36)
    private String adId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    /**
     * URL slug: slugified title plus 8 random hex characters.
     */
    @Column(name = "slug", nullable = false, unique = true, length = 255)
    private String slug;

    @Column(name = "description", length = 5000)
    private String description;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "currency", nullable = false, length = 3)
    @Builder.Default
    private String currency = "KES";

    @Enumerated(EnumType.STRING)
    @Column(name = "item_condition", nullable = false, length = 20)
    @Builder.Default
    private AdCondition condition = AdCondition.USED;

    @ManyToOne
    @JoinColumn(name = "category_id", nullable = false)
    private Category category;

    @ManyToOne
    @JoinColumn(name = "location_id", nullable = false)
    private Location location;

    @Column(name = "seller_id", nullable = false, length = 36)
    private String sellerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private AdStatus status = AdStatus.DRAFT;

    /**
     * Current premium tier. BASIC means not premium.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "premium_type", nullable = false, length = 20)
    @Builder.Default
    private PremiumType premiumType = PremiumType.BASIC;

    @Column(name = "is_negotiable", nullable = false)
    @Builder.Default
    private Boolean isNegotiable = false;

    @Column(name = "views_count", nullable = false)
    @Builder.Default
    private Integer viewsCount = 0;

    @Column(name = "contact_count", nullable = false)
    @Builder.Default
    private Integer contactCount = 0;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (adId == null) {
            adId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = Instant.now();

        if (slug == null) {
            slug = generateSlug(title);
        }
        if (expiresAt == null && status == AdStatus.ACTIVE) {
            expiresAt = createdAt.plus(EXPIRATION_DAYS, ChronoUnit.DAYS);
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Check if the ad currently carries a premium tier.
     *
     * @return true unless the tier is BASIC
     */
    public boolean isPremium() {
        return premiumType != null && premiumType != PremiumType.BASIC;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public void applyPremiumType(PremiumType premiumType) {
        this.premiumType = premiumType;
    }

    /**
     * Build a slug from a title: ASCII-folded, lowercased, runs of other
     * characters collapsed to a single dash, then a random 8-hex suffix.
     *
     * @param title Ad title
     * @return Unique-enough slug
     */
    static String generateSlug(String title) {
        String base = title == null ? "" : Normalizer.normalize(title, Normalizer.Form.NFKD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+|-+$)", "");

        byte[] suffix = new byte[4];
        SLUG_RANDOM.nextBytes(suffix);
        String hex = HexFormat.of().formatHex(suffix);

        return base.isEmpty() ? hex : base + "-" + hex;
    }

    /**
     * Condition of the listed item.
     */
    public enum AdCondition {
        NEW,
        USED,
        REFURBISHED;

        public static AdCondition fromValue(String value) {
            return EnumValues.parse(AdCondition.class, value, "condition");
        }
    }

    /**
     * Listing lifecycle. Only ACTIVE ads appear in the public listing.
     */
    public enum AdStatus {
        DRAFT,
        ACTIVE,
        EXPIRED,
        SOLD,
        DELETED
    }

    /**
     * Premium tier of an ad. Every tier except BASIC ranks ahead of BASIC ads.
     */
    public enum PremiumType {
        BASIC,
        VIP,
        TOP,
        BOOSTED,
        FEATURED;

        public static PremiumType fromValue(String value) {
            return EnumValues.parse(PremiumType.class, value, "premium_type");
        }
    }
}
