package com.cred.freestyle.marketplace.repository;

import com.cred.freestyle.marketplace.domain.model.Ad.AdCondition;
import com.cred.freestyle.marketplace.domain.model.Ad.PremiumType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Sort;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Optional filters of the public ad listing. Null fields do not filter.
 * Only ACTIVE ads are ever listed, whatever the criteria.
 *
 * @author Marketplace Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdSearchCriteria {

    /** Inclusive lower price bound. */
    private BigDecimal priceMin;

    /** Inclusive upper price bound. */
    private BigDecimal priceMax;

    private String categoryId;

    private String categorySlug;

    /** Case-insensitive exact match. */
    private String city;

    /** Case-insensitive exact match. */
    private String county;

    private AdCondition condition;

    /** true: any tier except BASIC; false: BASIC only. */
    private Boolean isPremium;

    private PremiumType premiumType;

    private String sellerId;

    /** Case-insensitive substring over title or description. */
    private String search;

    /** Inclusive lower bound on created_at. */
    private Instant createdAfter;

    /** Inclusive upper bound on created_at. */
    private Instant createdBefore;

    private Boolean isNegotiable;

    /**
     * Client-selected ordering. When sorted, it replaces the premium-first ranking.
     * Build it with {@link AdSpecifications#parseOrdering(String)}.
     */
    private Sort ordering;
}
