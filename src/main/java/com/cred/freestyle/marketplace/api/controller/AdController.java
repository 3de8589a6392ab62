package com.cred.freestyle.marketplace.api.controller;

import com.cred.freestyle.marketplace.api.dto.AdPageResponse;
import com.cred.freestyle.marketplace.api.dto.AdResponse;
import com.cred.freestyle.marketplace.domain.model.Ad;
import com.cred.freestyle.marketplace.repository.AdSearchCriteria;
import com.cred.freestyle.marketplace.repository.AdSpecifications;
import com.cred.freestyle.marketplace.security.SecurityUtils;
import com.cred.freestyle.marketplace.service.AdQueryService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Public ad listing and ad detail.
 *
 * The listing ranks premium ads (any tier but basic) above basic ones, newest first
 * within each group, unless the client picks an ordering (created_at, price, views_count,
 * "-" for descending). Query parameters keep the snake_case names the web client sends.
 *
 * @author Marketplace Team
 */
@RestController
@RequestMapping("/api/v1/ads")
public class AdController {

    private final AdQueryService adQueryService;

    public AdController(AdQueryService adQueryService) {
        this.adQueryService = adQueryService;
    }

    @GetMapping
    public ResponseEntity<AdPageResponse> listAds(
            @RequestParam(name = "price_min", required = false) BigDecimal priceMin,
            @RequestParam(name = "price_max", required = false) BigDecimal priceMax,
            @RequestParam(name = "category", required = false) String categoryId,
            @RequestParam(name = "category_slug", required = false) String categorySlug,
            @RequestParam(name = "city", required = false) String city,
            @RequestParam(name = "county", required = false) String county,
            @RequestParam(name = "condition", required = false) String condition,
            @RequestParam(name = "is_premium", required = false) Boolean isPremium,
            @RequestParam(name = "premium_type", required = false) String premiumType,
            @RequestParam(name = "seller", required = false) String sellerId,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "created_after", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdAfter,
            @RequestParam(name = "created_before", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdBefore,
            @RequestParam(name = "is_negotiable", required = false) Boolean isNegotiable,
            @RequestParam(name = "ordering", required = false) String ordering,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        AdSearchCriteria criteria = AdSearchCriteria.builder()
                .priceMin(priceMin)
                .priceMax(priceMax)
                .categoryId(blankToNull(categoryId))
                .categorySlug(blankToNull(categorySlug))
                .city(blankToNull(city))
                .county(blankToNull(county))
                .condition(hasText(condition) ? Ad.AdCondition.fromValue(condition) : null)
                .isPremium(isPremium)
                .premiumType(hasText(premiumType) ? Ad.PremiumType.fromValue(premiumType) : null)
                .sellerId(blankToNull(sellerId))
                .search(blankToNull(search))
                .createdAfter(createdAfter)
                .createdBefore(createdBefore)
                .isNegotiable(isNegotiable)
                .ordering(AdSpecifications.parseOrdering(ordering))
                .build();

        return ResponseEntity.ok(AdPageResponse.fromPage(adQueryService.listAds(criteria, page, size)));
    }

    @GetMapping("/{slug}")
    public ResponseEntity<AdResponse> getAd(@PathVariable String slug) {
        Ad ad = adQueryService.getAdBySlug(slug, SecurityUtils.getCurrentUserId());
        return ResponseEntity.ok(AdResponse.fromEntity(ad));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String blankToNull(String value) {
        return hasText(value) ? value.trim() : null;
    }
}
