package com.cred.freestyle.marketplace.service;

import com.cred.freestyle.marketplace.domain.model.Ad;
import com.cred.freestyle.marketplace.exception.ResourceNotFoundException;
import com.cred.freestyle.marketplace.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.marketplace.repository.AdRepository;
import com.cred.freestyle.marketplace.repository.AdSearchCriteria;
import com.cred.freestyle.marketplace.repository.AdSpecifications;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read side of the ad catalogue: the ranked public listing and single-ad lookup.
 *
 * @author Marketplace Team
 */
@Service
public class AdQueryService {

    private static final Logger logger = LoggerFactory.getLogger(AdQueryService.class);

    public static final int DEFAULT_PAGE_SIZE = 20;

    private final AdRepository adRepository;
    private final CloudWatchMetricsService metricsService;

    @Value("${marketplace.ads.max-page-size:100}")
    private int maxPageSize = 100;

    public AdQueryService(AdRepository adRepository, CloudWatchMetricsService metricsService) {
        this.adRepository = adRepository;
        this.metricsService = metricsService;
    }

    /**
     * List active ads matching the criteria, premium ads first, newest first within each group.
     *
     * @param criteria Filters (null fields are ignored)
     * @param page Zero-based page index (negative values read as 0)
     * @param size Page size, clamped to [1, max-page-size]
     * @return Page of ads
     */
    @Transactional(readOnly = true)
    public Page<Ad> listAds(AdSearchCriteria criteria, int page, int size) {
        long startTime = System.currentTimeMillis();
        PageRequest pageRequest = PageRequest.of(Math.max(page, 0), clampPageSize(size));

        Page<Ad> result = adRepository.findAll(AdSpecifications.listing(criteria), pageRequest);

        metricsService.recordAdListingLatency(System.currentTimeMillis() - startTime);
        logger.debug("Listed {} of {} ads (page {}, size {})",
                result.getNumberOfElements(), result.getTotalElements(),
                pageRequest.getPageNumber(), pageRequest.getPageSize());
        return result;
    }

    /**
     * Get an ad by slug. Views by anyone but the seller are counted.
     * The count is a single-column update; the ad is then re-read, never written back.
     *
     * @param slug Ad slug
     * @param viewerId Viewing user, or null for anonymous viewers
     * @return Ad
     * @throws ResourceNotFoundException if no ad has the slug or it is deleted
     */
    @Transactional
    public Ad getAdBySlug(String slug, String viewerId) {
        Ad ad = adRepository.findBySlug(slug)
                .filter(found -> found.getStatus() != Ad.AdStatus.DELETED)
                .orElseThrow(() -> new ResourceNotFoundException("Ad", slug));

        if (viewerId != null && viewerId.equals(ad.getSellerId())) {
            return ad;
        }

        String adId = ad.getAdId();
        adRepository.incrementViewsCount(adId);
        return adRepository.findById(adId)
                .orElseThrow(() -> new ResourceNotFoundException("Ad", slug));
    }

    int clampPageSize(int size) {
        if (size < 1) {
            return Math.min(DEFAULT_PAGE_SIZE, maxPageSize);
        }
        return Math.min(size, maxPageSize);
    }
}
