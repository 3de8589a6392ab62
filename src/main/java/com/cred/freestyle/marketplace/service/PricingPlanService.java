package com.cred.freestyle.marketplace.service;

import com.cred.freestyle.marketplace.domain.model.PricingPlan;
import com.cred.freestyle.marketplace.domain.model.PricingPlan.PlanType;
import com.cred.freestyle.marketplace.exception.ResourceNotFoundException;
import com.cred.freestyle.marketplace.infrastructure.cache.RedisCacheService;
import com.cred.freestyle.marketplace.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.marketplace.infrastructure.transaction.AfterCommit;
import com.cred.freestyle.marketplace.repository.PricingPlanRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service for the pricing plan catalogue.
 * Reads are cache-first (Redis, 10 minute TTL); every admin write evicts all plan cache keys
 * once its transaction has committed.
 *
 * @author Marketplace Team
 */
@Service
public class PricingPlanService {

    private static final Logger logger = LoggerFactory.getLogger(PricingPlanService.class);

    private static final String CACHE_TYPE = "pricing_plans";
    private static final String RESOURCE_TYPE = "PricingPlan";

    private final PricingPlanRepository pricingPlanRepository;
    private final RedisCacheService cacheService;
    private final CloudWatchMetricsService metricsService;

    public PricingPlanService(
            PricingPlanRepository pricingPlanRepository,
            RedisCacheService cacheService,
            CloudWatchMetricsService metricsService
    ) {
        this.pricingPlanRepository = pricingPlanRepository;
        this.cacheService = cacheService;
        this.metricsService = metricsService;
    }

    /**
     * List active plans ordered by display order, then price.
     *
     * @param planType Plan type filter, or null for all plans
     * @return Active plans
     */
    @Transactional(readOnly = true)
    public List<PricingPlan> listActivePlans(PlanType planType) {
        Optional<List<PricingPlan>> cached = cacheService.getPricingPlans(planType);
        if (cached.isPresent()) {
            metricsService.recordCacheHit(CACHE_TYPE);
            return cached.get();
        }

        metricsService.recordCacheMiss(CACHE_TYPE);
        List<PricingPlan> plans = planType == null
                ? pricingPlanRepository.findByIsActiveTrueOrderByDisplayOrderAscPriceAsc()
                : pricingPlanRepository.findByPlanTypeAndIsActiveTrueOrderByDisplayOrderAscPriceAsc(planType);

        List<PricingPlan> detached = new ArrayList<>(plans);
        cacheService.cachePricingPlans(planType, detached);
        logger.debug("Loaded {} active pricing plans (type: {}) from database", detached.size(), planType);
        return detached;
    }

    /**
     * Create a plan.
     *
     * @param plan Plan to create
     * @return Saved plan
     * @throws IllegalArgumentException if price or duration is invalid
     */
    @Transactional
    public PricingPlan createPlan(PricingPlan plan) {
        validate(plan.getPrice(), plan.getDurationDays());
        PricingPlan saved = pricingPlanRepository.save(plan);
        AfterCommit.run("evict pricing plans", cacheService::evictPricingPlans);
        logger.info("Created pricing plan {} ({})", saved.getPlanId(), saved.getName());
        return saved;
    }

    /**
     * Replace the editable fields of a plan.
     *
     * @param planId Plan ID
     * @param changes Plan carrying the new values
     * @return Updated plan
     * @throws ResourceNotFoundException if the plan does not exist
     * @throws IllegalArgumentException if price or duration is invalid
     */
    @Transactional
    public PricingPlan updatePlan(String planId, PricingPlan changes) {
        validate(changes.getPrice(), changes.getDurationDays());

        PricingPlan plan = pricingPlanRepository.findById(planId)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, planId));

        plan.setName(changes.getName());
        plan.setPlanType(changes.getPlanType());
        plan.setDescription(changes.getDescription());
        plan.setPrice(changes.getPrice());
        if (changes.getCurrency() != null) {
            plan.setCurrency(changes.getCurrency());
        }
        plan.setDurationDays(changes.getDurationDays());
        plan.getFeatures().clear();
        if (changes.getFeatures() != null) {
            plan.getFeatures().addAll(changes.getFeatures());
        }
        if (changes.getIsActive() != null) {
            plan.setIsActive(changes.getIsActive());
        }
        if (changes.getDisplayOrder() != null) {
            plan.setDisplayOrder(changes.getDisplayOrder());
        }

        PricingPlan saved = pricingPlanRepository.save(plan);
        AfterCommit.run("evict pricing plans", cacheService::evictPricingPlans);
        logger.info("Updated pricing plan {}", planId);
        return saved;
    }

    /**
     * Deactivate a plan. Deactivated plans disappear from the public listing.
     *
     * @param planId Plan ID
     * @return Deactivated plan
     * @throws ResourceNotFoundException if the plan does not exist
     */
    @Transactional
    public PricingPlan deactivatePlan(String planId) {
        PricingPlan plan = pricingPlanRepository.findById(planId)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, planId));
        plan.deactivate();
        PricingPlan saved = pricingPlanRepository.save(plan);
        AfterCommit.run("evict pricing plans", cacheService::evictPricingPlans);
        logger.info("Deactivated pricing plan {}", planId);
        return saved;
    }

    private void validate(BigDecimal price, Integer durationDays) {
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("price must be zero or greater");
        }
        if (durationDays == null || durationDays < 1) {
            throw new IllegalArgumentException("duration_days must be at least 1");
        }
    }
}
