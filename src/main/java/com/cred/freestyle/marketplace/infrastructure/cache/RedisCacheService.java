package com.cred.freestyle.marketplace.infrastructure.cache;

import com.cred.freestyle.marketplace.domain.model.PricingPlan;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Redis cache service for read-mostly catalogue data.
 *
 * Cache Keys:
 * - pricing_plans:all -> All active pricing plans (JSON list)
 * - pricing_plans:{plan_type} -> Active plans of one type (JSON list)
 *
 * Every method degrades to a cache miss on Redis errors; the database stays the source of truth.
 *
 * @author Marketplace Team
 */
@Service
public class RedisCacheService {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheService.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    // Cache key prefixes
    private static final String PRICING_PLANS_PREFIX = "pricing_plans:";
    private static final String ALL_PLANS_SCOPE = "all";

    // Cache TTL durations
    private static final Duration PRICING_PLANS_TTL = Duration.ofMinutes(10);

    public RedisCacheService(RedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Get cached active pricing plans.
     *
     * @param planType Plan type, or null for all types
     * @return Optional containing the cached plans
     */
    public Optional<List<PricingPlan>> getPricingPlans(PricingPlan.PlanType planType) {
        String key = pricingPlansKey(planType);
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json != null) {
                JavaType listType = objectMapper.getTypeFactory()
                        .constructCollectionType(List.class, PricingPlan.class);
                List<PricingPlan> plans = objectMapper.readValue(json, listType);
                logger.debug("Cache hit for {}", key);
                return Optional.of(plans);
            }
            logger.debug("Cache miss for {}", key);
            return Optional.empty();
        } catch (Exception e) {
            logger.error("Error getting pricing plans from cache for key: {}", key, e);
            return Optional.empty();
        }
    }

    /**
     * Cache active pricing plans.
     *
     * @param planType Plan type, or null for all types
     * @param plans Plans to cache
     */
    public void cachePricingPlans(PricingPlan.PlanType planType, List<PricingPlan> plans) {
        String key = pricingPlansKey(planType);
        try {
            String json = objectMapper.writeValueAsString(plans);
            redisTemplate.opsForValue().set(key, json, PRICING_PLANS_TTL);
            logger.debug("Cached {} pricing plans under {}", plans.size(), key);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing pricing plans for key: {}", key, e);
        } catch (Exception e) {
            logger.error("Error caching pricing plans for key: {}", key, e);
        }
    }

    /**
     * Evict every pricing plan cache entry (all-types list and each per-type list).
     */
    public void evictPricingPlans() {
        List<String> keys = new ArrayList<>();
        keys.add(pricingPlansKey(null));
        for (PricingPlan.PlanType type : PricingPlan.PlanType.values()) {
            keys.add(pricingPlansKey(type));
        }
        try {
            redisTemplate.delete(keys);
            logger.debug("Evicted pricing plan cache keys: {}", keys);
        } catch (Exception e) {
            logger.error("Error evicting pricing plan cache", e);
        }
    }

    static String pricingPlansKey(PricingPlan.PlanType planType) {
        String scope = planType == null ? ALL_PLANS_SCOPE : planType.name().toLowerCase(Locale.ROOT);
        return PRICING_PLANS_PREFIX + scope;
    }
}
