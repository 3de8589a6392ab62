package com.cred.freestyle.marketplace.service;

import com.cred.freestyle.marketplace.domain.model.PricingPlan;
import com.cred.freestyle.marketplace.domain.model.PricingPlan.PlanType;
import com.cred.freestyle.marketplace.exception.ResourceNotFoundException;
import com.cred.freestyle.marketplace.infrastructure.cache.RedisCacheService;
import com.cred.freestyle.marketplace.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.marketplace.repository.PricingPlanRepository;
import com.cred.freestyle.marketplace.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PricingPlanService.
 * Verifies the cache-aside read path and cache eviction after every committed write.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PricingPlanService Tests")
class PricingPlanServiceTest {

    @Mock
    private PricingPlanRepository pricingPlanRepository;

    @Mock
    private RedisCacheService cacheService;

    @Mock
    private CloudWatchMetricsService metricsService;

    @InjectMocks
    private PricingPlanService pricingPlanService;

    // ========================================
    // listActivePlans Tests
    // ========================================

    @Test
    @DisplayName("listActivePlans - Cache hit: database is not queried")
    void listActivePlans_CacheHit() {
        // Given
        PricingPlan plan = TestDataBuilder.aPlan().build();
        when(cacheService.getPricingPlans(null)).thenReturn(Optional.of(List.of(plan)));

        // When
        List<PricingPlan> plans = pricingPlanService.listActivePlans(null);

        // Then
        assertThat(plans).containsExactly(plan);
        verify(metricsService).recordCacheHit("pricing_plans");
        verifyNoInteractions(pricingPlanRepository);
    }

    @Test
    @DisplayName("listActivePlans - Cache miss: loads from database and populates the cache")
    void listActivePlans_CacheMiss() {
        // Given
        PricingPlan plan = TestDataBuilder.aPlan().planType(PlanType.AD_BOOST).build();
        when(cacheService.getPricingPlans(PlanType.AD_BOOST)).thenReturn(Optional.empty());
        when(pricingPlanRepository.findByPlanTypeAndIsActiveTrueOrderByDisplayOrderAscPriceAsc(PlanType.AD_BOOST))
                .thenReturn(List.of(plan));

        // When
        List<PricingPlan> plans = pricingPlanService.listActivePlans(PlanType.AD_BOOST);

        // Then
        assertThat(plans).containsExactly(plan);
        verify(metricsService).recordCacheMiss("pricing_plans");
        verify(cacheService).cachePricingPlans(PlanType.AD_BOOST, plans);
        verify(pricingPlanRepository, never()).findByIsActiveTrueOrderByDisplayOrderAscPriceAsc();
    }

    // ========================================
    // Write Tests
    // ========================================

    @Test
    @DisplayName("createPlan - Saves and evicts the cache")
    void createPlan_EvictsCache() {
        PricingPlan plan = TestDataBuilder.aPlan().planId(null).build();
        when(pricingPlanRepository.save(plan)).thenReturn(plan);

        PricingPlan saved = pricingPlanService.createPlan(plan);

        assertThat(saved).isSameAs(plan);
        verify(cacheService).evictPricingPlans();
    }

    @Test
    @DisplayName("createPlan - Inside a transaction: cache is evicted only after the commit")
    void createPlan_EvictsAfterCommit() {
        // Given
        PricingPlan plan = TestDataBuilder.aPlan().planId(null).build();
        when(pricingPlanRepository.save(plan)).thenReturn(plan);
        TransactionSynchronizationManager.initSynchronization();

        try {
            // When
            pricingPlanService.createPlan(plan);

            // Then
            verify(cacheService, never()).evictPricingPlans();
            List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
            assertThat(synchronizations).hasSize(1);

            synchronizations.forEach(TransactionSynchronization::afterCommit);
            verify(cacheService).evictPricingPlans();
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("deactivatePlan - Rolled back transaction leaves the cache alone")
    void deactivatePlan_RolledBackKeepsCache() {
        // Given
        PricingPlan plan = TestDataBuilder.aPlan().build();
        when(pricingPlanRepository.findById(plan.getPlanId())).thenReturn(Optional.of(plan));
        when(pricingPlanRepository.save(plan)).thenReturn(plan);
        TransactionSynchronizationManager.initSynchronization();

        try {
            // When
            pricingPlanService.deactivatePlan(plan.getPlanId());
            TransactionSynchronizationManager.getSynchronizations()
                    .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

            // Then
            verify(cacheService, never()).evictPricingPlans();
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("createPlan - Negative price is rejected")
    void createPlan_NegativePrice() {
        PricingPlan plan = TestDataBuilder.aPlan().price(new BigDecimal("-1.00")).build();

        assertThatThrownBy(() -> pricingPlanService.createPlan(plan))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("price must be zero or greater");

        verifyNoInteractions(pricingPlanRepository, cacheService);
    }

    @Test
    @DisplayName("updatePlan - Replaces fields, features and evicts the cache")
    void updatePlan_ReplacesFields() {
        // Given
        PricingPlan existing = TestDataBuilder.aPlan().build();
        PricingPlan changes = TestDataBuilder.aPlan()
                .name("Pro Monthly")
                .price(new BigDecimal("2499.00"))
                .features(new ArrayList<>(List.of("Analytics")))
                .isActive(null)
                .build();
        when(pricingPlanRepository.findById(existing.getPlanId())).thenReturn(Optional.of(existing));
        when(pricingPlanRepository.save(existing)).thenReturn(existing);

        // When
        PricingPlan updated = pricingPlanService.updatePlan(existing.getPlanId(), changes);

        // Then
        assertThat(updated.getName()).isEqualTo("Pro Monthly");
        assertThat(updated.getPrice()).isEqualByComparingTo("2499.00");
        assertThat(updated.getFeatures()).containsExactly("Analytics");
        assertThat(updated.getIsActive()).isTrue();
        verify(cacheService).evictPricingPlans();
    }

    @Test
    @DisplayName("updatePlan - Zero duration is rejected")
    void updatePlan_ZeroDuration() {
        PricingPlan changes = TestDataBuilder.aPlan().durationDays(0).build();

        assertThatThrownBy(() -> pricingPlanService.updatePlan("PLAN-1", changes))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("duration_days must be at least 1");
    }

    @Test
    @DisplayName("deactivatePlan - Missing plan is not found and cache untouched")
    void deactivatePlan_Missing() {
        when(pricingPlanRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> pricingPlanService.deactivatePlan("missing"))
                .isInstanceOf(ResourceNotFoundException.class);

        verify(cacheService, never()).evictPricingPlans();
    }

    @Test
    @DisplayName("deactivatePlan - Plan becomes inactive and cache is evicted")
    void deactivatePlan_Success() {
        PricingPlan plan = TestDataBuilder.aPlan().build();
        when(pricingPlanRepository.findById(plan.getPlanId())).thenReturn(Optional.of(plan));
        when(pricingPlanRepository.save(plan)).thenReturn(plan);

        PricingPlan deactivated = pricingPlanService.deactivatePlan(plan.getPlanId());

        assertThat(deactivated.getIsActive()).isFalse();
        verify(cacheService).evictPricingPlans();
    }
}
