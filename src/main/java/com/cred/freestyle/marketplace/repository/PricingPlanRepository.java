package com.cred.freestyle.marketplace.repository;

import com.cred.freestyle.marketplace.domain.model.PricingPlan;
import com.cred.freestyle.marketplace.domain.model.PricingPlan.PlanType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for PricingPlan entity.
 *
 * @author Marketplace Team
 */
@Repository
public interface PricingPlanRepository extends JpaRepository<PricingPlan, String> {

    /**
     * Find all active plans in display order (display_order, then price).
     *
     * @return Active plans
     */
    List<PricingPlan> findByIsActiveTrueOrderByDisplayOrderAscPriceAsc();

    /**
     * Find active plans of one type in display order.
     *
     * @param planType Plan type
     * @return Active plans of the type
     */
    List<PricingPlan> findByPlanTypeAndIsActiveTrueOrderByDisplayOrderAscPriceAsc(PlanType planType);
}
