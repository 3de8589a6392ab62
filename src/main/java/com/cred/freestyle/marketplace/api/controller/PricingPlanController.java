package com.cred.freestyle.marketplace.api.controller;

import com.cred.freestyle.marketplace.api.dto.PricingPlanRequest;
import com.cred.freestyle.marketplace.api.dto.PricingPlanResponse;
import com.cred.freestyle.marketplace.domain.model.PricingPlan;
import com.cred.freestyle.marketplace.service.PricingPlanService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the pricing plan catalogue.
 * Listing is public; create, update and deactivate are admin only.
 *
 * @author Marketplace Team
 */
@RestController
@RequestMapping("/api/v1/payments/plans")
public class PricingPlanController {

    private static final Logger logger = LoggerFactory.getLogger(PricingPlanController.class);

    private final PricingPlanService pricingPlanService;

    public PricingPlanController(PricingPlanService pricingPlanService) {
        this.pricingPlanService = pricingPlanService;
    }

    /**
     * List active pricing plans.
     *
     * @param planType Optional filter: "subscription" or "ad_boost"
     * @return Active plans ordered by display order, then price
     */
    @GetMapping
    public ResponseEntity<List<PricingPlanResponse>> listPlans(
            @RequestParam(name = "plan_type", required = false) String planType
    ) {
        PricingPlan.PlanType type = planType == null || planType.isBlank()
                ? null
                : PricingPlan.PlanType.fromValue(planType);

        List<PricingPlanResponse> plans = pricingPlanService.listActivePlans(type).stream()
                .map(PricingPlanResponse::fromEntity)
                .toList();
        return ResponseEntity.ok(plans);
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<PricingPlanResponse> createPlan(@Valid @RequestBody PricingPlanRequest request) {
        logger.info("Creating pricing plan: {} ({})", request.getName(), request.getPlanType());
        PricingPlan plan = pricingPlanService.createPlan(request.toEntity());
        return ResponseEntity.status(HttpStatus.CREATED).body(PricingPlanResponse.fromEntity(plan));
    }

    @PutMapping("/{planId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<PricingPlanResponse> updatePlan(
            @PathVariable String planId,
            @Valid @RequestBody PricingPlanRequest request
    ) {
        logger.info("Updating pricing plan: {}", planId);
        PricingPlan plan = pricingPlanService.updatePlan(planId, request.toEntity());
        return ResponseEntity.ok(PricingPlanResponse.fromEntity(plan));
    }

    /**
     * Deactivate a plan. The plan is kept for existing purchases' history.
     *
     * @param planId Plan ID
     * @return Deactivated plan
     */
    @DeleteMapping("/{planId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<PricingPlanResponse> deactivatePlan(@PathVariable String planId) {
        logger.info("Deactivating pricing plan: {}", planId);
        PricingPlan plan = pricingPlanService.deactivatePlan(planId);
        return ResponseEntity.ok(PricingPlanResponse.fromEntity(plan));
    }
}
