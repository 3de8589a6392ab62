package com.cred.freestyle.marketplace.api.controller;

import com.cred.freestyle.marketplace.api.dto.AdBoostResponse;
import com.cred.freestyle.marketplace.api.dto.BoostPurchaseRequest;
import com.cred.freestyle.marketplace.api.dto.BoostPurchaseResponse;
import com.cred.freestyle.marketplace.domain.model.AdBoost;
import com.cred.freestyle.marketplace.domain.model.AdBoost.BoostType;
import com.cred.freestyle.marketplace.domain.model.Transaction.PaymentMethod;
import com.cred.freestyle.marketplace.security.SecurityUtils;
import com.cred.freestyle.marketplace.service.AdBoostService;
import com.cred.freestyle.marketplace.service.PurchaseResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for boosting the caller's ads.
 *
 * @author Marketplace Team
 */
@RestController
@RequestMapping("/api/v1/payments/boosts")
public class AdBoostController {

    private static final Logger logger = LoggerFactory.getLogger(AdBoostController.class);

    static final String PURCHASE_INITIATED = "Ad boost purchase initiated.";

    private final AdBoostService adBoostService;

    public AdBoostController(AdBoostService adBoostService) {
        this.adBoostService = adBoostService;
    }

    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<AdBoostResponse>> listBoosts() {
        String userId = SecurityUtils.requireCurrentUserId();
        List<AdBoostResponse> boosts = adBoostService.getBoostsForUser(userId).stream()
                .map(AdBoostResponse::fromEntity)
                .toList();
        return ResponseEntity.ok(boosts);
    }

    /**
     * Start a boost purchase on one of the caller's ads.
     *
     * @param request Ad, boost type, duration, payment method
     * @return 201 with the pending boost, pending transaction and payment instructions
     */
    @PostMapping("/purchase")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<BoostPurchaseResponse> purchaseBoost(@Valid @RequestBody BoostPurchaseRequest request) {
        String userId = SecurityUtils.requireCurrentUserId();
        BoostType boostType = BoostType.fromValue(request.getBoostType());
        PaymentMethod paymentMethod = PaymentMethod.fromValue(request.getPaymentMethod());
        int durationDays = request.getDurationDays() == null
                ? AdBoost.DEFAULT_DURATION_DAYS
                : request.getDurationDays();

        logger.info("Boost purchase - user: {}, ad: {}, type: {}, days: {}",
                userId, request.getAdId(), boostType, durationDays);

        PurchaseResult<AdBoost> result = adBoostService.purchaseBoost(
                userId, request.getAdId(), boostType, durationDays, paymentMethod);

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BoostPurchaseResponse.fromResult(PURCHASE_INITIATED, result));
    }
}
