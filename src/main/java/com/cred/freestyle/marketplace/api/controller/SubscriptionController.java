package com.cred.freestyle.marketplace.api.controller;

import com.cred.freestyle.marketplace.api.dto.SubscriptionCancelResponse;
import com.cred.freestyle.marketplace.api.dto.SubscriptionPurchaseRequest;
import com.cred.freestyle.marketplace.api.dto.SubscriptionPurchaseResponse;
import com.cred.freestyle.marketplace.api.dto.SubscriptionResponse;
import com.cred.freestyle.marketplace.domain.model.PremiumSubscription;
import com.cred.freestyle.marketplace.domain.model.PremiumSubscription.SubscriptionType;
import com.cred.freestyle.marketplace.domain.model.Transaction.PaymentMethod;
import com.cred.freestyle.marketplace.security.SecurityUtils;
import com.cred.freestyle.marketplace.service.PurchaseResult;
import com.cred.freestyle.marketplace.service.SubscriptionService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the caller's premium subscriptions.
 *
 * @author Marketplace Team
 */
@RestController
@RequestMapping("/api/v1/payments/subscriptions")
public class SubscriptionController {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionController.class);

    static final String PURCHASE_INITIATED = "Subscription purchase initiated.";
    static final String CANCELLED = "Subscription cancelled successfully.";

    private final SubscriptionService subscriptionService;

    public SubscriptionController(SubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<SubscriptionResponse>> listSubscriptions() {
        String userId = SecurityUtils.requireCurrentUserId();
        List<SubscriptionResponse> subscriptions = subscriptionService.getSubscriptionsForUser(userId).stream()
                .map(SubscriptionResponse::fromEntity)
                .toList();
        return ResponseEntity.ok(subscriptions);
    }

    @GetMapping("/active")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SubscriptionResponse> getActiveSubscription() {
        String userId = SecurityUtils.requireCurrentUserId();
        return ResponseEntity.ok(SubscriptionResponse.fromEntity(subscriptionService.getActiveSubscription(userId)));
    }

    /**
     * Start a subscription purchase for the caller.
     *
     * @param request Subscription type, duration, payment method, auto-renew flag
     * @return 201 with the pending subscription, pending transaction and payment instructions
     */
    @PostMapping("/purchase")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SubscriptionPurchaseResponse> purchaseSubscription(
            @Valid @RequestBody SubscriptionPurchaseRequest request
    ) {
        String userId = SecurityUtils.requireCurrentUserId();
        SubscriptionType type = SubscriptionType.fromValue(request.getSubscriptionType());
        PaymentMethod paymentMethod = PaymentMethod.fromValue(request.getPaymentMethod());
        int durationDays = request.getDurationDays() == null
                ? PremiumSubscription.DEFAULT_DURATION_DAYS
                : request.getDurationDays();

        logger.info("Subscription purchase - user: {}, type: {}, days: {}, method: {}",
                userId, type, durationDays, paymentMethod);

        PurchaseResult<PremiumSubscription> result = subscriptionService.purchaseSubscription(
                userId, type, durationDays, paymentMethod, Boolean.TRUE.equals(request.getAutoRenew()));

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(SubscriptionPurchaseResponse.fromResult(PURCHASE_INITIATED, result));
    }

    /**
     * Cancel one of the caller's active subscriptions.
     * Subscriptions of other users answer 404.
     *
     * @param subscriptionId Subscription ID
     * @return Cancelled subscription
     */
    @PostMapping("/{subscriptionId}/cancel")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SubscriptionCancelResponse> cancelSubscription(@PathVariable String subscriptionId) {
        String userId = SecurityUtils.requireCurrentUserId();
        logger.info("Cancelling subscription: {} for user: {}", subscriptionId, userId);

        PremiumSubscription cancelled = subscriptionService.cancelSubscription(subscriptionId, userId);
        return ResponseEntity.ok(SubscriptionCancelResponse.of(CANCELLED, cancelled));
    }
}
