package com.cred.freestyle.marketplace.service;

import com.cred.freestyle.marketplace.domain.model.PremiumSubscription;
import com.cred.freestyle.marketplace.domain.model.PremiumSubscription.SubscriptionStatus;
import com.cred.freestyle.marketplace.domain.model.PremiumSubscription.SubscriptionType;
import com.cred.freestyle.marketplace.domain.model.PurchaseTarget;
import com.cred.freestyle.marketplace.domain.model.Transaction;
import com.cred.freestyle.marketplace.domain.model.Transaction.PaymentMethod;
import com.cred.freestyle.marketplace.domain.model.User;
import com.cred.freestyle.marketplace.exception.InvalidStateException;
import com.cred.freestyle.marketplace.exception.PermissionDeniedException;
import com.cred.freestyle.marketplace.exception.ResourceNotFoundException;
import com.cred.freestyle.marketplace.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.marketplace.infrastructure.messaging.events.NotificationMessage;
import com.cred.freestyle.marketplace.infrastructure.messaging.events.PaymentEvent;
import com.cred.freestyle.marketplace.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.marketplace.infrastructure.transaction.AfterCommit;
import com.cred.freestyle.marketplace.repository.PremiumSubscriptionRepository;
import com.cred.freestyle.marketplace.repository.UserRepository;
import com.cred.freestyle.marketplace.service.payment.PaymentGateway;
import com.cred.freestyle.marketplace.service.payment.PaymentInstructions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Service for premium subscriptions: purchase, cancellation and lookups.
 *
 * Cancellation runs with the owner's user row locked so that the premium flag
 * is recomputed against a stable view of the user's other subscriptions. A purchase
 * completing concurrently for the same user is not serialized with it.
 *
 * @author Marketplace Team
 */
@Service
public class SubscriptionService {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionService.class);

    private static final String RESOURCE_TYPE = "Subscription";

    public static final int MIN_DURATION_DAYS = 1;
    public static final int MAX_DURATION_DAYS = 365;

    private final PremiumSubscriptionRepository subscriptionRepository;
    private final UserRepository userRepository;
    private final PricingCalculator pricingCalculator;
    private final TransactionLedgerService ledgerService;
    private final PaymentGateway paymentGateway;
    private final KafkaProducerService kafkaProducerService;
    private final CloudWatchMetricsService metricsService;

    @Value("${marketplace.payments.default-currency:KES}")
    private String defaultCurrency = "KES";

    public SubscriptionService(
            PremiumSubscriptionRepository subscriptionRepository,
            UserRepository userRepository,
            PricingCalculator pricingCalculator,
            TransactionLedgerService ledgerService,
            PaymentGateway paymentGateway,
            KafkaProducerService kafkaProducerService,
            CloudWatchMetricsService metricsService
    ) {
        this.subscriptionRepository = subscriptionRepository;
        this.userRepository = userRepository;
        this.pricingCalculator = pricingCalculator;
        this.ledgerService = ledgerService;
        this.paymentGateway = paymentGateway;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
    }

    /**
     * Start a subscription purchase: a PENDING subscription and a PENDING transaction,
     * created together. The subscription activates when the gateway confirms payment.
     *
     * @param userId Buying user
     * @param subscriptionType Subscription tier
     * @param durationDays Paid duration, 1 to 365 days
     * @param paymentMethod Payment method
     * @param autoRenew Whether the subscription should renew
     * @return Pending subscription, pending transaction and payment instructions
     * @throws IllegalArgumentException if the duration is out of range
     * @throws ResourceNotFoundException if the user does not exist
     */
    @Transactional
    public PurchaseResult<PremiumSubscription> purchaseSubscription(
            String userId,
            SubscriptionType subscriptionType,
            int durationDays,
            PaymentMethod paymentMethod,
            boolean autoRenew
    ) {
        if (durationDays < MIN_DURATION_DAYS || durationDays > MAX_DURATION_DAYS) {
            throw new IllegalArgumentException(String.format(
                    "duration_days must be between %d and %d", MIN_DURATION_DAYS, MAX_DURATION_DAYS));
        }

        try {
            userRepository.findById(userId)
                    .orElseThrow(() -> new ResourceNotFoundException("User", userId));

            BigDecimal amount = pricingCalculator.subscriptionAmount(subscriptionType, durationDays);

            PremiumSubscription subscription = PremiumSubscription.builder()
                    .userId(userId)
                    .subscriptionType(subscriptionType)
                    .status(SubscriptionStatus.PENDING)
                    .amount(amount)
                    .currency(defaultCurrency)
                    .durationDays(durationDays)
                    .autoRenew(autoRenew)
                    .build();
            subscription = subscriptionRepository.save(subscription);

            Transaction transaction = ledgerService.createTransaction(
                    userId, PurchaseTarget.of(subscription), paymentMethod);
            PaymentInstructions instructions = paymentGateway.instructionsFor(transaction);

            logger.info("Subscription purchase initiated: {} {} days for user {}, subscription {}, transaction {}",
                    subscriptionType, durationDays, userId, subscription.getSubscriptionId(),
                    transaction.getTransactionReference());
            return new PurchaseResult<>(subscription, transaction, instructions);

        } catch (ResourceNotFoundException e) {
            logger.warn("Subscription purchase rejected: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            logger.error("Error purchasing {} subscription for user {}", subscriptionType, userId, e);
            metricsService.recordError("SUBSCRIPTION_PURCHASE_ERROR", "purchaseSubscription");
            throw e;
        }
    }

    /**
     * Cancel an active subscription owned by the user.
     * Clears the user's premium flag unless another active subscription remains.
     *
     * @param subscriptionId Subscription ID
     * @param userId Requesting user
     * @return Cancelled subscription
     * @throws ResourceNotFoundException if the subscription or user does not exist
     * @throws PermissionDeniedException if the subscription belongs to another user
     * @throws InvalidStateException if the subscription is not ACTIVE (nothing is changed)
     */
    @Transactional
    public PremiumSubscription cancelSubscription(String subscriptionId, String userId) {
        User user = userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));

        PremiumSubscription subscription = subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, subscriptionId));

        if (!subscription.getUserId().equals(userId)) {
            logger.warn("User {} attempted to cancel subscription {} owned by another user", userId, subscriptionId);
            throw new PermissionDeniedException(RESOURCE_TYPE, subscriptionId, userId);
        }

        if (subscription.getStatus() != SubscriptionStatus.ACTIVE) {
            logger.warn("Cannot cancel subscription {} in status {}", subscriptionId, subscription.getStatus());
            throw new InvalidStateException(RESOURCE_TYPE, subscriptionId, subscription.getStatus().name(),
                    "Only active subscriptions can be cancelled");
        }

        subscription.cancel(Instant.now());
        subscription = subscriptionRepository.save(subscription);

        boolean stillPremium = subscriptionRepository.existsByUserIdAndStatusAndSubscriptionIdNot(
                userId, SubscriptionStatus.ACTIVE, subscriptionId);
        if (!stillPremium) {
            user.revokePremium();
            userRepository.save(user);
        }

        metricsService.recordSubscriptionCancelled(subscription.getSubscriptionType().name());
        PaymentEvent cancelledEvent =
                PaymentEvent.forSubscription(subscription, PaymentEvent.EventType.SUBSCRIPTION_CANCELLED);
        NotificationMessage notification = new NotificationMessage(
                userId,
                NotificationMessage.SUBSCRIPTION_CANCELLED,
                Map.of("subscriptionId", subscriptionId,
                        "subscriptionType", subscription.getSubscriptionType().name()));
        AfterCommit.run("publish SUBSCRIPTION_CANCELLED for " + subscriptionId, () -> {
            kafkaProducerService.publishPaymentEvent(cancelledEvent);
            kafkaProducerService.publishNotification(notification);
        });

        logger.info("Cancelled subscription {} for user {} (user still premium: {})",
                subscriptionId, userId, stillPremium);
        return subscription;
    }

    /**
     * Get all subscriptions of a user, newest first.
     *
     * @param userId User ID
     * @return Subscriptions
     */
    @Transactional(readOnly = true)
    public List<PremiumSubscription> getSubscriptionsForUser(String userId) {
        logger.debug("Listing subscriptions for user {}", userId);
        return subscriptionRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    /**
     * Get the user's active subscription with the latest end date.
     *
     * @param userId User ID
     * @return Active subscription
     * @throws ResourceNotFoundException if the user has no active subscription
     */
    @Transactional(readOnly = true)
    public PremiumSubscription getActiveSubscription(String userId) {
        return subscriptionRepository.findFirstByUserIdAndStatusOrderByEndDateDesc(userId, SubscriptionStatus.ACTIVE)
                .filter(subscription -> subscription.isActiveAt(Instant.now()))
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, userId, "No active subscription."));
    }
}
