package com.cred.freestyle.marketplace.service;

import com.cred.freestyle.marketplace.domain.model.Ad;
import com.cred.freestyle.marketplace.domain.model.AdBoost;
import com.cred.freestyle.marketplace.domain.model.PremiumSubscription;
import com.cred.freestyle.marketplace.domain.model.PurchaseTarget;
import com.cred.freestyle.marketplace.domain.model.Transaction;
import com.cred.freestyle.marketplace.domain.model.User;
import com.cred.freestyle.marketplace.exception.ResourceNotFoundException;
import com.cred.freestyle.marketplace.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.marketplace.repository.AdBoostRepository;
import com.cred.freestyle.marketplace.repository.AdRepository;
import com.cred.freestyle.marketplace.repository.PremiumSubscriptionRepository;
import com.cred.freestyle.marketplace.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Activates the entitlement paid for by a completed transaction and applies its
 * effect on the owner:
 * - Subscription: ACTIVE for its duration, owning user becomes premium
 * - Ad boost: ACTIVE for its duration, boosted ad takes the boost type as premium tier
 *
 * Must run inside the callback's database transaction so that the entitlement write and
 * the owner write commit together or not at all.
 *
 * Two boosts completing for the same ad are last-write-wins on the ad's tier.
 *
 * @author Marketplace Team
 */
@Service
public class EntitlementActivator {

    private static final Logger logger = LoggerFactory.getLogger(EntitlementActivator.class);

    private final PremiumSubscriptionRepository subscriptionRepository;
    private final AdBoostRepository adBoostRepository;
    private final UserRepository userRepository;
    private final AdRepository adRepository;
    private final CloudWatchMetricsService metricsService;

    public EntitlementActivator(
            PremiumSubscriptionRepository subscriptionRepository,
            AdBoostRepository adBoostRepository,
            UserRepository userRepository,
            AdRepository adRepository,
            CloudWatchMetricsService metricsService
    ) {
        this.subscriptionRepository = subscriptionRepository;
        this.adBoostRepository = adBoostRepository;
        this.userRepository = userRepository;
        this.adRepository = adRepository;
        this.metricsService = metricsService;
    }

    /**
     * Activate whatever the transaction paid for.
     *
     * @param transaction Completed transaction
     * @param now Activation time
     * @return Activation outcome, or empty if the transaction carries no entitlement
     * @throws ResourceNotFoundException if the subscription's user no longer exists
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<ActivationResult> activate(Transaction transaction, Instant now) {
        Optional<PurchaseTarget> target = transaction.purchaseTarget();
        if (target.isEmpty()) {
            logger.warn("Transaction {} of type {} has no entitlement to activate",
                    transaction.getTransactionReference(), transaction.getTransactionType());
            return Optional.empty();
        }

        ActivationResult result = target.get().match(
                subscription -> activateSubscription(subscription, now),
                boost -> activateBoost(boost, now)
        );
        return Optional.of(result);
    }

    private ActivationResult activateSubscription(PremiumSubscription subscription, Instant now) {
        subscription.activate(now);
        subscriptionRepository.save(subscription);

        User user = userRepository.findById(subscription.getUserId())
                .orElseThrow(() -> new ResourceNotFoundException("User", subscription.getUserId()));
        user.grantPremium();
        userRepository.save(user);

        metricsService.recordEntitlementActivated(ActivationResult.SUBSCRIPTION,
                subscription.getSubscriptionType().name());
        logger.info("Activated {} subscription {} for user {} until {}",
                subscription.getSubscriptionType(), subscription.getSubscriptionId(),
                user.getUserId(), subscription.getEndDate());

        return new ActivationResult(ActivationResult.SUBSCRIPTION, subscription.getSubscriptionId(),
                subscription.getSubscriptionType().name(), subscription.getEndDate());
    }

    private ActivationResult activateBoost(AdBoost boost, Instant now) {
        boost.activate(now);
        adBoostRepository.save(boost);

        Ad ad = boost.getAd();
        ad.applyPremiumType(boost.getBoostType().toPremiumType());
        adRepository.save(ad);

        metricsService.recordEntitlementActivated(ActivationResult.AD_BOOST, boost.getBoostType().name());
        logger.info("Activated {} boost {} on ad {} until {}",
                boost.getBoostType(), boost.getBoostId(), ad.getAdId(), boost.getEndDate());

        return new ActivationResult(ActivationResult.AD_BOOST, boost.getBoostId(),
                boost.getBoostType().name(), boost.getEndDate());
    }
}
