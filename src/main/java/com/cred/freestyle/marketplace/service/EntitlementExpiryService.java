package com.cred.freestyle.marketplace.service;

import com.cred.freestyle.marketplace.domain.model.Ad;
import com.cred.freestyle.marketplace.domain.model.AdBoost;
import com.cred.freestyle.marketplace.domain.model.AdBoost.BoostStatus;
import com.cred.freestyle.marketplace.domain.model.PremiumSubscription;
import com.cred.freestyle.marketplace.domain.model.PremiumSubscription.SubscriptionStatus;
import com.cred.freestyle.marketplace.domain.model.User;
import com.cred.freestyle.marketplace.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.marketplace.infrastructure.messaging.events.NotificationMessage;
import com.cred.freestyle.marketplace.infrastructure.messaging.events.PaymentEvent;
import com.cred.freestyle.marketplace.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.marketplace.infrastructure.transaction.AfterCommit;
import com.cred.freestyle.marketplace.repository.AdBoostRepository;
import com.cred.freestyle.marketplace.repository.AdRepository;
import com.cred.freestyle.marketplace.repository.PremiumSubscriptionRepository;
import com.cred.freestyle.marketplace.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Moves lapsed ACTIVE entitlements to EXPIRED and resets the flags they backed.
 * Each entitlement is expired in its own database transaction, so one failure
 * does not roll back the rest of a sweep.
 *
 * @author Marketplace Team
 */
@Service
public class EntitlementExpiryService {

    private static final Logger logger = LoggerFactory.getLogger(EntitlementExpiryService.class);

    private final PremiumSubscriptionRepository subscriptionRepository;
    private final AdBoostRepository adBoostRepository;
    private final UserRepository userRepository;
    private final AdRepository adRepository;
    private final KafkaProducerService kafkaProducerService;
    private final CloudWatchMetricsService metricsService;

    public EntitlementExpiryService(
            PremiumSubscriptionRepository subscriptionRepository,
            AdBoostRepository adBoostRepository,
            UserRepository userRepository,
            AdRepository adRepository,
            KafkaProducerService kafkaProducerService,
            CloudWatchMetricsService metricsService
    ) {
        this.subscriptionRepository = subscriptionRepository;
        this.adBoostRepository = adBoostRepository;
        this.userRepository = userRepository;
        this.adRepository = adRepository;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
    }

    @Transactional(readOnly = true)
    public List<String> findLapsedSubscriptionIds(Instant now) {
        return subscriptionRepository.findLapsed(SubscriptionStatus.ACTIVE, now).stream()
                .map(PremiumSubscription::getSubscriptionId)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<String> findLapsedBoostIds(Instant now) {
        return adBoostRepository.findLapsed(BoostStatus.ACTIVE, now).stream()
                .map(AdBoost::getBoostId)
                .toList();
    }

    /**
     * Expire one lapsed subscription.
     * The user's premium flag is cleared unless another active subscription remains.
     *
     * @param subscriptionId Subscription ID
     * @param now Sweep time
     * @return true if the subscription was expired, false if it was no longer lapsed
     */
    @Transactional
    public boolean expireSubscription(String subscriptionId, Instant now) {
        PremiumSubscription subscription = subscriptionRepository.findById(subscriptionId).orElse(null);
        if (subscription == null || subscription.getStatus() != SubscriptionStatus.ACTIVE
                || subscription.isActiveAt(now)) {
            logger.debug("Subscription {} no longer lapsed, skipping", subscriptionId);
            return false;
        }

        String userId = subscription.getUserId();
        User user = userRepository.findByIdForUpdate(userId).orElse(null);

        subscription.expire();
        subscriptionRepository.save(subscription);

        boolean stillPremium = subscriptionRepository.existsByUserIdAndStatusAndSubscriptionIdNot(
                userId, SubscriptionStatus.ACTIVE, subscriptionId);
        if (user != null && !stillPremium) {
            user.revokePremium();
            userRepository.save(user);
        }

        metricsService.recordEntitlementExpired(ActivationResult.SUBSCRIPTION);
        PaymentEvent expiredEvent =
                PaymentEvent.forSubscription(subscription, PaymentEvent.EventType.SUBSCRIPTION_EXPIRED);
        NotificationMessage notification = new NotificationMessage(
                userId,
                NotificationMessage.SUBSCRIPTION_EXPIRED,
                Map.of("subscriptionId", subscriptionId,
                        "subscriptionType", subscription.getSubscriptionType().name()));
        AfterCommit.run("publish SUBSCRIPTION_EXPIRED for " + subscriptionId, () -> {
            kafkaProducerService.publishPaymentEvent(expiredEvent);
            kafkaProducerService.publishNotification(notification);
        });

        logger.info("Expired subscription {} of user {} (user still premium: {})",
                subscriptionId, userId, stillPremium);
        return true;
    }

    /**
     * Expire one lapsed boost.
     * The ad falls back to the tier of its latest other active boost, or BASIC if none.
     *
     * @param boostId Boost ID
     * @param now Sweep time
     * @return true if the boost was expired, false if it was no longer lapsed
     */
    @Transactional
    public boolean expireBoost(String boostId, Instant now) {
        AdBoost boost = adBoostRepository.findById(boostId).orElse(null);
        if (boost == null || boost.getStatus() != BoostStatus.ACTIVE || boost.isActiveAt(now)) {
            logger.debug("Boost {} no longer lapsed, skipping", boostId);
            return false;
        }

        boost.expire();
        adBoostRepository.save(boost);

        Ad ad = boost.getAd();
        Ad.PremiumType fallback = adBoostRepository
                .findOtherBoostsForAd(ad.getAdId(), BoostStatus.ACTIVE, boostId).stream()
                .filter(other -> other.isActiveAt(now))
                .findFirst()
                .map(other -> other.getBoostType().toPremiumType())
                .orElse(Ad.PremiumType.BASIC);
        ad.applyPremiumType(fallback);
        adRepository.save(ad);

        metricsService.recordEntitlementExpired(ActivationResult.AD_BOOST);
        PaymentEvent expiredEvent = PaymentEvent.forBoost(boost, PaymentEvent.EventType.BOOST_EXPIRED);
        NotificationMessage notification = new NotificationMessage(
                ad.getSellerId(),
                NotificationMessage.BOOST_EXPIRED,
                Map.of("boostId", boostId, "adId", ad.getAdId(), "boostType", boost.getBoostType().name()));
        AfterCommit.run("publish BOOST_EXPIRED for " + boostId, () -> {
            kafkaProducerService.publishPaymentEvent(expiredEvent);
            kafkaProducerService.publishNotification(notification);
        });

        logger.info("Expired {} boost {} on ad {}, ad tier now {}", boost.getBoostType(), boostId, ad.getAdId(), fallback);
        return true;
    }
}
