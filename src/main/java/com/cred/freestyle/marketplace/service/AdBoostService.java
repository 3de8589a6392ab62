package com.cred.freestyle.marketplace.service;

import com.cred.freestyle.marketplace.domain.model.Ad;
import com.cred.freestyle.marketplace.domain.model.AdBoost;
import com.cred.freestyle.marketplace.domain.model.AdBoost.BoostStatus;
import com.cred.freestyle.marketplace.domain.model.AdBoost.BoostType;
import com.cred.freestyle.marketplace.domain.model.PurchaseTarget;
import com.cred.freestyle.marketplace.domain.model.Transaction;
import com.cred.freestyle.marketplace.domain.model.Transaction.PaymentMethod;
import com.cred.freestyle.marketplace.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.marketplace.repository.AdBoostRepository;
import com.cred.freestyle.marketplace.repository.AdRepository;
import com.cred.freestyle.marketplace.service.payment.PaymentGateway;
import com.cred.freestyle.marketplace.service.payment.PaymentInstructions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Service for ad boosts: purchase and listing of the caller's boosts.
 *
 * @author Marketplace Team
 */
@Service
public class AdBoostService {

    private static final Logger logger = LoggerFactory.getLogger(AdBoostService.class);

    public static final String AD_NOT_OWNED_MESSAGE = "Ad not found or you don't have permission to boost it.";

    public static final int MIN_DURATION_DAYS = 1;
    public static final int MAX_DURATION_DAYS = 30;

    private final AdBoostRepository adBoostRepository;
    private final AdRepository adRepository;
    private final PricingCalculator pricingCalculator;
    private final TransactionLedgerService ledgerService;
    private final PaymentGateway paymentGateway;
    private final CloudWatchMetricsService metricsService;

    @Value("${marketplace.payments.default-currency:KES}")
    private String defaultCurrency = "KES";

    public AdBoostService(
            AdBoostRepository adBoostRepository,
            AdRepository adRepository,
            PricingCalculator pricingCalculator,
            TransactionLedgerService ledgerService,
            PaymentGateway paymentGateway,
            CloudWatchMetricsService metricsService
    ) {
        this.adBoostRepository = adBoostRepository;
        this.adRepository = adRepository;
        this.pricingCalculator = pricingCalculator;
        this.ledgerService = ledgerService;
        this.paymentGateway = paymentGateway;
        this.metricsService = metricsService;
    }

    /**
     * Start a boost purchase on one of the caller's ads: a PENDING boost and a
     * PENDING transaction, created together.
     *
     * @param userId Buying user, must be the ad's seller
     * @param adId Ad to boost
     * @param boostType Boost tier
     * @param durationDays Paid duration, 1 to 30 days
     * @param paymentMethod Payment method
     * @return Pending boost, pending transaction and payment instructions
     * @throws IllegalArgumentException if the duration is out of range, or the ad does not
     *                                  exist or is not owned by the caller
     */
    @Transactional
    public PurchaseResult<AdBoost> purchaseBoost(
            String userId,
            String adId,
            BoostType boostType,
            int durationDays,
            PaymentMethod paymentMethod
    ) {
        if (durationDays < MIN_DURATION_DAYS || durationDays > MAX_DURATION_DAYS) {
            throw new IllegalArgumentException(String.format(
                    "duration_days must be between %d and %d", MIN_DURATION_DAYS, MAX_DURATION_DAYS));
        }

        Ad ad = adRepository.findByAdIdAndSellerId(adId, userId)
                .orElseThrow(() -> {
                    logger.warn("User {} cannot boost ad {}: not found or not owned", userId, adId);
                    return new IllegalArgumentException(AD_NOT_OWNED_MESSAGE);
                });

        try {
            BigDecimal amount = pricingCalculator.boostAmount(boostType, durationDays);

            AdBoost boost = AdBoost.builder()
                    .ad(ad)
                    .boostType(boostType)
                    .status(BoostStatus.PENDING)
                    .amount(amount)
                    .currency(defaultCurrency)
                    .durationDays(durationDays)
                    .build();
            boost = adBoostRepository.save(boost);

            Transaction transaction = ledgerService.createTransaction(
                    userId, PurchaseTarget.of(boost), paymentMethod);
            PaymentInstructions instructions = paymentGateway.instructionsFor(transaction);

            logger.info("Ad boost purchase initiated: {} {} days on ad {}, boost {}, transaction {}",
                    boostType, durationDays, adId, boost.getBoostId(), transaction.getTransactionReference());
            return new PurchaseResult<>(boost, transaction, instructions);

        } catch (RuntimeException e) {
            logger.error("Error purchasing {} boost on ad {} for user {}", boostType, adId, userId, e);
            metricsService.recordError("BOOST_PURCHASE_ERROR", "purchaseBoost");
            throw e;
        }
    }

    /**
     * Get boosts on all of the user's ads, newest first.
     *
     * @param userId Seller user ID
     * @return Boosts
     */
    @Transactional(readOnly = true)
    public List<AdBoost> getBoostsForUser(String userId) {
        logger.debug("Listing boosts for user {}", userId);
        return adBoostRepository.findBySellerId(userId);
    }
}
