package com.cred.freestyle.marketplace.domain.model;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.function.Function;

/**
 * The entitlement a transaction pays for: either a subscription or an ad boost,
 * never both and never neither. The private constructor closes the hierarchy
 * to the two nested variants.
 *
 * @author Marketplace Team
 */
public abstract class PurchaseTarget {

    private PurchaseTarget() {
    }

    public static PurchaseTarget of(PremiumSubscription subscription) {
        return new SubscriptionPurchase(subscription);
    }

    public static PurchaseTarget of(AdBoost adBoost) {
        return new BoostPurchase(adBoost);
    }

    public abstract Transaction.TransactionType transactionType();

    public abstract BigDecimal amount();

    public abstract String currency();

    /**
     * Dispatch on the variant.
     *
     * @param onSubscription Applied when the target is a subscription
     * @param onBoost Applied when the target is an ad boost
     * @return Result of the applied function
     */
    public abstract <R> R match(Function<PremiumSubscription, ? extends R> onSubscription,
                                Function<AdBoost, ? extends R> onBoost);

    /**
     * Payment for a premium subscription.
     */
    public static final class SubscriptionPurchase extends PurchaseTarget {

        private final PremiumSubscription subscription;

        private SubscriptionPurchase(PremiumSubscription subscription) {
            this.subscription = Objects.requireNonNull(subscription, "subscription");
        }

        public PremiumSubscription getSubscription() {
            return subscription;
        }

        @Override
        public Transaction.TransactionType transactionType() {
            return Transaction.TransactionType.SUBSCRIPTION;
        }

        @Override
        public BigDecimal amount() {
            return subscription.getAmount();
        }

        @Override
        public String currency() {
            return subscription.getCurrency();
        }

        @Override
        public <R> R match(Function<PremiumSubscription, ? extends R> onSubscription,
                           Function<AdBoost, ? extends R> onBoost) {
            return onSubscription.apply(subscription);
        }
    }

    /**
     * Payment for an ad boost.
     */
    public static final class BoostPurchase extends PurchaseTarget {

        private final AdBoost adBoost;

        private BoostPurchase(AdBoost adBoost) {
            this.adBoost = Objects.requireNonNull(adBoost, "adBoost");
        }

        public AdBoost getAdBoost() {
            return adBoost;
        }

        @Override
        public Transaction.TransactionType transactionType() {
            return Transaction.TransactionType.AD_BOOST;
        }

        @Override
        public BigDecimal amount() {
            return adBoost.getAmount();
        }

        @Override
        public String currency() {
            return adBoost.getCurrency();
        }

        @Override
        public <R> R match(Function<PremiumSubscription, ? extends R> onSubscription,
                           Function<AdBoost, ? extends R> onBoost) {
            return onBoost.apply(adBoost);
        }
    }
}
