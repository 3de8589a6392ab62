package com.cred.freestyle.marketplace.repository;

import com.cred.freestyle.marketplace.domain.model.PremiumSubscription;
import com.cred.freestyle.marketplace.domain.model.PremiumSubscription.SubscriptionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for PremiumSubscription entity.
 *
 * @author Marketplace Team
 */
@Repository
public interface PremiumSubscriptionRepository extends JpaRepository<PremiumSubscription, String> {

    /**
     * Find all subscriptions of a user, newest first.
     *
     * @param userId User ID
     * @return List of subscriptions
     */
    List<PremiumSubscription> findByUserIdOrderByCreatedAtDesc(String userId);

    /**
     * Find the user's subscription in the given status with the latest end date.
     *
     * @param userId User ID
     * @param status Subscription status
     * @return Optional containing the subscription if any
     */
    Optional<PremiumSubscription> findFirstByUserIdAndStatusOrderByEndDateDesc(String userId, SubscriptionStatus status);

    /**
     * Check whether the user holds another subscription in the given status.
     * Decides whether the premium flag survives a cancellation or expiry.
     *
     * @param userId User ID
     * @param status Subscription status
     * @param subscriptionId Subscription to exclude
     * @return true if another matching subscription exists
     */
    boolean existsByUserIdAndStatusAndSubscriptionIdNot(String userId, SubscriptionStatus status, String subscriptionId);

    /**
     * Find subscriptions still marked with the given status whose end date has passed.
     * Used by the expiry sweep.
     *
     * @param status Status to look for (ACTIVE)
     * @param now Current timestamp
     * @return Lapsed subscriptions
     */
    @Query("SELECT s FROM PremiumSubscription s WHERE s.status = :status AND s.endDate < :now ORDER BY s.endDate ASC")
    List<PremiumSubscription> findLapsed(@Param("status") SubscriptionStatus status, @Param("now") Instant now);
}
