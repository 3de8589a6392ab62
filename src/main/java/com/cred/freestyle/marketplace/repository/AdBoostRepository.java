package com.cred.freestyle.marketplace.repository;

import com.cred.freestyle.marketplace.domain.model.AdBoost;
import com.cred.freestyle.marketplace.domain.model.AdBoost.BoostStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for AdBoost entity.
 *
 * @author Marketplace Team
 */
@Repository
public interface AdBoostRepository extends JpaRepository<AdBoost, String> {

    /**
     * Find boosts on all ads of a seller, newest first.
     *
     * @param sellerId Seller user ID
     * @return List of boosts
     */
    @Query("SELECT b FROM AdBoost b WHERE b.ad.sellerId = :sellerId ORDER BY b.createdAt DESC")
    List<AdBoost> findBySellerId(@Param("sellerId") String sellerId);

    /**
     * Find the other boosts of an ad in the given status, latest end date first.
     * Decides which tier an ad keeps when one of its boosts expires.
     *
     * @param adId Ad ID
     * @param status Boost status
     * @param boostId Boost to exclude
     * @return Matching boosts
     */
    @Query("SELECT b FROM AdBoost b WHERE b.ad.adId = :adId AND b.status = :status " +
           "AND b.boostId <> :boostId ORDER BY b.endDate DESC")
    List<AdBoost> findOtherBoostsForAd(@Param("adId") String adId,
                                       @Param("status") BoostStatus status,
                                       @Param("boostId") String boostId);

    /**
     * Find boosts still marked with the given status whose end date has passed.
     *
     * @param status Status to look for (ACTIVE)
     * @param now Current timestamp
     * @return Lapsed boosts
     */
    @Query("SELECT b FROM AdBoost b WHERE b.status = :status AND b.endDate < :now ORDER BY b.endDate ASC")
    List<AdBoost> findLapsed(@Param("status") BoostStatus status, @Param("now") Instant now);
}
