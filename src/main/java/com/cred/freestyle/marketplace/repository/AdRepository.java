package com.cred.freestyle.marketplace.repository;

import com.cred.freestyle.marketplace.domain.model.Ad;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Ad entity.
 * Listing queries go through {@link JpaSpecificationExecutor} with {@link AdSpecifications}.
 *
 * @author Marketplace Team
 */
@Repository
public interface AdRepository extends JpaRepository<Ad, String>, JpaSpecificationExecutor<Ad> {

    /**
     * Find ad by its URL slug.
     *
     * @param slug Ad slug
     * @return Optional containing the ad if found
     */
    Optional<Ad> findBySlug(String slug);

    /**
     * Find an ad only if it belongs to the given seller.
     * Used to authorize boost purchases.
     *
     * @param adId Ad ID
     * @param sellerId Seller user ID
     * @return Optional containing the ad if it exists and is owned by the seller
     */
    Optional<Ad> findByAdIdAndSellerId(String adId, String sellerId);

    /**
     * Find all ads of a seller.
     *
     * @param sellerId Seller user ID
     * @return List of ads
     */
    List<Ad> findBySellerId(String sellerId);

    /**
     * Atomically increment the view counter. Only views_count is written.
     * The persistence context is cleared afterwards, so ads loaded before the call
     * are detached and must be re-read.
     *
     * @param adId Ad ID
     * @return Number of rows updated
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Ad a SET a.viewsCount = a.viewsCount + 1 WHERE a.adId = :adId")
    int incrementViewsCount(@Param("adId") String adId);
}
