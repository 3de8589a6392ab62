package com.cred.freestyle.marketplace.service;

import com.cred.freestyle.marketplace.domain.model.Ad;
import com.cred.freestyle.marketplace.domain.model.Ad.PremiumType;
import com.cred.freestyle.marketplace.domain.model.Category;
import com.cred.freestyle.marketplace.domain.model.Location;
import com.cred.freestyle.marketplace.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.marketplace.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * View counting of AdQueryService against the embedded database.
 * A view must only ever write views_count.
 */
@DataJpaTest(properties = "spring.jpa.hibernate.ddl-auto=create-drop")
@Import(AdQueryService.class)
@DisplayName("AdQueryService View Counting Tests")
class AdQueryServiceViewCountTest {

    @Autowired
    private AdQueryService adQueryService;

    @Autowired
    private TestEntityManager entityManager;

    @MockBean
    private CloudWatchMetricsService metricsService;

    private String adId;
    private String slug;

    @BeforeEach
    void setUp() {
        Category category = entityManager.persist(TestDataBuilder.aCategory().build());
        Location location = entityManager.persist(TestDataBuilder.aLocation().build());
        Ad ad = entityManager.persist(TestDataBuilder.anAd()
                .adId(null)
                .title("Mountain bike")
                .category(category)
                .location(location)
                .build());
        entityManager.flush();
        entityManager.clear();

        adId = ad.getAdId();
        slug = ad.getSlug();
    }

    @Test
    @DisplayName("getAdBySlug - View does not write back a stale premium tier or touch updated_at")
    void getAdBySlug_ViewKeepsConcurrentBoost() {
        // Given: the ad is loaded as BASIC, then a boost activation upgrades the row to VIP
        Ad stale = entityManager.find(Ad.class, adId);
        Instant storedUpdatedAt = stale.getUpdatedAt();
        entityManager.getEntityManager()
                .createQuery("UPDATE Ad a SET a.premiumType = :premiumType WHERE a.adId = :adId")
                .setParameter("premiumType", PremiumType.VIP)
                .setParameter("adId", adId)
                .executeUpdate();
        assertThat(stale.getPremiumType()).isEqualTo(PremiumType.BASIC);

        // When
        Ad viewed = adQueryService.getAdBySlug(slug, null);
        entityManager.flush();
        entityManager.clear();

        // Then
        assertThat(viewed.getPremiumType()).isEqualTo(PremiumType.VIP);
        assertThat(viewed.getViewsCount()).isEqualTo(1);

        Ad stored = entityManager.find(Ad.class, adId);
        assertThat(stored.getPremiumType()).isEqualTo(PremiumType.VIP);
        assertThat(stored.getViewsCount()).isEqualTo(1);
        assertThat(stored.getUpdatedAt()).isEqualTo(storedUpdatedAt);
    }

    @Test
    @DisplayName("getAdBySlug - Consecutive views each add one")
    void getAdBySlug_ConsecutiveViews() {
        adQueryService.getAdBySlug(slug, null);
        adQueryService.getAdBySlug(slug, TestDataBuilder.OTHER_USER_ID);
        Ad viewed = adQueryService.getAdBySlug(slug, null);

        assertThat(viewed.getViewsCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("getAdBySlug - Seller view leaves the row untouched")
    void getAdBySlug_SellerViewUntouched() {
        Instant storedUpdatedAt = entityManager.find(Ad.class, adId).getUpdatedAt();
        entityManager.clear();

        adQueryService.getAdBySlug(slug, TestDataBuilder.USER_ID);
        entityManager.flush();
        entityManager.clear();

        Ad stored = entityManager.find(Ad.class, adId);
        assertThat(stored.getViewsCount()).isZero();
        assertThat(stored.getUpdatedAt()).isEqualTo(storedUpdatedAt);
    }
}
