package com.cred.freestyle.marketplace.service;

import com.cred.freestyle.marketplace.domain.model.Ad;
import com.cred.freestyle.marketplace.exception.ResourceNotFoundException;
import com.cred.freestyle.marketplace.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.marketplace.repository.AdRepository;
import com.cred.freestyle.marketplace.repository.AdSearchCriteria;
import com.cred.freestyle.marketplace.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AdQueryService Tests")
class AdQueryServiceTest {

    @Mock
    private AdRepository adRepository;

    @Mock
    private CloudWatchMetricsService metricsService;

    @InjectMocks
    private AdQueryService adQueryService;

    @Test
    @DisplayName("listAds - Oversized page is clamped and negative page reads as first page")
    @SuppressWarnings("unchecked")
    void listAds_ClampsPaging() {
        // Given
        Ad ad = TestDataBuilder.anAd().build();
        when(adRepository.findAll(any(Specification.class), any(Pageable.class)))
                .thenAnswer(inv -> new PageImpl<>(List.of(ad), inv.getArgument(1), 1));

        // When
        Page<Ad> page = adQueryService.listAds(AdSearchCriteria.builder().build(), -3, 500);

        // Then
        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(adRepository).findAll(any(Specification.class), pageable.capture());
        assertThat(pageable.getValue().getPageNumber()).isZero();
        assertThat(pageable.getValue().getPageSize()).isEqualTo(100);
        assertThat(page.getContent()).containsExactly(ad);
        verify(metricsService).recordAdListingLatency(anyLong());
    }

    @Test
    @DisplayName("clampPageSize - Zero size uses the default page size")
    void clampPageSize_Default() {
        assertThat(adQueryService.clampPageSize(0)).isEqualTo(AdQueryService.DEFAULT_PAGE_SIZE);
        assertThat(adQueryService.clampPageSize(5)).isEqualTo(5);
    }

    @Test
    @DisplayName("getAdBySlug - Anonymous view is counted")
    void getAdBySlug_AnonymousViewCounted() {
        // Given
        Ad ad = TestDataBuilder.anAd().slug("samsung-galaxy-s21-0a1b2c3d").viewsCount(4).build();
        Ad reloaded = TestDataBuilder.anAd().adId(ad.getAdId()).slug(ad.getSlug()).viewsCount(5).build();
        when(adRepository.findBySlug(ad.getSlug())).thenReturn(Optional.of(ad));
        when(adRepository.findById(ad.getAdId())).thenReturn(Optional.of(reloaded));

        // When
        Ad found = adQueryService.getAdBySlug(ad.getSlug(), null);

        // Then
        assertThat(found).isSameAs(reloaded);
        assertThat(found.getViewsCount()).isEqualTo(5);
        assertThat(ad.getViewsCount()).isEqualTo(4);
        InOrder inOrder = inOrder(adRepository);
        inOrder.verify(adRepository).incrementViewsCount(ad.getAdId());
        inOrder.verify(adRepository).findById(ad.getAdId());
        verify(adRepository, never()).save(any(Ad.class));
    }

    @Test
    @DisplayName("getAdBySlug - Seller viewing their own ad is not counted")
    void getAdBySlug_SellerViewNotCounted() {
        Ad ad = TestDataBuilder.anAd().slug("samsung-galaxy-s21-0a1b2c3d").viewsCount(4).build();
        when(adRepository.findBySlug(ad.getSlug())).thenReturn(Optional.of(ad));

        Ad found = adQueryService.getAdBySlug(ad.getSlug(), TestDataBuilder.USER_ID);

        assertThat(found.getViewsCount()).isEqualTo(4);
        verify(adRepository, never()).incrementViewsCount(anyString());
    }

    @Test
    @DisplayName("getAdBySlug - Deleted ad is not found")
    void getAdBySlug_Deleted() {
        Ad ad = TestDataBuilder.anAd().slug("old-sofa-11223344").status(Ad.AdStatus.DELETED).build();
        when(adRepository.findBySlug(ad.getSlug())).thenReturn(Optional.of(ad));

        assertThatThrownBy(() -> adQueryService.getAdBySlug(ad.getSlug(), null))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
