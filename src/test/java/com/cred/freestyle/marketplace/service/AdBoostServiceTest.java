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
import com.cred.freestyle.marketplace.service.payment.StubPaymentGateway;
import com.cred.freestyle.marketplace.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AdBoostService Tests")
class AdBoostServiceTest {

    @Mock
    private AdBoostRepository adBoostRepository;

    @Mock
    private AdRepository adRepository;

    @Spy
    private PricingCalculator pricingCalculator = new PricingCalculator();

    @Mock
    private TransactionLedgerService ledgerService;

    @Spy
    private PaymentGateway paymentGateway = new StubPaymentGateway();

    @Mock
    private CloudWatchMetricsService metricsService;

    @InjectMocks
    private AdBoostService adBoostService;

    @Test
    @DisplayName("purchaseBoost - Success: pending boost on the seller's ad, ad tier unchanged until paid")
    void purchaseBoost_Success() {
        // Given
        Ad ad = TestDataBuilder.anAd().build();
        when(adRepository.findByAdIdAndSellerId(ad.getAdId(), TestDataBuilder.USER_ID)).thenReturn(Optional.of(ad));
        when(adBoostRepository.save(any(AdBoost.class))).thenAnswer(inv -> inv.getArgument(0));
        when(ledgerService.createTransaction(eq(TestDataBuilder.USER_ID), any(PurchaseTarget.class), eq(PaymentMethod.CARD)))
                .thenAnswer(inv -> Transaction.forTarget(TestDataBuilder.USER_ID, inv.getArgument(1),
                        PaymentMethod.CARD, "TXN-20240115-0123456789ABCDEF"));

        // When
        PurchaseResult<AdBoost> result = adBoostService.purchaseBoost(
                TestDataBuilder.USER_ID, ad.getAdId(), BoostType.FEATURED, 14, PaymentMethod.CARD);

        // Then
        AdBoost boost = result.getEntitlement();
        assertThat(boost.getStatus()).isEqualTo(BoostStatus.PENDING);
        assertThat(boost.getAd()).isSameAs(ad);
        assertThat(boost.getAmount()).isEqualByComparingTo("798.00");
        assertThat(result.getTransaction().getAdBoost()).isSameAs(boost);
        assertThat(result.getTransaction().getTransactionType()).isEqualTo(Transaction.TransactionType.AD_BOOST);
        assertThat(result.getPaymentInstructions().getMethod()).isEqualTo("Card");
        assertThat(ad.getPremiumType()).isEqualTo(Ad.PremiumType.BASIC);
    }

    @Test
    @DisplayName("purchaseBoost - Ad of another seller reads as not found")
    void purchaseBoost_NotOwned() {
        when(adRepository.findByAdIdAndSellerId("AD-1", TestDataBuilder.OTHER_USER_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> adBoostService.purchaseBoost(
                TestDataBuilder.OTHER_USER_ID, "AD-1", BoostType.VIP, 7, PaymentMethod.MPESA))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage(AdBoostService.AD_NOT_OWNED_MESSAGE);

        verifyNoInteractions(adBoostRepository, ledgerService);
    }

    @Test
    @DisplayName("purchaseBoost - Duration above 30 days is rejected")
    void purchaseBoost_DurationTooLong() {
        assertThatThrownBy(() -> adBoostService.purchaseBoost(
                TestDataBuilder.USER_ID, "AD-1", BoostType.VIP, 31, PaymentMethod.MPESA))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 1 and 30");

        verifyNoInteractions(adRepository);
    }

    @Test
    @DisplayName("getBoostsForUser - Delegates to the seller query")
    void getBoostsForUser() {
        AdBoost boost = TestDataBuilder.aPendingBoost(TestDataBuilder.anAd().build()).build();
        when(adBoostRepository.findBySellerId(TestDataBuilder.USER_ID)).thenReturn(List.of(boost));

        assertThat(adBoostService.getBoostsForUser(TestDataBuilder.USER_ID)).containsExactly(boost);
    }
}
