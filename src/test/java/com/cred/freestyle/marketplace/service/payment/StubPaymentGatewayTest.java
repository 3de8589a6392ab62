package com.cred.freestyle.marketplace.service.payment;

import com.cred.freestyle.marketplace.domain.model.Transaction;
import com.cred.freestyle.marketplace.domain.model.Transaction.PaymentMethod;
import com.cred.freestyle.marketplace.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StubPaymentGateway Tests")
class StubPaymentGatewayTest {

    private final StubPaymentGateway gateway = new StubPaymentGateway();

    @Test
    @DisplayName("instructionsFor - M-Pesa gets M-Pesa instructions")
    void instructionsFor_Mpesa() {
        Transaction transaction = TestDataBuilder.pendingTransactionFor(TestDataBuilder.aPendingSubscription().build());

        PaymentInstructions instructions = gateway.instructionsFor(transaction);

        assertThat(instructions.getMethod()).isEqualTo("M-Pesa");
        assertThat(instructions.getInstructions()).isEqualTo("Please complete payment via M-Pesa.");
        assertThat(instructions.getTransactionReference()).isEqualTo(transaction.getTransactionReference());
    }

    @Test
    @DisplayName("instructionsFor - Card gets card gateway instructions")
    void instructionsFor_Card() {
        Transaction transaction = TestDataBuilder.pendingTransactionFor(
                TestDataBuilder.aPendingBoost(TestDataBuilder.anAd().build()).build());

        PaymentInstructions instructions = gateway.instructionsFor(transaction);

        assertThat(instructions.getMethod()).isEqualTo("Card");
        assertThat(instructions.getInstructions()).isEqualTo("Proceed to card payment gateway.");
    }

    @Test
    @DisplayName("instructionsFor - Other methods get the method name only")
    void instructionsFor_OtherMethod() {
        Transaction transaction = TestDataBuilder.pendingTransactionFor(TestDataBuilder.aPendingSubscription().build());
        transaction.setPaymentMethod(PaymentMethod.BANK_TRANSFER);

        PaymentInstructions instructions = gateway.instructionsFor(transaction);

        assertThat(instructions.getMethod()).isEqualTo("bank_transfer");
        assertThat(instructions.getInstructions()).isNull();
        assertThat(instructions.getTransactionReference()).isEqualTo("TXN-20240115-00000000000000A1");
    }
}
