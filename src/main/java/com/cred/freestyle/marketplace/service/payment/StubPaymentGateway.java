package com.cred.freestyle.marketplace.service.payment;

import com.cred.freestyle.marketplace.domain.model.EnumValues;
import com.cred.freestyle.marketplace.domain.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Gateway stand-in that only returns static payment instructions.
 * No provider is contacted; settlement arrives through the callback endpoint.
 *
 * @author Marketplace Team
 */
@Component
public class StubPaymentGateway implements PaymentGateway {

    private static final Logger logger = LoggerFactory.getLogger(StubPaymentGateway.class);

    @Override
    public PaymentInstructions instructionsFor(Transaction transaction) {
        String reference = transaction.getTransactionReference();
        logger.debug("Building {} payment instructions for transaction {}", transaction.getPaymentMethod(), reference);

        switch (transaction.getPaymentMethod()) {
            case MPESA:
                return new PaymentInstructions("M-Pesa", "Please complete payment via M-Pesa.", reference);
            case CARD:
                return new PaymentInstructions("Card", "Proceed to card payment gateway.", reference);
            default:
                return new PaymentInstructions(EnumValues.toValue(transaction.getPaymentMethod()), null, reference);
        }
    }
}
