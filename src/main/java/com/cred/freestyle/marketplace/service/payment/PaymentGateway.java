package com.cred.freestyle.marketplace.service.payment;

import com.cred.freestyle.marketplace.domain.model.Transaction;

/**
 * Payment provider integration point. The provider settles transactions
 * asynchronously by calling the payment callback endpoint.
 *
 * @author Marketplace Team
 */
public interface PaymentGateway {

    /**
     * Build the payment instructions returned to the payer for a pending transaction.
     *
     * @param transaction Pending transaction
     * @return Instructions carrying the transaction reference
     */
    PaymentInstructions instructionsFor(Transaction transaction);
}
