package com.cred.freestyle.marketplace.api.controller;

import com.cred.freestyle.marketplace.api.dto.PaymentCallbackRequest;
import com.cred.freestyle.marketplace.api.dto.PaymentCallbackResponse;
import com.cred.freestyle.marketplace.domain.model.Transaction.TransactionStatus;
import com.cred.freestyle.marketplace.service.CallbackResult;
import com.cred.freestyle.marketplace.service.TransactionLedgerService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoint called by the payment gateway when a payment settles.
 *
 * Unauthenticated: the gateway is trusted at the network edge. The transaction
 * reference is checked before anything is written.
 *
 * @author Marketplace Team
 */
@RestController
@RequestMapping("/api/v1/payments/callback")
public class PaymentCallbackController {

    private static final Logger logger = LoggerFactory.getLogger(PaymentCallbackController.class);

    static final String PROCESSED = "Payment callback processed.";

    private final TransactionLedgerService ledgerService;

    public PaymentCallbackController(TransactionLedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @PostMapping
    public ResponseEntity<PaymentCallbackResponse> handleCallback(@Valid @RequestBody PaymentCallbackRequest request) {
        TransactionStatus status = TransactionStatus.fromValue(request.getStatus());
        logger.info("Payment callback - reference: {}, status: {}", request.getTransactionReference(), status);

        CallbackResult result = ledgerService.applyCallback(
                request.getTransactionReference(),
                status,
                request.getPaymentProviderReference(),
                request.getMetadata());

        return ResponseEntity.ok(PaymentCallbackResponse.fromResult(PROCESSED, result));
    }
}
