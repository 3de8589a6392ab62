package com.cred.freestyle.marketplace.api.controller;

import com.cred.freestyle.marketplace.api.dto.TransactionResponse;
import com.cred.freestyle.marketplace.security.SecurityUtils;
import com.cred.freestyle.marketplace.service.TransactionLedgerService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only access to the caller's payment transactions.
 *
 * @author Marketplace Team
 */
@RestController
@RequestMapping("/api/v1/payments/transactions")
public class TransactionController {

    private final TransactionLedgerService ledgerService;

    public TransactionController(TransactionLedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<TransactionResponse>> listTransactions() {
        String userId = SecurityUtils.requireCurrentUserId();
        List<TransactionResponse> transactions = ledgerService.getTransactionsForUser(userId).stream()
                .map(TransactionResponse::fromEntity)
                .toList();
        return ResponseEntity.ok(transactions);
    }

    @GetMapping("/{transactionId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable String transactionId) {
        String userId = SecurityUtils.requireCurrentUserId();
        return ResponseEntity.ok(TransactionResponse.fromEntity(
                ledgerService.getTransactionForUser(transactionId, userId)));
    }
}
