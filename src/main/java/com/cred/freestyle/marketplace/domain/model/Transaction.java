package com.cred.freestyle.marketplace.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Payment ledger entry.
 *
 * A transaction pays for exactly one entitlement (subscription or ad boost) when its type
 * is SUBSCRIPTION or AD_BOOST. New transactions are built through
 * {@link #forTarget(String, PurchaseTarget, PaymentMethod, String)} so the link and the
 * type cannot disagree; the link is re-checked before insert for rows built any other way.
 *
 * Lifecycle: PENDING → COMPLETED | FAILED (REFUNDED and PROCESSING are reserved for
 * gateway flows this service does not drive).
 *
 * @author Marketplace Team
 */
@Entity
@Table(name = "transactions", uniqueConstraints = {
    @UniqueConstraint(name = Transaction.REFERENCE_CONSTRAINT, columnNames = "transaction_reference")
}, indexes = {
    @Index(name = "idx_transactions_user_created", columnList = "user_id, created_at"),
    @Index(name = "idx_transactions_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {

    /** Unique constraint on transaction_reference. */
    public static final String REFERENCE_CONSTRAINT = "uk_transactions_reference";

    @Id
    @Column(name = "transaction_id", nullable = false, length = 36)
    private String transactionId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 20)
    private TransactionType transactionType;

    @ManyToOne
    @JoinColumn(name = "subscription_id")
    private PremiumSubscription subscription;

    @ManyToOne
    @JoinColumn(name = "ad_boost_id")
    private AdBoost adBoost;

    @Column(name = "amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    @Builder.Default
    private String currency = "KES";

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private TransactionStatus status = TransactionStatus.PENDING;

    /**
     * Public reference handed to the payer and echoed back by the gateway callback.
     * Format: TXN-YYYYMMDD-XXXXXXXXXXXXXXXX (16 uppercase hex characters).
     */
    @Column(name = "transaction_reference", nullable = false, length = 40)
    private String transactionReference;

    /**
     * Reference assigned by the payment provider, set from the callback.
     */
    @Column(name = "payment_provider_reference", length = 255)
    private String paymentProviderReference;

    @Convert(converter = MetadataConverter.class)
    @Column(name = "metadata", length = 4000)
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "notes", length = 1000)
    private String notes;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "failed_at")
    private Instant failedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Build a pending transaction paying for the given entitlement.
     *
     * @param userId Paying user
     * @param target Entitlement being paid for
     * @param paymentMethod Payment method chosen by the user
     * @param reference Unique transaction reference
     * @return New, unsaved transaction
     */
    public static Transaction forTarget(String userId, PurchaseTarget target,
                                        PaymentMethod paymentMethod, String reference) {
        Transaction transaction = Transaction.builder()
                .userId(userId)
                .transactionType(target.transactionType())
                .amount(target.amount())
                .currency(target.currency())
                .paymentMethod(paymentMethod)
                .status(TransactionStatus.PENDING)
                .transactionReference(reference)
                .build();
        target.match(
                subscription -> {
                    transaction.setSubscription(subscription);
                    return null;
                },
                adBoost -> {
                    transaction.setAdBoost(adBoost);
                    return null;
                }
        );
        return transaction;
    }

    @PrePersist
    protected void onCreate() {
        if (transactionId == null) {
            transactionId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = Instant.now();

        if (status == null) {
            status = TransactionStatus.PENDING;
        }
        if (metadata == null) {
            metadata = new HashMap<>();
        }
        validateEntitlementLink();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Verify the entitlement link matches the transaction type.
     *
     * @throws IllegalStateException if a SUBSCRIPTION or AD_BOOST transaction does not
     *                               reference exactly its own kind of entitlement
     */
    public void validateEntitlementLink() {
        boolean hasSubscription = subscription != null;
        boolean hasBoost = adBoost != null;

        if (transactionType == TransactionType.SUBSCRIPTION && (!hasSubscription || hasBoost)) {
            throw new IllegalStateException("Subscription transaction must reference exactly one subscription");
        }
        if (transactionType == TransactionType.AD_BOOST && (!hasBoost || hasSubscription)) {
            throw new IllegalStateException("Ad boost transaction must reference exactly one ad boost");
        }
    }

    /**
     * The entitlement this transaction pays for, if any.
     *
     * @return Purchase target, or empty for FEATURED_AD / OTHER transactions
     */
    public Optional<PurchaseTarget> purchaseTarget() {
        if (subscription != null) {
            return Optional.of(PurchaseTarget.of(subscription));
        }
        if (adBoost != null) {
            return Optional.of(PurchaseTarget.of(adBoost));
        }
        return Optional.empty();
    }

    /**
     * Mark the transaction as paid.
     *
     * @param providerReference Provider reference from the callback (kept if null)
     * @param callbackMetadata Metadata merged over the stored metadata
     * @param now Completion time
     */
    public void complete(String providerReference, Map<String, Object> callbackMetadata, Instant now) {
        applyCallbackDetails(providerReference, callbackMetadata);
        this.status = TransactionStatus.COMPLETED;
        this.completedAt = now;
    }

    /**
     * Mark the transaction as failed. Nothing is activated.
     *
     * @param providerReference Provider reference from the callback (kept if null)
     * @param callbackMetadata Metadata merged over the stored metadata
     * @param now Failure time
     */
    public void fail(String providerReference, Map<String, Object> callbackMetadata, Instant now) {
        applyCallbackDetails(providerReference, callbackMetadata);
        this.status = TransactionStatus.FAILED;
        this.failedAt = now;
    }

    /**
     * Check if the transaction can still be settled by a callback.
     *
     * @return true if PENDING or PROCESSING
     */
    public boolean isSettleable() {
        return status == TransactionStatus.PENDING || status == TransactionStatus.PROCESSING;
    }

    private void applyCallbackDetails(String providerReference, Map<String, Object> callbackMetadata) {
        if (providerReference != null && !providerReference.isBlank()) {
            this.paymentProviderReference = providerReference;
        }
        if (callbackMetadata != null && !callbackMetadata.isEmpty()) {
            Map<String, Object> merged = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
            merged.putAll(callbackMetadata);
            this.metadata = merged;
        }
    }

    /**
     * Transaction type enum.
     */
    public enum TransactionType {
        SUBSCRIPTION,
        AD_BOOST,
        FEATURED_AD,
        OTHER
    }

    /**
     * Payment method enum.
     */
    public enum PaymentMethod {
        MPESA,
        CARD,
        PAYPAL,
        BANK_TRANSFER,
        OTHER;

        public static PaymentMethod fromValue(String value) {
            return EnumValues.parse(PaymentMethod.class, value, "payment_method");
        }
    }

    /**
     * Transaction status enum.
     */
    public enum TransactionStatus {
        PENDING,
        PROCESSING,
        COMPLETED,
        FAILED,
        REFUNDED;

        public static TransactionStatus fromValue(String value) {
            return EnumValues.parse(TransactionStatus.class, value, "status");
        }
    }
}
