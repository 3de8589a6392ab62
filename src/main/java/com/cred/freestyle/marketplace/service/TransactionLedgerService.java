package com.cred.freestyle.marketplace.service;

import com.cred.freestyle.marketplace.domain.model.PurchaseTarget;
import com.cred.freestyle.marketplace.domain.model.Transaction;
import com.cred.freestyle.marketplace.domain.model.Transaction.PaymentMethod;
import com.cred.freestyle.marketplace.domain.model.Transaction.TransactionStatus;
import com.cred.freestyle.marketplace.exception.InvalidStateException;
import com.cred.freestyle.marketplace.exception.PermissionDeniedException;
import com.cred.freestyle.marketplace.exception.ResourceNotFoundException;
import com.cred.freestyle.marketplace.exception.TransactionReferenceConflictException;
import com.cred.freestyle.marketplace.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.marketplace.infrastructure.messaging.events.NotificationMessage;
import com.cred.freestyle.marketplace.infrastructure.messaging.events.PaymentEvent;
import com.cred.freestyle.marketplace.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.marketplace.infrastructure.transaction.AfterCommit;
import com.cred.freestyle.marketplace.repository.TransactionRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Payment ledger: creates transactions with unique references and settles them
 * from payment gateway callbacks.
 *
 * Callback handling:
 * 1. Lock the transaction row by reference (concurrent callbacks queue here)
 * 2. Same status as already stored: no-op, reported as already processed
 * 3. Different terminal status already stored: rejected
 * 4. COMPLETED: record provider details, activate the entitlement in the same DB transaction
 * 5. FAILED: record provider details, activate nothing
 *
 * Kafka events and notifications go out only after the database transaction commits.
 *
 * @author Marketplace Team
 */
@Service
public class TransactionLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(TransactionLedgerService.class);

    private static final String RESOURCE_TYPE = "Transaction";

    private final TransactionRepository transactionRepository;
    private final TransactionReferenceGenerator referenceGenerator;
    private final EntitlementActivator entitlementActivator;
    private final KafkaProducerService kafkaProducerService;
    private final CloudWatchMetricsService metricsService;

    @Value("${marketplace.payments.reference-max-attempts:3}")
    private int referenceMaxAttempts = 3;

    public TransactionLedgerService(
            TransactionRepository transactionRepository,
            TransactionReferenceGenerator referenceGenerator,
            EntitlementActivator entitlementActivator,
            KafkaProducerService kafkaProducerService,
            CloudWatchMetricsService metricsService
    ) {
        this.transactionRepository = transactionRepository;
        this.referenceGenerator = referenceGenerator;
        this.entitlementActivator = entitlementActivator;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
    }

    /**
     * Create a PENDING transaction paying for the given entitlement.
     * Type, amount and currency are taken from the target.
     *
     * @param userId Paying user
     * @param target Entitlement being paid for
     * @param paymentMethod Payment method
     * @return Saved transaction
     * @throws TransactionReferenceConflictException if no unused reference could be generated
     *                                               or the insert hit the reference unique constraint
     * @throws DataIntegrityViolationException if the insert violated any other constraint
     */
    @Transactional
    public Transaction createTransaction(String userId, PurchaseTarget target, PaymentMethod paymentMethod) {
        String reference = nextUnusedReference();
        Transaction transaction = Transaction.forTarget(userId, target, paymentMethod, reference);

        try {
            transaction = transactionRepository.saveAndFlush(transaction);
        } catch (DataIntegrityViolationException e) {
            if (!isReferenceViolation(e)) {
                logger.error("Error inserting transaction {} for user {}", reference, userId, e);
                metricsService.recordError("TRANSACTION_INSERT_ERROR", "createTransaction");
                throw e;
            }
            logger.warn("Transaction reference {} collided on insert", reference);
            metricsService.recordError("TRANSACTION_REFERENCE_CONFLICT", "createTransaction");
            throw new TransactionReferenceConflictException(reference, e);
        }

        metricsService.recordTransactionCreated(transaction.getTransactionType().name(), paymentMethod.name());
        PaymentEvent createdEvent = PaymentEvent.forTransaction(transaction, PaymentEvent.EventType.TRANSACTION_CREATED);
        AfterCommit.run("publish TRANSACTION_CREATED for " + reference,
                () -> kafkaProducerService.publishPaymentEvent(createdEvent));

        logger.info("Created {} transaction {} for user {}: {} {}",
                transaction.getTransactionType(), reference, userId,
                transaction.getAmount(), transaction.getCurrency());
        return transaction;
    }

    /**
     * Apply a payment gateway callback.
     *
     * @param reference Transaction reference from the callback
     * @param status Reported status, COMPLETED or FAILED
     * @param providerReference Provider's own reference (optional)
     * @param metadata Provider metadata merged into the transaction (optional)
     * @return Callback result with the updated transaction
     * @throws ResourceNotFoundException if no transaction has the reference
     * @throws InvalidStateException if the transaction was already settled differently
     * @throws IllegalArgumentException if the status is not COMPLETED or FAILED
     */
    @Transactional
    public CallbackResult applyCallback(
            String reference,
            TransactionStatus status,
            String providerReference,
            Map<String, Object> metadata
    ) {
        if (status != TransactionStatus.COMPLETED && status != TransactionStatus.FAILED) {
            throw new IllegalArgumentException("Callback status must be completed or failed, got " + status);
        }

        long startTime = System.currentTimeMillis();

        try {
            Transaction transaction = transactionRepository.findByTransactionReferenceForUpdate(reference)
                    .orElseThrow(() -> {
                        logger.warn("Callback for unknown transaction reference {}", reference);
                        return new ResourceNotFoundException(RESOURCE_TYPE, reference, "Transaction not found.");
                    });

            if (transaction.getStatus() == status) {
                logger.warn("Duplicate {} callback for transaction {}, ignoring", status, reference);
                metricsService.recordDuplicateCallback(status.name());
                return CallbackResult.alreadyProcessed(transaction);
            }

            if (!transaction.isSettleable()) {
                logger.warn("Rejected {} callback for transaction {} already {}",
                        status, reference, transaction.getStatus());
                throw new InvalidStateException(RESOURCE_TYPE, reference, transaction.getStatus().name(),
                        String.format("Transaction %s is already %s and cannot become %s",
                                reference, transaction.getStatus(), status));
            }

            Instant now = Instant.now();
            if (status == TransactionStatus.COMPLETED) {
                complete(transaction, providerReference, metadata, now);
            } else {
                fail(transaction, providerReference, metadata, now);
            }

            metricsService.recordCallbackLatency(System.currentTimeMillis() - startTime);
            return CallbackResult.processed(transaction);

        } catch (ResourceNotFoundException | InvalidStateException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Error processing {} callback for transaction {}", status, reference, e);
            metricsService.recordError("CALLBACK_PROCESSING_ERROR", "applyCallback");
            throw e;
        }
    }

    /**
     * Get all transactions of a user, newest first.
     *
     * @param userId User ID
     * @return Transactions
     */
    @Transactional(readOnly = true)
    public List<Transaction> getTransactionsForUser(String userId) {
        logger.debug("Listing transactions for user {}", userId);
        return transactionRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    /**
     * Get one transaction, only if it belongs to the user.
     *
     * @param transactionId Transaction ID
     * @param userId Requesting user
     * @return Transaction
     * @throws ResourceNotFoundException if the transaction does not exist
     * @throws PermissionDeniedException if it belongs to another user
     */
    @Transactional(readOnly = true)
    public Transaction getTransactionForUser(String transactionId, String userId) {
        Transaction transaction = transactionRepository.findById(transactionId)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, transactionId));

        if (!transaction.getUserId().equals(userId)) {
            logger.warn("User {} requested transaction {} owned by another user", userId, transactionId);
            throw new PermissionDeniedException(RESOURCE_TYPE, transactionId, userId);
        }
        return transaction;
    }

    private void complete(Transaction transaction, String providerReference,
                          Map<String, Object> metadata, Instant now) {
        transaction.complete(providerReference, metadata, now);
        transactionRepository.save(transaction);

        Optional<ActivationResult> activation = entitlementActivator.activate(transaction, now);

        String type = transaction.getTransactionType().name();
        metricsService.recordTransactionCompleted(type);
        metricsService.recordRevenue(type, transaction.getCurrency(), transaction.getAmount().doubleValue());

        publishAfterCommit(
                PaymentEvent.forTransaction(transaction, PaymentEvent.EventType.TRANSACTION_COMPLETED),
                new NotificationMessage(
                        transaction.getUserId(),
                        NotificationMessage.PAYMENT_COMPLETED,
                        notificationParams(transaction, activation)));

        logger.info("Transaction {} completed (provider reference: {})",
                transaction.getTransactionReference(), transaction.getPaymentProviderReference());
    }

    private void fail(Transaction transaction, String providerReference,
                      Map<String, Object> metadata, Instant now) {
        transaction.fail(providerReference, metadata, now);
        transactionRepository.save(transaction);

        metricsService.recordTransactionFailed(transaction.getTransactionType().name());

        publishAfterCommit(
                PaymentEvent.forTransaction(transaction, PaymentEvent.EventType.TRANSACTION_FAILED),
                new NotificationMessage(
                        transaction.getUserId(),
                        NotificationMessage.PAYMENT_FAILED,
                        notificationParams(transaction, Optional.empty())));

        logger.info("Transaction {} failed (provider reference: {})",
                transaction.getTransactionReference(), transaction.getPaymentProviderReference());
    }

    private void publishAfterCommit(PaymentEvent event, NotificationMessage notification) {
        AfterCommit.run("publish " + event.getEventType() + " for " + event.getUserId(), () -> {
            kafkaProducerService.publishPaymentEvent(event);
            kafkaProducerService.publishNotification(notification);
        });
    }

    private Map<String, Object> notificationParams(Transaction transaction, Optional<ActivationResult> activation) {
        Map<String, Object> params = new HashMap<>();
        params.put("transactionReference", transaction.getTransactionReference());
        params.put("amount", transaction.getAmount());
        params.put("currency", transaction.getCurrency());
        activation.ifPresent(result -> {
            params.put("entitlementType", result.getEntitlementType());
            params.put("tier", result.getTier());
            params.put("validUntil", result.getValidUntil());
        });
        return params;
    }

    /**
     * Whether the violation comes from the transaction_reference unique constraint.
     * Prefers the constraint name Hibernate extracted, falling back to the driver message.
     */
    private boolean isReferenceViolation(DataIntegrityViolationException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                String constraintName = ((ConstraintViolationException) cause).getConstraintName();
                if (constraintName != null) {
                    return mentionsReferenceConstraint(constraintName);
                }
            }
        }
        return mentionsReferenceConstraint(e.getMostSpecificCause().getMessage());
    }

    private static boolean mentionsReferenceConstraint(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(Transaction.REFERENCE_CONSTRAINT);
    }

    private String nextUnusedReference() {
        String reference = null;
        for (int attempt = 1; attempt <= referenceMaxAttempts; attempt++) {
            reference = referenceGenerator.generate();
            if (!transactionRepository.existsByTransactionReference(reference)) {
                return reference;
            }
            logger.warn("Generated transaction reference {} already exists (attempt {}/{})",
                    reference, attempt, referenceMaxAttempts);
        }
        metricsService.recordError("TRANSACTION_REFERENCE_CONFLICT", "createTransaction");
        throw new TransactionReferenceConflictException(reference);
    }
}
