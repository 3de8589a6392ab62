package com.cred.freestyle.marketplace.service;

import com.cred.freestyle.marketplace.domain.model.PremiumSubscription;
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
import com.cred.freestyle.marketplace.repository.TransactionRepository;
import com.cred.freestyle.marketplace.testutil.TestDataBuilder;
import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TransactionLedgerService.
 * Covers reference allocation and callback settlement, including duplicate and conflicting callbacks.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TransactionLedgerService Tests")
class TransactionLedgerServiceTest {

    @Mock
    private TransactionRepository transactionRepository;

    @Mock
    private TransactionReferenceGenerator referenceGenerator;

    @Mock
    private EntitlementActivator entitlementActivator;

    @Mock
    private KafkaProducerService kafkaProducerService;

    @Mock
    private CloudWatchMetricsService metricsService;

    @InjectMocks
    private TransactionLedgerService ledgerService;

    private PremiumSubscription subscription;
    private Transaction pendingTransaction;
    private String reference;

    @AfterEach
    void clearSynchronization() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @BeforeEach
    void setUp() {
        subscription = TestDataBuilder.aPendingSubscription().build();
        pendingTransaction = TestDataBuilder.pendingTransactionFor(subscription);
        reference = pendingTransaction.getTransactionReference();
    }

    // ========================================
    // createTransaction Tests
    // ========================================

    @Test
    @DisplayName("createTransaction - Success: PENDING transaction copies amount and currency from the target")
    void createTransaction_Success() {
        // Given
        when(referenceGenerator.generate()).thenReturn("TXN-20240115-AAAAAAAAAAAAAAAA");
        when(transactionRepository.existsByTransactionReference("TXN-20240115-AAAAAAAAAAAAAAAA")).thenReturn(false);
        when(transactionRepository.saveAndFlush(any(Transaction.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        Transaction created = ledgerService.createTransaction(
                TestDataBuilder.USER_ID, PurchaseTarget.of(subscription), PaymentMethod.MPESA);

        // Then
        assertThat(created.getTransactionReference()).isEqualTo("TXN-20240115-AAAAAAAAAAAAAAAA");
        assertThat(created.getStatus()).isEqualTo(TransactionStatus.PENDING);
        assertThat(created.getAmount()).isEqualByComparingTo(subscription.getAmount());
        assertThat(created.getSubscription()).isSameAs(subscription);
        verify(metricsService).recordTransactionCreated("SUBSCRIPTION", "MPESA");
        verify(kafkaProducerService).publishPaymentEvent(any(PaymentEvent.class));
    }

    @Test
    @DisplayName("createTransaction - Retry: existing reference is regenerated")
    void createTransaction_RetriesOnExistingReference() {
        // Given
        when(referenceGenerator.generate()).thenReturn("TXN-20240115-1111111111111111", "TXN-20240115-2222222222222222");
        when(transactionRepository.existsByTransactionReference("TXN-20240115-1111111111111111")).thenReturn(true);
        when(transactionRepository.existsByTransactionReference("TXN-20240115-2222222222222222")).thenReturn(false);
        when(transactionRepository.saveAndFlush(any(Transaction.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        Transaction created = ledgerService.createTransaction(
                TestDataBuilder.USER_ID, PurchaseTarget.of(subscription), PaymentMethod.CARD);

        // Then
        assertThat(created.getTransactionReference()).isEqualTo("TXN-20240115-2222222222222222");
        verify(referenceGenerator, times(2)).generate();
    }

    @Test
    @DisplayName("createTransaction - Failure: every attempt collides")
    void createTransaction_AllAttemptsCollide() {
        // Given
        when(referenceGenerator.generate()).thenReturn("TXN-20240115-1111111111111111");
        when(transactionRepository.existsByTransactionReference(anyString())).thenReturn(true);

        // When & Then
        assertThatThrownBy(() -> ledgerService.createTransaction(
                TestDataBuilder.USER_ID, PurchaseTarget.of(subscription), PaymentMethod.MPESA))
                .isInstanceOf(TransactionReferenceConflictException.class);

        verify(referenceGenerator, times(3)).generate();
        verify(transactionRepository, never()).saveAndFlush(any());
        verify(metricsService).recordError("TRANSACTION_REFERENCE_CONFLICT", "createTransaction");
    }

    @Test
    @DisplayName("createTransaction - Failure: unique constraint hit on insert")
    void createTransaction_UniqueConstraintOnInsert() {
        // Given
        when(referenceGenerator.generate()).thenReturn("TXN-20240115-1111111111111111");
        when(transactionRepository.existsByTransactionReference(anyString())).thenReturn(false);
        when(transactionRepository.saveAndFlush(any(Transaction.class)))
                .thenThrow(constraintViolation(Transaction.REFERENCE_CONSTRAINT));

        // When & Then
        assertThatThrownBy(() -> ledgerService.createTransaction(
                TestDataBuilder.USER_ID, PurchaseTarget.of(subscription), PaymentMethod.MPESA))
                .isInstanceOf(TransactionReferenceConflictException.class);

        verify(kafkaProducerService, never()).publishPaymentEvent(any());
    }

    @Test
    @DisplayName("createTransaction - Failure: reference constraint named only in the driver message")
    void createTransaction_ReferenceConstraintInDriverMessage() {
        // Given
        when(referenceGenerator.generate()).thenReturn("TXN-20240115-1111111111111111");
        when(transactionRepository.existsByTransactionReference(anyString())).thenReturn(false);
        when(transactionRepository.saveAndFlush(any(Transaction.class)))
                .thenThrow(new DataIntegrityViolationException("could not execute statement",
                        new SQLException("ERROR: duplicate key value violates unique constraint "
                                + "\"uk_transactions_reference\"", "23505")));

        // When & Then
        assertThatThrownBy(() -> ledgerService.createTransaction(
                TestDataBuilder.USER_ID, PurchaseTarget.of(subscription), PaymentMethod.MPESA))
                .isInstanceOf(TransactionReferenceConflictException.class);
    }

    @Test
    @DisplayName("createTransaction - Failure: other constraint violations are not reported as reference conflicts")
    void createTransaction_OtherConstraintRethrown() {
        // Given
        DataIntegrityViolationException violation = constraintViolation("fk_transactions_subscription");
        when(referenceGenerator.generate()).thenReturn("TXN-20240115-1111111111111111");
        when(transactionRepository.existsByTransactionReference(anyString())).thenReturn(false);
        when(transactionRepository.saveAndFlush(any(Transaction.class))).thenThrow(violation);

        // When & Then
        assertThatThrownBy(() -> ledgerService.createTransaction(
                TestDataBuilder.USER_ID, PurchaseTarget.of(subscription), PaymentMethod.MPESA))
                .isSameAs(violation);

        verify(metricsService).recordError("TRANSACTION_INSERT_ERROR", "createTransaction");
        verify(metricsService, never()).recordError("TRANSACTION_REFERENCE_CONFLICT", "createTransaction");
        verify(kafkaProducerService, never()).publishPaymentEvent(any());
    }

    private static DataIntegrityViolationException constraintViolation(String constraintName) {
        SQLException sqlException = new SQLException("constraint violated: " + constraintName, "23505");
        return new DataIntegrityViolationException("could not execute statement",
                new ConstraintViolationException("could not execute statement", sqlException, constraintName));
    }

    // ========================================
    // applyCallback Tests
    // ========================================

    @Test
    @DisplayName("applyCallback - COMPLETED: settles, activates entitlement and notifies")
    void applyCallback_Completed() {
        // Given
        when(transactionRepository.findByTransactionReferenceForUpdate(reference))
                .thenReturn(Optional.of(pendingTransaction));
        when(entitlementActivator.activate(eq(pendingTransaction), any(Instant.class)))
                .thenReturn(Optional.of(new ActivationResult(ActivationResult.SUBSCRIPTION,
                        subscription.getSubscriptionId(), "PREMIUM", Instant.now())));

        // When
        CallbackResult result = ledgerService.applyCallback(
                reference, TransactionStatus.COMPLETED, "MP-123", Map.of("receipt", "QK12ABC"));

        // Then
        assertThat(result.isAlreadyProcessed()).isFalse();
        Transaction settled = result.getTransaction();
        assertThat(settled.getStatus()).isEqualTo(TransactionStatus.COMPLETED);
        assertThat(settled.getCompletedAt()).isNotNull();
        assertThat(settled.getPaymentProviderReference()).isEqualTo("MP-123");
        assertThat(settled.getMetadata()).containsEntry("receipt", "QK12ABC");

        verify(transactionRepository).save(pendingTransaction);
        verify(metricsService).recordTransactionCompleted("SUBSCRIPTION");
        verify(metricsService).recordRevenue(eq("SUBSCRIPTION"), eq("KES"), eq(999.00));

        ArgumentCaptor<NotificationMessage> notification = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(kafkaProducerService).publishNotification(notification.capture());
        assertThat(notification.getValue().getTemplate()).isEqualTo(NotificationMessage.PAYMENT_COMPLETED);
        assertThat(notification.getValue().getParams())
                .containsEntry("transactionReference", reference)
                .containsEntry("tier", "PREMIUM");
    }

    @Test
    @DisplayName("applyCallback - COMPLETED inside a transaction: events wait for the commit")
    void applyCallback_Completed_PublishesAfterCommit() {
        // Given
        when(transactionRepository.findByTransactionReferenceForUpdate(reference))
                .thenReturn(Optional.of(pendingTransaction));
        when(entitlementActivator.activate(eq(pendingTransaction), any(Instant.class)))
                .thenReturn(Optional.empty());
        TransactionSynchronizationManager.initSynchronization();

        // When
        ledgerService.applyCallback(reference, TransactionStatus.COMPLETED, "MP-123", null);

        // Then
        verifyNoInteractions(kafkaProducerService);

        List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
        assertThat(synchronizations).hasSize(1);
        synchronizations.forEach(TransactionSynchronization::afterCommit);

        ArgumentCaptor<PaymentEvent> event = ArgumentCaptor.forClass(PaymentEvent.class);
        verify(kafkaProducerService).publishPaymentEvent(event.capture());
        assertThat(event.getValue().getEventType()).isEqualTo(PaymentEvent.EventType.TRANSACTION_COMPLETED);
        verify(kafkaProducerService).publishNotification(any(NotificationMessage.class));
    }

    @Test
    @DisplayName("applyCallback - FAILED inside a rolled back transaction: nothing is published")
    void applyCallback_Failed_RolledBackPublishesNothing() {
        // Given
        when(transactionRepository.findByTransactionReferenceForUpdate(reference))
                .thenReturn(Optional.of(pendingTransaction));
        TransactionSynchronizationManager.initSynchronization();

        // When
        ledgerService.applyCallback(reference, TransactionStatus.FAILED, null, null);
        TransactionSynchronizationManager.getSynchronizations()
                .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

        // Then
        verifyNoInteractions(kafkaProducerService);
    }

    @Test
    @DisplayName("applyCallback - FAILED: marks failed and activates nothing")
    void applyCallback_Failed() {
        // Given
        when(transactionRepository.findByTransactionReferenceForUpdate(reference))
                .thenReturn(Optional.of(pendingTransaction));

        // When
        CallbackResult result = ledgerService.applyCallback(reference, TransactionStatus.FAILED, null, null);

        // Then
        assertThat(result.isAlreadyProcessed()).isFalse();
        assertThat(result.getTransaction().getStatus()).isEqualTo(TransactionStatus.FAILED);
        assertThat(result.getTransaction().getFailedAt()).isNotNull();
        verify(entitlementActivator, never()).activate(any(), any());
        verify(metricsService).recordTransactionFailed("SUBSCRIPTION");
    }

    @Test
    @DisplayName("applyCallback - Duplicate: same status again is a no-op")
    void applyCallback_DuplicateIsIdempotent() {
        // Given
        pendingTransaction.complete("MP-123", null, Instant.now());
        when(transactionRepository.findByTransactionReferenceForUpdate(reference))
                .thenReturn(Optional.of(pendingTransaction));

        // When
        CallbackResult result = ledgerService.applyCallback(reference, TransactionStatus.COMPLETED, "MP-456", null);

        // Then
        assertThat(result.isAlreadyProcessed()).isTrue();
        assertThat(result.getTransaction().getPaymentProviderReference()).isEqualTo("MP-123");
        verify(transactionRepository, never()).save(any());
        verify(entitlementActivator, never()).activate(any(), any());
        verify(metricsService).recordDuplicateCallback("COMPLETED");
        verifyNoInteractions(kafkaProducerService);
    }

    @Test
    @DisplayName("applyCallback - Conflict: FAILED after COMPLETED is rejected")
    void applyCallback_ConflictingTerminalStatus() {
        // Given
        pendingTransaction.complete("MP-123", null, Instant.now());
        when(transactionRepository.findByTransactionReferenceForUpdate(reference))
                .thenReturn(Optional.of(pendingTransaction));

        // When & Then
        assertThatThrownBy(() -> ledgerService.applyCallback(reference, TransactionStatus.FAILED, null, null))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("COMPLETED");

        assertThat(pendingTransaction.getStatus()).isEqualTo(TransactionStatus.COMPLETED);
        verify(transactionRepository, never()).save(any());
    }

    @Test
    @DisplayName("applyCallback - Unknown reference is not found")
    void applyCallback_UnknownReference() {
        // Given
        when(transactionRepository.findByTransactionReferenceForUpdate("TXN-UNKNOWN")).thenReturn(Optional.empty());

        // When & Then
        assertThatThrownBy(() -> ledgerService.applyCallback("TXN-UNKNOWN", TransactionStatus.COMPLETED, null, null))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Transaction not found.");
    }

    @Test
    @DisplayName("applyCallback - Non-terminal status is rejected before any lookup")
    void applyCallback_NonTerminalStatus() {
        assertThatThrownBy(() -> ledgerService.applyCallback(reference, TransactionStatus.PENDING, null, null))
                .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(transactionRepository);
    }

    @Test
    @DisplayName("applyCallback - Activation failure is recorded and propagated")
    void applyCallback_ActivationFailure() {
        // Given
        when(transactionRepository.findByTransactionReferenceForUpdate(reference))
                .thenReturn(Optional.of(pendingTransaction));
        when(entitlementActivator.activate(eq(pendingTransaction), any(Instant.class)))
                .thenThrow(new ResourceNotFoundException("User", TestDataBuilder.USER_ID));

        // When & Then
        assertThatThrownBy(() -> ledgerService.applyCallback(reference, TransactionStatus.COMPLETED, null, null))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(kafkaProducerService, never()).publishNotification(any());
    }

    // ========================================
    // Lookup Tests
    // ========================================

    @Test
    @DisplayName("getTransactionForUser - Owner gets the transaction")
    void getTransactionForUser_Owner() {
        when(transactionRepository.findById(pendingTransaction.getTransactionId()))
                .thenReturn(Optional.of(pendingTransaction));

        Transaction found = ledgerService.getTransactionForUser(
                pendingTransaction.getTransactionId(), TestDataBuilder.USER_ID);

        assertThat(found).isSameAs(pendingTransaction);
    }

    @Test
    @DisplayName("getTransactionForUser - Another user's transaction is denied")
    void getTransactionForUser_OtherUser() {
        when(transactionRepository.findById(pendingTransaction.getTransactionId()))
                .thenReturn(Optional.of(pendingTransaction));

        assertThatThrownBy(() -> ledgerService.getTransactionForUser(
                pendingTransaction.getTransactionId(), TestDataBuilder.OTHER_USER_ID))
                .isInstanceOf(PermissionDeniedException.class);
    }

    @Test
    @DisplayName("getTransactionForUser - Missing transaction is not found")
    void getTransactionForUser_Missing() {
        when(transactionRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ledgerService.getTransactionForUser("missing", TestDataBuilder.USER_ID))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
