package com.cred.freestyle.marketplace.repository;

import com.cred.freestyle.marketplace.domain.model.Transaction;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Transaction entity.
 *
 * @author Marketplace Team
 */
@Repository
public interface TransactionRepository extends JpaRepository<Transaction, String> {

    /**
     * Find transaction by its public reference.
     *
     * @param transactionReference Transaction reference
     * @return Optional containing the transaction if found
     */
    Optional<Transaction> findByTransactionReference(String transactionReference);

    /**
     * Find transaction by reference with pessimistic write lock.
     * Concurrent callbacks for the same reference queue on this row.
     *
     * @param transactionReference Transaction reference
     * @return Optional containing the locked transaction if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Transaction t WHERE t.transactionReference = :reference")
    Optional<Transaction> findByTransactionReferenceForUpdate(@Param("reference") String transactionReference);

    /**
     * Check if a reference is already taken.
     *
     * @param transactionReference Transaction reference
     * @return true if a transaction uses the reference
     */
    boolean existsByTransactionReference(String transactionReference);

    /**
     * Find all transactions of a user, newest first.
     *
     * @param userId User ID
     * @return List of transactions
     */
    List<Transaction> findByUserIdOrderByCreatedAtDesc(String userId);
}
