package com.cred.freestyle.marketplace.repository;

import com.cred.freestyle.marketplace.domain.model.User;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for User entity.
 *
 * @author Marketplace Team
 */
@Repository
public interface UserRepository extends JpaRepository<User, String> {

    /**
     * Find user by ID with pessimistic write lock.
     * Serializes writers of the derived premium flag (cancellation, expiry sweep).
     *
     * @param userId User ID
     * @return Optional containing the locked user if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM User u WHERE u.userId = :userId")
    Optional<User> findByIdForUpdate(@Param("userId") String userId);

    /**
     * Find user by email address.
     *
     * @param email Email address
     * @return Optional containing the user if found
     */
    Optional<User> findByEmail(String email);
}
