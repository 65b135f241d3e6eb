package com.rcmp.marketplace.repository;

import com.rcmp.marketplace.domain.model.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for Account entity.
 *
 * @author Marketplace Team
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, String> {

    /**
     * Find account by username (case-sensitive).
     *
     * @param username Username
     * @return Optional containing the account if found
     */
    Optional<Account> findByUsername(String username);

    /**
     * Check if a username is already registered.
     *
     * @param username Username
     * @return true if taken
     */
    boolean existsByUsername(String username);

    /**
     * Replace the password hash if the credential version is still the expected one,
     * bumping the version in the same statement.
     *
     * @param accountId Account ID
     * @param expectedVersion Version the reset token was issued against
     * @param passwordHash New BCrypt hash
     * @param updatedAt Change timestamp
     * @return 1 if the password was replaced, 0 if the version moved on
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Account a SET " +
           "a.passwordHash = :passwordHash, " +
           "a.credentialVersion = a.credentialVersion + 1, " +
           "a.updatedAt = :updatedAt " +
           "WHERE a.accountId = :accountId AND a.credentialVersion = :expectedVersion")
    int replacePasswordHash(
            @Param("accountId") String accountId,
            @Param("expectedVersion") Integer expectedVersion,
            @Param("passwordHash") String passwordHash,
            @Param("updatedAt") Instant updatedAt
    );
}
