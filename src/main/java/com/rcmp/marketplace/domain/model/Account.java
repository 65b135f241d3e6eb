package com.rcmp.marketplace.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Account entity representing a marketplace user (buyer and/or seller).
 * Accounts are never deleted; the credential hash changes only through
 * a successful password reset ({@code AccountRepository.replacePasswordHash}).
 *
 * @author Marketplace Team
 */
@Entity
@Table(name = "accounts", indexes = {
    @Index(name = "idx_accounts_username", columnList = "username", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    @Id
    @Column(name = "account_id", nullable = false, length = 36)
    private String accountId;

    /**
     * Login name. Unique and case-sensitive.
     */
    @Column(name = "username", nullable = false, unique = true, length = 100)
    private String username;

    /**
     * BCrypt hash of the password.
     */
    @ToString.Exclude
    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    /**
     * Address the reset link is sent to. Optional.
     */
    @Column(name = "contact_email", length = 255)
    private String contactEmail;

    /**
     * Stripe Connect account that receives seller payouts (e.g. "acct_1Nv...").
     * Required for checkout when fee splitting is enabled.
     */
    @Column(name = "payout_account_id", length = 255)
    private String payoutAccountId;

    /**
     * Incremented on every password change. Reset tokens carry the value they
     * were issued against, so a token stops working once it has been used.
     */
    @Column(name = "credential_version", nullable = false)
    @Builder.Default
    private Integer credentialVersion = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (accountId == null) {
            accountId = UUID.randomUUID().toString();
        }
        if (credentialVersion == null) {
            credentialVersion = 0;
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Check if this account can receive Connect payouts.
     *
     * @return true if a payout account is linked
     */
    public boolean isPayable() {
        return payoutAccountId != null && !payoutAccountId.isBlank();
    }
}
