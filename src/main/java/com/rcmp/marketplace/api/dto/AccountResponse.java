package com.rcmp.marketplace.api.dto;

import com.rcmp.marketplace.domain.model.Account;

import java.time.Instant;

/**
 * Public view of an account. Never carries the credential hash.
 *
 * @author Marketplace Team
 */
public class AccountResponse {

    private String accountId;
    private String username;
    private String email;
    private boolean payoutAccountLinked;
    private Instant createdAt;

    public AccountResponse() {
    }

    /**
     * Create response from Account entity.
     *
     * @param account Account entity
     * @return AccountResponse
     */
    public static AccountResponse fromEntity(Account account) {
        AccountResponse response = new AccountResponse();
        response.setAccountId(account.getAccountId());
        response.setUsername(account.getUsername());
        response.setEmail(account.getContactEmail());
        response.setPayoutAccountLinked(account.isPayable());
        response.setCreatedAt(account.getCreatedAt());
        return response;
    }

    public String getAccountId() {
        return accountId;
    }

    public void setAccountId(String accountId) {
        this.accountId = accountId;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public boolean isPayoutAccountLinked() {
        return payoutAccountLinked;
    }

    public void setPayoutAccountLinked(boolean payoutAccountLinked) {
        this.payoutAccountLinked = payoutAccountLinked;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
