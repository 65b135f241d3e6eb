package com.rcmp.marketplace.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Account domain model.
 */
@DisplayName("Account Domain Model Tests")
class AccountTest {

    @Test
    @DisplayName("isPayable should require a non-blank payout account")
    void isPayableShouldRequirePayoutAccount() {
        assertThat(Account.builder().payoutAccountId(null).build().isPayable()).isFalse();
        assertThat(Account.builder().payoutAccountId("  ").build().isPayable()).isFalse();
        assertThat(Account.builder().payoutAccountId("acct_X").build().isPayable()).isTrue();
    }

    @Test
    @DisplayName("toString should not expose the password hash")
    void toStringShouldHideHash() {
        Account account = Account.builder().username("alice").passwordHash("$2a$12$secret").build();

        assertThat(account.toString()).doesNotContain("$2a$12$secret");
    }
}
