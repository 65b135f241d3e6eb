package com.rcmp.marketplace.service;

import com.rcmp.marketplace.domain.model.Account;
import com.rcmp.marketplace.exception.InvalidCredentialsException;
import com.rcmp.marketplace.exception.ResourceNotFoundException;
import com.rcmp.marketplace.exception.UsernameAlreadyExistsException;
import com.rcmp.marketplace.repository.AccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static com.rcmp.marketplace.testutil.TestDataBuilder.anAccount;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AccountService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AccountService Unit Tests")
class AccountServiceTest {

    @Mock
    private AccountRepository accountRepository;

    private PasswordEncoder passwordEncoder;
    private AccountService accountService;

    @BeforeEach
    void setUp() {
        passwordEncoder = new BCryptPasswordEncoder(4);
        accountService = new AccountService(accountRepository, passwordEncoder);
    }

    @Test
    @DisplayName("register - Stores a salted hash, never the plain password")
    void register_HashesPassword() {
        // Given
        when(accountRepository.existsByUsername("alice")).thenReturn(false);
        when(accountRepository.saveAndFlush(any(Account.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        Account account = accountService.register("alice", "correct-horse", "alice@example.org");

        // Then
        assertThat(account.getUsername()).isEqualTo("alice");
        assertThat(account.getContactEmail()).isEqualTo("alice@example.org");
        assertThat(account.getPasswordHash()).isNotEqualTo("correct-horse").startsWith("$2a$");
        assertThat(passwordEncoder.matches("correct-horse", account.getPasswordHash())).isTrue();
    }

    @Test
    @DisplayName("register - Taken username is rejected")
    void register_DuplicateUsername_Throws() {
        when(accountRepository.existsByUsername("alice")).thenReturn(true);

        assertThatThrownBy(() -> accountService.register("alice", "correct-horse", null))
                .isInstanceOf(UsernameAlreadyExistsException.class);
        verify(accountRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("register - Unique constraint race maps to UsernameAlreadyExists")
    void register_ConstraintRace_Throws() {
        when(accountRepository.existsByUsername("alice")).thenReturn(false);
        when(accountRepository.saveAndFlush(any(Account.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThatThrownBy(() -> accountService.register("alice", "correct-horse", null))
                .isInstanceOf(UsernameAlreadyExistsException.class);
    }

    @Test
    @DisplayName("login - Correct credentials return the account")
    void login_Success() {
        Account alice = anAccount().username("alice").passwordHash(passwordEncoder.encode("correct-horse")).build();
        when(accountRepository.findByUsername("alice")).thenReturn(Optional.of(alice));

        assertThat(accountService.login("alice", "correct-horse")).isSameAs(alice);
    }

    @Test
    @DisplayName("login - Wrong password and unknown user fail identically")
    void login_Failures_AreUniform() {
        Account alice = anAccount().username("alice").passwordHash(passwordEncoder.encode("correct-horse")).build();
        when(accountRepository.findByUsername("alice")).thenReturn(Optional.of(alice));
        when(accountRepository.findByUsername("nobody")).thenReturn(Optional.empty());

        Throwable wrongPassword = catchThrowable(() -> accountService.login("alice", "wrong"));
        Throwable unknownUser = catchThrowable(() -> accountService.login("nobody", "wrong"));

        assertThat(wrongPassword).isInstanceOf(InvalidCredentialsException.class);
        assertThat(unknownUser).isInstanceOf(InvalidCredentialsException.class);
        assertThat(wrongPassword.getMessage()).isEqualTo(unknownUser.getMessage());
    }

    @Test
    @DisplayName("setPayoutAccount - Links the Connect account")
    void setPayoutAccount_Success() {
        Account seller = anAccount().accountId("seller-1").notPayable().build();
        when(accountRepository.findById("seller-1")).thenReturn(Optional.of(seller));
        when(accountRepository.save(seller)).thenReturn(seller);

        Account updated = accountService.setPayoutAccount("seller-1", "acct_X");

        assertThat(updated.getPayoutAccountId()).isEqualTo("acct_X");
        assertThat(updated.isPayable()).isTrue();
    }

    @Test
    @DisplayName("setPayoutAccount - Unknown account is NotFound")
    void setPayoutAccount_UnknownAccount_Throws() {
        when(accountRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> accountService.setPayoutAccount("missing", "acct_X"))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
