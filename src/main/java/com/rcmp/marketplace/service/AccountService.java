package com.rcmp.marketplace.service;

import com.rcmp.marketplace.domain.model.Account;
import com.rcmp.marketplace.exception.InvalidCredentialsException;
import com.rcmp.marketplace.exception.ResourceNotFoundException;
import com.rcmp.marketplace.exception.UsernameAlreadyExistsException;
import com.rcmp.marketplace.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Service for account registration, login and payout account linking.
 *
 * @author Marketplace Team
 */
@Service
public class AccountService {

    private static final Logger logger = LoggerFactory.getLogger(AccountService.class);

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;

    public AccountService(AccountRepository accountRepository, PasswordEncoder passwordEncoder) {
        this.accountRepository = accountRepository;
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Register a new account.
     *
     * @param username Unique username
     * @param rawPassword Plain-text password, hashed before storage
     * @param contactEmail Optional address for reset links
     * @return Created account
     * @throws UsernameAlreadyExistsException if the username is taken
     */
    @Transactional
    public Account register(String username, String rawPassword, String contactEmail) {
        if (accountRepository.existsByUsername(username)) {
            logger.warn("Registration rejected, username taken: {}", username);
            throw new UsernameAlreadyExistsException(username);
        }

        Account account = Account.builder()
                .username(username)
                .passwordHash(passwordEncoder.encode(rawPassword))
                .contactEmail(contactEmail)
                .build();

        try {
            account = accountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException e) {
            // Lost a race with a concurrent registration of the same name
            throw new UsernameAlreadyExistsException(username);
        }

        logger.info("Registered account {} for username {}", account.getAccountId(), username);
        return account;
    }

    /**
     * Check credentials.
     * Unknown username and wrong password fail the same way.
     *
     * @param username Username
     * @param rawPassword Plain-text password
     * @return Authenticated account
     * @throws InvalidCredentialsException if the credentials do not match
     */
    @Transactional(readOnly = true)
    public Account login(String username, String rawPassword) {
        Account account = accountRepository.findByUsername(username).orElse(null);

        if (account == null || !passwordEncoder.matches(rawPassword, account.getPasswordHash())) {
            logger.info("Failed login for username {}", username);
            throw new InvalidCredentialsException();
        }

        return account;
    }

    /**
     * Link a Stripe Connect account for seller payouts.
     *
     * @param accountId Account ID
     * @param payoutAccountId Connect account id, e.g. "acct_1Nv..."
     * @return Updated account
     * @throws ResourceNotFoundException if the account does not exist
     */
    @Transactional
    public Account setPayoutAccount(String accountId, String payoutAccountId) {
        Account account = getAccount(accountId);
        account.setPayoutAccountId(payoutAccountId);
        account = accountRepository.save(account);

        logger.info("Linked payout account for account {}", accountId);
        return account;
    }

    /**
     * Get account by ID.
     *
     * @param accountId Account ID
     * @return Account
     * @throws ResourceNotFoundException if not found
     */
    @Transactional(readOnly = true)
    public Account getAccount(String accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
    }
}
