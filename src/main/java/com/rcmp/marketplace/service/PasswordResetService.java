package com.rcmp.marketplace.service;

import com.rcmp.marketplace.domain.model.Account;
import com.rcmp.marketplace.exception.InvalidResetTokenException;
import com.rcmp.marketplace.exception.NotificationDeliveryException;
import com.rcmp.marketplace.exception.ResourceNotFoundException;
import com.rcmp.marketplace.infrastructure.messaging.ResetLinkSender;
import com.rcmp.marketplace.infrastructure.messaging.events.PasswordResetLinkMessage;
import com.rcmp.marketplace.infrastructure.metrics.MarketplaceMetricsService;
import com.rcmp.marketplace.infrastructure.token.ResetTokenClaims;
import com.rcmp.marketplace.infrastructure.token.ResetTokenService;
import com.rcmp.marketplace.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Password recovery: issue a reset link, then accept a new password
 * against a valid token.
 *
 * A token is bound to the account's credential version at issuance.
 * Completing a reset bumps the version, so a token works at most once
 * and any other outstanding tokens for the account stop working too.
 *
 * @author Marketplace Team
 */
@Service
public class PasswordResetService {

    private static final Logger logger = LoggerFactory.getLogger(PasswordResetService.class);

    static final String RESET_EMAIL_SUBJECT = "RCMP123 Password Reset";

    private final AccountRepository accountRepository;
    private final ResetTokenService resetTokenService;
    private final ResetLinkSender resetLinkSender;
    private final PasswordEncoder passwordEncoder;
    private final MarketplaceMetricsService metricsService;
    private final Clock clock;

    @Value("${marketplace.reset-token.link-base:http://127.0.0.1:5500/frontend/reset-password.html}")
    private String resetLinkBase;

    @Value("${marketplace.reset-token.fallback-email-domain:email.com}")
    private String fallbackEmailDomain;

    @Value("${marketplace.reset-token.ttl:PT30M}")
    private Duration tokenTtl;

    public PasswordResetService(
            AccountRepository accountRepository,
            ResetTokenService resetTokenService,
            ResetLinkSender resetLinkSender,
            PasswordEncoder passwordEncoder,
            MarketplaceMetricsService metricsService,
            Clock clock
    ) {
        this.accountRepository = accountRepository;
        this.resetTokenService = resetTokenService;
        this.resetLinkSender = resetLinkSender;
        this.passwordEncoder = passwordEncoder;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Issue a reset token for the account and send the link.
     *
     * @param username Username
     * @throws ResourceNotFoundException if no account has this username
     * @throws NotificationDeliveryException if the link could not be handed off
     */
    @Transactional(readOnly = true)
    public void forgotPassword(String username) {
        Account account = accountRepository.findByUsername(username)
                .orElseThrow(() -> new ResourceNotFoundException("Account", username));

        String token = resetTokenService.issue(account.getUsername(), account.getCredentialVersion());
        Instant now = Instant.now(clock);

        PasswordResetLinkMessage message = PasswordResetLinkMessage.builder()
                .username(account.getUsername())
                .recipient(recipientFor(account))
                .subject(RESET_EMAIL_SUBJECT)
                .body(composeBody(account.getUsername(), resetLink(token)))
                .requestedAt(now)
                .expiresAt(now.plus(tokenTtl))
                .build();

        resetLinkSender.send(message);
        metricsService.recordResetLinkIssued();
        logger.info("Password reset link issued for account {}", account.getAccountId());
    }

    /**
     * Replace the password of the account named by a valid token.
     *
     * @param token Reset token
     * @param newPassword New plain-text password
     * @throws InvalidResetTokenException if the token is invalid, expired or already used
     */
    @Transactional
    public void resetPassword(String token, String newPassword) {
        ResetTokenClaims claims = resetTokenService.verify(token)
                .orElseThrow(this::rejectToken);

        Account account = accountRepository.findByUsername(claims.getUsername())
                .orElseThrow(this::rejectToken);

        if (account.getCredentialVersion() != claims.getCredentialVersion()) {
            logger.info("Reset token for account {} was already used or superseded", account.getAccountId());
            throw rejectToken();
        }

        // Two requests carrying the same token can both get this far; only one moves the version
        int updated = accountRepository.replacePasswordHash(
                account.getAccountId(),
                claims.getCredentialVersion(),
                passwordEncoder.encode(newPassword),
                Instant.now(clock));
        if (updated == 0) {
            logger.info("Reset token for account {} lost a concurrent reset", account.getAccountId());
            throw rejectToken();
        }

        metricsService.recordResetCompleted();
        logger.info("Password reset completed for account {}", account.getAccountId());
    }

    String resetLink(String token) {
        return UriComponentsBuilder.fromUriString(resetLinkBase)
                .queryParam("token", token)
                .build()
                .toUriString();
    }

    private String recipientFor(Account account) {
        String email = account.getContactEmail();
        if (email != null && !email.isBlank()) {
            return email;
        }
        return account.getUsername() + "@" + fallbackEmailDomain;
    }

    private String composeBody(String username, String link) {
        return "Hello " + username + ",\n\n"
                + "Click the link to reset your password:\n" + link + "\n\n"
                + "The link expires in " + tokenTtl.toMinutes()
                + " minutes. If you did not request a reset, ignore this message.";
    }

    private InvalidResetTokenException rejectToken() {
        metricsService.recordResetTokenRejected();
        return new InvalidResetTokenException();
    }
}
