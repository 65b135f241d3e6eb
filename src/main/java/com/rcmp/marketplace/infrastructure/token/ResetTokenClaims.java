package com.rcmp.marketplace.infrastructure.token;

import lombok.Value;

import java.time.Instant;

/**
 * Verified contents of a password reset token.
 *
 * @author Marketplace Team
 */
@Value
public class ResetTokenClaims {
    String username;
    int credentialVersion;
    Instant expiresAt;
}
