package com.rcmp.marketplace.infrastructure.messaging.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Outbound notification carrying a password reset link to the mail relay.
 *
 * @author Marketplace Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PasswordResetLinkMessage {

    private String username;
    private String recipient;
    private String subject;

    // Holds a live credential
    @ToString.Exclude
    private String body;

    private Instant expiresAt;
    private Instant requestedAt;
}
