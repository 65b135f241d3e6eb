package com.rcmp.marketplace.infrastructure.messaging;

import com.rcmp.marketplace.infrastructure.messaging.events.PasswordResetLinkMessage;

/**
 * Hands a reset link to whatever delivers mail.
 *
 * @author Marketplace Team
 */
public interface ResetLinkSender {

    /**
     * Send the message, returning only once delivery has been accepted.
     *
     * @param message Reset link message
     * @throws com.rcmp.marketplace.exception.NotificationDeliveryException if delivery was not accepted
     */
    void send(PasswordResetLinkMessage message);
}
