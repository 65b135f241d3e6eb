package com.rcmp.marketplace.exception;

/**
 * Exception thrown when an outbound notification (e.g. the password reset link)
 * could not be handed to the messaging transport.
 *
 * @author Marketplace Team
 */
public class NotificationDeliveryException extends RuntimeException {

    public NotificationDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
