package com.rcmp.marketplace.exception;

/**
 * Exception thrown when a password reset token is rejected.
 * The cause (expired, forged, already used) is deliberately not exposed.
 *
 * @author Marketplace Team
 */
public class InvalidResetTokenException extends RuntimeException {

    public InvalidResetTokenException() {
        super("Invalid or expired token");
    }
}
