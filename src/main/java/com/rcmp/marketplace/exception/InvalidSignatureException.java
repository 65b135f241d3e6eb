package com.rcmp.marketplace.exception;

/**
 * Exception thrown when a payment webhook fails signature verification.
 * The message is for logs only; callers receive a generic response.
 *
 * @author Marketplace Team
 */
public class InvalidSignatureException extends RuntimeException {

    public InvalidSignatureException(String message) {
        super(message);
    }
}
