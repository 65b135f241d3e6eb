package com.rcmp.marketplace.exception;

/**
 * Exception thrown on a failed login. Unknown user and wrong password
 * produce the same exception.
 *
 * @author Marketplace Team
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException() {
        super("Invalid login");
    }
}
