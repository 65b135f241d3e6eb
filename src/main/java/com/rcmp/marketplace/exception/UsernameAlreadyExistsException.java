package com.rcmp.marketplace.exception;

/**
 * Exception thrown when registering a username that is already taken.
 *
 * @author Marketplace Team
 */
public class UsernameAlreadyExistsException extends RuntimeException {

    private final String username;

    public UsernameAlreadyExistsException(String username) {
        super("Username already exists");
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
