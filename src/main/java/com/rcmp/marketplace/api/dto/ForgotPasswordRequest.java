package com.rcmp.marketplace.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for requesting a password reset link.
 *
 * @author Marketplace Team
 */
public class ForgotPasswordRequest {

    @NotBlank(message = "Username is required")
    private String username;

    public ForgotPasswordRequest() {
    }

    public ForgotPasswordRequest(String username) {
        this.username = username;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }
}
