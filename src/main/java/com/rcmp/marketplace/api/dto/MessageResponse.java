package com.rcmp.marketplace.api.dto;

/**
 * Simple outcome body for the password recovery endpoints.
 *
 * @author Marketplace Team
 */
public class MessageResponse {

    private boolean success;
    private String message;

    public MessageResponse() {
    }

    public MessageResponse(boolean success, String message) {
        this.success = success;
        this.message = message;
    }

    public static MessageResponse ok(String message) {
        return new MessageResponse(true, message);
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
