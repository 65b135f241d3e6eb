package com.rcmp.marketplace.api.controller;

import com.rcmp.marketplace.api.dto.AccountResponse;
import com.rcmp.marketplace.api.dto.ForgotPasswordRequest;
import com.rcmp.marketplace.api.dto.LoginRequest;
import com.rcmp.marketplace.api.dto.MessageResponse;
import com.rcmp.marketplace.api.dto.RegisterRequest;
import com.rcmp.marketplace.api.dto.ResetPasswordRequest;
import com.rcmp.marketplace.domain.model.Account;
import com.rcmp.marketplace.service.AccountService;
import com.rcmp.marketplace.service.PasswordResetService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for registration, login and password recovery.
 * Login and both recovery endpoints sit behind the per-IP rate limiter.
 *
 * @author Marketplace Team
 */
@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

    private final AccountService accountService;
    private final PasswordResetService passwordResetService;

    public AuthController(AccountService accountService, PasswordResetService passwordResetService) {
        this.accountService = accountService;
        this.passwordResetService = passwordResetService;
    }

    @PostMapping("/register")
    public ResponseEntity<AccountResponse> register(@Valid @RequestBody RegisterRequest request) {
        Account account = accountService.register(request.getUsername(), request.getPassword(), request.getEmail());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.fromEntity(account));
    }

    @PostMapping("/login")
    public ResponseEntity<AccountResponse> login(@Valid @RequestBody LoginRequest request) {
        Account account = accountService.login(request.getUsername(), request.getPassword());
        logger.debug("Login succeeded for account {}", account.getAccountId());
        return ResponseEntity.ok(AccountResponse.fromEntity(account));
    }

    /**
     * Send a reset link to the account's contact address.
     *
     * @param request Username
     * @return Confirmation
     */
    @PostMapping("/forgot-password")
    public ResponseEntity<MessageResponse> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        passwordResetService.forgotPassword(request.getUsername());
        return ResponseEntity.ok(MessageResponse.ok("Password reset link sent"));
    }

    /**
     * Set a new password using a reset token.
     *
     * @param request Token and new password
     * @return Confirmation
     */
    @PostMapping("/reset-password")
    public ResponseEntity<MessageResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        passwordResetService.resetPassword(request.getToken(), request.getPassword());
        return ResponseEntity.ok(MessageResponse.ok("Password has been reset"));
    }
}
