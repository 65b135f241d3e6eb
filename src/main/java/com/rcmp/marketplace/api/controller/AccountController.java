package com.rcmp.marketplace.api.controller;

import com.rcmp.marketplace.api.dto.AccountResponse;
import com.rcmp.marketplace.api.dto.PayoutAccountRequest;
import com.rcmp.marketplace.domain.model.Account;
import com.rcmp.marketplace.security.SecurityUtils;
import com.rcmp.marketplace.service.AccountService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for seller account settings.
 *
 * @author Marketplace Team
 */
@RestController
@RequestMapping("/api/v1/accounts")
public class AccountController {

    private final AccountService accountService;

    public AccountController(AccountService accountService) {
        this.accountService = accountService;
    }

    /**
     * Link the Stripe Connect account that receives payouts for this seller.
     *
     * Authorization: callers can only change their own account (or admin)
     *
     * @param accountId Account ID
     * @param request Connect account id
     * @return Updated account
     */
    @PutMapping("/{accountId}/payout-account")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<AccountResponse> setPayoutAccount(
            @PathVariable String accountId,
            @Valid @RequestBody PayoutAccountRequest request
    ) {
        SecurityUtils.verifyAccountAccess(accountId);

        Account account = accountService.setPayoutAccount(accountId, request.getPayoutAccountId());
        return ResponseEntity.ok(AccountResponse.fromEntity(account));
    }

    /**
     * Get account details.
     *
     * Authorization: callers can only view their own account (or admin)
     *
     * @param accountId Account ID
     * @return Account
     */
    @GetMapping("/{accountId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable String accountId) {
        SecurityUtils.verifyAccountAccess(accountId);
        return ResponseEntity.ok(AccountResponse.fromEntity(accountService.getAccount(accountId)));
    }
}
