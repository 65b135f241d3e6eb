package com.rcmp.marketplace.api.controller;

import com.rcmp.marketplace.api.exception.GlobalExceptionHandler;
import com.rcmp.marketplace.domain.model.Account;
import com.rcmp.marketplace.infrastructure.metrics.MarketplaceMetricsService;
import com.rcmp.marketplace.service.AccountService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import static com.rcmp.marketplace.testutil.TestDataBuilder.anAccount;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for AccountController using MockMvc.
 */
@WebMvcTest(AccountController.class)
@AutoConfigureMockMvc(addFilters = false)
@ContextConfiguration(classes = {AccountController.class, GlobalExceptionHandler.class})
@DisplayName("AccountController Tests")
class AccountControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AccountService accountService;

    @MockBean
    private MarketplaceMetricsService metricsService;

    private void authenticateAs(String accountId, String... roles) {
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(accountId, null, AuthorityUtils.createAuthorityList(roles)));
    }

    @AfterEach
    void clearSecurityContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("PUT /{accountId}/payout-account - Owner links a Connect account")
    void setPayoutAccount_Owner_Returns200() throws Exception {
        // Given
        authenticateAs("seller-1", "ROLE_USER");
        Account updated = anAccount().accountId("seller-1").username("alice").payoutAccountId("acct_123").build();
        when(accountService.setPayoutAccount("seller-1", "acct_123")).thenReturn(updated);

        // When / Then
        mockMvc.perform(put("/api/v1/accounts/{accountId}/payout-account", "seller-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payoutAccountId\":\"acct_123\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payoutAccountLinked").value(true));
    }

    @Test
    @DisplayName("PUT /{accountId}/payout-account - Another caller is refused with 403")
    void setPayoutAccount_OtherCaller_Returns403() throws Exception {
        authenticateAs("mallory", "ROLE_USER");

        mockMvc.perform(put("/api/v1/accounts/{accountId}/payout-account", "seller-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payoutAccountId\":\"acct_evil\"}"))
                .andExpect(status().isForbidden());

        verify(accountService, never()).setPayoutAccount(anyString(), anyString());
    }

    @Test
    @DisplayName("PUT /{accountId}/payout-account - Malformed Connect id returns 400")
    void setPayoutAccount_MalformedId_Returns400() throws Exception {
        authenticateAs("seller-1", "ROLE_USER");

        mockMvc.perform(put("/api/v1/accounts/{accountId}/payout-account", "seller-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payoutAccountId\":\"not-a-connect-id\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /{accountId} - Admin may read any account")
    void getAccount_Admin_Returns200() throws Exception {
        authenticateAs("admin-1", "ROLE_ADMIN");
        Account account = anAccount().accountId("seller-1").username("alice").build();
        when(accountService.getAccount("seller-1")).thenReturn(account);

        mockMvc.perform(get("/api/v1/accounts/{accountId}", "seller-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("alice"));
    }

    @Test
    @DisplayName("GET /{accountId} - Anonymous caller is refused with 403")
    void getAccount_Anonymous_Returns403() throws Exception {
        mockMvc.perform(get("/api/v1/accounts/{accountId}", "seller-1"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(accountService);
    }
}
