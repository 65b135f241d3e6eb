package com.rcmp.marketplace.api.controller;

import com.rcmp.marketplace.api.exception.GlobalExceptionHandler;
import com.rcmp.marketplace.exception.InvalidCredentialsException;
import com.rcmp.marketplace.infrastructure.metrics.MarketplaceMetricsService;
import com.rcmp.marketplace.infrastructure.ratelimit.RateLimitConfig;
import com.rcmp.marketplace.infrastructure.ratelimit.RateLimitInterceptor;
import com.rcmp.marketplace.infrastructure.ratelimit.RateLimiter;
import com.rcmp.marketplace.infrastructure.ratelimit.SlidingWindowRateLimiter;
import com.rcmp.marketplace.service.AccountService;
import com.rcmp.marketplace.service.PasswordResetService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Duration;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Rate limiting on the credential endpoints, through the registered interceptor.
 */
@WebMvcTest(AuthController.class)
@AutoConfigureMockMvc(addFilters = false)
@ContextConfiguration(classes = {
        AuthController.class,
        GlobalExceptionHandler.class,
        RateLimitConfig.class,
        RateLimitInterceptor.class,
        AuthRateLimitTest.LimiterConfig.class
})
@DisplayName("Auth Rate Limit Tests")
class AuthRateLimitTest {

    @TestConfiguration
    static class LimiterConfig {
        @Bean
        RateLimiter rateLimiter() {
            return new SlidingWindowRateLimiter(5, Duration.ofSeconds(60), Clock.systemUTC());
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AccountService accountService;

    @MockBean
    private PasswordResetService passwordResetService;

    @MockBean
    private MarketplaceMetricsService metricsService;

    @Test
    @DisplayName("Sixth credential attempt from one IP inside a minute returns 429")
    void credentialEndpoints_ShareOneWindow() throws Exception {
        // Given
        when(accountService.login(anyString(), anyString())).thenThrow(new InvalidCredentialsException());
        String login = "{\"username\":\"alice\",\"password\":\"wrong-password\"}";

        // When: five attempts spread over login and forgot-password
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(post("/api/v1/auth/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(login))
                    .andExpect(status().isUnauthorized());
        }
        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/api/v1/auth/forgot-password")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"username\":\"alice\"}"))
                    .andExpect(status().isOk());
        }

        // Then
        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(login))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.status").value(429));

        verify(accountService, times(3)).login(anyString(), anyString());
        verify(metricsService).recordRateLimitRejection("/api/v1/auth/login");
    }

    @Test
    @DisplayName("Registration is not rate limited")
    void register_NotLimited() throws Exception {
        for (int i = 0; i < 7; i++) {
            mockMvc.perform(post("/api/v1/auth/register")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"username\":\"\",\"password\":\"x\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(header().doesNotExist("X-RateLimit-Limit"));
        }
    }
}
