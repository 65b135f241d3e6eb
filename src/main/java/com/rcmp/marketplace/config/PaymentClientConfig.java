package com.rcmp.marketplace.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client for the Stripe API.
 * Connect and read timeouts bound every outbound call so a slow processor
 * surfaces as an error instead of a hung request thread.
 *
 * @author Marketplace Team
 */
@Configuration
public class PaymentClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(PaymentClientConfig.class);

    @Bean
    public RestClient stripeRestClient(RestClient.Builder builder, PaymentProperties paymentProperties) {
        PaymentProperties.Stripe stripe = paymentProperties.getStripe();

        if (!stripe.isConfigured()) {
            logger.warn("marketplace.payment.stripe.api-key is not set. Checkout will fail until it is configured.");
        }

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) stripe.getTimeouts().getConnect().toMillis());
        requestFactory.setReadTimeout((int) stripe.getTimeouts().getRead().toMillis());

        RestClient.Builder configured = builder
                .requestFactory(requestFactory)
                .baseUrl(stripe.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);

        if (stripe.isConfigured()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + stripe.getApiKey());
        }
        if (stripe.getApiVersion() != null && !stripe.getApiVersion().isBlank()) {
            configured.defaultHeader("Stripe-Version", stripe.getApiVersion());
        }

        return configured.build();
    }
}
