package com.rcmp.marketplace.infrastructure.payment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.rcmp.marketplace.config.PaymentProperties;
import com.rcmp.marketplace.exception.PaymentProcessorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Stripe Checkout client.
 * Stripe takes application/x-www-form-urlencoded bodies with bracketed keys
 * for nested parameters (line_items[0][price_data][unit_amount]).
 *
 * @author Marketplace Team
 */
@Component
public class StripeCheckoutClient implements PaymentProcessorClient {

    private static final Logger logger = LoggerFactory.getLogger(StripeCheckoutClient.class);

    static final String CHECKOUT_SESSIONS_PATH = "/v1/checkout/sessions";
    public static final String LISTING_ID_METADATA_KEY = "listing_id";

    private final RestClient stripeRestClient;
    private final PaymentProperties paymentProperties;

    public StripeCheckoutClient(RestClient stripeRestClient, PaymentProperties paymentProperties) {
        this.stripeRestClient = stripeRestClient;
        this.paymentProperties = paymentProperties;
    }

    @Override
    public CheckoutRedirect createCheckoutSession(CheckoutSessionRequest request) {
        if (!paymentProperties.getStripe().isConfigured()) {
            throw new PaymentProcessorException("Stripe not configured (missing API key)");
        }

        MultiValueMap<String, String> form = toForm(request);

        try {
            CheckoutSessionResponse response = stripeRestClient.post()
                    .uri(CHECKOUT_SESSIONS_PATH)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(CheckoutSessionResponse.class);

            if (response == null || response.url == null || response.url.isBlank()) {
                throw new PaymentProcessorException("Stripe returned a checkout session without a URL");
            }

            logger.info("Created Stripe checkout session {} for listing {}", response.id, request.getListingId());
            return new CheckoutRedirect(response.id, response.url);

        } catch (RestClientResponseException e) {
            logger.warn("Stripe rejected checkout session for listing {}: status {}, body {}",
                    request.getListingId(), e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new PaymentProcessorException("Stripe error: " + e.getStatusCode().value(),
                    e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            logger.warn("Stripe unreachable while creating checkout session for listing {}: {}",
                    request.getListingId(), e.getMessage());
            throw new PaymentProcessorException("Stripe unreachable", e);
        } catch (RestClientException e) {
            logger.error("Unexpected Stripe client failure for listing {}", request.getListingId(), e);
            throw new PaymentProcessorException("Stripe error", e);
        }
    }

    /**
     * Flatten the request into Stripe's form encoding.
     *
     * @param request Checkout intent
     * @return Form parameters
     */
    MultiValueMap<String, String> toForm(CheckoutSessionRequest request) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("mode", "payment");
        form.add("customer_email", request.getBuyerEmail());

        form.add("line_items[0][price_data][currency]", request.getCurrency());
        form.add("line_items[0][price_data][product_data][name]", request.getItemName());
        if (request.getItemDescription() != null && !request.getItemDescription().isBlank()) {
            form.add("line_items[0][price_data][product_data][description]", request.getItemDescription());
        }
        form.add("line_items[0][price_data][unit_amount]", String.valueOf(request.getAmountMinor()));
        form.add("line_items[0][quantity]", "1");

        form.add("success_url", request.getSuccessUrl());
        form.add("cancel_url", request.getCancelUrl());

        // Correlation key for the completion webhook
        form.add("metadata[" + LISTING_ID_METADATA_KEY + "]", request.getListingId());
        form.add("payment_intent_data[metadata][" + LISTING_ID_METADATA_KEY + "]", request.getListingId());

        if (request.isFeeSplit()) {
            form.add("payment_intent_data[application_fee_amount]", String.valueOf(request.getApplicationFeeMinor()));
            form.add("payment_intent_data[transfer_data][destination]", request.getDestinationAccountId());
        }
        return form;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CheckoutSessionResponse {
        public String id;
        public String url;
    }
}
