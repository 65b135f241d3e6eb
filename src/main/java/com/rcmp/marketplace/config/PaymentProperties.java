package com.rcmp.marketplace.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Payment processor configuration (Stripe Checkout + Connect fee split).
 *
 * @author Marketplace Team
 */
@Getter
@Setter
@ToString
@Validated
@ConfigurationProperties(prefix = "marketplace.payment")
public class PaymentProperties {

    /** ISO currency sent with every checkout session, lower case. */
    @NotBlank
    private String currency = "usd";

    /** Where the processor sends the buyer after paying. May contain {CHECKOUT_SESSION_ID}. */
    @NotBlank
    private String successUrl = "http://127.0.0.1:5500/frontend/success.html?session_id={CHECKOUT_SESSION_ID}";

    /** Where the processor sends the buyer after abandoning checkout. */
    @NotBlank
    private String cancelUrl = "http://127.0.0.1:5500/frontend/cancel.html";

    @Valid
    private FeeSplit feeSplit = new FeeSplit();

    @Valid
    private Stripe stripe = new Stripe();

    @Getter
    @Setter
    @ToString
    public static class FeeSplit {
        /** Route the remainder to the seller's payout account and keep a platform fee. */
        private boolean enabled = true;

        /** Platform fee in minor units ($1.23). */
        @Min(0)
        private long platformFeeMinor = 123;
    }

    @Getter
    @Setter
    @ToString
    public static class Stripe {
        /** Secret API key, e.g. "sk_test_...". */
        @ToString.Exclude
        private String apiKey;

        /** Stripe API base. */
        @NotBlank
        private String baseUrl = "https://api.stripe.com";

        /** Optional explicit API version header. */
        private String apiVersion;

        @Valid
        private Webhook webhook = new Webhook();

        @Valid
        private Timeouts timeouts = new Timeouts();

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Getter
    @Setter
    @ToString
    public static class Webhook {
        /** Endpoint signing secret, e.g. "whsec_...". */
        @ToString.Exclude
        private String endpointSecret;

        /** Maximum age of a signed timestamp. */
        private Duration tolerance = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    @ToString
    public static class Timeouts {
        private Duration connect = Duration.ofSeconds(2);
        private Duration read = Duration.ofSeconds(10);
    }
}
