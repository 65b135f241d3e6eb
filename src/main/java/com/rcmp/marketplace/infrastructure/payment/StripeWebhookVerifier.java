package com.rcmp.marketplace.infrastructure.payment;

import com.rcmp.marketplace.config.PaymentProperties;
import com.rcmp.marketplace.exception.InvalidSignatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Verifies the Stripe-Signature header of webhook deliveries.
 *
 * Header format: {@code t=<unix seconds>,v1=<hex hmac>[,v1=<hex hmac>...]}.
 * The signed payload is {@code t + "." + rawBody}, HMAC-SHA256 keyed with the
 * endpoint secret. Several v1 entries appear while a secret is being rolled.
 *
 * @author Marketplace Team
 */
@Component
public class StripeWebhookVerifier {

    private static final Logger logger = LoggerFactory.getLogger(StripeWebhookVerifier.class);

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String TIMESTAMP_KEY = "t";
    private static final String SIGNATURE_SCHEME = "v1";

    private final PaymentProperties paymentProperties;
    private final Clock clock;

    public StripeWebhookVerifier(PaymentProperties paymentProperties, Clock clock) {
        this.paymentProperties = paymentProperties;
        this.clock = clock;
    }

    /**
     * Verify a delivery before anything reads its body.
     *
     * @param rawPayload Exact request body bytes as received
     * @param signatureHeader Value of the Stripe-Signature header, may be null
     * @throws InvalidSignatureException if the signature is missing, stale or does not match
     */
    public void verify(byte[] rawPayload, String signatureHeader) {
        String secret = paymentProperties.getStripe().getWebhook().getEndpointSecret();
        if (secret == null || secret.isBlank()) {
            logger.error("Webhook endpoint secret is not configured; rejecting delivery");
            throw new InvalidSignatureException("Webhook endpoint secret not configured");
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new InvalidSignatureException("Missing signature header");
        }

        Long timestamp = null;
        List<String> signatures = new ArrayList<>();
        for (String part : signatureHeader.split(",")) {
            String[] kv = part.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String key = kv[0].trim();
            String value = kv[1].trim();
            if (TIMESTAMP_KEY.equals(key)) {
                try {
                    timestamp = Long.parseLong(value);
                } catch (NumberFormatException e) {
                    throw new InvalidSignatureException("Malformed signature timestamp");
                }
            } else if (SIGNATURE_SCHEME.equals(key)) {
                signatures.add(value);
            }
        }

        if (timestamp == null) {
            throw new InvalidSignatureException("Signature header has no timestamp");
        }
        if (signatures.isEmpty()) {
            throw new InvalidSignatureException("Signature header has no " + SIGNATURE_SCHEME + " signature");
        }

        Duration tolerance = paymentProperties.getStripe().getWebhook().getTolerance();
        long now = clock.instant().getEpochSecond();
        if (Math.abs(now - timestamp) > tolerance.getSeconds()) {
            throw new InvalidSignatureException("Signature timestamp outside tolerance: " + timestamp);
        }

        byte[] expected = computeSignature(secret, timestamp, rawPayload);
        for (String candidate : signatures) {
            byte[] provided;
            try {
                provided = HexFormat.of().parseHex(candidate);
            } catch (IllegalArgumentException e) {
                continue;
            }
            if (MessageDigest.isEqual(expected, provided)) {
                return;
            }
        }

        throw new InvalidSignatureException("No signature matches the payload");
    }

    /**
     * Compute the v1 signature for a payload.
     *
     * @param secret Endpoint secret
     * @param timestamp Unix seconds
     * @param rawPayload Body bytes
     * @return HMAC-SHA256 digest
     */
    static byte[] computeSignature(String secret, long timestamp, byte[] rawPayload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            mac.update((timestamp + ".").getBytes(StandardCharsets.UTF_8));
            return mac.doFinal(rawPayload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
