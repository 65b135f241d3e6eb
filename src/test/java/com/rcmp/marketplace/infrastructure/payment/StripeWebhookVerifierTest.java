package com.rcmp.marketplace.infrastructure.payment;

import com.rcmp.marketplace.config.PaymentProperties;
import com.rcmp.marketplace.exception.InvalidSignatureException;
import com.rcmp.marketplace.testutil.MutableClock;
import com.rcmp.marketplace.testutil.WebhookSigner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StripeWebhookVerifier.
 */
@DisplayName("StripeWebhookVerifier Unit Tests")
class StripeWebhookVerifierTest {

    private static final String SECRET = "whsec_test_secret";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String PAYLOAD = WebhookSigner.completedSessionEvent("evt_1", "cs_test_1", "listing-1");

    private PaymentProperties properties;
    private MutableClock clock;
    private StripeWebhookVerifier verifier;

    @BeforeEach
    void setUp() {
        properties = new PaymentProperties();
        properties.getStripe().getWebhook().setEndpointSecret(SECRET);
        clock = new MutableClock(NOW);
        verifier = new StripeWebhookVerifier(properties, clock);
    }

    @Test
    @DisplayName("Valid signature over the exact payload is accepted")
    void validSignatureIsAccepted() {
        String header = WebhookSigner.sign(SECRET, NOW.getEpochSecond(), PAYLOAD);

        assertThatCode(() -> verifier.verify(bytes(PAYLOAD), header)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Any matching v1 entry is enough when several are present")
    void oneOfSeveralSignaturesMatches() {
        long ts = NOW.getEpochSecond();
        String header = "t=" + ts
                + ",v1=" + WebhookSigner.hmacHex("whsec_old_secret", ts + "." + PAYLOAD)
                + ",v1=" + WebhookSigner.hmacHex(SECRET, ts + "." + PAYLOAD)
                + ",v0=ignored";

        assertThatCode(() -> verifier.verify(bytes(PAYLOAD), header)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Payload modified after signing is rejected")
    void modifiedPayloadIsRejected() {
        String header = WebhookSigner.sign(SECRET, NOW.getEpochSecond(), PAYLOAD);
        String modified = PAYLOAD.replace("listing-1", "listing-2");

        assertThatThrownBy(() -> verifier.verify(bytes(modified), header))
                .isInstanceOf(InvalidSignatureException.class);
    }

    @Test
    @DisplayName("Signature made with a different secret is rejected")
    void wrongSecretIsRejected() {
        String header = WebhookSigner.sign("whsec_other", NOW.getEpochSecond(), PAYLOAD);

        assertThatThrownBy(() -> verifier.verify(bytes(PAYLOAD), header))
                .isInstanceOf(InvalidSignatureException.class);
    }

    @Test
    @DisplayName("Missing or blank header is rejected")
    void missingHeaderIsRejected() {
        assertThatThrownBy(() -> verifier.verify(bytes(PAYLOAD), null))
                .isInstanceOf(InvalidSignatureException.class);
        assertThatThrownBy(() -> verifier.verify(bytes(PAYLOAD), " "))
                .isInstanceOf(InvalidSignatureException.class);
    }

    @Test
    @DisplayName("Malformed headers are rejected")
    void malformedHeaderIsRejected() {
        String v1 = WebhookSigner.hmacHex(SECRET, NOW.getEpochSecond() + "." + PAYLOAD);

        assertThatThrownBy(() -> verifier.verify(bytes(PAYLOAD), "v1=" + v1))
                .isInstanceOf(InvalidSignatureException.class)
                .hasMessageContaining("timestamp");
        assertThatThrownBy(() -> verifier.verify(bytes(PAYLOAD), "t=" + NOW.getEpochSecond()))
                .isInstanceOf(InvalidSignatureException.class);
        assertThatThrownBy(() -> verifier.verify(bytes(PAYLOAD), "t=yesterday,v1=" + v1))
                .isInstanceOf(InvalidSignatureException.class);
        assertThatThrownBy(() -> verifier.verify(bytes(PAYLOAD), "t=" + NOW.getEpochSecond() + ",v1=zz"))
                .isInstanceOf(InvalidSignatureException.class);
    }

    @Test
    @DisplayName("Timestamp older than the tolerance is rejected even with a valid MAC")
    void staleTimestampIsRejected() {
        long signedAt = NOW.minus(Duration.ofMinutes(6)).getEpochSecond();
        String header = WebhookSigner.sign(SECRET, signedAt, PAYLOAD);

        assertThatThrownBy(() -> verifier.verify(bytes(PAYLOAD), header))
                .isInstanceOf(InvalidSignatureException.class)
                .hasMessageContaining("tolerance");
    }

    @Test
    @DisplayName("Timestamp within the tolerance is accepted")
    void recentTimestampIsAccepted() {
        long signedAt = NOW.minus(Duration.ofMinutes(4)).getEpochSecond();
        String header = WebhookSigner.sign(SECRET, signedAt, PAYLOAD);

        assertThatCode(() -> verifier.verify(bytes(PAYLOAD), header)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Every delivery is rejected while no endpoint secret is configured")
    void missingSecretRejectsEverything() {
        properties.getStripe().getWebhook().setEndpointSecret(null);
        String header = WebhookSigner.sign(SECRET, NOW.getEpochSecond(), PAYLOAD);

        assertThatThrownBy(() -> verifier.verify(bytes(PAYLOAD), header))
                .isInstanceOf(InvalidSignatureException.class);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
