package com.rcmp.marketplace.infrastructure.token;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.rcmp.marketplace.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ResetTokenService.
 */
@DisplayName("ResetTokenService Unit Tests")
class ResetTokenServiceTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private MutableClock clock;
    private ResetTokenService tokenService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        tokenService = new ResetTokenService(SECRET, Duration.ofMinutes(30), clock);
    }

    @Test
    @DisplayName("A freshly issued token verifies to its username and credential version")
    void issueThenVerify() {
        // When
        String token = tokenService.issue("alice", 3);
        Optional<ResetTokenClaims> claims = tokenService.verify(token);

        // Then
        assertThat(claims).isPresent();
        assertThat(claims.get().getUsername()).isEqualTo("alice");
        assertThat(claims.get().getCredentialVersion()).isEqualTo(3);
        assertThat(claims.get().getExpiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(30)));
        assertThat(tokenService.verifyUsername(token)).contains("alice");
    }

    @Test
    @DisplayName("Issued tokens name HS256 in the header")
    void issuedTokenUsesHs256() throws Exception {
        String token = tokenService.issue("alice", 0);

        assertThat(SignedJWT.parse(token).getHeader().getAlgorithm()).isEqualTo(JWSAlgorithm.HS256);
    }

    @Test
    @DisplayName("Token is valid just before 30 minutes and invalid from 30 minutes on")
    void tokenExpiresAfterThirtyMinutes() {
        // Given
        String token = tokenService.issue("alice", 0);

        // When / Then
        clock.advance(Duration.ofMinutes(29).plusSeconds(59));
        assertThat(tokenService.verify(token)).isPresent();

        clock.advance(Duration.ofSeconds(1));
        assertThat(tokenService.verify(token)).isEmpty();

        clock.advance(Duration.ofMinutes(1));
        assertThat(tokenService.verify(token)).isEmpty();
    }

    @Test
    @DisplayName("Token with a modified payload fails verification")
    void tamperedPayloadIsRejected() throws Exception {
        // Given
        String token = tokenService.issue("alice", 0);
        String[] parts = token.split("\\.");
        JWTClaimsSet forged = new JWTClaimsSet.Builder(SignedJWT.parse(token).getJWTClaimsSet())
                .subject("mallory")
                .build();
        String forgedPayload = Base64URL.encode(forged.toString().getBytes(StandardCharsets.UTF_8)).toString();

        // When
        Optional<ResetTokenClaims> claims = tokenService.verify(parts[0] + "." + forgedPayload + "." + parts[2]);

        // Then
        assertThat(claims).isEmpty();
    }

    @Test
    @DisplayName("Token signed with another key fails verification")
    void otherKeyIsRejected() {
        ResetTokenService other = new ResetTokenService(
                "ffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff", Duration.ofMinutes(30), clock);

        String token = other.issue("alice", 0);

        assertThat(tokenService.verify(token)).isEmpty();
    }

    @Test
    @DisplayName("Token signed with the right key but HS512 is rejected")
    void otherAlgorithmIsRejected() throws Exception {
        // Given
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS512), validClaims("alice").build());
        jwt.sign(new MACSigner(SECRET.getBytes(StandardCharsets.UTF_8)));

        // When / Then
        assertThat(tokenService.verify(jwt.serialize())).isEmpty();
    }

    @Test
    @DisplayName("Unsigned token with alg none is rejected")
    void algNoneIsRejected() {
        // Given
        String header = Base64URL.encode("{\"alg\":\"none\"}".getBytes(StandardCharsets.UTF_8)).toString();
        String payload = Base64URL.encode(validClaims("alice").build().toString()
                .getBytes(StandardCharsets.UTF_8)).toString();

        // When / Then
        assertThat(tokenService.verify(header + "." + payload + ".")).isEmpty();
    }

    @Test
    @DisplayName("Correctly signed JWT issued for another purpose is rejected")
    void wrongPurposeIsRejected() throws Exception {
        // Given
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256),
                validClaims("alice").claim(ResetTokenService.PURPOSE_CLAIM, "session").build());
        jwt.sign(new MACSigner(SECRET.getBytes(StandardCharsets.UTF_8)));

        // When / Then
        assertThat(tokenService.verify(jwt.serialize())).isEmpty();
    }

    @Test
    @DisplayName("Garbage, blank and null tokens are rejected")
    void malformedTokensAreRejected() {
        assertThat(tokenService.verify("not-a-token")).isEmpty();
        assertThat(tokenService.verify("a.b.c")).isEmpty();
        assertThat(tokenService.verify("")).isEmpty();
        assertThat(tokenService.verify(null)).isEmpty();
    }

    @Test
    @DisplayName("Secret shorter than 32 bytes is refused at construction")
    void shortSecretIsRefused() {
        assertThatThrownBy(() -> new ResetTokenService("too-short", Duration.ofMinutes(30), clock))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32 bytes");
    }

    private JWTClaimsSet.Builder validClaims(String username) {
        return new JWTClaimsSet.Builder()
                .subject(username)
                .issueTime(Date.from(NOW))
                .expirationTime(Date.from(NOW.plus(Duration.ofMinutes(30))))
                .claim(ResetTokenService.PURPOSE_CLAIM, ResetTokenService.PURPOSE)
                .claim(ResetTokenService.VERSION_CLAIM, 0);
    }
}
