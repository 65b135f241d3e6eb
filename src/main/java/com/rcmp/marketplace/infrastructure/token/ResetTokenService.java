package com.rcmp.marketplace.infrastructure.token;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and verifies password reset tokens.
 *
 * Tokens are compact JWS objects signed with HMAC-SHA256 and carry:
 * - sub: username
 * - exp: issuance time + TTL (30 minutes by default)
 * - purpose: "password_reset", so no other token signed with the same key is accepted
 * - ver: the account's credential version at issuance
 *
 * Verification accepts HS256 only. A token whose header names any other
 * algorithm (including "none") is rejected before the MAC is checked.
 * Nothing is stored server side.
 *
 * @author Marketplace Team
 */
@Service
public class ResetTokenService {

    private static final Logger logger = LoggerFactory.getLogger(ResetTokenService.class);

    static final JWSAlgorithm ALGORITHM = JWSAlgorithm.HS256;
    static final String PURPOSE_CLAIM = "purpose";
    static final String PURPOSE = "password_reset";
    static final String VERSION_CLAIM = "ver";

    private static final int MIN_SECRET_BYTES = 32;

    private final byte[] secret;
    private final Duration ttl;
    private final Clock clock;

    public ResetTokenService(
            @Value("${marketplace.reset-token.secret}") String secret,
            @Value("${marketplace.reset-token.ttl:PT30M}") Duration ttl,
            Clock clock
    ) {
        byte[] secretBytes = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "marketplace.reset-token.secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        this.secret = secretBytes;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Issue a reset token for one account.
     *
     * @param username Subject
     * @param credentialVersion Current credential version of the account
     * @return Serialized token
     */
    public String issue(String username, int credentialVersion) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);

        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .subject(username)
                .issueTime(Date.from(now))
                .expirationTime(Date.from(expiresAt))
                .jwtID(UUID.randomUUID().toString())
                .claim(PURPOSE_CLAIM, PURPOSE)
                .claim(VERSION_CLAIM, credentialVersion)
                .build();

        try {
            SignedJWT jwt = new SignedJWT(new JWSHeader(ALGORITHM), claims);
            jwt.sign(new MACSigner(secret));
            logger.debug("Issued reset token for user: {}, expires: {}", username, expiresAt);
            return jwt.serialize();
        } catch (JOSEException e) {
            throw new IllegalStateException("Unable to sign reset token", e);
        }
    }

    /**
     * Verify a reset token.
     *
     * Every failure (malformed, wrong algorithm, bad signature, wrong purpose,
     * expired) yields an empty result; only the log line differs.
     *
     * @param token Serialized token
     * @return Claims if the token is authentic and unexpired
     */
    public Optional<ResetTokenClaims> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }

        SignedJWT jwt;
        try {
            jwt = SignedJWT.parse(token);
        } catch (ParseException e) {
            logger.debug("Rejected reset token: not a signed JWT");
            return Optional.empty();
        }

        JWSAlgorithm algorithm = jwt.getHeader().getAlgorithm();
        if (!ALGORITHM.equals(algorithm)) {
            logger.warn("Rejected reset token with unexpected algorithm {}; possible tampering", algorithm);
            return Optional.empty();
        }

        try {
            JWSVerifier verifier = new MACVerifier(secret);
            if (!jwt.verify(verifier)) {
                logger.warn("Rejected reset token: signature mismatch");
                return Optional.empty();
            }

            JWTClaimsSet claims = jwt.getJWTClaimsSet();

            if (!PURPOSE.equals(claims.getStringClaim(PURPOSE_CLAIM))) {
                logger.warn("Rejected reset token: wrong purpose claim");
                return Optional.empty();
            }

            String subject = claims.getSubject();
            Date expiration = claims.getExpirationTime();
            Long version = claims.getLongClaim(VERSION_CLAIM);
            if (subject == null || subject.isBlank() || expiration == null || version == null) {
                logger.warn("Rejected reset token: missing required claims");
                return Optional.empty();
            }

            Instant expiresAt = expiration.toInstant();
            if (!clock.instant().isBefore(expiresAt)) {
                logger.info("Rejected reset token for user: {}, expired at {}", subject, expiresAt);
                return Optional.empty();
            }

            return Optional.of(new ResetTokenClaims(subject, version.intValue(), expiresAt));

        } catch (JOSEException | ParseException e) {
            logger.warn("Rejected reset token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Username bound to a valid token.
     *
     * @param token Serialized token
     * @return Username, or empty if the token is invalid
     */
    public Optional<String> verifyUsername(String token) {
        return verify(token).map(ResetTokenClaims::getUsername);
    }
}
