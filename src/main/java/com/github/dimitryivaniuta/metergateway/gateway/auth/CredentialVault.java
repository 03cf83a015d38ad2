package com.github.dimitryivaniuta.metergateway.gateway.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.metergateway.gateway.error.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Issues and verifies stateless session tokens.
 *
 * <p>Token layout: {@code v1.} + base64url(iv[12] || AES-256-GCM(claims) || tag[16]). The claims
 * ({@code sub}, {@code sec}, {@code iat}, {@code exp}) are JSON and entirely inside the ciphertext, so the GCM
 * tag covers every payload byte; the version prefix is bound in as associated data.
 *
 * <p>No mutable state: any instance holding the same key verifies tokens issued by any other.
 */
@Slf4j
public final class CredentialVault implements TokenIssuer, TokenVerifier {

    public static final String TOKEN_PREFIX = "v1.";

    static final Set<String> PLACEHOLDER_SECRETS = Set.of(
            "change_me_in_production",
            "changeme",
            "change-me",
            "please-change-me",
            "secret"
    );

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_TAG_LENGTH = GCM_TAG_BITS / 8;
    private static final byte[] ASSOCIATED_DATA = "meter-gateway/v1".getBytes(StandardCharsets.US_ASCII);

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final SecretKey key;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public CredentialVault(SecretKey key, Clock clock, ObjectMapper objectMapper) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Builds a vault from configured secret material (AES key = SHA-256 of the material).
     *
     * @param production when true, a missing or placeholder secret aborts startup
     * @throws ConfigurationException on a missing/placeholder secret in production
     */
    public static CredentialVault fromSecret(String secretMaterial, boolean production, Clock clock, ObjectMapper objectMapper) {
        if (secretMaterial == null || secretMaterial.isBlank()) {
            if (production) {
                throw new ConfigurationException("meter-gateway.security.secret-key must be set in production mode");
            }
            log.warn("No session secret configured; using an ephemeral key. Tokens will not survive a restart.");
            byte[] random = new byte[32];
            SECURE_RANDOM.nextBytes(random);
            return new CredentialVault(new SecretKeySpec(random, "AES"), clock, objectMapper);
        }
        if (isPlaceholder(secretMaterial)) {
            if (production) {
                throw new ConfigurationException("meter-gateway.security.secret-key is a placeholder value; refusing to start in production mode");
            }
            log.warn("Session secret is a placeholder value. Do not run like this in production.");
        }
        return new CredentialVault(deriveKey(secretMaterial), clock, objectMapper);
    }

    static boolean isPlaceholder(String secretMaterial) {
        return PLACEHOLDER_SECRETS.contains(secretMaterial.trim().toLowerCase(Locale.ROOT));
    }

    static SecretKey deriveKey(String secretMaterial) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(secretMaterial.getBytes(StandardCharsets.UTF_8));
            return new SecretKeySpec(digest, "AES");
        } catch (NoSuchAlgorithmException e) {
            throw new ConfigurationException("SHA-256 not available", e);
        }
    }

    @Override
    public SessionToken create(String principalId, String secret, Duration ttl) {
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("principalId must not be blank");
        }
        Objects.requireNonNull(secret, "secret must not be null");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }

        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant expiresAt = issuedAt.plus(ttl).truncatedTo(ChronoUnit.MILLIS);
        TokenClaims claims = new TokenClaims(principalId, secret, issuedAt.toEpochMilli(), expiresAt.toEpochMilli());

        try {
            byte[] plaintext = objectMapper.writeValueAsBytes(claims);
            byte[] iv = new byte[GCM_IV_LENGTH];
            SECURE_RANDOM.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(ASSOCIATED_DATA);
            byte[] sealed = cipher.doFinal(plaintext);

            byte[] payload = new byte[iv.length + sealed.length];
            System.arraycopy(iv, 0, payload, 0, iv.length);
            System.arraycopy(sealed, 0, payload, iv.length, sealed.length);

            String value = TOKEN_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(payload);
            return new SessionToken(value, issuedAt, expiresAt);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize token claims", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to seal session token", e);
        }
    }

    @Override
    public GatewayPrincipal verify(String token) {
        byte[] payload = decode(token);

        byte[] plaintext;
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, payload, 0, GCM_IV_LENGTH));
            cipher.updateAAD(ASSOCIATED_DATA);
            plaintext = cipher.doFinal(payload, GCM_IV_LENGTH, payload.length - GCM_IV_LENGTH);
        } catch (AEADBadTagException e) {
            log.warn("Security event: session token failed integrity check");
            throw new GatewayAuthenticationException(AuthenticationFailure.SIGNATURE_INVALID, "Token signature is invalid");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to open session token", e);
        }

        TokenClaims claims = readClaims(plaintext);
        Instant expiresAt = Instant.ofEpochMilli(claims.exp());
        if (clock.instant().isAfter(expiresAt)) {
            throw new GatewayAuthenticationException(AuthenticationFailure.EXPIRED, "Token expired at " + expiresAt);
        }
        return new GatewayPrincipal(claims.sub(), claims.sec(), expiresAt);
    }

    private static byte[] decode(String token) {
        if (token == null || !token.startsWith(TOKEN_PREFIX)) {
            throw new GatewayAuthenticationException(AuthenticationFailure.MALFORMED, "Token format is not recognized");
        }
        String body = token.substring(TOKEN_PREFIX.length());
        for (int i = 0; i < body.length(); i++) {
            if (!isBase64UrlChar(body.charAt(i))) {
                throw new GatewayAuthenticationException(AuthenticationFailure.MALFORMED, "Token is not valid base64url");
            }
        }
        byte[] payload;
        try {
            payload = Base64.getUrlDecoder().decode(body);
        } catch (IllegalArgumentException e) {
            throw new GatewayAuthenticationException(AuthenticationFailure.MALFORMED, "Token is not valid base64url", e);
        }
        if (payload.length <= GCM_IV_LENGTH + GCM_TAG_LENGTH) {
            throw new GatewayAuthenticationException(AuthenticationFailure.MALFORMED, "Token is truncated");
        }
        // the decoder ignores the unused low bits of the last character; an altered one still changes the token
        if (!Base64.getUrlEncoder().withoutPadding().encodeToString(payload).equals(body)) {
            log.warn("Security event: session token has a non-canonical encoding");
            throw new GatewayAuthenticationException(AuthenticationFailure.SIGNATURE_INVALID, "Token signature is invalid");
        }
        return payload;
    }

    private static boolean isBase64UrlChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-' || c == '_';
    }

    private TokenClaims readClaims(byte[] plaintext) {
        TokenClaims claims;
        try {
            claims = objectMapper.readValue(plaintext, TokenClaims.class);
        } catch (java.io.IOException e) {
            throw new GatewayAuthenticationException(AuthenticationFailure.MALFORMED, "Token claims are unreadable", e);
        }
        if (claims == null || claims.sub() == null || claims.sec() == null || claims.exp() <= 0) {
            throw new GatewayAuthenticationException(AuthenticationFailure.MALFORMED, "Token claims are incomplete");
        }
        return claims;
    }

    record TokenClaims(String sub, String sec, long iat, long exp) {}
}
