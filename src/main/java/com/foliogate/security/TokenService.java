package com.foliogate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Service for generating share tokens and keyed fingerprints.
 * Tokens are 32 random bytes from SecureRandom encoded as base64url (without padding),
 * i.e. 256 bits of entropy in 43 URL-safe characters.
 * HMAC-SHA256 fingerprints let the usage ledger correlate prompts without storing them.
 */
@Service
public class TokenService {

    private static final Logger logger = LoggerFactory.getLogger(TokenService.class);
    public static final int TOKEN_BYTES = 32;
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final String tokenSecret;
    private final SecureRandom secureRandom;

    public TokenService(@Value("${app.security.token-secret:change-me-in-production}") String tokenSecret) {
        this.tokenSecret = tokenSecret;
        this.secureRandom = new SecureRandom();

        if ("change-me-in-production".equals(tokenSecret)) {
            logger.warn("Using default token secret! Set APP_TOKEN_SECRET environment variable in production.");
        }
    }

    /**
     * Generates a random 32-byte token and returns it as base64url string (without padding).
     * @return base64url-encoded token string
     */
    public String generateToken() {
        byte[] tokenBytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(tokenBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(tokenBytes);
    }

    /**
     * Computes HMAC-SHA256 of the value using the app secret as key.
     * @param value the value to fingerprint
     * @return base64url-encoded HMAC digest
     */
    public String computeHmac(String value) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(tokenSecret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            byte[] hmacBytes = mac.doFinal(value.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hmacBytes);
        } catch (GeneralSecurityException e) {
            logger.error("Failed to compute HMAC", e);
            throw new IllegalStateException("Failed to compute HMAC", e);
        }
    }
}
