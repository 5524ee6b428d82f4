package com.sandy.aiot.gateway.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 webhook signature check over the exact bytes received.
 * The claimed signature is compared as sent (lower-case hex), in constant time.
 */
@Component
@Slf4j
public class SignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    public boolean verify(byte[] rawBody, String claimedSignature, String secret) {
        if (rawBody == null || claimedSignature == null || claimedSignature.isBlank()) return false;
        if (secret == null || secret.isEmpty()) return false;
        try {
            byte[] expected = sign(rawBody, secret).getBytes(StandardCharsets.US_ASCII);
            byte[] claimed = claimedSignature.getBytes(StandardCharsets.US_ASCII);
            boolean ok = MessageDigest.isEqual(expected, claimed);
            if (!ok) {
                log.warn("Webhook signature mismatch received={}...", claimedSignature.substring(0, Math.min(16, claimedSignature.length())));
            }
            return ok;
        } catch (RuntimeException e) {
            log.error("Webhook signature verification error type={} message={}", e.getClass().getSimpleName(), e.getMessage());
            return false;
        }
    }

    /** Lower-case hex HMAC-SHA256 of {@code body}. */
    public String sign(byte[] body, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(body));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
