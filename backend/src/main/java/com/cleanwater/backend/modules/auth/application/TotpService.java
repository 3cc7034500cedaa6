package com.cleanwater.backend.modules.auth.application;

import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import com.cleanwater.backend.global.config.SecurityProperties;

import org.apache.commons.codec.binary.Base32;
import org.springframework.stereotype.Service;

/**
 * RFC 6238 time-based one-time passwords: HMAC-SHA1, 30 second steps, 6 digits.
 * Verification accepts the current step and {@code allowedDriftSteps} steps on either side.
 */
@Service
public class TotpService {

    private static final int SECRET_BYTES = 20;
    private static final long TIME_STEP_SECONDS = 30L;
    private static final int CODE_DIGITS = 6;
    private static final int CODE_MODULUS = 1_000_000;
    private static final String ALGORITHM = "HmacSHA1";

    private final SecureRandom secureRandom = new SecureRandom();
    private final Base32 base32 = new Base32();
    private final String issuer;
    private final int allowedDriftSteps;
    private final Clock clock;

    public TotpService(SecurityProperties properties, Clock clock) {
        this.issuer = properties.twoFactor().issuer();
        this.allowedDriftSteps = properties.twoFactor().allowedDriftSteps();
        this.clock = clock;
    }

    /**
     * Fresh 160-bit secret, Base32 without padding.
     */
    public String generateSecret() {
        byte[] secretBytes = new byte[SECRET_BYTES];
        secureRandom.nextBytes(secretBytes);
        return base32.encodeToString(secretBytes).replace("=", "");
    }

    public String generateCode(String secret, Instant at) {
        return codeForCounter(decode(secret), Math.floorDiv(at.getEpochSecond(), TIME_STEP_SECONDS));
    }

    public boolean verify(String secret, String code) {
        if (secret == null || secret.isBlank() || code == null || !code.matches("\\d{" + CODE_DIGITS + "}")) {
            return false;
        }
        byte[] key = decode(secret);
        long current = Math.floorDiv(clock.instant().getEpochSecond(), TIME_STEP_SECONDS);
        byte[] submitted = code.getBytes(StandardCharsets.US_ASCII);
        boolean matched = false;
        for (long offset = -allowedDriftSteps; offset <= allowedDriftSteps; offset++) {
            byte[] expected = codeForCounter(key, current + offset).getBytes(StandardCharsets.US_ASCII);
            matched |= MessageDigest.isEqual(expected, submitted);
        }
        return matched;
    }

    /**
     * {@code otpauth://} URI understood by authenticator apps.
     */
    public String provisioningUri(String secret, String accountName) {
        String label = encode(issuer) + ":" + encode(accountName);
        return "otpauth://totp/" + label
                + "?secret=" + secret
                + "&issuer=" + encode(issuer)
                + "&algorithm=SHA1&digits=" + CODE_DIGITS
                + "&period=" + TIME_STEP_SECONDS;
    }

    private byte[] decode(String secret) {
        return base32.decode(secret.toUpperCase(Locale.ROOT));
    }

    private static String codeForCounter(byte[] key, long counter) {
        byte[] hash;
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            hash = mac.doFinal(ByteBuffer.allocate(Long.BYTES).putLong(counter).array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA1 unavailable", e);
        }
        int offset = hash[hash.length - 1] & 0x0f;
        int binary = ((hash[offset] & 0x7f) << 24)
                | ((hash[offset + 1] & 0xff) << 16)
                | ((hash[offset + 2] & 0xff) << 8)
                | (hash[offset + 3] & 0xff);
        return String.format("%0" + CODE_DIGITS + "d", binary % CODE_MODULUS);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
