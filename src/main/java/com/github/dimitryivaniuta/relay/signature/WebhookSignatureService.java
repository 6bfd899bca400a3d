package com.github.dimitryivaniuta.relay.signature;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * HMAC signing and verification of webhook payloads.
 * <p>
 * Signed string: {@code timestamp + "." + nonce + "." + body} where {@code body} is the canonical JSON of the payload.
 * Replay protection is the timestamp tolerance window only; nonces are not remembered.
 * Verification never throws for a bad signature, it returns {@link SignatureVerification}.
 */
@Slf4j
@Service
public class WebhookSignatureService {

    public static final int DEFAULT_SECRET_BYTES = 32;
    public static final long DEFAULT_TOLERANCE_SECONDS = 300;

    private static final int NONCE_BYTES = 16;
    private static final Pattern SECRET_PATTERN = Pattern.compile("^[a-fA-F0-9]{64,}$");
    private static final HexFormat HEX = HexFormat.of();

    private final SecureRandom secureRandom = new SecureRandom();

    private final CanonicalJson canonicalJson;
    private final Clock clock;

    public WebhookSignatureService(CanonicalJson canonicalJson, Clock clock) {
        this.canonicalJson = canonicalJson;
        this.clock = clock;
    }

    public String generateSecret() {
        return generateSecret(DEFAULT_SECRET_BYTES);
    }

    /** Hex string of {@code lengthBytes} random bytes (two characters per byte). */
    public String generateSecret(int lengthBytes) {
        if (lengthBytes < DEFAULT_SECRET_BYTES) {
            throw new IllegalArgumentException("Secret length must be at least " + DEFAULT_SECRET_BYTES + " bytes");
        }
        return HEX.formatHex(randomBytes(lengthBytes));
    }

    public boolean isValidSecret(String secret) {
        return secret != null && SECRET_PATTERN.matcher(secret).matches();
    }

    public SignedPayload sign(Object payload, String secret, SignatureAlgorithm algorithm) {
        return signRaw(canonicalJson.write(payload), secret, algorithm);
    }

    /** Signs a body that is already serialized; the body is sent exactly as given. */
    public SignedPayload signRaw(String body, String secret, SignatureAlgorithm algorithm) {
        Objects.requireNonNull(body, "body");
        requireSecret(secret);
        long timestamp = clock.instant().getEpochSecond();
        String nonce = HEX.formatHex(randomBytes(NONCE_BYTES));
        String signature = hmacHex(algorithm, secret, signedString(timestamp, nonce, body));
        return new SignedPayload(body, signature, timestamp, nonce, algorithm);
    }

    public SignatureVerification verify(Object payload, String signature, String secret,
                                        long timestamp, String nonce, SignatureAlgorithm algorithm) {
        return verify(payload, signature, secret, timestamp, nonce, algorithm, DEFAULT_TOLERANCE_SECONDS);
    }

    public SignatureVerification verify(Object payload, String signature, String secret,
                                        long timestamp, String nonce, SignatureAlgorithm algorithm,
                                        long toleranceSeconds) {
        return verifyRaw(canonicalJson.write(payload), signature, secret, timestamp, nonce, algorithm, toleranceSeconds);
    }

    public SignatureVerification verifyRaw(String body, String signature, String secret,
                                           long timestamp, String nonce, SignatureAlgorithm algorithm,
                                           long toleranceSeconds) {
        if (body == null || signature == null || nonce == null || secret == null || secret.isEmpty()) {
            return SignatureVerification.failed("Missing signature headers");
        }

        long now = clock.instant().getEpochSecond();
        long drift;
        try {
            drift = Math.absExact(Math.subtractExact(now, timestamp));
        } catch (ArithmeticException overflow) {
            drift = Long.MAX_VALUE;
        }
        if (drift > toleranceSeconds) {
            log.debug("Rejected webhook signature: timestamp drift {}s exceeds {}s", drift, toleranceSeconds);
            return SignatureVerification.failed(
                    "Timestamp outside tolerance window (" + drift + "s > " + toleranceSeconds + "s)");
        }

        byte[] expected = hmacHex(algorithm, secret, signedString(timestamp, nonce, body))
                .getBytes(StandardCharsets.US_ASCII);
        byte[] provided = signature.getBytes(StandardCharsets.US_ASCII);

        // length is fixed per algorithm, so checking it first leaks nothing useful
        if (expected.length != provided.length || !MessageDigest.isEqual(expected, provided)) {
            return SignatureVerification.failed("Signature mismatch");
        }
        return SignatureVerification.ok();
    }

    public Map<String, String> signatureHeaders(Object payload, String secret, SignatureAlgorithm algorithm) {
        return SignatureHeaders.of(sign(payload, secret, algorithm));
    }

    public SignatureVerification verifyFromHeaders(Object payload, Map<String, String> headers, String secret,
                                                   SignatureAlgorithm defaultAlgorithm, long toleranceSeconds) {
        return verifyRawFromHeaders(canonicalJson.write(payload), headers, secret, defaultAlgorithm, toleranceSeconds);
    }

    /**
     * Verifies a received body against {@code X-Webhook-*} headers. A recognized
     * {@code X-Webhook-Algorithm} header overrides {@code defaultAlgorithm}.
     */
    public SignatureVerification verifyRawFromHeaders(String body, Map<String, String> headers, String secret,
                                                      SignatureAlgorithm defaultAlgorithm, long toleranceSeconds) {
        Optional<String> sigHeader = SignatureHeaders.find(headers, SignatureHeaders.SIGNATURE);
        Optional<String> tsHeader = SignatureHeaders.find(headers, SignatureHeaders.TIMESTAMP);
        Optional<String> nonceHeader = SignatureHeaders.find(headers, SignatureHeaders.NONCE);
        if (sigHeader.isEmpty() || tsHeader.isEmpty() || nonceHeader.isEmpty()) {
            return SignatureVerification.failed("Missing signature headers");
        }

        Optional<String> signature = SignatureHeaders.parseSignature(sigHeader.get());
        if (signature.isEmpty()) {
            return SignatureVerification.failed("Invalid signature header format");
        }

        long timestamp;
        try {
            timestamp = Long.parseLong(tsHeader.get());
        } catch (NumberFormatException e) {
            return SignatureVerification.failed("Invalid timestamp");
        }

        SignatureAlgorithm algorithm = SignatureHeaders.find(headers, SignatureHeaders.ALGORITHM)
                .flatMap(SignatureAlgorithm::fromTag)
                .orElse(defaultAlgorithm);

        return verifyRaw(body, signature.get(), secret, timestamp, nonceHeader.get(), algorithm, toleranceSeconds);
    }

    private static String signedString(long timestamp, String nonce, String body) {
        return timestamp + "." + nonce + "." + body;
    }

    private static String hmacHex(SignatureAlgorithm algorithm, String secret, String data) {
        try {
            Mac mac = Mac.getInstance(algorithm.macName());
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), algorithm.macName()));
            return HEX.formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC " + algorithm.macName() + " unavailable", e);
        }
    }

    private static void requireSecret(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Signing secret must not be empty");
        }
    }

    private byte[] randomBytes(int n) {
        byte[] buf = new byte[n];
        secureRandom.nextBytes(buf);
        return buf;
    }
}
