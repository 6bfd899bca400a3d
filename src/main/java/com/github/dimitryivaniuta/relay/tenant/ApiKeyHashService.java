package com.github.dimitryivaniuta.relay.tenant;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

@Service
public class ApiKeyHashService {

    private static final String KEY_PREFIX = "rk_";

    private final SecureRandom secureRandom = new SecureRandom();

    private final String pepper;
    private final String algorithm;

    public ApiKeyHashService(
            @Value("${relay.api-key.pepper:}") String pepper,
            @Value("${relay.api-key.hash-algorithm:SHA-256}") String algorithm
    ) {
        this.pepper = pepper == null ? "" : pepper;
        this.algorithm = algorithm;
    }

    /** Random tenant API key ("rk_" + base64url of 32 bytes). Only its hash is stored. */
    public String generateRawApiKey() {
        byte[] buf = new byte[32];
        secureRandom.nextBytes(buf);
        return KEY_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(buf);
    }

    /** hash(raw + ":" + pepper) as lowercase hex. The pepper lives in configuration only. */
    public String hash(String rawApiKey) {
        if (rawApiKey == null || rawApiKey.isBlank()) {
            throw new IllegalArgumentException("rawApiKey must not be blank");
        }
        try {
            MessageDigest md = MessageDigest.getInstance(algorithm);
            byte[] digest = md.digest((rawApiKey + ":" + pepper).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to hash API key with " + algorithm, e);
        }
    }
}
