package com.github.dimitryivaniuta.relay.signature;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum SignatureAlgorithm {
    SHA256("sha256", "HmacSHA256"),
    SHA512("sha512", "HmacSHA512");

    private final String tag;
    private final String macName;

    SignatureAlgorithm(String tag, String macName) {
        this.tag = tag;
        this.macName = macName;
    }

    @JsonValue
    public String tag() { return tag; }

    public String macName() { return macName; }

    /** Accepts "sha256", "SHA256", "hmac-sha256" style names. */
    public static Optional<SignatureAlgorithm> fromTag(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith("hmac-")) v = v.substring(5);
        for (SignatureAlgorithm a : values()) {
            if (a.tag.equals(v)) return Optional.of(a);
        }
        return Optional.empty();
    }
}
