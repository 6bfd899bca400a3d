package com.github.dimitryivaniuta.relay.signature;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Header names and the {@code signature=<hex>} encoding used on outbound deliveries and by
 * {@link WebhookSignatureService#verifyFromHeaders}.
 */
public final class SignatureHeaders {
    private SignatureHeaders() {}

    public static final String SIGNATURE = "X-Webhook-Signature";
    public static final String TIMESTAMP = "X-Webhook-Timestamp";
    public static final String NONCE = "X-Webhook-Nonce";
    public static final String ALGORITHM = "X-Webhook-Algorithm";

    public static final String EVENT = "X-Webhook-Event";
    public static final String WEBHOOK_ID = "X-Webhook-ID";
    public static final String DELIVERY_ID = "X-Webhook-Delivery";

    private static final String SIGNATURE_PREFIX = "signature=";

    public static Map<String, String> of(SignedPayload signed) {
        Map<String, String> h = new LinkedHashMap<>();
        h.put(SIGNATURE, SIGNATURE_PREFIX + signed.signature());
        h.put(TIMESTAMP, Long.toString(signed.timestamp()));
        h.put(NONCE, signed.nonce());
        h.put(ALGORITHM, signed.algorithm().tag());
        return h;
    }

    /**
     * Case-insensitive lookup; {@code X-Webhook-Foo} also matches {@code webhook-foo}.
     */
    public static Optional<String> find(Map<String, String> headers, String name) {
        if (headers == null || headers.isEmpty()) return Optional.empty();
        String wanted = name.toLowerCase(Locale.ROOT);
        String unprefixed = wanted.startsWith("x-") ? wanted.substring(2) : wanted;
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            String k = e.getKey().toLowerCase(Locale.ROOT);
            if (k.equals(wanted) || k.equals(unprefixed)) {
                String v = e.getValue().trim();
                return v.isEmpty() ? Optional.empty() : Optional.of(v);
            }
        }
        return Optional.empty();
    }

    /**
     * Extracts the hex digest from {@code signature=<hex>} (comma separated parts allowed).
     * Empty when the value does not carry a signature part.
     */
    public static Optional<String> parseSignature(String headerValue) {
        if (headerValue == null) return Optional.empty();
        for (String part : headerValue.split(",")) {
            String p = part.trim();
            if (p.regionMatches(true, 0, SIGNATURE_PREFIX, 0, SIGNATURE_PREFIX.length())) {
                String hex = p.substring(SIGNATURE_PREFIX.length()).trim();
                return hex.isEmpty() ? Optional.empty() : Optional.of(hex);
            }
        }
        return Optional.empty();
    }
}
