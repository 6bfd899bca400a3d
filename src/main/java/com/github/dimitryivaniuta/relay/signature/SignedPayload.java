package com.github.dimitryivaniuta.relay.signature;

/**
 * One signing result. {@code payload} is the exact canonical JSON that was signed and must be sent as-is.
 * Recomputed for every delivery attempt since timestamp and nonce change.
 */
public record SignedPayload(
        String payload,
        String signature,
        long timestamp,
        String nonce,
        SignatureAlgorithm algorithm
) {}
