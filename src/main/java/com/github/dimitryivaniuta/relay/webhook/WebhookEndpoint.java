package com.github.dimitryivaniuta.relay.webhook;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * A registered subscription. Delivery state (failures, last triggered, active) is changed by concurrent
 * delivery attempts, so every accessor synchronizes on the instance.
 */
public class WebhookEndpoint {

    private final String id;
    private final long ownerId;
    private final Instant createdAt;
    private final int maxRetries;

    private String url;
    private Set<String> eventTypes;
    private String secret;
    private boolean active = true;
    private Instant lastTriggeredAt;
    private int failureCount;

    public WebhookEndpoint(String id, long ownerId, String url, Set<String> eventTypes,
                           String secret, int maxRetries, Instant createdAt) {
        if (maxRetries < 1) throw new IllegalArgumentException("maxRetries must be >= 1");
        this.id = Objects.requireNonNull(id, "id");
        this.ownerId = ownerId;
        this.url = Objects.requireNonNull(url, "url");
        this.eventTypes = Set.copyOf(eventTypes);
        this.secret = secret;
        this.maxRetries = maxRetries;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }

    public long getOwnerId() { return ownerId; }

    public Instant getCreatedAt() { return createdAt; }

    public int getMaxRetries() { return maxRetries; }

    public synchronized String getUrl() { return url; }

    public synchronized Set<String> getEventTypes() { return eventTypes; }

    public synchronized String getSecret() { return secret; }

    public synchronized boolean hasSecret() { return secret != null && !secret.isEmpty(); }

    public synchronized boolean isActive() { return active; }

    public synchronized Instant getLastTriggeredAt() { return lastTriggeredAt; }

    public synchronized int getFailureCount() { return failureCount; }

    public synchronized boolean subscribesTo(String eventType) {
        return eventTypes.contains(eventType);
    }

    synchronized void setUrl(String url) { this.url = Objects.requireNonNull(url, "url"); }

    synchronized void setEventTypes(Set<String> eventTypes) { this.eventTypes = Set.copyOf(eventTypes); }

    synchronized void setSecret(String secret) { this.secret = secret; }

    /** Re-enabling clears the failure streak. */
    synchronized void activate() {
        this.active = true;
        this.failureCount = 0;
    }

    synchronized void deactivate() { this.active = false; }

    synchronized void recordSuccess(Instant at) {
        this.failureCount = 0;
        this.lastTriggeredAt = at;
    }

    synchronized int recordFailure() {
        return ++failureCount;
    }
}
