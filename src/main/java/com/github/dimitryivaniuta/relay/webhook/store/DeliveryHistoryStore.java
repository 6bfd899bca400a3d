package com.github.dimitryivaniuta.relay.webhook.store;

import com.github.dimitryivaniuta.relay.webhook.WebhookDelivery;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Append-only delivery records, one bounded ring per endpoint. The oldest record is evicted once the
 * ring is full.
 */
public class DeliveryHistoryStore {

    private final int capacity;
    private final ConcurrentMap<String, Deque<WebhookDelivery>> rings = new ConcurrentHashMap<>();

    public DeliveryHistoryStore(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }

    public void open(String webhookId) {
        rings.putIfAbsent(webhookId, new ArrayDeque<>());
    }

    /**
     * Appends to an opened ring. Returns false when the endpoint's ring was removed (endpoint deleted
     * while an attempt was in flight).
     */
    public boolean append(WebhookDelivery delivery) {
        Deque<WebhookDelivery> ring = rings.get(delivery.webhookId());
        if (ring == null) return false;
        synchronized (ring) {
            if (ring.size() >= capacity) ring.pollFirst();
            ring.addLast(delivery);
        }
        return true;
    }

    /** Newest first, at most {@code limit} records. */
    public List<WebhookDelivery> recent(String webhookId, int limit) {
        Deque<WebhookDelivery> ring = rings.get(webhookId);
        if (ring == null || limit <= 0) return List.of();
        synchronized (ring) {
            List<WebhookDelivery> out = new ArrayList<>(Math.min(limit, ring.size()));
            Iterator<WebhookDelivery> it = ring.descendingIterator();
            while (it.hasNext() && out.size() < limit) out.add(it.next());
            return out;
        }
    }

    /** Oldest first. */
    public List<WebhookDelivery> all(String webhookId) {
        Deque<WebhookDelivery> ring = rings.get(webhookId);
        if (ring == null) return List.of();
        synchronized (ring) {
            return List.copyOf(ring);
        }
    }

    public void remove(String webhookId) {
        rings.remove(webhookId);
    }

    public void clear() {
        rings.clear();
    }
}
