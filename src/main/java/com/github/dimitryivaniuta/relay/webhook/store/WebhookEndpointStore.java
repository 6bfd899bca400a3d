package com.github.dimitryivaniuta.relay.webhook.store;

import com.github.dimitryivaniuta.relay.webhook.WebhookEndpoint;

import java.util.List;
import java.util.Optional;

/**
 * Endpoint storage. The default implementation is in memory; a durable one only needs to honour
 * these operations.
 */
public interface WebhookEndpointStore {

    WebhookEndpoint save(WebhookEndpoint endpoint);

    Optional<WebhookEndpoint> findById(String id);

    List<WebhookEndpoint> findByOwner(long ownerId);

    List<WebhookEndpoint> findAll();

    boolean delete(String id);

    void clear();
}
