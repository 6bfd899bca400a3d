package com.github.dimitryivaniuta.relay.webhook;

import java.util.Set;

/** Partial update; null fields are left unchanged. */
public record WebhookUpdate(String url, Set<String> events, Boolean active) {}
