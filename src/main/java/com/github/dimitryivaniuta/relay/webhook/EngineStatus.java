package com.github.dimitryivaniuta.relay.webhook;

public record EngineStatus(int totalWebhooks, int activeWebhooks, int queuedEvents, int pendingRetries, boolean running) {}
