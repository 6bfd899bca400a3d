package com.github.dimitryivaniuta.relay.webhook;

public record WebhookTestResult(boolean success, Integer statusCode, String error) {}
