package com.github.dimitryivaniuta.relay.webhook;

import com.github.dimitryivaniuta.relay.metrics.RelayMetrics;
import com.github.dimitryivaniuta.relay.signature.CanonicalJson;
import com.github.dimitryivaniuta.relay.signature.SignatureHeaders;
import com.github.dimitryivaniuta.relay.signature.SignedPayload;
import com.github.dimitryivaniuta.relay.signature.WebhookSignatureService;
import com.github.dimitryivaniuta.relay.webhook.store.DeliveryHistoryStore;
import com.github.dimitryivaniuta.relay.webhook.transport.DeliveryOutcome;
import com.github.dimitryivaniuta.relay.webhook.transport.WebhookTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * At-least-once delivery of triggered events to matching active endpoints.
 * <p>
 * One consumer thread drains the event queue in FIFO order and hands one attempt per matching endpoint to the
 * delivery executor. A failed attempt is retried through {@link RetryScheduler} following {@link RetryPolicy}
 * until the endpoint's {@code maxRetries} is reached, then the endpoint is deactivated.
 * Every attempt appends one {@link WebhookDelivery} to the endpoint's history.
 * <p>
 * When the executor refuses an attempt, the submitting thread runs it itself. The dispatcher then stops
 * draining until the attempt is done, so a saturated pool slows intake instead of losing events.
 */
@Slf4j
public class WebhookDeliveryEngine implements AutoCloseable {

    private final WebhookRegistry registry;
    private final DeliveryHistoryStore history;
    private final WebhookSignatureService signatures;
    private final CanonicalJson canonicalJson;
    private final WebhookTransport transport;
    private final RetryScheduler retries;
    private final TaskExecutor deliveryExecutor;
    private final WebhookProperties properties;
    private final RetryPolicy retryPolicy;
    private final RelayMetrics metrics;
    private final Clock clock;

    private final BlockingQueue<WebhookEvent> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread consumer;

    public WebhookDeliveryEngine(WebhookRegistry registry,
                                 DeliveryHistoryStore history,
                                 WebhookSignatureService signatures,
                                 CanonicalJson canonicalJson,
                                 WebhookTransport transport,
                                 RetryScheduler retries,
                                 TaskExecutor deliveryExecutor,
                                 WebhookProperties properties,
                                 RelayMetrics metrics,
                                 Clock clock) {
        this.registry = registry;
        this.history = history;
        this.signatures = signatures;
        this.canonicalJson = canonicalJson;
        this.transport = transport;
        this.retries = retries;
        this.deliveryExecutor = deliveryExecutor;
        this.properties = properties;
        this.retryPolicy = new RetryPolicy(properties.getDelivery().getRetrySchedule());
        this.metrics = metrics;
        this.clock = clock;
    }

    // ---- lifecycle ----

    public void start() {
        if (!running.compareAndSet(false, true)) return;
        Thread t = new Thread(this::drain, "webhook-dispatcher");
        t.setDaemon(true);
        consumer = t;
        t.start();
        log.info("Webhook delivery engine started");
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) return;
        Thread t = consumer;
        if (t != null) t.interrupt();
        retries.cancelAll();
        log.info("Webhook delivery engine stopped ({} events left in queue)", queue.size());
    }

    public boolean isRunning() {
        return running.get();
    }

    // ---- triggering ----

    public WebhookEvent triggerEvent(WebhookEventType type, long ownerId, Map<String, Object> payload) {
        return triggerEvent(type.tag(), ownerId, payload);
    }

    /**
     * Enqueues the event and returns immediately. Delivery problems never reach the caller.
     */
    public WebhookEvent triggerEvent(String type, long ownerId, Map<String, Object> payload) {
        if (type == null || type.isBlank()) throw new IllegalArgumentException("event type is required");
        WebhookEvent event = new WebhookEvent(WebhookIds.event(), type, ownerId, payload, clock.instant());
        queue.add(event);
        metrics.eventTriggered(type);
        log.debug("Queued event {} ({}) for owner {}", event.id(), type, ownerId);
        return event;
    }

    private void drain() {
        while (running.get()) {
            WebhookEvent event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                dispatch(event);
            } catch (RuntimeException ex) {
                log.error("Failed to dispatch event {} ({})", event.id(), event.type(), ex);
            }
        }
    }

    private void dispatch(WebhookEvent event) {
        List<WebhookEndpoint> targets = event.targetWebhookId() != null
                ? registry.get(event.targetWebhookId()).filter(WebhookEndpoint::isActive).stream().toList()
                : registry.listByOwner(event.ownerId()).stream()
                        .filter(WebhookEndpoint::isActive)
                        .filter(e -> e.subscribesTo(event.type()))
                        .toList();
        if (targets.isEmpty()) {
            log.debug("No active webhooks subscribed to {} for owner {}", event.type(), event.ownerId());
            return;
        }
        for (WebhookEndpoint endpoint : targets) {
            submit(endpoint.getId(), event, 1);
        }
    }

    private void submit(String endpointId, WebhookEvent event, int attempt) {
        try {
            deliveryExecutor.execute(() -> attempt(endpointId, event, attempt));
        } catch (TaskRejectedException ex) {
            metrics.deliveryRejected();
            log.warn("Delivery executor saturated, running attempt {} of event {} to webhook {} on {}",
                    attempt, event.id(), endpointId, Thread.currentThread().getName());
            attempt(endpointId, event, attempt);
        }
    }

    // ---- single attempt ----

    void attempt(String endpointId, WebhookEvent event, int attempt) {
        WebhookEndpoint endpoint = registry.get(endpointId).orElse(null);
        if (endpoint == null || !endpoint.isActive()) {
            log.debug("Skipping attempt {} of event {}: webhook {} is gone or inactive", attempt, event.id(), endpointId);
            return;
        }

        String deliveryId = WebhookIds.delivery();
        long start = System.nanoTime();
        DeliveryOutcome outcome = send(endpoint, event.type(), event.payload(), deliveryId);
        Instant now = clock.instant();

        if (outcome.isSuccess()) {
            endpoint.recordSuccess(now);
            history.append(record(deliveryId, endpoint, event, attempt, outcome, now, null));
            metrics.deliveryAttempt("success");
            metrics.recordDeliveryDuration("success", System.nanoTime() - start);
            log.debug("Delivered event {} to webhook {} on attempt {}", event.id(), endpointId, attempt);
            return;
        }

        metrics.deliveryAttempt("failure");
        metrics.recordDeliveryDuration("failure", System.nanoTime() - start);
        int failures = endpoint.recordFailure();

        boolean permanent = properties.getDelivery().isFailFastOnClientError() && outcome.isPermanentClientError();
        if (attempt < endpoint.getMaxRetries() && !permanent) {
            Duration delay = retryPolicy.delayAfter(attempt);
            Instant nextAt = now.plus(delay);
            history.append(record(deliveryId, endpoint, event, attempt, outcome, now, nextAt));
            retries.schedule(endpointId, event.id(), nextAt, () -> submit(endpointId, event, attempt + 1));
            metrics.retryScheduled();
            log.warn("Webhook {} attempt {}/{} for event {} failed ({}), retrying in {}",
                    endpointId, attempt, endpoint.getMaxRetries(), event.id(), outcome.describe(), delay);
            return;
        }

        history.append(record(deliveryId, endpoint, event, attempt, outcome, now, null));
        endpoint.deactivate();
        retries.cancelForEndpoint(endpointId);
        metrics.endpointDisabled();
        log.warn("Webhook {} disabled after attempt {} for event {} failed ({}); consecutive failures={}",
                endpointId, attempt, event.id(), outcome.describe(), failures);
    }

    /**
     * One synthetic {@code health.degraded} delivery. Leaves failure count, last-triggered time and
     * history untouched, and never retries.
     */
    public WebhookTestResult testWebhook(String webhookId) {
        WebhookEndpoint endpoint = registry.get(webhookId).orElse(null);
        if (endpoint == null) {
            return new WebhookTestResult(false, null, "Webhook not found");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", "This is a test webhook delivery");
        data.put("timestamp", clock.instant().toString());

        DeliveryOutcome outcome = send(endpoint, WebhookEventType.HEALTH_DEGRADED.tag(), data, WebhookIds.delivery());
        String error = outcome.isSuccess() ? null : (outcome.error() != null ? outcome.error() : outcome.describe());
        return new WebhookTestResult(outcome.isSuccess(), outcome.statusCode(), error);
    }

    private DeliveryOutcome send(WebhookEndpoint endpoint, String eventType, Map<String, Object> data, String deliveryId) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("event", eventType);
        envelope.put("timestamp", clock.instant().toString());
        envelope.put("data", data);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", properties.getDelivery().getUserAgent());
        headers.put(SignatureHeaders.EVENT, eventType);
        headers.put(SignatureHeaders.WEBHOOK_ID, endpoint.getId());
        headers.put(SignatureHeaders.DELIVERY_ID, deliveryId);

        try {
            String body;
            String secret = endpoint.getSecret();
            if (secret != null && !secret.isEmpty()) {
                SignedPayload signed = signatures.sign(envelope, secret, properties.getSignatureAlgorithm());
                headers.putAll(SignatureHeaders.of(signed));
                body = signed.payload();
            } else {
                body = canonicalJson.write(envelope);
            }
            return transport.post(endpoint.getUrl(), body, headers);
        } catch (RuntimeException ex) {
            log.warn("Delivery to webhook {} failed before a response: {}", endpoint.getId(), ex.getMessage());
            return DeliveryOutcome.failure(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        }
    }

    private static WebhookDelivery record(String deliveryId, WebhookEndpoint endpoint, WebhookEvent event, int attempt,
                                          DeliveryOutcome outcome, Instant at, Instant nextRetryAt) {
        return new WebhookDelivery(deliveryId, endpoint.getId(), event.id(), event.type(), event.payload(), attempt,
                outcome.statusCode(), outcome.body(), outcome.error(), at, nextRetryAt, event.replayOf());
    }

    // ---- replay ----

    /**
     * Queues the event behind a recorded delivery again, for that endpoint only. The replay is a new event
     * with its own id and goes through the normal retry path. {@code editedPayload}, when given, replaces
     * the recorded data.
     *
     * @return the queued event, or empty when the endpoint has no such delivery
     * @throws IllegalStateException when the endpoint is missing or inactive
     */
    public Optional<WebhookEvent> replayDelivery(String webhookId, String deliveryId, Map<String, Object> editedPayload) {
        WebhookEndpoint endpoint = registry.get(webhookId)
                .orElseThrow(() -> new IllegalStateException("Webhook not found"));
        if (!endpoint.isActive()) {
            throw new IllegalStateException("Webhook is inactive");
        }
        Optional<WebhookDelivery> original = history.all(webhookId).stream()
                .filter(d -> d.id().equals(deliveryId))
                .findFirst();
        if (original.isEmpty()) {
            return Optional.empty();
        }
        WebhookDelivery recorded = original.get();
        Map<String, Object> payload = editedPayload != null ? editedPayload : recorded.payload();
        WebhookEvent replay = new WebhookEvent(WebhookIds.event(), recorded.eventType(), endpoint.getOwnerId(),
                payload, clock.instant(), webhookId, deliveryId);
        queue.add(replay);
        metrics.deliveryReplayed();
        log.info("Queued replay {} of delivery {} ({}) to webhook {}{}", replay.id(), deliveryId,
                recorded.eventType(), webhookId, editedPayload != null ? " with edited payload" : "");
        return Optional.of(replay);
    }

    /** Replay attempts of one endpoint, newest first. */
    public List<WebhookDelivery> getReplayHistory(String webhookId, int limit) {
        int clamped = Math.max(1, Math.min(limit, history.capacity()));
        return history.recent(webhookId, history.capacity()).stream()
                .filter(d -> d.replayOf() != null)
                .limit(clamped)
                .toList();
    }

    // ---- queries ----

    /** Newest first; {@code limit} is clamped to [1, history capacity]. */
    public List<WebhookDelivery> getDeliveryHistory(String webhookId, int limit) {
        int clamped = Math.max(1, Math.min(limit, history.capacity()));
        return history.recent(webhookId, clamped);
    }

    public WebhookStats getWebhookStats(String webhookId) {
        List<WebhookDelivery> records = history.all(webhookId);
        long total = records.size();
        long ok = records.stream().filter(WebhookDelivery::successful).count();
        double rate = total == 0 ? 0.0 : (ok * 100.0) / total;
        return new WebhookStats(total, ok, total - ok, rate);
    }

    public EngineStatus getStatus() {
        List<WebhookEndpoint> all = registry.listAll();
        int active = (int) all.stream().filter(WebhookEndpoint::isActive).count();
        return new EngineStatus(all.size(), active, queue.size(), retries.pendingCount(), running.get());
    }

    /** Drops queued events, pending retries, endpoints and history. */
    public void clearAll() {
        queue.clear();
        registry.clear();
        log.info("Webhook engine state cleared");
    }
}
