package com.github.dimitryivaniuta.relay.webhook;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Delayed retry attempts keyed by (endpoint, event) so they can be cancelled when the endpoint is
 * deleted or deactivated.
 */
@Slf4j
public class RetryScheduler {

    record RetryKey(String endpointId, String eventId) {}

    private final TaskScheduler scheduler;
    private final ConcurrentMap<RetryKey, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public RetryScheduler(TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /** Replaces any retry already pending for the same endpoint and event. */
    public void schedule(String endpointId, String eventId, Instant at, Runnable attempt) {
        RetryKey key = new RetryKey(endpointId, eventId);
        pending.compute(key, (k, previous) -> {
            if (previous != null) previous.cancel(false);
            return scheduler.schedule(() -> {
                pending.remove(k);
                attempt.run();
            }, at);
        });
    }

    /** Cancels every pending retry of one endpoint; returns how many were cancelled. */
    public int cancelForEndpoint(String endpointId) {
        int cancelled = 0;
        for (var it = pending.entrySet().iterator(); it.hasNext(); ) {
            var e = it.next();
            if (e.getKey().endpointId().equals(endpointId)) {
                e.getValue().cancel(false);
                it.remove();
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled {} pending retries for webhook {}", cancelled, endpointId);
        }
        return cancelled;
    }

    public void cancelAll() {
        pending.values().forEach(f -> f.cancel(false));
        pending.clear();
    }

    public int pendingCount() {
        return pending.size();
    }

    public int pendingCount(String endpointId) {
        return (int) pending.keySet().stream().filter(k -> k.endpointId().equals(endpointId)).count();
    }
}
