package com.github.dimitryivaniuta.relay.webhook;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;
import java.util.List;

/**
 * Fixed backoff schedule; attempts past the end of the schedule reuse its last delay.
 */
public final class RetryPolicy {

    private final List<Duration> schedule;
    private final IntervalFunction interval;

    public RetryPolicy(List<Duration> schedule) {
        if (schedule == null || schedule.isEmpty()) {
            throw new IllegalArgumentException("retry schedule must not be empty");
        }
        List<Duration> steps = List.copyOf(schedule);
        this.schedule = steps;
        this.interval = attempt -> steps.get(Math.min(Math.max(attempt, 1) - 1, steps.size() - 1)).toMillis();
    }

    /** Delay before the attempt following failed attempt {@code attempt} (1-based). */
    public Duration delayAfter(int attempt) {
        return Duration.ofMillis(interval.apply(attempt));
    }

    public List<Duration> schedule() {
        return schedule;
    }
}
