package com.github.dimitryivaniuta.relay.ratelimit;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.config.IntervalTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class RateLimitMaintenanceJobTest {

    private final RateLimiterService limiter = mock(RateLimiterService.class);
    private final RateLimitProperties props = new RateLimitProperties();

    @Test
    void registersCleanupAndReconnectWithConfiguredIntervals() {
        props.setCleanupInterval(Duration.ofSeconds(60));
        props.setReconnectInterval(Duration.ofSeconds(30));
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();

        new RateLimitMaintenanceJob(limiter, props).configureTasks(registrar);

        assertThat(registrar.getFixedDelayTaskList())
                .extracting(IntervalTask::getIntervalDuration)
                .containsExactly(Duration.ofSeconds(60), Duration.ofSeconds(30));
    }

    @Test
    void zeroReconnectIntervalSkipsReconnectTask() {
        props.setReconnectInterval(Duration.ZERO);
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();

        new RateLimitMaintenanceJob(limiter, props).configureTasks(registrar);

        assertThat(registrar.getFixedDelayTaskList()).hasSize(1);
        assertThat(props.isReconnectEnabled()).isFalse();
    }

    @Test
    void cleanupIntervalMustBePositive() {
        props.setCleanupInterval(Duration.ZERO);

        assertThatThrownBy(() -> new RateLimitMaintenanceJob(limiter, props).configureTasks(new ScheduledTaskRegistrar()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void tasksDelegateToLimiter() {
        when(limiter.cleanupExpired()).thenReturn(3);
        RateLimitMaintenanceJob job = new RateLimitMaintenanceJob(limiter, props);

        job.cleanup();
        job.reconnect();

        verify(limiter).cleanupExpired();
        verify(limiter).tryReconnect();
    }
}
