package com.github.dimitryivaniuta.relay.ratelimit;

import com.github.dimitryivaniuta.relay.metrics.RelayMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.RedisSystemException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RateLimiterServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private RedisRateLimitStore redis;
    private LocalRateLimitStore local;
    private RateLimitProperties props;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        redis = mock(RedisRateLimitStore.class);
        local = new LocalRateLimitStore();
        props = new RateLimitProperties();
        props.setConnectAttempts(2);
        registry = new SimpleMeterRegistry();
    }

    private RateLimiterService service(RedisRateLimitStore store) {
        return new RateLimiterService(store, local, props, new RelayMetrics(registry), CLOCK);
    }

    @Test
    void withoutRedisUsesMemory() {
        RateLimiterService svc = service(null);
        svc.start();

        assertThat(svc.backend()).isEqualTo(RateLimitBackend.MEMORY);
        assertThat(svc.checkRateLimit("k", 2, 60_000).remaining()).isEqualTo(1);
        assertThat(svc.checkRateLimit("k", 2, 60_000).remaining()).isZero();
        assertThat(svc.checkRateLimit("k", 2, 60_000).allowed()).isFalse();

        assertThat(registry.get("relay_ratelimit_allowed_total").tag("backend", "memory").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("relay_ratelimit_rejected_total").tag("backend", "memory").counter().count())
                .isEqualTo(1.0);
        assertThat(svc.getServiceStatus().redisConfigured()).isFalse();
        assertThat(svc.getServiceStatus().entryCount()).isEqualTo(1);
        assertThat(svc.tryReconnect()).isFalse();
    }

    @Test
    void rejectsInvalidArguments() {
        RateLimiterService svc = service(null);
        assertThatThrownBy(() -> svc.checkRateLimit("k", 0, 1_000)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> svc.checkRateLimit("k", 1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void usesRedisWhenReachable() {
        when(redis.ping()).thenReturn("PONG");
        RateLimitResult fromRedis = new RateLimitResult(true, 9, CLOCK.instant().plusSeconds(60), null);
        when(redis.check("k", 10, 60_000, CLOCK.millis())).thenReturn(fromRedis);

        RateLimiterService svc = service(redis);
        svc.start();

        assertThat(svc.backend()).isEqualTo(RateLimitBackend.REDIS);
        assertThat(svc.checkRateLimit("k", 10, 60_000)).isSameAs(fromRedis);
        assertThat(local.size()).isZero();
        assertThat(svc.getServiceStatus().entryCount()).isEqualTo(-1);
    }

    @Test
    void startFallsBackToMemoryAfterProbeAttempts() {
        when(redis.ping()).thenThrow(new RedisConnectionFailureException("refused"));

        RateLimiterService svc = service(redis);
        svc.start();

        assertThat(svc.backend()).isEqualTo(RateLimitBackend.MEMORY);
        verify(redis, times(2)).ping();
        assertThat(svc.checkRateLimit("k", 1, 1_000).allowed()).isTrue();
        verify(redis, never()).check(anyString(), anyInt(), anyLong(), anyLong());
    }

    @Test
    void connectionLossSwitchesToMemoryAndReconnectRestoresRedis() {
        when(redis.ping()).thenReturn("PONG");
        when(redis.check(anyString(), anyInt(), anyLong(), anyLong()))
                .thenThrow(new RedisConnectionFailureException("connection reset"));

        RateLimiterService svc = service(redis);
        svc.start();

        RateLimitResult r = svc.checkRateLimit("k", 5, 60_000);

        assertThat(r.allowed()).isTrue();
        assertThat(r.remaining()).isEqualTo(4);
        assertThat(svc.backend()).isEqualTo(RateLimitBackend.MEMORY);
        assertThat(registry.get("relay_ratelimit_fallback_total").tag("reason", "connection").counter().count())
                .isEqualTo(1.0);

        // later calls go straight to memory
        svc.checkRateLimit("k", 5, 60_000);
        verify(redis, times(1)).check(anyString(), anyInt(), anyLong(), anyLong());

        assertThat(svc.tryReconnect()).isTrue();
        assertThat(svc.backend()).isEqualTo(RateLimitBackend.REDIS);
    }

    @Test
    void operationalErrorAnswersLocallyButKeepsRedis() {
        when(redis.ping()).thenReturn("PONG");
        when(redis.check(anyString(), anyInt(), anyLong(), anyLong()))
                .thenThrow(new RedisSystemException("WRONGTYPE", new IllegalStateException("bad type")));

        RateLimiterService svc = service(redis);
        svc.start();

        assertThat(svc.getServiceStatus().healthy()).isTrue();
        assertThat(svc.checkRateLimit("k", 5, 60_000).allowed()).isTrue();
        assertThat(svc.backend()).isEqualTo(RateLimitBackend.REDIS);
        assertThat(registry.get("relay_ratelimit_fallback_total").tag("reason", "operation").counter().count())
                .isEqualTo(1.0);
        assertThat(svc.getServiceStatus().healthy()).isFalse();
    }

    @Test
    void healthFollowsLastRedisOutcome() {
        when(redis.ping()).thenReturn("PONG");
        RateLimitResult ok = new RateLimitResult(true, 4, CLOCK.instant().plusSeconds(60), null);
        when(redis.check(anyString(), anyInt(), anyLong(), anyLong()))
                .thenThrow(new RedisSystemException("LOADING", new IllegalStateException("loading")))
                .thenReturn(ok);

        RateLimiterService svc = service(redis);
        svc.start();

        svc.checkRateLimit("k", 5, 60_000);
        assertThat(svc.getServiceStatus().healthy()).isFalse();

        assertThat(svc.checkRateLimit("k", 5, 60_000)).isSameAs(ok);
        assertThat(svc.getServiceStatus().healthy()).isTrue();
        assertThat(svc.getServiceStatus().backend()).isEqualTo(RateLimitBackend.REDIS);
    }

    @Test
    void memoryFallbackReportsHealthy() {
        when(redis.ping()).thenThrow(new RedisConnectionFailureException("down"));
        RateLimiterService svc = service(redis);
        svc.start();

        RateLimiterStatus status = svc.getServiceStatus();
        assertThat(status.backend()).isEqualTo(RateLimitBackend.MEMORY);
        assertThat(status.healthy()).isTrue();
        assertThat(status.redisConfigured()).isTrue();
    }

    @Test
    void resetClearsBothStores() {
        when(redis.ping()).thenReturn("PONG");
        when(redis.status("k", CLOCK.millis())).thenReturn(Optional.empty());
        local.check("k", 5, 60_000, CLOCK.millis());

        RateLimiterService svc = service(redis);
        svc.start();
        svc.reset("k");

        verify(redis).reset("k");
        assertThat(local.size()).isZero();
        assertThat(svc.getStatus("k").count()).isZero();
        assertThat(svc.getStatus("k").backend()).isEqualTo(RateLimitBackend.REDIS);
    }

    @Test
    void reconnectDisabledStaysOnMemory() {
        props.setReconnectInterval(Duration.ZERO);
        when(redis.ping()).thenThrow(new RedisConnectionFailureException("down"));
        RateLimiterService svc = service(redis);
        svc.start();

        assertThat(svc.tryReconnect()).isFalse();
        assertThat(svc.backend()).isEqualTo(RateLimitBackend.MEMORY);
    }

    @Test
    void detectsWrappedConnectionFailures() {
        RuntimeException wrapped = new IllegalStateException("outer", new RedisConnectionFailureException("inner"));
        assertThat(RateLimiterService.isConnectionFailure(wrapped)).isTrue();
        assertThat(RateLimiterService.isConnectionFailure(new IllegalStateException("x"))).isFalse();
    }
}
