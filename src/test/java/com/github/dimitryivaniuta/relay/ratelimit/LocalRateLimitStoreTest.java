package com.github.dimitryivaniuta.relay.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class LocalRateLimitStoreTest {

    private final LocalRateLimitStore store = new LocalRateLimitStore();

    @Test
    void countsDownThenRejects() {
        long t0 = 1_000_000L;

        assertThat(store.check("k", 3, 60_000, t0).remaining()).isEqualTo(2);
        assertThat(store.check("k", 3, 60_000, t0 + 1).remaining()).isEqualTo(1);
        RateLimitResult third = store.check("k", 3, 60_000, t0 + 2);
        assertThat(third.allowed()).isTrue();
        assertThat(third.remaining()).isZero();
        assertThat(third.retryAfter()).isNull();

        RateLimitResult fourth = store.check("k", 3, 60_000, t0 + 1_500);
        assertThat(fourth.allowed()).isFalse();
        assertThat(fourth.remaining()).isZero();
        assertThat(fourth.resetTime()).isEqualTo(Instant.ofEpochMilli(t0 + 60_000));
        assertThat(fourth.retryAfter()).isEqualTo(59);
    }

    @Test
    void windowExpiryStartsOver() {
        long t0 = 5_000L;
        store.check("k", 1, 100, t0);
        assertThat(store.check("k", 1, 100, t0 + 50).allowed()).isFalse();

        RateLimitResult afterWindow = store.check("k", 1, 100, t0 + 150);
        assertThat(afterWindow.allowed()).isTrue();
        assertThat(afterWindow.resetTime()).isEqualTo(Instant.ofEpochMilli(t0 + 250));
    }

    @Test
    void keysAreIndependent() {
        store.check("a", 1, 1_000, 0);
        assertThat(store.check("a", 1, 1_000, 1).allowed()).isFalse();
        assertThat(store.check("b", 1, 1_000, 1).allowed()).isTrue();
    }

    @Test
    void retryAfterIsAtLeastOneSecond() {
        store.check("k", 1, 1_000, 0);
        RateLimitResult denied = store.check("k", 1, 1_000, 999);
        assertThat(denied.retryAfter()).isEqualTo(1);
    }

    @Test
    void statusResetAndCleanup() {
        store.check("live", 5, 10_000, 0);
        store.check("live", 5, 10_000, 1);
        store.check("stale", 5, 100, 0);

        assertThat(store.status("live", 10).orElseThrow().count()).isEqualTo(2);
        assertThat(store.status("stale", 200)).isEmpty();
        assertThat(store.status("missing", 0)).isEmpty();

        assertThat(store.cleanupExpired(200)).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);

        store.reset("live");
        assertThat(store.status("live", 10)).isEmpty();
        assertThat(store.check("live", 5, 10_000, 20).remaining()).isEqualTo(4);

        store.clear();
        assertThat(store.size()).isZero();
    }
}
