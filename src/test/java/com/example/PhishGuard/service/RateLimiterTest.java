package com.example.PhishGuard.service;

import com.example.PhishGuard.MutableClock;
import com.example.PhishGuard.models.RateLimitDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RateLimiter")
class RateLimiterTest {

    private MutableClock clock;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        rateLimiter = new RateLimiter(3, 60, true, clock);
    }

    @Test
    @DisplayName("Allows max requests in a window and rejects the next one")
    void rejectsFourthRequestInWindow() {
        assertThat(rateLimiter.admit("10.0.0.1").allowed()).isTrue();
        assertThat(rateLimiter.admit("10.0.0.1").allowed()).isTrue();
        assertThat(rateLimiter.admit("10.0.0.1").allowed()).isTrue();

        RateLimitDecision fourth = rateLimiter.admit("10.0.0.1");

        assertThat(fourth.allowed()).isFalse();
        assertThat(fourth.retryAfterSeconds()).isEqualTo(60);
    }

    @Test
    @DisplayName("Allows again once the window has elapsed")
    void resetsAfterWindow() {
        for (int i = 0; i < 4; i++) {
            rateLimiter.admit("10.0.0.1");
        }
        clock.advance(Duration.ofSeconds(59));
        assertThat(rateLimiter.admit("10.0.0.1").allowed()).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(rateLimiter.admit("10.0.0.1").allowed()).isTrue();
    }

    @Test
    @DisplayName("Retry-After reflects the time left in the window")
    void retryAfterShrinksWithWindow() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.admit("10.0.0.1");
        }
        clock.advance(Duration.ofMillis(45_500));

        RateLimitDecision decision = rateLimiter.admit("10.0.0.1");

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.retryAfterSeconds()).isEqualTo(15);
    }

    @Test
    @DisplayName("Counts each client independently")
    void separateKeys() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.admit("10.0.0.1");
        }
        assertThat(rateLimiter.admit("10.0.0.1").allowed()).isFalse();
        assertThat(rateLimiter.admit("10.0.0.2").allowed()).isTrue();
    }

    @Test
    @DisplayName("Disabled limiter admits everything")
    void disabledLimiter() {
        RateLimiter disabled = new RateLimiter(1, 60, false, clock);
        for (int i = 0; i < 10; i++) {
            assertThat(disabled.admit("10.0.0.1").allowed()).isTrue();
        }
    }

    @Test
    @DisplayName("Rejects nonsensical configuration")
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new RateLimiter(0, 60, true, clock)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RateLimiter(10, 0, true, clock)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("The largest configurable limit keeps counting upwards")
    void largestLimitDoesNotWrap() {
        RateLimiter limiter = new RateLimiter(Integer.MAX_VALUE, 60, true, clock);

        for (int i = 0; i < 5; i++) {
            assertThat(limiter.admit("10.0.0.9").allowed()).isTrue();
        }

        assertThat(limiter.requestsCounted("10.0.0.9")).isEqualTo(5);
    }

    @Test
    @DisplayName("Concurrent checks for one client admit exactly max requests")
    void concurrentAdmissions() throws Exception {
        RateLimiter limiter = new RateLimiter(20, 60, true, clock);
        int threads = 16;
        int callsPerThread = 10;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                Callable<Integer> worker = () -> {
                    start.await();
                    int allowed = 0;
                    for (int i = 0; i < callsPerThread; i++) {
                        if (limiter.admit("203.0.113.7").allowed()) {
                            allowed++;
                        }
                    }
                    return allowed;
                };
                results.add(pool.submit(worker));
            }
            start.countDown();
            int total = 0;
            for (Future<Integer> result : results) {
                total += result.get(10, TimeUnit.SECONDS);
            }
            assertThat(total).isEqualTo(20);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Evicts only elapsed windows")
    void evictExpired() {
        rateLimiter.admit("10.0.0.1");
        clock.advance(Duration.ofSeconds(30));
        rateLimiter.admit("10.0.0.2");
        clock.advance(Duration.ofSeconds(30));

        assertThat(rateLimiter.evictExpired()).isEqualTo(1);
        assertThat(rateLimiter.trackedClients()).isEqualTo(1);
    }
}
