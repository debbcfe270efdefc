package com.example.PhishGuard.service;

import com.example.PhishGuard.models.RateLimitDecision;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window request counter per client key (the caller's IP).
 * <p>
 * Each admission is a single {@link ConcurrentHashMap#compute} on the client's window, so two
 * concurrent checks for the same key can neither both see the same count nor slip past the limit.
 * State is local to this process.
 */
@Service
public class RateLimiter {
    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();
    private final int maxRequests;
    private final Duration windowDuration;
    private final boolean enabled;
    private final Clock clock;

    public RateLimiter(@Value("${RATE_LIMIT_REQUESTS:100}") int maxRequests,
                       @Value("${RATE_LIMIT_WINDOW:60}") long windowSeconds,
                       @Value("${RATE_LIMIT_ENABLED:true}") boolean enabled,
                       Clock clock) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("RATE_LIMIT_REQUESTS must be at least 1");
        }
        if (windowSeconds < 1) {
            throw new IllegalArgumentException("RATE_LIMIT_WINDOW must be at least 1 second");
        }
        this.maxRequests = maxRequests;
        this.windowDuration = Duration.ofSeconds(windowSeconds);
        this.enabled = enabled;
        this.clock = clock;
    }

    public RateLimitDecision admit(String clientKey) {
        if (!enabled) {
            return RateLimitDecision.allow();
        }
        Instant now = clock.instant();
        Window window = windows.compute(clientKey, (key, current) -> {
            if (current == null || current.hasElapsed(now, windowDuration)) {
                return new Window(now, 1);
            }
            // capped one past the limit; stays rejected until the window resets
            return new Window(current.start(), Math.min(current.count() + 1, (long) maxRequests + 1));
        });
        if (window.count() > maxRequests) {
            Duration remaining = Duration.between(now, window.start().plus(windowDuration));
            long retryAfter = (remaining.toMillis() + 999) / 1000;
            return RateLimitDecision.reject(retryAfter);
        }
        return RateLimitDecision.allow();
    }

    /**
     * Drops windows that have fully elapsed.
     *
     * @return number of client windows removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, Window> entry : windows.entrySet()) {
            if (entry.getValue().hasElapsed(now, windowDuration)
                    && windows.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public boolean isEnabled() {
        return enabled;
    }

    int trackedClients() {
        return windows.size();
    }

    long requestsCounted(String clientKey) {
        Window window = windows.get(clientKey);
        return window == null ? 0 : window.count();
    }

    private record Window(Instant start, long count) {
        boolean hasElapsed(Instant now, Duration duration) {
            return !now.isBefore(start.plus(duration));
        }
    }
}
