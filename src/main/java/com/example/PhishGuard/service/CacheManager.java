package com.example.PhishGuard.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process TTL cache for report lookups, backed by Caffeine.
 * <p>
 * Each entry carries its own deadline. Invalidation is tracked per key namespace (the key up to
 * and including its first {@code ':'}) with a monotonic epoch. Readers take
 * {@link #generation(String)} before going to the store and populate with
 * {@link #set(String, Object, Duration, long)}; the set is refused if the epoch moved, and an
 * entry stored under an old epoch is never served, so invalidation always wins over a
 * concurrent set.
 */
@Service
public class CacheManager {
    private static final Logger logger = LoggerFactory.getLogger(CacheManager.class);

    public static final String LIST_KEY_PREFIX = "reports:";
    public static final String ALL_REPORTS_KEY = LIST_KEY_PREFIX + "all";
    public static final String REPORT_KEY_PREFIX = "report:";

    static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    private final Cache<String, CacheEntry> cache;
    private final ConcurrentHashMap<String, AtomicLong> epochs = new ConcurrentHashMap<>();
    private final AtomicInteger expiredCount = new AtomicInteger();
    private final Clock clock;
    private final Instant origin;

    @Autowired
    public CacheManager(Clock clock) {
        this(clock, DEFAULT_MAXIMUM_SIZE);
    }

    CacheManager(Clock clock, long maximumSize) {
        this.clock = clock;
        this.origin = clock.instant();
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new DeadlineExpiry())
                .ticker(this::ticks)
                .executor(Runnable::run)
                .removalListener((String key, CacheEntry entry, RemovalCause cause) -> {
                    if (cause == RemovalCause.EXPIRED) {
                        expiredCount.incrementAndGet();
                    }
                })
                .build();
    }

    public static String reportKey(String id) {
        return REPORT_KEY_PREFIX + id;
    }

    public static String listKey(String variant) {
        return LIST_KEY_PREFIX + variant;
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.epoch() != epochOf(key).get()) {
            cache.asMap().remove(key, entry);
            return Optional.empty();
        }
        Object value = entry.value();
        if (!type.isInstance(value)) {
            logger.warn("Cache entry {} holds {} but {} was requested", key, value.getClass().getName(), type.getName());
            return Optional.empty();
        }
        return Optional.of(type.cast(value));
    }

    /**
     * Unconditional set; last writer wins.
     */
    public void set(String key, Object value, Duration ttl) {
        long deadline = deadline(value, ttl);
        AtomicLong epoch = epochOf(key);
        cache.asMap().compute(key, (k, current) -> new CacheEntry(value, deadline, epoch.get()));
    }

    /**
     * Sets only if no invalidation happened since {@code expectedGeneration} was read.
     *
     * @return whether the value was stored
     */
    public boolean set(String key, Object value, Duration ttl, long expectedGeneration) {
        long deadline = deadline(value, ttl);
        AtomicLong epoch = epochOf(key);
        if (epoch.get() != expectedGeneration) {
            logger.debug("Dropped stale cache set for {}", key);
            return false;
        }
        boolean[] stored = {false};
        cache.asMap().compute(key, (k, current) -> {
            if (epoch.get() != expectedGeneration) {
                return current;
            }
            stored[0] = true;
            return new CacheEntry(value, deadline, expectedGeneration);
        });
        if (!stored[0]) {
            logger.debug("Dropped stale cache set for {}", key);
        }
        return stored[0];
    }

    public long generation(String key) {
        return epochOf(key).get();
    }

    /**
     * Invalidates the key together with the rest of its namespace.
     */
    public void invalidate(String key) {
        epochOf(key).incrementAndGet();
        cache.invalidate(key);
    }

    public int invalidatePrefix(String prefix) {
        for (Map.Entry<String, AtomicLong> epoch : epochs.entrySet()) {
            String namespace = epoch.getKey();
            if (namespace.startsWith(prefix) || prefix.startsWith(namespace)) {
                epoch.getValue().incrementAndGet();
            }
        }
        List<String> matching = new ArrayList<>();
        for (String key : cache.asMap().keySet()) {
            if (key.startsWith(prefix)) {
                matching.add(key);
            }
        }
        cache.invalidateAll(matching);
        logger.debug("Invalidated {} cache keys under {}", matching.size(), prefix);
        return matching.size();
    }

    public void invalidateAll() {
        epochs.values().forEach(AtomicLong::incrementAndGet);
        cache.invalidateAll();
        logger.info("Cache cleared");
    }

    /**
     * Removes expired entries and entries stored under a superseded epoch.
     *
     * @return number of entries evicted
     */
    public int evictExpired() {
        int before = expiredCount.get();
        cache.cleanUp();
        int evicted = expiredCount.get() - before;
        for (Map.Entry<String, CacheEntry> e : cache.asMap().entrySet()) {
            if (e.getValue().epoch() != epochOf(e.getKey()).get()
                    && cache.asMap().remove(e.getKey(), e.getValue())) {
                evicted++;
            }
        }
        return evicted;
    }

    public int size() {
        cache.cleanUp();
        return (int) cache.estimatedSize();
    }

    private AtomicLong epochOf(String key) {
        return epochs.computeIfAbsent(namespaceOf(key), n -> new AtomicLong());
    }

    static String namespaceOf(String key) {
        int colon = key.indexOf(':');
        return colon < 0 ? key : key.substring(0, colon + 1);
    }

    private long deadline(Object value, Duration ttl) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot cache a null value");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        return ticks() + ttl.toNanos();
    }

    private long ticks() {
        return Duration.between(origin, clock.instant()).toNanos();
    }

    record CacheEntry(Object value, long deadlineTicks, long epoch) {
    }

    private static final class DeadlineExpiry implements Expiry<String, CacheEntry> {
        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return Math.max(0, entry.deadlineTicks() - currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return Math.max(0, entry.deadlineTicks() - currentTime);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
