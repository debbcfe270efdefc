package com.example.PhishGuard.tasks;

import com.example.PhishGuard.service.CacheManager;
import com.example.PhishGuard.service.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class CleanupTask {
    private static final Logger logger = LoggerFactory.getLogger(CleanupTask.class);
    private final CacheManager cacheManager;
    private final RateLimiter rateLimiter;

    public CleanupTask(CacheManager cacheManager, RateLimiter rateLimiter) {
        this.cacheManager = cacheManager;
        this.rateLimiter = rateLimiter;
    }

    // 默认每分钟执行一次
    @Scheduled(fixedRateString = "${CLEANUP_INTERVAL_MS:60000}", initialDelayString = "${CLEANUP_INTERVAL_MS:60000}")
    public void cleanup() {
        try {
            int evicted = cacheManager.evictExpired();
            int windows = rateLimiter.evictExpired();
            if (evicted > 0 || windows > 0) {
                logger.info("Cleaned up {} expired cache entries and {} rate limit windows", evicted, windows);
            }
        } catch (RuntimeException e) {
            logger.error("Error during cleanup: " + e.getMessage(), e);
        }
    }
}
