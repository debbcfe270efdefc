package com.example.PhishGuard.service;

import com.example.PhishGuard.dto.ReportResponse;
import com.example.PhishGuard.dto.ReportsResponse;
import com.example.PhishGuard.models.ReportPage;
import com.example.PhishGuard.models.ReportQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Read path for the dashboard: cache first, store on a miss.
 * <p>
 * Lists use the short TTL because every submission changes them (and the orchestrator drops them
 * on write). Single reports are immutable, so their longer TTL only bounds memory.
 */
@Service
public class ReportService {
    private static final Logger logger = LoggerFactory.getLogger(ReportService.class);

    private final PersistenceManager persistenceManager;
    private final CacheManager cacheManager;
    private final Duration listTtl;
    private final Duration singleReportTtl;

    public ReportService(PersistenceManager persistenceManager,
                         CacheManager cacheManager,
                         @Value("${CACHE_TTL_REPORTS:60}") long listTtlSeconds,
                         @Value("${CACHE_TTL_SINGLE_REPORT:300}") long singleReportTtlSeconds) {
        this.persistenceManager = persistenceManager;
        this.cacheManager = cacheManager;
        this.listTtl = Duration.ofSeconds(listTtlSeconds);
        this.singleReportTtl = Duration.ofSeconds(singleReportTtlSeconds);
    }

    public ReportsResponse listReports(ReportQuery query) {
        String key = CacheManager.listKey(query.cacheKey());
        Optional<ReportsResponse> cached = cacheManager.get(key, ReportsResponse.class);
        if (cached.isPresent()) {
            logger.debug("Cache hit for {}", key);
            return cached.get();
        }
        long generation = cacheManager.generation(key);
        ReportPage page = persistenceManager.list(query);
        ReportsResponse response = new ReportsResponse(page.total(),
                page.records().stream().map(ReportResponse::from).toList());
        cacheManager.set(key, response, listTtl, generation);
        return response;
    }

    public ReportResponse getReport(String id) {
        String key = CacheManager.reportKey(id);
        Optional<ReportResponse> cached = cacheManager.get(key, ReportResponse.class);
        if (cached.isPresent()) {
            logger.debug("Cache hit for {}", key);
            return cached.get();
        }
        long generation = cacheManager.generation(key);
        ReportResponse response = ReportResponse.from(persistenceManager.findById(id));
        cacheManager.set(key, response, singleReportTtl, generation);
        return response;
    }
}
