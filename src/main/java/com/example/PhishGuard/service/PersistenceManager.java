package com.example.PhishGuard.service;

import com.example.PhishGuard.exceptions.PersistenceUnavailableException;
import com.example.PhishGuard.exceptions.ReportNotFoundException;
import com.example.PhishGuard.models.AttachmentRecord;
import com.example.PhishGuard.models.PredictionRecord;
import com.example.PhishGuard.models.ReportPage;
import com.example.PhishGuard.models.ReportQuery;
import com.example.PhishGuard.repo.PredictionRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Store access for prediction records.
 * <p>
 * Pool sizing, pool wait and the majority write concern are configured on the client in
 * {@link com.example.PhishGuard.config.MongoConfig}; every store failure surfaces here as
 * {@link PersistenceUnavailableException}.
 */
@Slf4j
@Service
public class PersistenceManager {
    static final String TIMESTAMP_INDEX = "timestamp_desc";
    static final String PREDICTION_INDEX = "prediction_timestamp";
    static final String SHA256_INDEX = "attachments_sha256";

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "timestamp");

    private final PredictionRecordRepository repository;
    private final MongoTemplate mongoTemplate;

    public PersistenceManager(PredictionRecordRepository repository, MongoTemplate mongoTemplate) {
        this.repository = repository;
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Verifies connectivity and ensures the query indexes. Failures are logged, not fatal:
     * requests will report the store as unavailable until it comes back.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void connect() {
        try {
            Document ping = mongoTemplate.executeCommand(new Document("ping", 1));
            log.info("Prediction store connection established: {}", ping.toJson());
        } catch (DataAccessException e) {
            log.error("Prediction store connection failed: {}", e.getMessage());
            return;
        }
        try {
            ensureIndexes();
        } catch (DataAccessException e) {
            log.warn("Failed to create indexes: {}", e.getMessage());
        }
    }

    void ensureIndexes() {
        IndexOperations indexOps = mongoTemplate.indexOps(PredictionRecord.class);
        indexOps.ensureIndex(new Index().on("timestamp", Sort.Direction.DESC).named(TIMESTAMP_INDEX));
        indexOps.ensureIndex(new Index()
                .on("prediction", Sort.Direction.ASC)
                .on("timestamp", Sort.Direction.DESC)
                .named(PREDICTION_INDEX));
        indexOps.ensureIndex(new Index().on("attachments_info.sha256", Sort.Direction.ASC).named(SHA256_INDEX));
        log.info("Database indexes created successfully");
    }

    public PredictionRecord insert(PredictionRecord record) {
        flagDuplicateAttachments(record);
        PredictionRecord saved = withStore("save prediction", () -> repository.insert(record));
        log.info("Prediction saved successfully with ID: {}", saved.getId());
        return saved;
    }

    public ReportPage list(ReportQuery query) {
        Pageable page = new OffsetPageable(query.skip(), query.limit(), NEWEST_FIRST);
        Page<PredictionRecord> result = withStore("fetch reports", () -> {
            if (query.prediction() != null && query.sha256() != null) {
                return repository.findByPredictionAndAttachmentsSha256(query.prediction().label(), query.sha256(), page);
            }
            if (query.prediction() != null) {
                return repository.findByPrediction(query.prediction().label(), page);
            }
            if (query.sha256() != null) {
                return repository.findByAttachmentsSha256(query.sha256(), page);
            }
            return repository.findAll(page);
        });
        log.info("Retrieved {} of {} reports from database", result.getNumberOfElements(), result.getTotalElements());
        return new ReportPage(result.getTotalElements(), result.getContent());
    }

    public PredictionRecord findById(String id) {
        if (id == null || !ObjectId.isValid(id)) {
            log.warn("Invalid ObjectId format: {}", id);
            throw new ReportNotFoundException(id);
        }
        PredictionRecord record = withStore("fetch report", () -> repository.findById(id))
                .orElseThrow(() -> {
                    log.info("No report found with ID: {}", id);
                    return new ReportNotFoundException(id);
                });
        log.info("Retrieved report with ID: {}", id);
        return record;
    }

    private void flagDuplicateAttachments(PredictionRecord record) {
        Set<String> hashes = new LinkedHashSet<>();
        for (AttachmentRecord attachment : record.getAttachments()) {
            hashes.add(attachment.getSha256());
        }
        for (String sha256 : hashes) {
            if (withStore("check attachment history", () -> repository.existsByAttachmentsSha256(sha256))) {
                log.info("Attachment content {} already seen in an earlier submission", sha256);
            }
        }
    }

    private <T> T withStore(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("Failed to {}: {}", operation, e.getMessage(), e);
            throw new PersistenceUnavailableException("Prediction store unavailable: could not " + operation, e);
        }
    }
}
