package com.example.PhishGuard.service;

import com.example.PhishGuard.exceptions.ValidationException;
import com.example.PhishGuard.models.AttachmentRecord;
import com.example.PhishGuard.models.ClassificationResult;
import com.example.PhishGuard.models.EmailSubmission;
import com.example.PhishGuard.models.PredictionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * The single write path: validate, classify, fingerprint attachments, persist, then drop the
 * cached report lists. A verdict is only returned once it has been stored.
 */
@Service
public class PredictionOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(PredictionOrchestrator.class);

    private final ClassificationEngine classificationEngine;
    private final AttachmentAnalyzer attachmentAnalyzer;
    private final PersistenceManager persistenceManager;
    private final CacheManager cacheManager;
    private final Clock clock;

    public PredictionOrchestrator(ClassificationEngine classificationEngine,
                                  AttachmentAnalyzer attachmentAnalyzer,
                                  PersistenceManager persistenceManager,
                                  CacheManager cacheManager,
                                  Clock clock) {
        this.classificationEngine = classificationEngine;
        this.attachmentAnalyzer = attachmentAnalyzer;
        this.persistenceManager = persistenceManager;
        this.cacheManager = cacheManager;
        this.clock = clock;
    }

    public PredictionRecord submit(EmailSubmission submission) {
        if (submission == null) {
            throw new ValidationException("Submission is required");
        }
        String subject = requireText("subject", submission.subject());
        String body = requireText("body", submission.body());

        ClassificationResult result = classificationEngine.classify(subject, body);
        List<AttachmentRecord> attachments = attachmentAnalyzer.analyzeAll(submission.attachments());
        if (!attachments.isEmpty()) {
            logger.info("Email has {} attachment(s)", attachments.size());
        }

        PredictionRecord record = PredictionRecord.unsaved(subject, body, result, clock.instant(), attachments);
        PredictionRecord saved = persistenceManager.insert(record);
        cacheManager.invalidatePrefix(CacheManager.LIST_KEY_PREFIX);
        return saved;
    }

    private static String requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " cannot be empty or whitespace only");
        }
        return value.strip();
    }
}
