package com.example.PhishGuard.repo;

import com.example.PhishGuard.models.PredictionRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface PredictionRecordRepository extends MongoRepository<PredictionRecord, String> {

    Page<PredictionRecord> findByPrediction(String prediction, Pageable pageable);

    Page<PredictionRecord> findByAttachmentsSha256(String sha256, Pageable pageable);

    Page<PredictionRecord> findByPredictionAndAttachmentsSha256(String prediction, String sha256, Pageable pageable);

    boolean existsByAttachmentsSha256(String sha256);
}
