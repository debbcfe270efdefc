package com.example.PhishGuard.dto;

import com.example.PhishGuard.models.PredictionRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Verdict returned by {@code POST /predict}.
 */
@Getter
@AllArgsConstructor
public class PredictionResponse {
    @JsonProperty("_id")
    private final String id;
    private final String prediction;
    private final double confidence;
    private final double spamProbability;
    private final double hamProbability;
    private final Instant timestamp;
    private final List<AttachmentInfo> attachmentsInfo;

    public static PredictionResponse from(PredictionRecord record) {
        return new PredictionResponse(
                record.getId(),
                record.getPrediction(),
                record.getConfidence(),
                record.getSpamProbability(),
                record.getHamProbability(),
                record.getTimestamp(),
                record.getAttachments().stream().map(AttachmentInfo::from).toList()
        );
    }
}
