package com.example.PhishGuard.dto;

import com.example.PhishGuard.models.PredictionRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Full stored record as served to the dashboard.
 */
@Getter
@AllArgsConstructor
public class ReportResponse {
    @JsonProperty("_id")
    private final String id;
    private final String subject;
    private final String body;
    private final String prediction;
    private final double confidence;
    private final double spamProbability;
    private final double hamProbability;
    private final Instant timestamp;
    private final List<AttachmentInfo> attachmentsInfo;

    public static ReportResponse from(PredictionRecord record) {
        return new ReportResponse(
                record.getId(),
                record.getSubject(),
                record.getBody(),
                record.getPrediction(),
                record.getConfidence(),
                record.getSpamProbability(),
                record.getHamProbability(),
                record.getTimestamp(),
                record.getAttachments().stream().map(AttachmentInfo::from).toList()
        );
    }
}
