package com.example.PhishGuard.models;

import lombok.Getter;
import lombok.With;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.PersistenceCreator;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.List;

/**
 * One classification verdict. Written once by the orchestrator and never updated.
 * Field names follow the snake_case layout of the {@code predictions} collection.
 */
@Getter
@Document(collection = "predictions")
public class PredictionRecord {

    @Id
    @With
    private final String id;

    @Field("subject")
    private final String subject;

    @Field("body")
    private final String body;

    @Field("prediction")
    private final String prediction;

    @Field("confidence")
    private final double confidence;

    @Field("spam_probability")
    private final double spamProbability;

    @Field("ham_probability")
    private final double hamProbability;

    @Field("timestamp")
    private final Instant timestamp;

    @Field("attachments_info")
    private final List<AttachmentRecord> attachments;

    @PersistenceCreator
    public PredictionRecord(String id, String subject, String body, String prediction, double confidence,
                            double spamProbability, double hamProbability, Instant timestamp,
                            List<AttachmentRecord> attachments) {
        this.id = id;
        this.subject = subject;
        this.body = body;
        this.prediction = prediction;
        this.confidence = confidence;
        this.spamProbability = spamProbability;
        this.hamProbability = hamProbability;
        this.timestamp = timestamp;
        this.attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    /**
     * Builds a not-yet-persisted record; the store assigns the id on insert.
     */
    public static PredictionRecord unsaved(String subject, String body, ClassificationResult result,
                                           Instant timestamp, List<AttachmentRecord> attachments) {
        return new PredictionRecord(null, subject, body, result.verdict().label(), result.confidence(),
                result.spamProbability(), result.hamProbability(), timestamp, attachments);
    }
}
