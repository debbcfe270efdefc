package com.example.PhishGuard.models;

import lombok.Getter;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * Fingerprint and risk of one uploaded file. Embedded in, and owned by, a single {@link PredictionRecord}.
 */
@Getter
public class AttachmentRecord {

    @Field("filename")
    private final String filename;

    @Field("content_type")
    private final String contentType;

    @Field("size")
    private final long size;

    @Field("sha256")
    private final String sha256;

    @Field("malicious_score")
    private final double maliciousScore;

    public AttachmentRecord(String filename, String contentType, long size, String sha256, double maliciousScore) {
        this.filename = filename;
        this.contentType = contentType;
        this.size = size;
        this.sha256 = sha256;
        this.maliciousScore = maliciousScore;
    }
}
