package com.example.PhishGuard.dto;

import com.example.PhishGuard.models.AttachmentRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AttachmentInfo {
    private final String filename;
    private final String contentType;
    private final long size;
    private final String sha256;
    private final double maliciousScore;

    public static AttachmentInfo from(AttachmentRecord record) {
        return new AttachmentInfo(record.getFilename(), record.getContentType(), record.getSize(),
                record.getSha256(), record.getMaliciousScore());
    }
}
