package com.example.PhishGuard.models;

import com.example.PhishGuard.dto.AttachmentDto;

import java.util.List;

/**
 * Request-scoped input to the classification pipeline. Never persisted as-is.
 */
public record EmailSubmission(String subject, String body, List<AttachmentDto> attachments) {

    public EmailSubmission {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }
}
