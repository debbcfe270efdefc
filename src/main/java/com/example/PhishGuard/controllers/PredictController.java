package com.example.PhishGuard.controllers;

import com.example.PhishGuard.PhishGuardApplication;
import com.example.PhishGuard.dto.AttachmentDto;
import com.example.PhishGuard.dto.PredictRequest;
import com.example.PhishGuard.dto.PredictionResponse;
import com.example.PhishGuard.exceptions.ValidationException;
import com.example.PhishGuard.models.EmailSubmission;
import com.example.PhishGuard.models.PredictionRecord;
import com.example.PhishGuard.service.PredictionOrchestrator;
import com.example.PhishGuard.utils.EmailParser;
import jakarta.mail.MessagingException;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@RestController
public class PredictController {
    private final PredictionOrchestrator orchestrator;

    public PredictController(PredictionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping(value = "/predict", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PredictionResponse> predict(@Valid @RequestBody PredictRequest rq) {
        EmailSubmission submission = new EmailSubmission(rq.getSubject(), rq.getBody(), rq.getAttachments());
        return handleSubmission(submission);
    }

    /**
     * Form upload: either subject/body fields with optional files, or a whole {@code .eml} as
     * {@code emlFile}. Explicit subject/body fields take precedence over the parsed message.
     */
    @PostMapping(value = "/predict", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<PredictionResponse> predictMultipart(
            @RequestParam(value = "subject", required = false) String subject,
            @RequestParam(value = "body", required = false) String body,
            @RequestPart(value = "attachments", required = false) List<MultipartFile> attachments,
            @RequestPart(value = "emlFile", required = false) MultipartFile emlFile) {
        List<AttachmentDto> files = new ArrayList<>();
        if (emlFile != null && !emlFile.isEmpty()) {
            EmailParser.ParsedEmail parsed = parseEmail(readBytes(emlFile));
            subject = isBlank(subject) ? parsed.subject() : subject;
            body = isBlank(body) ? parsed.body() : body;
            files.addAll(parsed.attachments());
        }
        if (attachments != null) {
            for (MultipartFile file : attachments) {
                if (file == null || (file.isEmpty() && isBlank(file.getOriginalFilename()))) {
                    continue;
                }
                files.add(new AttachmentDto(file.getOriginalFilename(), file.getContentType(), readBytes(file)));
            }
        }
        return handleSubmission(new EmailSubmission(subject, body, files));
    }

    @PostMapping(value = "/predict", consumes = "message/rfc822")
    public ResponseEntity<PredictionResponse> predictRaw(@RequestBody byte[] rawEmailBytes) {
        if (rawEmailBytes == null || rawEmailBytes.length == 0) {
            throw new ValidationException("Raw email body is empty");
        }
        return handleSubmission(parseEmail(rawEmailBytes).toSubmission());
    }

    private ResponseEntity<PredictionResponse> handleSubmission(EmailSubmission submission) {
        PredictionRecord record = orchestrator.submit(submission);
        return ResponseEntity.status(HttpStatus.OK).body(PredictionResponse.from(record));
    }

    private static EmailParser.ParsedEmail parseEmail(byte[] raw) {
        try {
            EmailParser.ParsedEmail parsed = EmailParser.parse(raw);
            PhishGuardApplication.logger.info("Parsed email {} from {} with {} attachment(s)",
                    parsed.messageId(), parsed.sourceAddr(), parsed.attachments().size());
            return parsed;
        } catch (MessagingException | IOException e) {
            PhishGuardApplication.logger.error("Failed to parse email", e);
            throw new ValidationException("Unable to parse email: " + e.getMessage(), e);
        }
    }

    private static byte[] readBytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            PhishGuardApplication.logger.error("Failed to read uploaded file {}", file.getOriginalFilename(), e);
            throw new ValidationException("Unable to read uploaded file: " + file.getOriginalFilename(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
