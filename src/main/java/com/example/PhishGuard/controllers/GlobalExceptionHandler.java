package com.example.PhishGuard.controllers;

import com.example.PhishGuard.dto.ErrorResponse;
import com.example.PhishGuard.exceptions.ModelUnavailableException;
import com.example.PhishGuard.exceptions.PersistenceUnavailableException;
import com.example.PhishGuard.exceptions.ReportNotFoundException;
import com.example.PhishGuard.exceptions.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the pipeline's failure taxonomy onto HTTP statuses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        log.info("Rejected submission: {}", ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", ex.getMessage(), null);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception ex) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", ex.getMessage(), null);
    }

    @ExceptionHandler(ModelUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleModelUnavailable(ModelUnavailableException ex) {
        log.error("Prediction refused: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Model Unavailable", ex.getMessage(), null);
    }

    @ExceptionHandler(PersistenceUnavailableException.class)
    public ResponseEntity<ErrorResponse> handlePersistenceUnavailable(PersistenceUnavailableException ex) {
        log.error("Store unavailable", ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Persistence Unavailable",
                "Unable to access prediction data", null);
    }

    @ExceptionHandler(ReportNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ReportNotFoundException ex) {
        log.info("Report lookup missed: {}", ex.getReportId());
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), null);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        log.warn("Upload rejected: {}", ex.getMessage());
        return build(HttpStatus.PAYLOAD_TOO_LARGE, "Payload Too Large", "Attachment exceeds the upload size limit", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", "Malformed request body", null);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(RuntimeException ex) {
        log.error("Unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message,
                                                       Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(error)
                .message(message)
                .details(details)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
