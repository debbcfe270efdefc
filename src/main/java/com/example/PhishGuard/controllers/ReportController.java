package com.example.PhishGuard.controllers;

import com.example.PhishGuard.PhishGuardApplication;
import com.example.PhishGuard.dto.ReportResponse;
import com.example.PhishGuard.dto.ReportsResponse;
import com.example.PhishGuard.exceptions.ValidationException;
import com.example.PhishGuard.models.ReportQuery;
import com.example.PhishGuard.models.Verdict;
import com.example.PhishGuard.service.ReportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.regex.Pattern;

@RestController
public class ReportController {
    private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-f]{64}");

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/reports")
    public ResponseEntity<ReportsResponse> listReports(
            @RequestParam(value = "skip", defaultValue = "0") int skip,
            @RequestParam(value = "limit", defaultValue = "" + ReportQuery.DEFAULT_LIMIT) int limit,
            @RequestParam(value = "prediction", required = false) String prediction,
            @RequestParam(value = "sha256", required = false) String sha256) {
        if (skip < 0) {
            throw new ValidationException("skip must not be negative");
        }
        if (limit < 1 || limit > ReportQuery.MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + ReportQuery.MAX_LIMIT);
        }
        ReportQuery query = new ReportQuery(skip, limit, parseVerdict(prediction), parseSha256(sha256));
        return ResponseEntity.ok(reportService.listReports(query));
    }

    @GetMapping("/report")
    public ResponseEntity<ReportResponse> getReport(@RequestParam("id") String id) {
        return ResponseEntity.ok(reportService.getReport(id));
    }

    @GetMapping("/reports/{id}")
    public ResponseEntity<ReportResponse> getReportByPath(@PathVariable String id) {
        return getReport(id);
    }

    private static Verdict parseVerdict(String prediction) {
        if (prediction == null || prediction.isBlank()) {
            return null;
        }
        try {
            return Verdict.fromLabel(prediction);
        } catch (IllegalArgumentException e) {
            PhishGuardApplication.logger.warn("Invalid prediction filter: {}", prediction);
            throw new ValidationException("prediction must be 'spam' or 'ham'");
        }
    }

    private static String parseSha256(String sha256) {
        if (sha256 == null || sha256.isBlank()) {
            return null;
        }
        String normalized = sha256.trim().toLowerCase(Locale.ROOT);
        if (!SHA256_HEX.matcher(normalized).matches()) {
            throw new ValidationException("sha256 must be 64 hexadecimal characters");
        }
        return normalized;
    }
}
