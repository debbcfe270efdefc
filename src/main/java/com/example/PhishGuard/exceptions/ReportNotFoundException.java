package com.example.PhishGuard.exceptions;

public class ReportNotFoundException extends RuntimeException {
    private final String reportId;

    public ReportNotFoundException(String reportId) {
        super("Report not found: " + reportId);
        this.reportId = reportId;
    }

    public String getReportId() {
        return reportId;
    }
}
