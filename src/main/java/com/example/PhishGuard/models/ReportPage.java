package com.example.PhishGuard.models;

import java.util.List;

public record ReportPage(long total, List<PredictionRecord> records) {
}
