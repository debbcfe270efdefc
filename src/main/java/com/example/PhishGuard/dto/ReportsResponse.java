package com.example.PhishGuard.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class ReportsResponse {
    private final long total;
    private final List<ReportResponse> reports;
}
