package com.example.PhishGuard.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class HealthResponse {
    private final String status;
    private final boolean modelsLoaded;
    private final String error;
}
