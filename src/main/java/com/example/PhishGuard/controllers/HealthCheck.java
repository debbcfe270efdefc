package com.example.PhishGuard.controllers;

import com.example.PhishGuard.dto.HealthResponse;
import com.example.PhishGuard.service.ClassificationEngine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthCheck {
    private final ClassificationEngine classificationEngine;
    private final String version;

    public HealthCheck(ClassificationEngine classificationEngine,
                       @Value("${APP_VERSION:1.0.0}") String version) {
        this.classificationEngine = classificationEngine;
        this.version = version;
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Phishing Email Detection System API");
        body.put("version", version);
        body.put("docs", "/health");
        return new ResponseEntity<>(body, HttpStatus.OK); // 200
    }

    /**
     * Liveness plus the model flag. Always 200; an unloaded model shows up as "unhealthy" in the body.
     */
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> healthCheck() {
        boolean loaded = classificationEngine.isLoaded();
        HealthResponse body = new HealthResponse(
                loaded ? "healthy" : "unhealthy",
                loaded,
                loaded ? null : classificationEngine.getLoadError()
        );
        return ResponseEntity.status(HttpStatus.OK).body(body);
    }
}
