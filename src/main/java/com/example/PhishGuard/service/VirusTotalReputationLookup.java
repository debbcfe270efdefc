package com.example.PhishGuard.service;

import com.example.PhishGuard.exceptions.ReputationLookupException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.OptionalDouble;

/**
 * File reputation from the VirusTotal v3 API ({@code GET /files/{sha256}}).
 * Only the hash leaves the process; unknown files are never uploaded.
 */
@Service
public class VirusTotalReputationLookup implements ReputationLookup {
    private static final Logger logger = LoggerFactory.getLogger(VirusTotalReputationLookup.class);

    private final String apiKey;
    private final URI baseUri;
    private final Duration timeout;
    private final HttpClient client;
    private final ObjectMapper om = new ObjectMapper();

    @Autowired
    public VirusTotalReputationLookup(@Value("${VT_API_KEY:}") String apiKey,
                                      @Value("${VT_BASE_URL:https://www.virustotal.com/api/v3}") String baseUrl,
                                      @Value("${VT_TIMEOUT_MS:3000}") long timeoutMs) {
        this(apiKey, URI.create(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/"), Duration.ofMillis(timeoutMs),
                HttpClient.newBuilder().connectTimeout(Duration.ofMillis(timeoutMs)).build());
    }

    VirusTotalReputationLookup(String apiKey, URI baseUri, Duration timeout, HttpClient client) {
        this.apiKey = apiKey;
        this.baseUri = baseUri;
        this.timeout = timeout;
        this.client = client;
        if (!isConfigured()) {
            logger.warn("No VT API key found, attachment reputation lookups are disabled.");
        }
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public OptionalDouble lookup(String sha256) throws ReputationLookupException {
        if (!isConfigured()) {
            return OptionalDouble.empty();
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(baseUri.resolve("files/" + sha256))
                .timeout(timeout)
                .header("x-apikey", apiKey)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> resp;
        try {
            resp = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ReputationLookupException("VirusTotal lookup timed out for " + sha256, e);
        } catch (IOException e) {
            throw new ReputationLookupException("VirusTotal lookup failed for " + sha256 + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReputationLookupException("VirusTotal lookup interrupted for " + sha256, e);
        }

        if (resp.statusCode() == 404) {
            return OptionalDouble.empty();
        }
        if (resp.statusCode() != 200) {
            throw new ReputationLookupException("VirusTotal returned status " + resp.statusCode() + " for " + sha256);
        }
        return OptionalDouble.of(extractScore(resp.body()));
    }

    /**
     * Share of engines flagging the file as malicious, scaled to [0,100].
     */
    double extractScore(String body) throws ReputationLookupException {
        JsonNode stats;
        try {
            stats = om.readTree(body).path("data").path("attributes").path("last_analysis_stats");
        } catch (IOException e) {
            throw new ReputationLookupException("Unreadable VirusTotal response", e);
        }
        if (!stats.isObject()) {
            throw new ReputationLookupException("VirusTotal response has no last_analysis_stats");
        }
        long total = 0;
        for (JsonNode count : stats) {
            total += count.asLong(0);
        }
        if (total == 0) {
            return 0.0;
        }
        return 100.0 * stats.path("malicious").asLong(0) / total;
    }
}
