package com.example.PhishGuard.models;

/**
 * Paging and filtering for the report list. Results are always newest first.
 */
public record ReportQuery(int skip, int limit, Verdict prediction, String sha256) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    public static ReportQuery firstPage() {
        return new ReportQuery(0, DEFAULT_LIMIT, null, null);
    }

    public boolean isDefault() {
        return skip == 0 && limit == DEFAULT_LIMIT && prediction == null && sha256 == null;
    }

    /**
     * Stable cache key suffix; the default query maps to the bare "all" view.
     */
    public String cacheKey() {
        if (isDefault()) {
            return "all";
        }
        StringBuilder key = new StringBuilder("all?skip=").append(skip).append("&limit=").append(limit);
        if (prediction != null) {
            key.append("&prediction=").append(prediction.label());
        }
        if (sha256 != null) {
            key.append("&sha256=").append(sha256);
        }
        return key.toString();
    }
}
