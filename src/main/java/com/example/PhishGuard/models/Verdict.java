package com.example.PhishGuard.models;

import java.util.Locale;

public enum Verdict {
    SPAM("spam"),
    HAM("ham");

    private final String label;

    Verdict(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Verdict fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Verdict label is required");
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (Verdict verdict : values()) {
            if (verdict.label.equals(normalized)) {
                return verdict;
            }
        }
        throw new IllegalArgumentException("Unknown verdict: " + label);
    }
}
