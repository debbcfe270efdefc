package com.example.PhishGuard.models;

/**
 * Class probabilities for one email. {@code hamProbability} is always {@code 1 - spamProbability}.
 */
public record ClassificationResult(double spamProbability, double hamProbability) {

    public static final double SPAM_THRESHOLD = 0.5;

    public static ClassificationResult ofSpamProbability(double spamProbability) {
        double clamped = Math.max(0.0, Math.min(1.0, spamProbability));
        return new ClassificationResult(clamped, 1.0 - clamped);
    }

    public Verdict verdict() {
        return spamProbability >= SPAM_THRESHOLD ? Verdict.SPAM : Verdict.HAM;
    }

    public double confidence() {
        return verdict() == Verdict.SPAM ? spamProbability : hamProbability;
    }
}
