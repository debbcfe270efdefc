package com.example.PhishGuard.ml;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Map;

/**
 * Binary logistic regression over tf-idf features. Class order is [ham, spam],
 * so the decision function yields the spam log-odds.
 */
public final class LogisticRegressionModel {
    private final double[] coefficients;
    private final double intercept;

    LogisticRegressionModel(double[] coefficients, double intercept) {
        this.coefficients = coefficients.clone();
        this.intercept = intercept;
    }

    public static LogisticRegressionModel fromJson(JsonNode root) throws IOException {
        String type = root.path("type").asText("logistic_regression");
        if (!"logistic_regression".equals(type)) {
            throw new IOException("Unsupported classifier type: " + type);
        }
        JsonNode classes = root.path("classes");
        if (classes.isArray() && classes.size() == 2
                && !("ham".equals(classes.get(0).asText()) && "spam".equals(classes.get(1).asText()))) {
            throw new IOException("Classifier classes must be ordered [ham, spam]");
        }
        JsonNode coefNode = root.path("coef");
        if (!coefNode.isArray() || coefNode.isEmpty()) {
            throw new IOException("Classifier artifact must contain a non-empty 'coef' array");
        }
        double[] coefficients = new double[coefNode.size()];
        for (int i = 0; i < coefficients.length; i++) {
            coefficients[i] = coefNode.get(i).asDouble();
        }
        return new LogisticRegressionModel(coefficients, root.path("intercept").asDouble(0.0));
    }

    public int featureCount() {
        return coefficients.length;
    }

    public double spamProbability(Map<Integer, Double> features) {
        double logit = intercept;
        for (Map.Entry<Integer, Double> feature : features.entrySet()) {
            logit += coefficients[feature.getKey()] * feature.getValue();
        }
        return 1.0 / (1.0 + Math.exp(-logit));
    }
}
