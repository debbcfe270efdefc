package com.example.PhishGuard.ml;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only term-frequency / inverse-document-frequency transform fitted offline.
 * <p>
 * Mirrors the fitted vectorizer exported by the training pipeline: the vocabulary maps each
 * term to a feature index, {@code idf} holds the learned weight per index. Tokens outside the
 * vocabulary contribute nothing.
 */
public final class TfidfVectorizer {
    static final String DEFAULT_TOKEN_PATTERN = "\\b\\w\\w+\\b";

    private final Map<String, Integer> vocabulary;
    private final double[] idf;
    private final boolean lowercase;
    private final boolean sublinearTf;
    private final boolean l2Normalize;
    private final Pattern tokenPattern;

    TfidfVectorizer(Map<String, Integer> vocabulary, double[] idf, boolean lowercase,
                    boolean sublinearTf, boolean l2Normalize, String tokenPattern) {
        this.vocabulary = Collections.unmodifiableMap(new HashMap<>(vocabulary));
        this.idf = idf.clone();
        this.lowercase = lowercase;
        this.sublinearTf = sublinearTf;
        this.l2Normalize = l2Normalize;
        this.tokenPattern = Pattern.compile(tokenPattern, Pattern.UNICODE_CHARACTER_CLASS);
        for (int index : this.vocabulary.values()) {
            if (index < 0 || index >= this.idf.length) {
                throw new IllegalArgumentException("Vocabulary index " + index + " outside idf range " + this.idf.length);
            }
        }
    }

    public static TfidfVectorizer fromJson(JsonNode root) throws IOException {
        JsonNode vocabularyNode = root.path("vocabulary");
        JsonNode idfNode = root.path("idf");
        if (!vocabularyNode.isObject() || !idfNode.isArray()) {
            throw new IOException("Vectorizer artifact must contain a 'vocabulary' object and an 'idf' array");
        }
        Map<String, Integer> vocabulary = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = vocabularyNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            vocabulary.put(entry.getKey(), entry.getValue().asInt());
        }
        double[] idf = new double[idfNode.size()];
        for (int i = 0; i < idf.length; i++) {
            idf[i] = idfNode.get(i).asDouble();
        }
        String norm = root.path("norm").asText("l2");
        try {
            return new TfidfVectorizer(
                    vocabulary,
                    idf,
                    root.path("lowercase").asBoolean(true),
                    root.path("sublinear_tf").asBoolean(false),
                    "l2".equals(norm),
                    root.path("token_pattern").asText(DEFAULT_TOKEN_PATTERN)
            );
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid vectorizer artifact: " + e.getMessage(), e);
        }
    }

    public int featureCount() {
        return idf.length;
    }

    /**
     * Sparse tf-idf vector for one document, keyed by feature index.
     */
    public Map<Integer, Double> transform(String text) {
        Map<Integer, Double> counts = new HashMap<>();
        String source = lowercase ? text.toLowerCase(Locale.ROOT) : text;
        Matcher matcher = tokenPattern.matcher(source);
        while (matcher.find()) {
            Integer index = vocabulary.get(matcher.group());
            if (index != null) {
                counts.merge(index, 1.0, Double::sum);
            }
        }

        double squaredNorm = 0.0;
        for (Map.Entry<Integer, Double> entry : counts.entrySet()) {
            double tf = sublinearTf ? 1.0 + Math.log(entry.getValue()) : entry.getValue();
            double weight = tf * idf[entry.getKey()];
            entry.setValue(weight);
            squaredNorm += weight * weight;
        }
        if (l2Normalize && squaredNorm > 0.0) {
            double norm = Math.sqrt(squaredNorm);
            counts.replaceAll((index, weight) -> weight / norm);
        }
        return counts;
    }
}
