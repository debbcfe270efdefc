package com.example.PhishGuard.service;

import com.example.PhishGuard.exceptions.ModelUnavailableException;
import com.example.PhishGuard.ml.LogisticRegressionModel;
import com.example.PhishGuard.ml.TfidfVectorizer;
import com.example.PhishGuard.models.ClassificationResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.availability.AvailabilityChangeEvent;
import org.springframework.boot.availability.ReadinessState;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Spam/ham inference over the pre-trained vectorizer and classifier.
 * <p>
 * Artifacts are read once at construction and never mutated, so concurrent {@link #classify}
 * calls share them without locking. A load failure does not stop the application: the error is
 * kept for {@code /health}, readiness is refused, and every classification attempt fails with
 * {@link ModelUnavailableException}.
 */
@Service
public class ClassificationEngine {
    private static final Logger logger = LoggerFactory.getLogger(ClassificationEngine.class);

    private final TfidfVectorizer vectorizer;
    private final LogisticRegressionModel model;
    private final String loadError;

    @Autowired
    public ClassificationEngine(ResourceLoader resourceLoader,
                                @Value("${MODELS_DIR:classpath:models}") String modelsDir,
                                @Value("${VECTORIZER_FILENAME:tfidf_vectorizer.json}") String vectorizerFilename,
                                @Value("${MODEL_FILENAME:spam_classifier_model.json}") String modelFilename) {
        this(resourceLoader.getResource(join(modelsDir, vectorizerFilename)),
                resourceLoader.getResource(join(modelsDir, modelFilename)));
    }

    public ClassificationEngine(Resource vectorizerResource, Resource modelResource) {
        TfidfVectorizer loadedVectorizer = null;
        LogisticRegressionModel loadedModel = null;
        String error = null;
        try {
            ObjectMapper om = new ObjectMapper();
            logger.info("Loading TF-IDF vectorizer from {}", vectorizerResource.getDescription());
            loadedVectorizer = TfidfVectorizer.fromJson(readArtifact(om, vectorizerResource));
            logger.info("Loading spam classifier model from {}", modelResource.getDescription());
            loadedModel = LogisticRegressionModel.fromJson(readArtifact(om, modelResource));
            if (loadedModel.featureCount() != loadedVectorizer.featureCount()) {
                throw new IOException("Classifier expects " + loadedModel.featureCount()
                        + " features but vectorizer produces " + loadedVectorizer.featureCount());
            }
            logger.info("Models loaded successfully ({} features)", loadedVectorizer.featureCount());
        } catch (IOException | RuntimeException e) {
            error = e.getMessage();
            loadedVectorizer = null;
            loadedModel = null;
            logger.error("Failed to load models: {}", error, e);
        }
        this.vectorizer = loadedVectorizer;
        this.model = loadedModel;
        this.loadError = error;
    }

    public static ClassificationEngine fromDirectory(String modelsDir) {
        ResourceLoader loader = new DefaultResourceLoader();
        return new ClassificationEngine(loader.getResource(join(modelsDir, "tfidf_vectorizer.json")),
                loader.getResource(join(modelsDir, "spam_classifier_model.json")));
    }

    public boolean isLoaded() {
        return loadError == null;
    }

    public String getLoadError() {
        return loadError;
    }

    /**
     * Classifies subject and body as a single text unit.
     *
     * @throws ModelUnavailableException if the artifacts did not load at startup
     */
    public ClassificationResult classify(String subject, String body) {
        if (!isLoaded()) {
            throw new ModelUnavailableException("Models not loaded: " + loadError);
        }
        String text = (subject + " " + body).strip();
        Map<Integer, Double> features = vectorizer.transform(text);
        ClassificationResult result = ClassificationResult.ofSpamProbability(model.spamProbability(features));
        logger.info("Prediction: {} (confidence: {})", result.verdict().label(),
                String.format("%.2f%%", result.confidence() * 100));
        return result;
    }

    /**
     * Keeps the instance out of rotation when the model is missing.
     */
    @EventListener
    public void onReadinessChange(AvailabilityChangeEvent<ReadinessState> event) {
        if (event.getState() == ReadinessState.ACCEPTING_TRAFFIC && !isLoaded()
                && event.getSource() instanceof ApplicationEventPublisher publisher) {
            logger.error("Refusing traffic: models not loaded ({})", loadError);
            AvailabilityChangeEvent.publish(publisher, this, ReadinessState.REFUSING_TRAFFIC);
        }
    }

    private static JsonNode readArtifact(ObjectMapper om, Resource resource) throws IOException {
        if (!resource.exists()) {
            throw new FileNotFoundException("Model artifact not found: " + resource.getDescription());
        }
        try (InputStream in = resource.getInputStream()) {
            return om.readTree(in);
        }
    }

    private static String join(String dir, String filename) {
        return dir.endsWith("/") ? dir + filename : dir + "/" + filename;
    }
}
