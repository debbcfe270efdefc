package com.example.PhishGuard.service;

import com.example.PhishGuard.exceptions.ModelUnavailableException;
import com.example.PhishGuard.models.ClassificationResult;
import com.example.PhishGuard.models.Verdict;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ClassificationEngine")
class ClassificationEngineTest {

    private static ClassificationEngine engine;

    @BeforeAll
    static void loadModels() {
        engine = ClassificationEngine.fromDirectory("classpath:models");
    }

    @Test
    @DisplayName("Loads the bundled artifacts")
    void loadsBundledArtifacts() {
        assertThat(engine.isLoaded()).isTrue();
        assertThat(engine.getLoadError()).isNull();
    }

    @Test
    @DisplayName("Flags a credential phishing email as spam")
    void phishingIsSpam() {
        ClassificationResult result = engine.classify("URGENT: Verify your account",
                "Click here to confirm your password or your account will be suspended");

        assertThat(result.verdict()).isEqualTo(Verdict.SPAM);
        assertThat(result.spamProbability()).isGreaterThan(0.5);
        assertThat(result.confidence()).isEqualTo(result.spamProbability());
    }

    @Test
    @DisplayName("Lets an ordinary colleague email through as ham")
    void ordinaryEmailIsHam() {
        ClassificationResult result = engine.classify("Lunch tomorrow?",
                "Hi Sam, are we still on for lunch tomorrow at noon? Let me know.");

        assertThat(result.verdict()).isEqualTo(Verdict.HAM);
        assertThat(result.hamProbability()).isGreaterThan(0.5);
        assertThat(result.confidence()).isEqualTo(result.hamProbability());
    }

    @Test
    @DisplayName("Probabilities are complementary and within [0,1]")
    void probabilitiesSumToOne() {
        List<String[]> samples = List.of(
                new String[]{"Winner", "You have won a free prize, claim now"},
                new String[]{"Meeting notes", "Attached are the notes from the project meeting"},
                new String[]{"zzqx", "qwfp ghjk"},
                new String[]{"Ünïcödé", "Grüße aus München"});
        for (String[] sample : samples) {
            ClassificationResult result = engine.classify(sample[0], sample[1]);
            assertThat(result.spamProbability()).isBetween(0.0, 1.0);
            assertThat(result.hamProbability()).isBetween(0.0, 1.0);
            assertThat(result.spamProbability() + result.hamProbability()).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    @DisplayName("Text with no known vocabulary falls back to the intercept")
    void unknownVocabularyUsesIntercept() {
        ClassificationResult result = engine.classify("zzqx", "qwfp ghjk");

        assertThat(result.spamProbability()).isCloseTo(1.0 / (1.0 + Math.exp(0.35)), within(1e-6));
        assertThat(result.verdict()).isEqualTo(Verdict.HAM);
    }

    @Test
    @DisplayName("Same input always yields the same probabilities")
    void deterministic() {
        ClassificationResult first = engine.classify("Invoice", "Please find the invoice attached");
        ClassificationResult second = engine.classify("Invoice", "Please find the invoice attached");

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Missing artifacts leave the engine unavailable instead of failing startup")
    void missingArtifacts(@TempDir Path dir) {
        ClassificationEngine missing = ClassificationEngine.fromDirectory("file:" + dir.toAbsolutePath());

        assertThat(missing.isLoaded()).isFalse();
        assertThat(missing.getLoadError()).contains("tfidf_vectorizer.json");
        assertThatThrownBy(() -> missing.classify("subject", "body"))
                .isInstanceOf(ModelUnavailableException.class)
                .hasMessageStartingWith("Models not loaded");
    }

    @Test
    @DisplayName("Corrupt artifacts leave the engine unavailable")
    void corruptArtifacts(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("tfidf_vectorizer.json"), "{not json", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("spam_classifier_model.json"), "{}", StandardCharsets.UTF_8);

        ClassificationEngine corrupt = ClassificationEngine.fromDirectory("file:" + dir.toAbsolutePath());

        assertThat(corrupt.isLoaded()).isFalse();
        assertThatThrownBy(() -> corrupt.classify("subject", "body")).isInstanceOf(ModelUnavailableException.class);
    }
}
