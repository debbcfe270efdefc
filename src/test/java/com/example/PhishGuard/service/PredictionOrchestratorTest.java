package com.example.PhishGuard.service;

import com.example.PhishGuard.dto.AttachmentDto;
import com.example.PhishGuard.exceptions.ModelUnavailableException;
import com.example.PhishGuard.exceptions.PersistenceUnavailableException;
import com.example.PhishGuard.exceptions.ValidationException;
import com.example.PhishGuard.models.AttachmentRecord;
import com.example.PhishGuard.models.ClassificationResult;
import com.example.PhishGuard.models.EmailSubmission;
import com.example.PhishGuard.models.PredictionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PredictionOrchestrator")
class PredictionOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ClassificationEngine classificationEngine;

    @Mock
    private AttachmentAnalyzer attachmentAnalyzer;

    @Mock
    private PersistenceManager persistenceManager;

    @Mock
    private CacheManager cacheManager;

    private PredictionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new PredictionOrchestrator(classificationEngine, attachmentAnalyzer, persistenceManager,
                cacheManager, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Persists the verdict, then drops cached report lists")
    void submitPersistsThenInvalidates() {
        when(classificationEngine.classify("Verify your account", "Click here"))
                .thenReturn(ClassificationResult.ofSpamProbability(0.93));
        when(attachmentAnalyzer.analyzeAll(anyList())).thenReturn(List.of());
        when(persistenceManager.insert(any(PredictionRecord.class)))
                .thenAnswer(invocation -> invocation.<PredictionRecord>getArgument(0).withId("65f1c0ffee0123456789abcd"));

        PredictionRecord saved = orchestrator.submit(new EmailSubmission("  Verify your account ", "Click here\n", null));

        assertThat(saved.getId()).isEqualTo("65f1c0ffee0123456789abcd");
        assertThat(saved.getSubject()).isEqualTo("Verify your account");
        assertThat(saved.getBody()).isEqualTo("Click here");
        assertThat(saved.getPrediction()).isEqualTo("spam");
        assertThat(saved.getConfidence()).isEqualTo(0.93);
        assertThat(saved.getSpamProbability() + saved.getHamProbability()).isCloseTo(1.0, within(1e-12));
        assertThat(saved.getTimestamp()).isEqualTo(NOW);

        InOrder order = inOrder(persistenceManager, cacheManager);
        order.verify(persistenceManager).insert(any(PredictionRecord.class));
        order.verify(cacheManager).invalidatePrefix(CacheManager.LIST_KEY_PREFIX);
    }

    @Test
    @DisplayName("Attachment records are stored in submission order")
    void attachmentsInOrder() {
        List<AttachmentDto> uploads = List.of(
                new AttachmentDto("one.txt", "text/plain", "1".getBytes(StandardCharsets.UTF_8)),
                new AttachmentDto("two.txt", "text/plain", "2".getBytes(StandardCharsets.UTF_8)));
        List<AttachmentRecord> analyzed = List.of(
                new AttachmentRecord("one.txt", "text/plain", 1, "1".repeat(64), 0),
                new AttachmentRecord("two.txt", "text/plain", 1, "2".repeat(64), 0));
        when(classificationEngine.classify(anyString(), anyString()))
                .thenReturn(ClassificationResult.ofSpamProbability(0.1));
        when(attachmentAnalyzer.analyzeAll(uploads)).thenReturn(analyzed);
        when(persistenceManager.insert(any(PredictionRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));

        orchestrator.submit(new EmailSubmission("Files", "See attached", uploads));

        ArgumentCaptor<PredictionRecord> stored = ArgumentCaptor.forClass(PredictionRecord.class);
        verify(persistenceManager).insert(stored.capture());
        assertThat(stored.getValue().getAttachments()).extracting(AttachmentRecord::getFilename)
                .containsExactly("one.txt", "two.txt");
        assertThat(stored.getValue().getPrediction()).isEqualTo("ham");
    }

    @Test
    @DisplayName("Blank fields are rejected before any work is done")
    void rejectsBlankFields() {
        assertThatThrownBy(() -> orchestrator.submit(new EmailSubmission("   ", "body", null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("subject");
        assertThatThrownBy(() -> orchestrator.submit(new EmailSubmission("subject", "\t\n", null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("body");
        assertThatThrownBy(() -> orchestrator.submit(null))
                .isInstanceOf(ValidationException.class);

        verifyNoInteractions(classificationEngine, attachmentAnalyzer, persistenceManager, cacheManager);
    }

    @Test
    @DisplayName("Unavailable model fails the submission without writing")
    void modelUnavailable() {
        when(classificationEngine.classify(anyString(), anyString()))
                .thenThrow(new ModelUnavailableException("Models not loaded"));

        assertThatThrownBy(() -> orchestrator.submit(new EmailSubmission("subject", "body", null)))
                .isInstanceOf(ModelUnavailableException.class);

        verifyNoInteractions(persistenceManager, cacheManager);
    }

    @Test
    @DisplayName("Failed write propagates and leaves the cache untouched")
    void persistenceFailure() {
        when(classificationEngine.classify(anyString(), anyString()))
                .thenReturn(ClassificationResult.ofSpamProbability(0.7));
        when(attachmentAnalyzer.analyzeAll(anyList())).thenReturn(List.of());
        when(persistenceManager.insert(any(PredictionRecord.class)))
                .thenThrow(new PersistenceUnavailableException("Prediction store unavailable",
                        new DataAccessResourceFailureException("connection refused")));

        assertThatThrownBy(() -> orchestrator.submit(new EmailSubmission("subject", "body", null)))
                .isInstanceOf(PersistenceUnavailableException.class);

        verify(cacheManager, never()).invalidatePrefix(anyString());
    }
}
