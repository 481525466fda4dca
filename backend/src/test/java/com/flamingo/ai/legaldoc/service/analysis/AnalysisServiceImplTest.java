package com.flamingo.ai.legaldoc.service.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.legaldoc.config.LegalAnalysisProperties;
import com.flamingo.ai.legaldoc.exception.CollaboratorUnavailableException;
import com.flamingo.ai.legaldoc.exception.DocumentValidationException;
import com.flamingo.ai.legaldoc.exception.JobNotFoundException;
import com.flamingo.ai.legaldoc.service.analysis.AnalysisService.AnalyzedDocument;
import com.flamingo.ai.legaldoc.service.analysis.model.AnalysisResult;
import com.flamingo.ai.legaldoc.service.document.AnalysisRecorder;
import com.flamingo.ai.legaldoc.service.job.JobStatus;
import com.flamingo.ai.legaldoc.service.job.JobTracker;
import com.flamingo.ai.legaldoc.service.job.PdfAnalysisJobRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.mock.web.MockMultipartFile;

@ExtendWith(MockitoExtension.class)
@DisplayName("AnalysisServiceImpl Tests")
class AnalysisServiceImplTest {

  @Mock private DocumentAnalysisOrchestrator orchestrator;
  @Mock private AnalysisRecorder analysisRecorder;
  @Mock private PdfAnalysisJobRunner pdfAnalysisJobRunner;

  private JobTracker jobTracker;
  private LegalAnalysisProperties properties;
  private AnalysisServiceImpl analysisService;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(AnalysisFixtures.PROCESSED_AT, ZoneOffset.UTC);
    jobTracker = new JobTracker(new SimpleMeterRegistry(), clock);
    properties = new LegalAnalysisProperties();
    analysisService =
        new AnalysisServiceImpl(
            orchestrator, analysisRecorder, jobTracker, pdfAnalysisJobRunner, properties, clock);
  }

  @Test
  void shouldReturnAnalysisAndDocumentId_whenTextAnalyzed() {
    AnalysisResult result = AnalysisFixtures.contractResult();
    UUID documentId = UUID.randomUUID();
    when(orchestrator.analyze("contract text")).thenReturn(result);
    when(analysisRecorder.recordSuccess(any(), eq(result), any()))
        .thenReturn(Optional.of(documentId));

    AnalyzedDocument analyzed = analysisService.analyzeText("contract text");

    assertThat(analyzed.result()).isSameAs(result);
    assertThat(analyzed.documentId()).isEqualTo(documentId);
  }

  @Test
  @DisplayName("Should record the failure and rethrow when a collaborator is down")
  void shouldRecordFailure_whenCollaboratorUnavailable() {
    when(orchestrator.analyze(anyString()))
        .thenThrow(new CollaboratorUnavailableException("summarization", "down"));

    assertThatThrownBy(() -> analysisService.analyzeText("contract text"))
        .isInstanceOf(CollaboratorUnavailableException.class);
    verify(analysisRecorder).recordFailure(any(), eq("down"));
    verify(analysisRecorder, never()).recordSuccess(any(), any(), any());
  }

  @Test
  @DisplayName("Should register a STARTING job and hand the bytes to the runner")
  void shouldStartJob_whenPdfValid() {
    MockMultipartFile file =
        new MockMultipartFile("file", "contract.pdf", "application/pdf", "%PDF-1.4".getBytes());

    String jobId = analysisService.submitPdf(file);

    assertThat(jobTracker.query(jobId).orElseThrow().status()).isEqualTo(JobStatus.STARTING);
    verify(pdfAnalysisJobRunner).runAsync(eq(jobId), eq("contract.pdf"), any(byte[].class));
  }

  @Test
  @DisplayName("Should fail the job and report 503 when the executor rejects it")
  void shouldFailJob_whenExecutorRejectsSubmission() {
    MockMultipartFile file =
        new MockMultipartFile("file", "contract.pdf", "application/pdf", "%PDF-1.4".getBytes());
    doThrow(new TaskRejectedException("queue full"))
        .when(pdfAnalysisJobRunner)
        .runAsync(anyString(), anyString(), any(byte[].class));

    assertThatThrownBy(() -> analysisService.submitPdf(file))
        .isInstanceOf(CollaboratorUnavailableException.class)
        .satisfies(
            e ->
                assertThat(((CollaboratorUnavailableException) e).getCollaborator())
                    .isEqualTo(AnalysisServiceImpl.EXECUTOR));

    Map<JobStatus, Long> counts = jobTracker.countByStatus();
    assertThat(counts.get(JobStatus.STARTING)).isZero();
    assertThat(counts.get(JobStatus.ERROR)).isEqualTo(1L);
  }

  @Test
  void shouldAcceptUpperCasePdfExtension() {
    MockMultipartFile file =
        new MockMultipartFile("file", "CONTRACT.PDF", "application/pdf", "%PDF-1.4".getBytes());

    assertThat(analysisService.submitPdf(file)).isNotBlank();
  }

  @Test
  void shouldRejectNonPdfUpload() {
    MockMultipartFile file =
        new MockMultipartFile("file", "contract.docx", "application/msword", "data".getBytes());

    assertThatThrownBy(() -> analysisService.submitPdf(file))
        .isInstanceOf(DocumentValidationException.class)
        .extracting(e -> ((DocumentValidationException) e).getUserMessage())
        .isEqualTo("Only PDF files are supported");
    verifyNoInteractions(pdfAnalysisJobRunner);
    assertThat(jobTracker.countByStatus().get(JobStatus.STARTING)).isZero();
  }

  @Test
  void shouldRejectEmptyUpload() {
    MockMultipartFile file =
        new MockMultipartFile("file", "contract.pdf", "application/pdf", new byte[0]);

    assertThatThrownBy(() -> analysisService.submitPdf(file))
        .isInstanceOf(DocumentValidationException.class);
    verifyNoInteractions(pdfAnalysisJobRunner);
  }

  @Test
  void shouldRejectMissingUpload() {
    assertThatThrownBy(() -> analysisService.submitPdf(null))
        .isInstanceOf(DocumentValidationException.class);
  }

  @Test
  void shouldRejectOversizedUpload() {
    properties.getUpload().setMaxFileSizeBytes(4);
    MockMultipartFile file =
        new MockMultipartFile("file", "contract.pdf", "application/pdf", "%PDF-1.4".getBytes());

    assertThatThrownBy(() -> analysisService.submitPdf(file))
        .isInstanceOf(DocumentValidationException.class)
        .hasMessageContaining("File too large");
  }

  @Test
  void shouldThrowJobNotFound_whenTaskUnknown() {
    assertThatThrownBy(() -> analysisService.getJob("unknown"))
        .isInstanceOf(JobNotFoundException.class);
  }
}
