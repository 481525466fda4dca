package com.flamingo.ai.legaldoc.service.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.flamingo.ai.legaldoc.domain.entity.Document;
import com.flamingo.ai.legaldoc.domain.entity.DocumentAnalysis;
import com.flamingo.ai.legaldoc.domain.entity.ExtractedClause;
import com.flamingo.ai.legaldoc.domain.entity.ExtractedEntity;
import com.flamingo.ai.legaldoc.domain.enums.DocumentStatus;
import com.flamingo.ai.legaldoc.domain.enums.DocumentType;
import com.flamingo.ai.legaldoc.domain.enums.RiskLevel;
import com.flamingo.ai.legaldoc.domain.repository.DocumentRepository;
import com.flamingo.ai.legaldoc.exception.DocumentNotFoundException;
import com.flamingo.ai.legaldoc.service.analysis.AnalysisFixtures;
import com.flamingo.ai.legaldoc.service.analysis.model.AnalysisResult;
import com.flamingo.ai.legaldoc.service.analysis.model.RawDocument;
import com.flamingo.ai.legaldoc.service.risk.RiskAssessor;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DocumentServiceImplTest {

  @Mock private DocumentRepository documentRepository;

  private DocumentServiceImpl documentService;

  @BeforeEach
  void setUp() {
    documentService = new DocumentServiceImpl(documentRepository, new RiskAssessor());
  }

  @Test
  void shouldStoreAnalysisWithEntitiesClausesAndRisk() {
    when(documentRepository.save(any(Document.class))).thenAnswer(inv -> inv.getArgument(0));
    AnalysisResult result = AnalysisFixtures.contractResult();

    Document saved =
        documentService.saveAnalysis(
            RawDocument.ofText(AnalysisFixtures.CONTRACT_TEXT), result, Duration.ofMillis(1500));

    assertThat(saved.getStatus()).isEqualTo(DocumentStatus.COMPLETED);
    assertThat(saved.getFileType()).isEqualTo("TXT");
    assertThat(saved.getProcessingDuration()).isEqualTo(1.5);
    assertThat(saved.getWordCount()).isEqualTo(1000);
    assertThat(saved.getCharacterCount()).isEqualTo(AnalysisFixtures.CONTRACT_TEXT.length());
    assertThat(saved.getFileHash()).hasSize(64);

    assertThat(saved.getAnalysis().getPredictedType()).isEqualTo(DocumentType.CONTRACT);
    assertThat(saved.getAnalysis().getDocument()).isSameAs(saved);
    assertThat(saved.getAnalysis().getClassificationScores()).containsEntry("contract", 1.0);
    assertThat(saved.getAnalysis().getExecutiveSummary()).isEqualTo(result.summary());

    // 2 ORG + 1 DATE + 1 MONEY + 1 GPE + 2 monetary_amounts
    assertThat(saved.getEntities()).hasSize(7);
    assertThat(saved.getEntities())
        .filteredOn(entity -> entity.getEntityType().equals("monetary_amounts"))
        .extracting(ExtractedEntity::getExtractionMethod)
        .containsOnly(ExtractedEntity.METHOD_REGEX);
    assertThat(saved.getClauses())
        .extracting(ExtractedClause::getClauseType)
        .containsExactly(
            "the effective date", "Who are the parties", "the payment terms", "the governing law");
    assertThat(saved.getRisks())
        .singleElement()
        .satisfies(risk -> assertThat(risk.getRiskLevel()).isEqualTo(RiskLevel.LOW));
  }

  @Test
  void shouldRejectSecondAnalysisForSameDocument() {
    when(documentRepository.save(any(Document.class))).thenAnswer(inv -> inv.getArgument(0));
    Document saved =
        documentService.saveAnalysis(
            RawDocument.ofText("text"), AnalysisFixtures.contractResult(), Duration.ZERO);

    assertThatThrownBy(() -> saved.attachAnalysis(DocumentAnalysis.builder().build()))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void shouldStoreFailureWithoutAnalysis() {
    when(documentRepository.save(any(Document.class))).thenAnswer(inv -> inv.getArgument(0));

    Document saved =
        documentService.saveFailure(
            RawDocument.ofFile("", "scan.pdf", new byte[] {1, 2, 3}),
            "Could not extract text from PDF");

    assertThat(saved.getStatus()).isEqualTo(DocumentStatus.FAILED);
    assertThat(saved.getFileType()).isEqualTo("PDF");
    assertThat(saved.getFileSize()).isEqualTo(3L);
    assertThat(saved.getErrorMessage()).isEqualTo("Could not extract text from PDF");
    assertThat(saved.getAnalysis()).isNull();
    assertThat(saved.getEntities()).isEmpty();
  }

  @Test
  void shouldThrowDocumentNotFound_whenIdUnknown() {
    UUID id = UUID.randomUUID();
    when(documentRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> documentService.getDocument(id))
        .isInstanceOf(DocumentNotFoundException.class)
        .hasMessageContaining(id.toString());
  }

  @Test
  void shouldAverageClassificationAndClauseConfidence() {
    // classification 1.0 and four clauses at 0.8
    assertThat(DocumentServiceImpl.confidenceScore(AnalysisFixtures.contractResult()))
        .isEqualTo(0.84);
  }
}
