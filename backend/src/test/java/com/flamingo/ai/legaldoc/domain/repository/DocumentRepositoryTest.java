package com.flamingo.ai.legaldoc.domain.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.legaldoc.domain.entity.Document;
import com.flamingo.ai.legaldoc.domain.entity.DocumentAnalysis;
import com.flamingo.ai.legaldoc.domain.entity.ExtractedClause;
import com.flamingo.ai.legaldoc.domain.entity.ExtractedEntity;
import com.flamingo.ai.legaldoc.domain.entity.RiskAssessment;
import com.flamingo.ai.legaldoc.domain.enums.DocumentStatus;
import com.flamingo.ai.legaldoc.domain.enums.DocumentType;
import com.flamingo.ai.legaldoc.domain.enums.RiskLevel;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;

@DataJpaTest
@DisplayName("Document persistence Tests")
class DocumentRepositoryTest {

  @Autowired private TestEntityManager entityManager;
  @Autowired private DocumentRepository documentRepository;
  @Autowired private DocumentAnalysisRepository documentAnalysisRepository;

  @Test
  @DisplayName("Should store the whole analysis hierarchy with one save")
  void shouldCascadeAnalysisHierarchy() {
    Document document = completedDocument("hash-1");
    Map<String, Double> scores = new LinkedHashMap<>();
    scores.put("contract", 1.0);
    scores.put("license", 0.25);
    document.attachAnalysis(analysis(scores));
    document.addEntity(
        ExtractedEntity.builder()
            .entityType("ORG")
            .entityText("Acme Corp")
            .entityCategory("legal_entity")
            .position(0)
            .extractionMethod(ExtractedEntity.METHOD_NER)
            .build());
    document.addClause(
        ExtractedClause.builder()
            .clauseType("the governing law")
            .clauseText("the laws of Ohio")
            .confidenceScore(0.91)
            .questionUsed("What is the governing law?")
            .build());
    document.addRiskAssessment(
        RiskAssessment.builder()
            .financialRisk(20.0)
            .legalRisk(0.0)
            .operationalRisk(0.0)
            .complianceRisk(50.0)
            .overallRisk(17.5)
            .riskLevel(RiskLevel.LOW)
            .riskFactors(List.of("No dates identified"))
            .assessmentTimestamp(LocalDateTime.now())
            .build());

    UUID id = documentRepository.saveAndFlush(document).getId();
    entityManager.clear();

    Document reloaded = documentRepository.findById(id).orElseThrow();
    assertThat(reloaded.getUploadTimestamp()).isNotNull();
    assertThat(reloaded.getAnalysis().getPredictedType()).isEqualTo(DocumentType.CONTRACT);
    assertThat(reloaded.getAnalysis().getClassificationScores())
        .containsExactly(Map.entry("contract", 1.0), Map.entry("license", 0.25));
    assertThat(reloaded.getEntities())
        .extracting(ExtractedEntity::getEntityText)
        .containsExactly("Acme Corp");
    assertThat(reloaded.getEntities().get(0).getCreatedAt()).isNotNull();
    assertThat(reloaded.getClauses().get(0).getExtractionMethod())
        .isEqualTo(ExtractedClause.METHOD_QA);
    assertThat(reloaded.getRisks().get(0).getRiskFactors()).containsExactly("No dates identified");
    assertThat(documentAnalysisRepository.findByDocumentId(id)).isPresent();
  }

  @Test
  @DisplayName("A document should have at most one analysis row")
  void shouldRejectSecondAnalysisRow() {
    Document document = completedDocument("hash-2");
    document.attachAnalysis(analysis(Map.of("contract", 1.0)));
    Document saved = documentRepository.saveAndFlush(document);

    DocumentAnalysis duplicate = analysis(Map.of("contract", 0.5));
    duplicate.setDocument(saved);

    assertThatThrownBy(() -> documentAnalysisRepository.saveAndFlush(duplicate))
        .isInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void shouldFindEarlierSubmissionsByHashAndCountByStatus() {
    documentRepository.save(completedDocument("same-hash"));
    Document failed = completedDocument("same-hash");
    failed.markFailed("Could not extract text from PDF");
    documentRepository.save(failed);
    documentRepository.saveAndFlush(completedDocument("other-hash"));

    assertThat(documentRepository.findByFileHashOrderByUploadTimestampDesc("same-hash"))
        .hasSize(2);
    assertThat(documentRepository.countByStatus(DocumentStatus.COMPLETED)).isEqualTo(2);
    assertThat(documentRepository.countByStatus(DocumentStatus.FAILED)).isEqualTo(1);
  }

  private static Document completedDocument(String hash) {
    Document document =
        Document.builder()
            .originalFilename("contract.pdf")
            .fileType("PDF")
            .fileSize(1024L)
            .fileHash(hash)
            .extractedText("This Agreement ...")
            .wordCount(3)
            .characterCount(18)
            .build();
    document.markCompleted(0.5);
    return document;
  }

  private static DocumentAnalysis analysis(Map<String, Double> scores) {
    return DocumentAnalysis.builder()
        .predictedType(DocumentType.CONTRACT)
        .classificationConfidence(1.0)
        .classificationScores(scores)
        .executiveSummary("A contract.")
        .analysisTimestamp(LocalDateTime.now())
        .confidenceScore(0.9)
        .overallRiskScore(17.5)
        .complexityScore(1.0)
        .build();
  }
}
