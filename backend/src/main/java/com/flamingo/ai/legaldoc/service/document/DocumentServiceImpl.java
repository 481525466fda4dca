package com.flamingo.ai.legaldoc.service.document;

import com.flamingo.ai.legaldoc.domain.entity.Document;
import com.flamingo.ai.legaldoc.domain.entity.DocumentAnalysis;
import com.flamingo.ai.legaldoc.domain.entity.ExtractedClause;
import com.flamingo.ai.legaldoc.domain.entity.ExtractedEntity;
import com.flamingo.ai.legaldoc.domain.entity.RiskAssessment;
import com.flamingo.ai.legaldoc.domain.repository.DocumentRepository;
import com.flamingo.ai.legaldoc.exception.DocumentNotFoundException;
import com.flamingo.ai.legaldoc.service.analysis.model.AnalysisResult;
import com.flamingo.ai.legaldoc.service.analysis.model.EntityCategory;
import com.flamingo.ai.legaldoc.service.analysis.model.KeyClause;
import com.flamingo.ai.legaldoc.service.analysis.model.RawDocument;
import com.flamingo.ai.legaldoc.service.risk.RiskAssessor;
import com.flamingo.ai.legaldoc.service.risk.RiskProfile;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the DocumentService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  private static final String TEXT_FILE_TYPE = "TXT";
  private static final String PDF_FILE_TYPE = "PDF";

  private final DocumentRepository documentRepository;
  private final RiskAssessor riskAssessor;

  @Override
  @Transactional
  @Timed(value = "document.save", description = "Time to store an analyzed document")
  public Document saveAnalysis(
      RawDocument rawDocument, AnalysisResult result, Duration processingTime) {
    Document document = newDocument(rawDocument);
    document.setWordCount(result.documentInfo().wordCount());
    document.markCompleted(processingTime.toMillis() / 1000.0);

    RiskProfile risk = riskAssessor.assess(result);
    LocalDateTime analyzedAt =
        LocalDateTime.ofInstant(result.documentInfo().processedAt(), ZoneOffset.UTC);

    document.attachAnalysis(
        DocumentAnalysis.builder()
            .predictedType(result.documentType())
            .classificationConfidence(result.documentInfo().confidence())
            .classificationScores(result.classificationScoresByValue())
            .executiveSummary(result.summary())
            .analysisTimestamp(analyzedAt)
            .confidenceScore(confidenceScore(result))
            .overallRiskScore(risk.overallRisk())
            .complexityScore(risk.complexityScore())
            .build());

    result
        .entities()
        .asMap()
        .forEach((category, spans) -> addEntities(document, category, spans));

    for (KeyClause clause : result.keyClauses().values()) {
      document.addClause(
          ExtractedClause.builder()
              .clauseType(clause.key())
              .clauseText(clause.text())
              .confidenceScore(clause.confidence())
              .questionUsed(clause.question())
              .build());
    }

    document.addRiskAssessment(
        RiskAssessment.builder()
            .financialRisk(risk.financialRisk())
            .legalRisk(risk.legalRisk())
            .operationalRisk(risk.operationalRisk())
            .complianceRisk(risk.complianceRisk())
            .overallRisk(risk.overallRisk())
            .riskLevel(risk.level())
            .riskFactors(risk.riskFactors())
            .assessmentTimestamp(analyzedAt)
            .build());

    Document saved = documentRepository.save(document);
    log.info(
        "Stored analysis for document {} ({} entities, {} clauses, risk {})",
        saved.getId(),
        saved.getEntities().size(),
        saved.getClauses().size(),
        risk.level());
    return saved;
  }

  @Override
  @Transactional
  @Timed(value = "document.saveFailure", description = "Time to store a failed document")
  public Document saveFailure(RawDocument rawDocument, String errorMessage) {
    Document document = newDocument(rawDocument);
    document.markFailed(errorMessage);
    Document saved = documentRepository.save(document);
    log.info("Stored failed document {}: {}", saved.getId(), errorMessage);
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "document.get", description = "Time to get a document")
  public Document getDocument(UUID documentId) {
    return documentRepository
        .findById(documentId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  @Override
  @Transactional(readOnly = true)
  public long countDocuments() {
    return documentRepository.count();
  }

  private Document newDocument(RawDocument rawDocument) {
    String text = rawDocument.text() == null ? "" : rawDocument.text();
    return Document.builder()
        .originalFilename(rawDocument.fileName())
        .fileType(rawDocument.fileName() == null ? TEXT_FILE_TYPE : PDF_FILE_TYPE)
        .fileSize(rawDocument.byteSize())
        .fileHash(rawDocument.contentHash())
        .extractedText(text)
        .characterCount(text.length())
        .build();
  }

  private static void addEntities(Document document, EntityCategory category, List<String> spans) {
    String method =
        category.isRecognizerLabel() ? ExtractedEntity.METHOD_NER : ExtractedEntity.METHOD_REGEX;
    for (int i = 0; i < spans.size(); i++) {
      document.addEntity(
          ExtractedEntity.builder()
              .entityType(category.key())
              .entityText(spans.get(i))
              .entityCategory(category.group())
              .position(i)
              .extractionMethod(method)
              .build());
    }
  }

  /** Mean of the classification confidence and the kept clause confidences. */
  static double confidenceScore(AnalysisResult result) {
    double total = result.documentInfo().confidence();
    int count = 1;
    for (KeyClause clause : result.keyClauses().values()) {
      total += clause.confidence();
      count++;
    }
    return Math.round(total / count * 10000.0) / 10000.0;
  }
}
