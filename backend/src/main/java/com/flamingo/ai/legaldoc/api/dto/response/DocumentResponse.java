package com.flamingo.ai.legaldoc.api.dto.response;

import com.flamingo.ai.legaldoc.domain.entity.Document;
import com.flamingo.ai.legaldoc.domain.entity.DocumentAnalysis;
import com.flamingo.ai.legaldoc.domain.entity.ExtractedClause;
import com.flamingo.ai.legaldoc.domain.entity.ExtractedEntity;
import com.flamingo.ai.legaldoc.domain.entity.RiskAssessment;
import com.flamingo.ai.legaldoc.domain.enums.DocumentStatus;
import com.flamingo.ai.legaldoc.domain.enums.DocumentType;
import com.flamingo.ai.legaldoc.domain.enums.RiskLevel;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stored document and everything derived from it. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String fileName;
  private String fileType;
  private Long fileSize;
  private DocumentStatus status;
  private Integer wordCount;
  private Integer characterCount;
  private Double processingDuration;
  private String errorMessage;
  private LocalDateTime uploadedAt;
  private LocalDateTime processedAt;
  private AnalysisSummary analysis;
  private List<EntityItem> entities;
  private List<ClauseItem> clauses;
  private List<RiskItem> risks;

  /** Creates a DocumentResponse from a Document entity. */
  public static DocumentResponse fromEntity(Document document) {
    return DocumentResponse.builder()
        .id(document.getId())
        .fileName(document.getOriginalFilename())
        .fileType(document.getFileType())
        .fileSize(document.getFileSize())
        .status(document.getStatus())
        .wordCount(document.getWordCount())
        .characterCount(document.getCharacterCount())
        .processingDuration(document.getProcessingDuration())
        .errorMessage(document.getErrorMessage())
        .uploadedAt(document.getUploadTimestamp())
        .processedAt(document.getProcessingCompletedAt())
        .analysis(
            document.getAnalysis() == null ? null : AnalysisSummary.from(document.getAnalysis()))
        .entities(document.getEntities().stream().map(EntityItem::from).toList())
        .clauses(document.getClauses().stream().map(ClauseItem::from).toList())
        .risks(document.getRisks().stream().map(RiskItem::from).toList())
        .build();
  }

  /** Stored classification and headline scores. */
  public record AnalysisSummary(
      DocumentType predictedType,
      Double classificationConfidence,
      Map<String, Double> classificationScores,
      String executiveSummary,
      Double confidenceScore,
      Double overallRiskScore,
      Double complexityScore,
      String modelVersion,
      LocalDateTime analyzedAt) {

    static AnalysisSummary from(DocumentAnalysis analysis) {
      return new AnalysisSummary(
          analysis.getPredictedType(),
          analysis.getClassificationConfidence(),
          analysis.getClassificationScores(),
          analysis.getExecutiveSummary(),
          analysis.getConfidenceScore(),
          analysis.getOverallRiskScore(),
          analysis.getComplexityScore(),
          analysis.getModelVersion(),
          analysis.getAnalysisTimestamp());
    }
  }

  public record EntityItem(String type, String text, String category, String method) {

    static EntityItem from(ExtractedEntity entity) {
      return new EntityItem(
          entity.getEntityType(),
          entity.getEntityText(),
          entity.getEntityCategory(),
          entity.getExtractionMethod());
    }
  }

  public record ClauseItem(String type, String text, Double confidence, String question) {

    static ClauseItem from(ExtractedClause clause) {
      return new ClauseItem(
          clause.getClauseType(),
          clause.getClauseText(),
          clause.getConfidenceScore(),
          clause.getQuestionUsed());
    }
  }

  public record RiskItem(
      Double financialRisk,
      Double legalRisk,
      Double operationalRisk,
      Double complianceRisk,
      Double overallRisk,
      RiskLevel riskLevel,
      List<String> riskFactors) {

    static RiskItem from(RiskAssessment risk) {
      return new RiskItem(
          risk.getFinancialRisk(),
          risk.getLegalRisk(),
          risk.getOperationalRisk(),
          risk.getComplianceRisk(),
          risk.getOverallRisk(),
          risk.getRiskLevel(),
          List.copyOf(risk.getRiskFactors()));
    }
  }
}
