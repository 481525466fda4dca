package com.flamingo.ai.legaldoc.domain.entity;

import com.flamingo.ai.legaldoc.domain.converter.ScoreMapConverter;
import com.flamingo.ai.legaldoc.domain.enums.DocumentType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Classification, summary and headline scores of an analyzed document. */
@Entity
@Table(name = "document_analyses")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentAnalysis {

  public static final String MODEL_VERSION = "legal-keyword-v1";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @OneToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "document_id", nullable = false, unique = true)
  private Document document;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 30)
  private DocumentType predictedType;

  @Column(nullable = false)
  private Double classificationConfidence;

  @Convert(converter = ScoreMapConverter.class)
  @Column(columnDefinition = "TEXT")
  private Map<String, Double> classificationScores;

  @Column(columnDefinition = "TEXT")
  private String executiveSummary;

  @Column(length = 50)
  @Builder.Default
  private String modelVersion = MODEL_VERSION;

  @Column(nullable = false)
  private LocalDateTime analysisTimestamp;

  /** Mean confidence of the classification and the kept clauses. */
  private Double confidenceScore;

  /** 0-100. */
  private Double overallRiskScore;

  /** 0-100. */
  private Double complexityScore;
}
