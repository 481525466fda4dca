package com.flamingo.ai.legaldoc.domain.entity;

import com.flamingo.ai.legaldoc.domain.converter.StringListConverter;
import com.flamingo.ai.legaldoc.domain.enums.RiskLevel;
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
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Risk scores derived from an analysis. All scores are in [0, 100]. */
@Entity
@Table(name = "risk_assessments")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RiskAssessment {

  public static final String MODEL_VERSION = "risk-rules-v1";

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "document_id", nullable = false)
  private Document document;

  private Double financialRisk;
  private Double legalRisk;
  private Double operationalRisk;
  private Double complianceRisk;

  @Column(nullable = false)
  private Double overallRisk;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private RiskLevel riskLevel;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> riskFactors = new ArrayList<>();

  @Column(nullable = false)
  private LocalDateTime assessmentTimestamp;

  @Column(length = 50)
  @Builder.Default
  private String modelVersion = MODEL_VERSION;
}
