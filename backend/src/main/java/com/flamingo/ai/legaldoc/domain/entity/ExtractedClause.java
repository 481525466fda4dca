package com.flamingo.ai.legaldoc.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A key clause answered by question answering. */
@Entity
@Table(name = "extracted_clauses")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExtractedClause {

  public static final String METHOD_QA = "qa_pipeline";

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "document_id", nullable = false)
  private Document document;

  /** Clause key derived from the question, e.g. "the governing law". */
  @Column(nullable = false, length = 100)
  private String clauseType;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String clauseText;

  private Double confidenceScore;

  @Column(length = 300)
  private String questionUsed;

  @Column(length = 30)
  @Builder.Default
  private String extractionMethod = METHOD_QA;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
