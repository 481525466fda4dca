package com.flamingo.ai.legaldoc.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
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

/** One entity span found in a document. */
@Entity
@Table(
    name = "extracted_entities",
    indexes = @Index(name = "idx_entity_type", columnList = "entityType"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExtractedEntity {

  public static final String METHOD_NER = "ner";
  public static final String METHOD_REGEX = "regex";

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "document_id", nullable = false)
  private Document document;

  /** PERSON, ORG, DATE, MONEY, GPE or monetary_amounts. */
  @Column(nullable = false, length = 50)
  private String entityType;

  @Column(nullable = false, length = 500)
  private String entityText;

  /** legal_entity, financial, temporal or location. */
  @Column(length = 50)
  private String entityCategory;

  /** Position of the span within its type, in first-occurrence order. */
  private Integer position;

  @Column(length = 30)
  private String extractionMethod;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
