package com.flamingo.ai.legaldoc.domain.entity;

import com.flamingo.ai.legaldoc.domain.enums.DocumentStatus;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OneToOne;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A submitted legal document and the outcome of analyzing it. */
@Entity
@Table(name = "documents")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  /** Uploaded file name, or null for pasted text. */
  private String originalFilename;

  /** PDF or TXT. */
  @Column(nullable = false, length = 10)
  private String fileType;

  /** Size of the submitted content in bytes. */
  @Column(nullable = false)
  private Long fileSize;

  /** SHA-256 of the submitted content. */
  @Column(nullable = false, length = 64)
  private String fileHash;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private DocumentStatus status;

  /** Analysis time in seconds. */
  private Double processingDuration;

  @Column(columnDefinition = "TEXT")
  private String errorMessage;

  @Column(columnDefinition = "TEXT")
  private String extractedText;

  private Integer wordCount;

  private Integer characterCount;

  @Column(nullable = false, updatable = false)
  private LocalDateTime uploadTimestamp;

  private LocalDateTime processingCompletedAt;

  @OneToOne(mappedBy = "document", cascade = CascadeType.ALL, orphanRemoval = true)
  private DocumentAnalysis analysis;

  @OneToMany(mappedBy = "document", cascade = CascadeType.ALL, orphanRemoval = true)
  @OrderBy("id ASC")
  @Builder.Default
  private List<ExtractedEntity> entities = new ArrayList<>();

  @OneToMany(mappedBy = "document", cascade = CascadeType.ALL, orphanRemoval = true)
  @OrderBy("id ASC")
  @Builder.Default
  private List<ExtractedClause> clauses = new ArrayList<>();

  @OneToMany(mappedBy = "document", cascade = CascadeType.ALL, orphanRemoval = true)
  @Builder.Default
  private List<RiskAssessment> risks = new ArrayList<>();

  @PrePersist
  protected void onCreate() {
    if (uploadTimestamp == null) {
      uploadTimestamp = LocalDateTime.now();
    }
  }

  /** Attaches the analysis; a document has at most one. */
  public void attachAnalysis(DocumentAnalysis documentAnalysis) {
    if (this.analysis != null) {
      throw new IllegalStateException("Document " + id + " already has an analysis");
    }
    documentAnalysis.setDocument(this);
    this.analysis = documentAnalysis;
  }

  public void addEntity(ExtractedEntity entity) {
    entity.setDocument(this);
    entities.add(entity);
  }

  public void addClause(ExtractedClause clause) {
    clause.setDocument(this);
    clauses.add(clause);
  }

  public void addRiskAssessment(RiskAssessment risk) {
    risk.setDocument(this);
    risks.add(risk);
  }

  /** Marks the document as successfully analyzed. */
  public void markCompleted(double durationSeconds) {
    this.status = DocumentStatus.COMPLETED;
    this.processingDuration = durationSeconds;
    this.processingCompletedAt = LocalDateTime.now();
  }

  /** Marks the document as failed with an error message. */
  public void markFailed(String message) {
    this.status = DocumentStatus.FAILED;
    this.errorMessage = message;
    this.processingCompletedAt = LocalDateTime.now();
  }
}
