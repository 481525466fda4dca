package com.flamingo.ai.legaldoc.service.document;

import com.flamingo.ai.legaldoc.domain.entity.Document;
import com.flamingo.ai.legaldoc.service.analysis.model.AnalysisResult;
import com.flamingo.ai.legaldoc.service.analysis.model.RawDocument;
import java.time.Duration;
import java.util.UUID;

/** Service interface for storing and reading analyzed documents. */
public interface DocumentService {

  /**
   * Stores a document together with its analysis, entities, clauses and risk assessment.
   *
   * @param rawDocument the analyzed input
   * @param result the finished analysis
   * @param processingTime time spent analyzing
   * @return the stored document
   */
  Document saveAnalysis(RawDocument rawDocument, AnalysisResult result, Duration processingTime);

  /**
   * Stores a document whose analysis failed.
   *
   * @param rawDocument the submitted input
   * @param errorMessage why the analysis failed
   * @return the stored document
   */
  Document saveFailure(RawDocument rawDocument, String errorMessage);

  /**
   * Gets a document by ID.
   *
   * @param documentId the document ID
   * @return the document
   * @throws com.flamingo.ai.legaldoc.exception.DocumentNotFoundException if not found
   */
  Document getDocument(UUID documentId);

  /** Total number of stored documents. */
  long countDocuments();
}
