package com.flamingo.ai.legaldoc.api.dto.response;

import com.flamingo.ai.legaldoc.service.analysis.AnalysisService.AnalyzedDocument;
import com.flamingo.ai.legaldoc.service.analysis.model.AnalysisResult;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a synchronous text analysis. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextAnalysisResponse {

  /** Stored document id; null when the result could not be stored. */
  private UUID documentId;

  private AnalysisResult analysis;

  public static TextAnalysisResponse from(AnalyzedDocument analyzed) {
    return TextAnalysisResponse.builder()
        .documentId(analyzed.documentId())
        .analysis(analyzed.result())
        .build();
  }
}
