package com.flamingo.ai.legaldoc.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for analyzing pasted document text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeTextRequest {

  @NotBlank(message = "No document content provided")
  private String text;
}
