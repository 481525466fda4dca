package com.flamingo.ai.legaldoc.service.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.legaldoc.domain.enums.DocumentType;
import java.time.Instant;

/** Document-level facts attached to an analysis. */
public record DocumentInfo(
    DocumentType type,
    double confidence,
    @JsonProperty("length") int wordCount,
    @JsonProperty("processed_at") Instant processedAt) {}
