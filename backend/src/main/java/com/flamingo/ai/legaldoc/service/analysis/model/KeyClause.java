package com.flamingo.ai.legaldoc.service.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A clause answer kept from question answering.
 *
 * @param key label derived from the question
 * @param text the answer span
 * @param confidence the answer score in [0, 1]
 * @param question the question that produced the answer
 */
public record KeyClause(
    @JsonIgnore String key,
    @JsonProperty("text") String text,
    @JsonProperty("confidence") double confidence,
    @JsonIgnore String question) {}
