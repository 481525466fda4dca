package com.flamingo.ai.legaldoc.api.rest;

import com.flamingo.ai.legaldoc.api.dto.request.AnalyzeTextRequest;
import com.flamingo.ai.legaldoc.api.dto.response.JobStatusResponse;
import com.flamingo.ai.legaldoc.api.dto.response.JobSubmissionResponse;
import com.flamingo.ai.legaldoc.api.dto.response.TextAnalysisResponse;
import com.flamingo.ai.legaldoc.service.analysis.AnalysisService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for document analysis. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AnalysisController {

  private final AnalysisService analysisService;

  /** Analyzes pasted text and waits for the result. */
  @PostMapping(value = "/analyze", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<TextAnalysisResponse> analyzeText(
      @Valid @RequestBody AnalyzeTextRequest request) {
    return ResponseEntity.ok(
        TextAnalysisResponse.from(analysisService.analyzeText(request.getText())));
  }

  /** Accepts a PDF for background analysis. */
  @PostMapping(value = "/analyze-pdf", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<JobSubmissionResponse> analyzePdf(
      @RequestParam(value = "file", required = false) MultipartFile file) {
    String taskId = analysisService.submitPdf(file);
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(JobSubmissionResponse.processing(taskId));
  }

  /** Gets the progress of a PDF analysis job. */
  @GetMapping("/status/{taskId}")
  public ResponseEntity<JobStatusResponse> getStatus(@PathVariable String taskId) {
    return ResponseEntity.ok(JobStatusResponse.fromJob(analysisService.getJob(taskId)));
  }
}
