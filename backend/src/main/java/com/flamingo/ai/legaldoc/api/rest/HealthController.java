package com.flamingo.ai.legaldoc.api.rest;

import com.flamingo.ai.legaldoc.service.document.DocumentService;
import com.flamingo.ai.legaldoc.service.job.JobStatus;
import com.flamingo.ai.legaldoc.service.job.JobTracker;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

  private final JobTracker jobTracker;
  private final DocumentService documentService;

  /** Returns a simple health check response with job counts. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<JobStatus, Long> counts = jobTracker.countByStatus();
    Map<String, Long> jobs = new LinkedHashMap<>();
    counts.forEach((status, count) -> jobs.put(status.value(), count));

    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "legal-document-analyzer");
    health.put("jobs", jobs);
    health.put("activeJobs", activeJobs(counts));
    health.put("totalDocuments", documentService.countDocuments());
    return ResponseEntity.ok(health);
  }

  private static long activeJobs(Map<JobStatus, Long> counts) {
    return counts.entrySet().stream()
        .filter(entry -> !entry.getKey().isTerminal())
        .mapToLong(Map.Entry::getValue)
        .sum();
  }
}
