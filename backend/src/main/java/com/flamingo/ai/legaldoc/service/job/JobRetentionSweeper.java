package com.flamingo.ai.legaldoc.service.job;

import com.flamingo.ai.legaldoc.config.LegalAnalysisProperties;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically evicts finished jobs once {@code legal.jobs.retention} has passed. */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobRetentionSweeper {

  private final JobTracker jobTracker;
  private final LegalAnalysisProperties properties;

  @Scheduled(
      fixedDelayString = "${legal.jobs.sweep-interval:PT5M}",
      initialDelayString = "${legal.jobs.sweep-interval:PT5M}")
  public void sweep() {
    Duration retention = properties.getJobs().getRetention();
    if (retention == null) {
      return;
    }
    int evicted = jobTracker.evictTerminalJobsOlderThan(retention);
    log.debug("Job sweep finished, {} evicted", evicted);
  }
}
