package com.flamingo.ai.legaldoc.service.job;

import com.flamingo.ai.legaldoc.exception.JobNotFoundException;
import com.flamingo.ai.legaldoc.service.analysis.model.AnalysisResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Tracks asynchronous analysis jobs.
 *
 * <p>Entries are immutable {@link AnalysisJob} snapshots replaced atomically per job, so readers
 * always see a consistent state and never hold a reference into the table. Transitions only move
 * forward; a job in COMPLETED or ERROR never changes again.
 */
@Component
@Slf4j
public class JobTracker {

  private final Map<String, AnalysisJob> jobs = new ConcurrentHashMap<>();
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public JobTracker(MeterRegistry meterRegistry, Clock clock) {
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    meterRegistry.gaugeMapSize("jobs.tracked", Tags.empty(), jobs);
  }

  /** Registers a new job in STARTING and returns its id. */
  public String submit() {
    Instant now = clock.instant();
    String id;
    do {
      id = UUID.randomUUID().toString();
    } while (jobs.putIfAbsent(id, AnalysisJob.starting(id, now)) != null);

    meterRegistry.counter("jobs.submitted").increment();
    log.info("Job {} submitted", id);
    return id;
  }

  /** Current snapshot of a job, or empty if the id is unknown. */
  public Optional<AnalysisJob> query(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(jobs.get(id));
  }

  public AnalysisJob markExtractingText(String id) {
    return transition(id, job -> job.advanceTo(JobStatus.EXTRACTING_TEXT, clock.instant()));
  }

  public AnalysisJob markAnalyzing(String id) {
    return transition(id, job -> job.advanceTo(JobStatus.ANALYZING, clock.instant()));
  }

  public AnalysisJob complete(String id, AnalysisResult result, UUID documentId) {
    AnalysisJob job =
        transition(id, current -> current.complete(result, documentId, clock.instant()));
    meterRegistry.counter("jobs.completed").increment();
    log.info("Job {} completed", id);
    return job;
  }

  public AnalysisJob fail(String id, String errorMessage) {
    AnalysisJob job = transition(id, current -> current.fail(errorMessage, clock.instant()));
    meterRegistry.counter("jobs.failed").increment();
    log.warn("Job {} failed: {}", id, errorMessage);
    return job;
  }

  /**
   * Removes finished jobs whose last transition is older than {@code retention}.
   *
   * @return number of jobs removed
   */
  public int evictTerminalJobsOlderThan(Duration retention) {
    Instant cutoff = clock.instant().minus(retention);
    int evicted = 0;
    Iterator<AnalysisJob> iterator = jobs.values().iterator();
    while (iterator.hasNext()) {
      AnalysisJob job = iterator.next();
      // terminal entries never change, so removing the one just read is safe
      if (job.status().isTerminal() && job.updatedAt().isBefore(cutoff)) {
        iterator.remove();
        evicted++;
      }
    }
    if (evicted > 0) {
      meterRegistry.counter("jobs.evicted").increment(evicted);
      log.info("Evicted {} finished jobs older than {}", evicted, retention);
    }
    return evicted;
  }

  /** Number of tracked jobs per status. */
  public Map<JobStatus, Long> countByStatus() {
    Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
    for (JobStatus status : JobStatus.values()) {
      counts.put(status, 0L);
    }
    jobs.values().forEach(job -> counts.merge(job.status(), 1L, Long::sum));
    return counts;
  }

  private AnalysisJob transition(String id, UnaryOperator<AnalysisJob> change) {
    AnalysisJob updated = jobs.computeIfPresent(id, (key, current) -> change.apply(current));
    if (updated == null) {
      throw new JobNotFoundException(id);
    }
    log.debug("Job {} -> {} ({}%)", id, updated.status(), updated.progress());
    return updated;
  }
}
