package dev.jobtracker;

import dev.jobtracker.model.RunStatus;
import dev.jobtracker.model.RunSummary;
import dev.jobtracker.model.RunTrigger;
import dev.jobtracker.service.PipelineAlreadyRunningException;
import dev.jobtracker.service.SchedulerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Executes a single manual run for run-once mode and turns its outcome into an exit status.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  private static final String SEPARATOR = "========================================";

  private final SchedulerService schedulerService;

  @Value("${tracker.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  /**
   * @return 0 when the run completed, 1 otherwise
   */
  public int execute() {
    log.info(SEPARATOR);
    log.info("Job Pipeline Tracker: single run");
    log.info(SEPARATOR);

    try {
      RunSummary summary = schedulerService.runNow(RunTrigger.MANUAL);
      boolean completed = summary != null && summary.status() == RunStatus.COMPLETED;

      log.info(SEPARATOR);
      if (completed) {
        log.info("Run completed: {} new postings, {} notified", summary.newPostings(), summary.notifiedPostings());
      } else {
        log.error("Run failed: {}", summary != null ? summary.errorMessage() : "no summary");
      }
      log.info(SEPARATOR);

      handleMetricsWait();
      return completed ? 0 : 1;
    } catch (PipelineAlreadyRunningException e) {
      log.error("Cannot start: {}", e.getMessage());
      return 1;
    }
  }

  private void handleMetricsWait() {
    if (metricsWaitSeconds > 0) {
      log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
      try {
        Thread.sleep(metricsWaitSeconds * 1000L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Metrics wait interrupted");
      }
    }
  }
}
