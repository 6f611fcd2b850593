package dev.jobtracker.metrics;

import dev.jobtracker.model.FetchStrategy;
import dev.jobtracker.model.RunStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for pipeline runs.
 */
@Component
public class TrackerMetrics {

    private static final String TAG_SOURCE = "source";
    private final MeterRegistry registry;

    // Counters
    private final Counter postingsExtractedCounter;
    private final Counter postingsNewCounter;
    private final Counter postingsUpdatedCounter;
    private final Counter candidatesDroppedCounter;
    private final Counter integrityFaultsCounter;
    private final Counter notificationsSentCounter;
    private final Counter notificationFailuresCounter;
    private final Counter runsRejectedCounter;

    // Timers (per strategy)
    private final ConcurrentHashMap<FetchStrategy, Timer> fetchTimers = new ConcurrentHashMap<>();
    private final Timer runTimer;

    // Gauges
    private final AtomicInteger lastRunNewPostings = new AtomicInteger(0);
    private final AtomicInteger lastRunFailedSources = new AtomicInteger(0);

    public TrackerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.postingsExtractedCounter = Counter.builder("job_tracker_postings_extracted_total")
                .description("Candidate postings returned by the extraction step")
                .register(registry);

        this.postingsNewCounter = Counter.builder("job_tracker_postings_new_total")
                .description("Postings stored for the first time")
                .register(registry);

        this.postingsUpdatedCounter = Counter.builder("job_tracker_postings_updated_total")
                .description("Known postings whose fields changed on a later sighting")
                .register(registry);

        this.candidatesDroppedCounter = Counter.builder("job_tracker_candidates_dropped_total")
                .description("Extracted entries discarded for missing a title")
                .register(registry);

        this.integrityFaultsCounter = Counter.builder("job_tracker_integrity_faults_total")
                .description("Candidates skipped because stored postings share their identity key")
                .register(registry);

        this.notificationsSentCounter = Counter.builder("job_tracker_notifications_sent_total")
                .description("Postings included in a delivered notification")
                .register(registry);

        this.notificationFailuresCounter = Counter.builder("job_tracker_notification_failures_total")
                .description("Notification batches that could not be delivered")
                .register(registry);

        this.runsRejectedCounter = Counter.builder("job_tracker_runs_rejected_total")
                .description("Run triggers rejected because a run was already in progress")
                .register(registry);

        this.runTimer = Timer.builder("job_tracker_run_duration")
                .description("Wall-clock duration of pipeline runs")
                .register(registry);

        Gauge.builder("job_tracker_last_run_new_postings", lastRunNewPostings, AtomicInteger::get)
                .description("New postings found in the last run")
                .register(registry);

        Gauge.builder("job_tracker_last_run_failed_sources", lastRunFailedSources, AtomicInteger::get)
                .description("Sources that failed in the last run")
                .register(registry);
    }

    public Timer getFetchTimer(FetchStrategy strategy) {
        return fetchTimers.computeIfAbsent(strategy, s ->
                Timer.builder("job_tracker_fetch_duration")
                        .description("Time to fetch a career page")
                        .tag("strategy", s.name().toLowerCase())
                        .register(registry));
    }

    public void recordFetchLatency(FetchStrategy strategy, Duration elapsed) {
        getFetchTimer(strategy).record(elapsed);
    }

    public void recordPostingsExtracted(int count) {
        postingsExtractedCounter.increment(count);
    }

    public void recordNewPostings(int count) {
        postingsNewCounter.increment(count);
    }

    public void recordUpdatedPostings(int count) {
        postingsUpdatedCounter.increment(count);
    }

    public void recordCandidatesDropped(int count) {
        candidatesDroppedCounter.increment(count);
    }

    public void recordIntegrityFaults(int count) {
        integrityFaultsCounter.increment(count);
    }

    public void recordNotificationSent(int postings) {
        notificationsSentCounter.increment(postings);
    }

    public void recordNotificationFailure() {
        notificationFailuresCounter.increment();
    }

    public void recordRunRejected() {
        runsRejectedCounter.increment();
    }

    /**
     * Count a failed source, tagged by source name and failure kind.
     */
    public void recordSourceFailure(String source, String kind) {
        Counter.builder("job_tracker_source_failures_total")
                .tag(TAG_SOURCE, source)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordRun(RunStatus status, Duration duration, int newPostings, int failedSources) {
        runTimer.record(duration);
        Counter.builder("job_tracker_runs_total")
                .tag("status", status.name().toLowerCase())
                .register(registry)
                .increment();
        lastRunNewPostings.set(newPostings);
        lastRunFailedSources.set(failedSources);
    }
}
