package dev.jobtracker.service;

import dev.jobtracker.config.TrackerProperties;
import dev.jobtracker.metrics.TrackerMetrics;
import dev.jobtracker.model.RunSummary;
import dev.jobtracker.model.RunTrigger;
import dev.jobtracker.model.ScheduleConfiguration;
import dev.jobtracker.model.SchedulerState;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Triggers pipeline runs, manually or on a recurring timer, behind the {@link RunGuard}.
 * <p>
 * The timer is a single pending task that re-arms itself after every tick using the interval in
 * force at that moment. Reconfiguring cancels the pending tick and arms a new one; a run already
 * in progress is never interrupted.
 */
@Slf4j
@Service
public class SchedulerService {

    private final PipelineService pipelineService;
    private final RunGuard runGuard;
    private final TaskScheduler taskScheduler;
    private final TrackerMetrics metrics;
    private final TrackerProperties properties;
    private final Clock clock;

    private final AtomicReference<ScheduleConfiguration> configuration;
    private final Object lifecycleLock = new Object();

    private ScheduledFuture<?> pendingTick;
    private volatile Instant nextRunAt;
    private volatile LocalDateTime lastRunAt;

    public SchedulerService(PipelineService pipelineService, RunGuard runGuard, TaskScheduler taskScheduler,
            TrackerMetrics metrics, TrackerProperties properties, Clock clock) {
        this.pipelineService = pipelineService;
        this.runGuard = runGuard;
        this.taskScheduler = taskScheduler;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        TrackerProperties.Scheduler scheduler = properties.getScheduler();
        this.configuration = new AtomicReference<>(
                new ScheduleConfiguration(scheduler.isEnabled(), scheduler.getIntervalMinutes()));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startIfEnabled() {
        if (properties.isRunOnce()) {
            log.info("Run-once mode: recurring schedule not armed");
            return;
        }
        ScheduleConfiguration current = configuration.get();
        log.info("Scheduler {} with interval {} minutes", current.enabled() ? "enabled" : "disabled",
                current.intervalMinutes());
        rearm();
    }

    @PreDestroy
    public void stop() {
        synchronized (lifecycleLock) {
            cancelPending();
        }
    }

    /**
     * Execute one run on the calling thread.
     *
     * @throws PipelineAlreadyRunningException when a run is in progress
     */
    public RunSummary runNow(RunTrigger trigger) {
        try (RunGuard.Permit permit = acquire(trigger)) {
            lastRunAt = LocalDateTime.now(clock);
            return pipelineService.execute(trigger).block();
        }
    }

    private RunGuard.Permit acquire(RunTrigger trigger) {
        try {
            return runGuard.acquire();
        } catch (PipelineAlreadyRunningException e) {
            metrics.recordRunRejected();
            log.info("{} run rejected: a run is already in progress", trigger);
            throw e;
        }
    }

    /**
     * Replace the schedule and re-arm the timer.
     *
     * @throws IllegalArgumentException when the interval is outside 1..10080 minutes
     */
    public SchedulerState configure(boolean enabled, int intervalMinutes) {
        ScheduleConfiguration updated = new ScheduleConfiguration(enabled, intervalMinutes);
        configuration.set(updated);
        log.info("Schedule updated: enabled={}, interval={} minutes", enabled, intervalMinutes);
        rearm();
        return state();
    }

    public SchedulerState state() {
        ScheduleConfiguration current = configuration.get();
        Instant next = current.enabled() ? nextRunAt : null;
        return new SchedulerState(
                current.enabled(),
                current.intervalMinutes(),
                runGuard.isRunning(),
                next != null ? LocalDateTime.ofInstant(next, clock.getZone()) : null,
                lastRunAt);
    }

    public ScheduleConfiguration getConfiguration() {
        return configuration.get();
    }

    void tick() {
        if (!configuration.get().enabled()) {
            return;
        }
        try {
            RunSummary summary = runNow(RunTrigger.SCHEDULED);
            log.info("Scheduled run finished: {}", summary != null ? summary.status() : "no summary");
        } catch (PipelineAlreadyRunningException e) {
            log.info("Skipping scheduled tick: a run is already in progress");
        } catch (RuntimeException e) {
            log.error("Scheduled run failed: {}", e.getMessage(), e);
        } finally {
            rearm();
        }
    }

    private void rearm() {
        synchronized (lifecycleLock) {
            cancelPending();
            ScheduleConfiguration current = configuration.get();
            if (!current.enabled()) {
                return;
            }
            Instant next = clock.instant().plus(Duration.ofMinutes(current.intervalMinutes()));
            nextRunAt = next;
            pendingTick = taskScheduler.schedule(this::tick, next);
            log.debug("Next scheduled run at {}", next);
        }
    }

    private void cancelPending() {
        if (pendingTick != null) {
            pendingTick.cancel(false);
            pendingTick = null;
        }
        nextRunAt = null;
    }
}
