package dev.jobtracker.service;

import dev.jobtracker.ai.ExtractionException;
import dev.jobtracker.config.TrackerProperties;
import dev.jobtracker.entity.JobPosting;
import dev.jobtracker.entity.TrackedSource;
import dev.jobtracker.fetch.FetchException;
import dev.jobtracker.fetch.FetchRouter;
import dev.jobtracker.metrics.TrackerMetrics;
import dev.jobtracker.model.ExtractionResult;
import dev.jobtracker.model.IntegrityFault;
import dev.jobtracker.model.NotificationStatus;
import dev.jobtracker.model.OutcomeStatus;
import dev.jobtracker.model.RawContent;
import dev.jobtracker.model.ReconciliationResult;
import dev.jobtracker.model.RunStatus;
import dev.jobtracker.model.RunSummary;
import dev.jobtracker.model.RunTrigger;
import dev.jobtracker.model.SourceOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Runs the pipeline once over every tracked source: fetch, extract, reconcile, persist, then one
 * notification for the whole run.
 * <p>
 * Sources are processed one at a time. A failing source is recorded and skipped; a rate-limited
 * extraction ends the pass early and leaves the remaining sources for the next run. Only an
 * unavailable store fails the run, keeping whatever sources already committed.
 * Callers are responsible for mutual exclusion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineService {

    private static final String SEPARATOR = "========================================";
    static final String RATE_LIMITED = "rate_limited";
    static final String UNEXPECTED = "unexpected";

    private final JobStoreService store;
    private final FetchRouter fetchRouter;
    private final ExtractionService extractionService;
    private final ChangeDetectionService changeDetectionService;
    private final NotificationService notificationService;
    private final TrackerProperties properties;
    private final TrackerMetrics metrics;
    private final Clock clock;

    public Mono<RunSummary> execute(RunTrigger trigger) {
        long start = System.nanoTime();
        log.info(SEPARATOR);
        log.info("Pipeline run starting (trigger: {})", trigger);
        log.info(SEPARATOR);

        return blocking(() -> store.startRun(trigger))
                .flatMap(run -> {
                    RunState state = new RunState(run.getId(), trigger, run.getStartedAt());
                    return blocking(store::listSources)
                            .flatMap(sources -> processSources(sources, state))
                            .then(Mono.defer(() -> notifyAndFinish(state)))
                            .onErrorResume(e -> failRun(state, e));
                })
                .onErrorResume(e -> {
                    log.error("Pipeline run could not be recorded: {}", e.getMessage(), e);
                    LocalDateTime now = LocalDateTime.now(clock);
                    return Mono.just(new RunSummary(null, trigger, RunStatus.FAILED, now, now, 0, 0,
                            NotificationStatus.NOT_ATTEMPTED, false, null, e.getMessage(), List.of()));
                })
                .doOnNext(summary -> {
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                    metrics.recordRun(summary.status(), elapsed, summary.newPostings(),
                            (int) summary.failedSources());
                    logSummary(summary, elapsed);
                });
    }

    private Mono<Void> processSources(List<TrackedSource> sources, RunState state) {
        log.info("Sources configured: {}", sources.size());
        return Flux.fromIterable(sources)
                .concatMap(source -> state.abortReason != null
                        ? Mono.just(SourceOutcome.deferred(source.getId(), source.getName()))
                        : processSource(source, state))
                .doOnNext(state.outcomes::add)
                .then();
    }

    private Mono<SourceOutcome> processSource(TrackedSource source, RunState state) {
        return fetch(source)
                .flatMap(content -> extractionService.extract(content, source.getName()))
                .flatMap(extraction -> blocking(() -> persist(source, extraction, state)))
                .onErrorResume(FetchException.class, e -> sourceFailed(source, e.getKind().code(), e.getMessage()))
                .onErrorResume(ExtractionException.class, e -> {
                    if (e.isRateLimited()) {
                        log.warn("Extraction rate limited on '{}', deferring remaining sources", source.getName());
                        state.abortReason = RATE_LIMITED;
                    }
                    return sourceFailed(source, e.getKind().code(), e.getMessage());
                })
                .onErrorResume(IntegrityFaultException.class,
                        e -> sourceFailed(source, "integrity_fault", e.getMessage()))
                .onErrorResume(e -> !isStoreUnavailable(e), e -> {
                    log.error("Unexpected failure on '{}': {}", source.getName(), e.getMessage(), e);
                    return sourceFailed(source, UNEXPECTED, String.valueOf(e.getMessage()));
                });
    }

    static boolean isStoreUnavailable(Throwable e) {
        return e instanceof DataAccessResourceFailureException
                || e instanceof CannotCreateTransactionException;
    }

    private Mono<RawContent> fetch(TrackedSource source) {
        TrackerProperties.Pipeline settings = properties.getPipeline();
        return fetchRouter.fetch(source)
                .retryWhen(Retry.backoff(settings.getFetchRetries(), settings.getRetryBackoff())
                        .filter(e -> e instanceof FetchException fe && fe.isTransient())
                        .doBeforeRetry(signal -> log.info("Retrying fetch of '{}' after {} (attempt {})",
                                source.getName(), signal.failure().getMessage(), signal.totalRetries() + 1))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    private SourceOutcome persist(TrackedSource source, ExtractionResult extraction, RunState state) {
        ReconciliationResult result = changeDetectionService.reconcile(source.getId(), extraction.candidates());
        List<JobPosting> inserted = store.applySourceResult(source.getId(), result, extraction.candidates().size());

        state.newPostings += inserted.size();
        metrics.recordNewPostings(inserted.size());
        metrics.recordUpdatedPostings(result.updatedPostings().size());
        inserted.forEach(p -> log.info("New posting on '{}': {} @ {}", source.getName(), p.getTitle(), p.getCompany()));

        int extracted = extraction.candidates().size();
        if (result.hasFaults()) {
            metrics.recordIntegrityFaults(result.faults().size());
            String message = result.faults().stream()
                    .map(IntegrityFault::describe)
                    .collect(Collectors.joining("; "));
            return SourceOutcome.partial(source.getId(), source.getName(), message,
                    extracted, inserted.size(), result.updatedPostings().size());
        }
        return SourceOutcome.success(source.getId(), source.getName(), extracted, inserted.size(),
                result.updatedPostings().size());
    }

    private Mono<SourceOutcome> sourceFailed(TrackedSource source, String kind, String message) {
        log.warn("Source '{}' failed ({}): {}", source.getName(), kind, message);
        metrics.recordSourceFailure(source.getName(), kind);
        return blocking(() -> {
            store.recordSourceFailure(source.getId(), kind + ": " + message);
            return SourceOutcome.failed(source.getId(), source.getName(), kind, message);
        });
    }

    private Mono<RunSummary> notifyAndFinish(RunState state) {
        return blocking(store::listUnnotifiedPostings)
                .flatMap(notificationService::notify)
                .flatMap(delivery -> {
                    state.notificationStatus = delivery.status();
                    if (!delivery.isDelivered()) {
                        if (delivery.status() == NotificationStatus.FAILED) {
                            log.error("Notification failed ({}), {} postings stay pending for the next run",
                                    delivery.error(), delivery.postingIds().size());
                        }
                        return Mono.just(delivery);
                    }
                    return blocking(() -> {
                        store.markNotified(delivery.postingIds());
                        state.notifiedPostings = delivery.postingIds().size();
                        return delivery;
                    });
                })
                .then(blocking(() -> store.finishRun(state.runId, RunStatus.COMPLETED, state.newPostings,
                        state.notifiedPostings, state.notificationStatus, state.abortReason, null,
                        state.outcomes)));
    }

    private Mono<RunSummary> failRun(RunState state, Throwable error) {
        log.error("Pipeline run {} failed: {}", state.runId, error.getMessage(), error);
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return blocking(() -> store.finishRun(state.runId, RunStatus.FAILED, state.newPostings,
                state.notifiedPostings, state.notificationStatus, state.abortReason, message, state.outcomes))
                .onErrorResume(e -> {
                    log.error("Could not record failure of run {}: {}", state.runId, e.getMessage());
                    LocalDateTime now = LocalDateTime.now(clock);
                    return Mono.just(new RunSummary(state.runId, state.trigger, RunStatus.FAILED, state.startedAt, now,
                            state.newPostings, state.notifiedPostings, state.notificationStatus,
                            state.abortReason != null, state.abortReason, message, state.outcomes));
                });
    }

    private void logSummary(RunSummary summary, Duration elapsed) {
        log.info(SEPARATOR);
        log.info("RUN SUMMARY");
        log.info(SEPARATOR);
        log.info("Status: {}{}", summary.status(), summary.aborted() ? " (aborted: " + summary.abortReason() + ")" : "");
        log.info("New postings: {}", summary.newPostings());
        log.info("Notified: {} ({})", summary.notifiedPostings(), summary.notificationStatus());
        for (SourceOutcome outcome : summary.outcomes()) {
            if (outcome.status() == OutcomeStatus.SUCCESS) {
                log.info("  [{}] {}: {} extracted, {} new, {} updated", outcome.status(), outcome.sourceName(),
                        outcome.extracted(), outcome.newPostings(), outcome.updatedPostings());
            } else {
                log.info("  [{}] {}: {}", outcome.status(), outcome.sourceName(), outcome.message());
            }
        }
        log.info("Duration: {} ms", elapsed.toMillis());
        log.info(SEPARATOR);
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    private static final class RunState {
        private final long runId;
        private final RunTrigger trigger;
        private final LocalDateTime startedAt;
        private final List<SourceOutcome> outcomes = new ArrayList<>();
        private int newPostings;
        private int notifiedPostings;
        private NotificationStatus notificationStatus = NotificationStatus.NOT_ATTEMPTED;
        private String abortReason;

        private RunState(long runId, RunTrigger trigger, LocalDateTime startedAt) {
            this.runId = runId;
            this.trigger = trigger;
            this.startedAt = startedAt;
        }
    }
}
