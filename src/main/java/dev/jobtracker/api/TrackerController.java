package dev.jobtracker.api;

import dev.jobtracker.entity.JobPosting;
import dev.jobtracker.entity.TrackedSource;
import dev.jobtracker.model.DashboardStats;
import dev.jobtracker.model.RunSummary;
import dev.jobtracker.model.RunTrigger;
import dev.jobtracker.model.SchedulerState;
import dev.jobtracker.model.SourcePostings;
import dev.jobtracker.service.DashboardService;
import dev.jobtracker.service.JobStoreService;
import dev.jobtracker.service.SchedulerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * JSON surface consumed by the dashboard. Store and pipeline calls block, so they run on boundedElastic.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TrackerController {

    static final int MAX_JOB_LIMIT = 1000;

    private final JobStoreService store;
    private final SchedulerService schedulerService;
    private final DashboardService dashboardService;

    @GetMapping("/sources")
    public Mono<List<TrackedSource>> sources() {
        return blocking(store::listSources);
    }

    @PostMapping("/sources")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<TrackedSource> addSource(@Valid @RequestBody AddSourceRequest request) {
        return blocking(() -> store.addSource(request.name(), request.url(), request.requiresBrowserOrDefault()));
    }

    @DeleteMapping("/sources/{id}")
    public Mono<ResponseEntity<Void>> deleteSource(@PathVariable("id") long id) {
        return blocking(() -> {
            store.deleteSource(id);
            return ResponseEntity.noContent().<Void>build();
        });
    }

    @GetMapping("/jobs")
    public Mono<List<JobPosting>> jobs(@RequestParam(name = "limit", defaultValue = "100") int limit) {
        if (limit < 1 || limit > MAX_JOB_LIMIT) {
            return Mono.error(new IllegalArgumentException("limit must be between 1 and " + MAX_JOB_LIMIT));
        }
        return blocking(() -> store.listRecentPostings(limit));
    }

    @GetMapping("/jobs/by-source")
    public Mono<List<SourcePostings>> jobsBySource() {
        return blocking(store::listPostingsGroupedBySource);
    }

    @GetMapping("/companies")
    public Mono<List<String>> companies() {
        return blocking(store::listCompanies);
    }

    @PostMapping("/run")
    public Mono<RunSummary> run() {
        return blocking(() -> schedulerService.runNow(RunTrigger.MANUAL));
    }

    @GetMapping("/runs/latest")
    public Mono<ResponseEntity<RunSummary>> latestRun() {
        return blocking(() -> store.latestRun()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build()));
    }

    @GetMapping("/scheduler")
    public SchedulerState scheduler() {
        return schedulerService.state();
    }

    @PostMapping("/scheduler")
    public SchedulerState configureScheduler(@Valid @RequestBody ScheduleRequest request) {
        return schedulerService.configure(request.enabled(), request.intervalMinutes());
    }

    @GetMapping("/stats")
    public Mono<DashboardStats> stats() {
        return blocking(dashboardService::stats);
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
