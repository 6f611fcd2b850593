package dev.jobtracker.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobtracker.entity.JobPosting;
import dev.jobtracker.entity.PipelineRun;
import dev.jobtracker.entity.TrackedSource;
import dev.jobtracker.model.IntegrityFault;
import dev.jobtracker.model.NotificationStatus;
import dev.jobtracker.model.ReconciliationResult;
import dev.jobtracker.model.RunStatus;
import dev.jobtracker.model.RunSummary;
import dev.jobtracker.model.RunTrigger;
import dev.jobtracker.model.SourceOutcome;
import dev.jobtracker.model.SourcePostings;
import dev.jobtracker.repository.JobPostingRepository;
import dev.jobtracker.repository.PipelineRunRepository;
import dev.jobtracker.repository.TrackedSourceRepository;
import dev.jobtracker.util.IdentityKeys;
import dev.jobtracker.util.UrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable state: sources, postings and run records.
 * Everything a pipeline run writes for one source goes through {@link #applySourceResult} in a single transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStoreService {

    static final String INTERRUPTED_BY_RESTART = "interrupted_by_restart";

    private static final TypeReference<List<SourceOutcome>> OUTCOME_LIST = new TypeReference<>() {
    };

    private final TrackedSourceRepository sourceRepository;
    private final JobPostingRepository postingRepository;
    private final PipelineRunRepository runRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // ---- Sources ----

    /**
     * Sources in the order a run processes them.
     */
    @Transactional(readOnly = true)
    public List<TrackedSource> listSources() {
        return sourceRepository.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public TrackedSource getSource(long sourceId) {
        return sourceRepository.findById(sourceId)
                .orElseThrow(() -> new SourceNotFoundException(sourceId));
    }

    /**
     * Register a new source.
     *
     * @throws IllegalArgumentException when the URL is not an absolute http(s) URL
     * @throws DuplicateSourceException when the URL is already tracked
     */
    @Transactional
    public TrackedSource addSource(String name, String url, boolean requiresBrowser) {
        String normalizedUrl = requireHttpUrl(url);
        if (sourceRepository.existsByUrl(normalizedUrl)) {
            throw new DuplicateSourceException(normalizedUrl);
        }
        TrackedSource source = sourceRepository.save(TrackedSource.builder()
                .name(displayName(name, normalizedUrl))
                .url(normalizedUrl)
                .requiresBrowser(requiresBrowser)
                .createdAt(LocalDateTime.now(clock))
                .build());
        log.info("Added source '{}' ({}) requiresBrowser={}", source.getName(), source.getUrl(), requiresBrowser);
        return source;
    }

    /**
     * Insert a source, or refresh the name and fetch strategy of the one already tracked at this URL.
     */
    @Transactional
    public TrackedSource upsertSource(String name, String url, boolean requiresBrowser) {
        String normalizedUrl = requireHttpUrl(url);
        Optional<TrackedSource> existing = sourceRepository.findByUrl(normalizedUrl);
        if (existing.isEmpty()) {
            return addSource(name, normalizedUrl, requiresBrowser);
        }
        TrackedSource source = existing.get();
        String newName = displayName(name, normalizedUrl);
        if (source.getName().equals(newName) && source.isRequiresBrowser() == requiresBrowser) {
            return source;
        }
        if (!source.getName().equals(newName)) {
            renameDefaultedPostings(source.getId(), source.getName(), newName);
        }
        source.setName(newName);
        source.setRequiresBrowser(requiresBrowser);
        log.info("Updated source '{}' ({}) requiresBrowser={}", newName, normalizedUrl, requiresBrowser);
        return sourceRepository.save(source);
    }

    /**
     * Postings without a reported company carry the source name, which is part of the title/company
     * identity key. Move them to the new name so a rename does not re-report them as new.
     */
    private void renameDefaultedPostings(long sourceId, String oldName, String newName) {
        List<JobPosting> defaulted = postingRepository.findBySourceIdAndCompany(sourceId, oldName);
        int moved = 0;
        for (JobPosting posting : defaulted) {
            String key = IdentityKeys.of(sourceId, posting.getTitle(), newName, posting.getUrl());
            if (!key.equals(posting.getIdentityKey()) && postingRepository.existsBySourceIdAndIdentityKey(sourceId, key)) {
                log.warn("Posting {} keeps company '{}': '{}' already has a posting with the renamed key",
                        posting.getId(), oldName, newName);
                continue;
            }
            posting.setCompany(newName);
            posting.setIdentityKey(key);
            moved++;
        }
        postingRepository.saveAll(defaulted);
        if (moved > 0) {
            log.info("Moved {} postings from company '{}' to '{}'", moved, oldName, newName);
        }
    }

    /**
     * Delete a source together with its postings.
     */
    @Transactional
    public void deleteSource(long sourceId) {
        TrackedSource source = getSource(sourceId);
        int removed = postingRepository.deleteBySourceId(sourceId);
        sourceRepository.delete(source);
        log.info("Deleted source '{}' and {} postings", source.getName(), removed);
    }

    // ---- Postings ----

    /**
     * @throws IntegrityFaultException when more than one posting carries the key
     */
    @Transactional(readOnly = true)
    public Optional<JobPosting> findPostingByIdentity(long sourceId, String identityKey) {
        List<JobPosting> matches = postingRepository.findBySourceIdAndIdentityKey(sourceId, identityKey);
        if (matches.size() > 1) {
            throw new IntegrityFaultException(IntegrityFault.duplicateIdentityKey(sourceId, identityKey,
                    matches.get(0).getTitle(), matches.size()));
        }
        return matches.stream().findFirst();
    }

    @Transactional
    public JobPosting insertPosting(JobPosting posting) {
        if (posting.getId() != null) {
            throw new IllegalArgumentException("New posting must not carry an id");
        }
        if (postingRepository.existsBySourceIdAndIdentityKey(posting.getSourceId(), posting.getIdentityKey())) {
            throw new IntegrityFaultException(IntegrityFault.duplicateIdentityKey(posting.getSourceId(),
                    posting.getIdentityKey(), posting.getTitle(), 1));
        }
        return postingRepository.save(posting);
    }

    /**
     * Persist changed fields of a stored posting. Identity, first sighting and notified state are
     * taken from the stored row.
     */
    @Transactional
    public JobPosting updatePosting(JobPosting posting) {
        JobPosting stored = postingRepository.findById(posting.getId())
                .orElseThrow(() -> new IllegalArgumentException("Unknown posting " + posting.getId()));
        if (!stored.getSourceId().equals(posting.getSourceId())
                || !stored.getIdentityKey().equals(posting.getIdentityKey())) {
            throw new IntegrityFaultException("Posting " + posting.getId() + " may not change its source or identity");
        }
        stored.setTitle(posting.getTitle());
        stored.setCompany(posting.getCompany());
        stored.setLocation(posting.getLocation());
        stored.setUrl(posting.getUrl());
        stored.setLastSeen(posting.getLastSeen() != null ? posting.getLastSeen() : LocalDateTime.now(clock));
        return postingRepository.save(stored);
    }

    /**
     * Commit one source's reconciliation and its success state in a single transaction.
     *
     * @return the inserted postings, with ids
     */
    @Transactional
    public List<JobPosting> applySourceResult(long sourceId, ReconciliationResult result, int postingCount) {
        TrackedSource source = getSource(sourceId);
        LocalDateTime now = LocalDateTime.now(clock);

        List<JobPosting> inserted = new ArrayList<>(result.newPostings().size());
        for (JobPosting posting : result.newPostings()) {
            inserted.add(insertPosting(posting));
        }
        for (JobPosting posting : result.updatedPostings()) {
            posting.setLastSeen(now);
            updatePosting(posting);
        }
        List<Long> unchangedIds = result.unchanged().stream().map(JobPosting::getId).toList();
        if (!unchangedIds.isEmpty()) {
            postingRepository.touchLastSeen(unchangedIds, now);
        }

        source.setLastChecked(now);
        source.setLastError(null);
        source.setLastPostingCount(postingCount);
        sourceRepository.save(source);

        log.debug("Committed source '{}': {} inserted, {} updated, {} refreshed",
                source.getName(), inserted.size(), result.updatedPostings().size(), unchangedIds.size());
        return inserted;
    }

    /**
     * Record a failed check. Postings and the last posting count are left as they were.
     */
    @Transactional
    public void recordSourceFailure(long sourceId, String error) {
        TrackedSource source = getSource(sourceId);
        source.setLastChecked(LocalDateTime.now(clock));
        source.setLastError(truncate(error, TrackedSource.MAX_ERROR_LENGTH));
        sourceRepository.save(source);
    }

    /**
     * Flag postings as notified. Safe to repeat.
     *
     * @return number of postings that were not yet flagged
     */
    @Transactional
    public int markNotified(Collection<Long> postingIds) {
        if (postingIds.isEmpty()) {
            return 0;
        }
        int changed = postingRepository.markNotified(postingIds);
        log.info("Marked {} postings as notified", changed);
        return changed;
    }

    @Transactional(readOnly = true)
    public List<JobPosting> listUnnotifiedPostings() {
        return postingRepository.findByNotifiedFalseOrderByFirstSeenAscIdAsc();
    }

    @Transactional(readOnly = true)
    public List<JobPosting> listRecentPostings(int limit) {
        return postingRepository.findAllByOrderByFirstSeenDescIdDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * Every source, newest first, with its postings newest first.
     */
    @Transactional(readOnly = true)
    public List<SourcePostings> listPostingsGroupedBySource() {
        return sourceRepository.findAllByOrderByCreatedAtDescIdDesc().stream()
                .map(source -> new SourcePostings(source,
                        postingRepository.findBySourceIdOrderByFirstSeenDescIdDesc(source.getId())))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<String> listCompanies() {
        return postingRepository.findDistinctCompanies();
    }

    @Transactional(readOnly = true)
    public long countPostings() {
        return postingRepository.count();
    }

    @Transactional(readOnly = true)
    public long countSources() {
        return sourceRepository.count();
    }

    @Transactional(readOnly = true)
    public long countRunsSince(LocalDateTime since) {
        return runRepository.countByStartedAtGreaterThanEqual(since);
    }

    @Transactional(readOnly = true)
    public long countNewPostingsSince(LocalDateTime since) {
        return runRepository.sumNewCountSince(since);
    }

    // ---- Runs ----

    @Transactional
    public PipelineRun startRun(RunTrigger trigger) {
        PipelineRun run = runRepository.save(PipelineRun.builder()
                .trigger(trigger)
                .status(RunStatus.RUNNING)
                .startedAt(LocalDateTime.now(clock))
                .notificationStatus(NotificationStatus.NOT_ATTEMPTED)
                .build());
        log.debug("Started run record {}", run.getId());
        return run;
    }

    /**
     * Finalize a run record. A record is finalized once; later calls are rejected.
     */
    @Transactional
    public RunSummary finishRun(long runId, RunStatus status, int newCount, int notifiedCount,
            NotificationStatus notificationStatus, String abortReason, String errorMessage,
            List<SourceOutcome> outcomes) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Run must finish in a terminal status, got " + status);
        }
        PipelineRun run = runRepository.findById(runId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown run " + runId));
        if (run.getStatus().isTerminal()) {
            throw new IllegalStateException("Run " + runId + " is already finalized as " + run.getStatus());
        }

        run.setStatus(status);
        run.setEndedAt(LocalDateTime.now(clock));
        run.setNewCount(newCount);
        run.setNotifiedCount(notifiedCount);
        run.setNotificationStatus(notificationStatus);
        run.setAborted(abortReason != null);
        run.setAbortReason(abortReason);
        run.setErrorMessage(truncate(errorMessage, 1000));
        run.setOutcomeSummary(writeOutcomes(outcomes));
        return toSummary(runRepository.save(run));
    }

    @Transactional(readOnly = true)
    public Optional<RunSummary> latestRun() {
        return runRepository.findFirstByOrderByStartedAtDescIdDesc().map(this::toSummary);
    }

    /**
     * Close run records left RUNNING by a process that died mid-run.
     *
     * @return number of records closed
     */
    @Transactional
    public int recoverInterruptedRuns() {
        List<PipelineRun> stale = runRepository.findByStatus(RunStatus.RUNNING);
        LocalDateTime now = LocalDateTime.now(clock);
        for (PipelineRun run : stale) {
            run.setStatus(RunStatus.FAILED);
            run.setEndedAt(now);
            run.setAborted(true);
            run.setAbortReason(INTERRUPTED_BY_RESTART);
            run.setErrorMessage(INTERRUPTED_BY_RESTART);
            log.warn("Run {} started at {} was interrupted by a restart, marking FAILED", run.getId(),
                    run.getStartedAt());
        }
        runRepository.saveAll(stale);
        return stale.size();
    }

    RunSummary toSummary(PipelineRun run) {
        return new RunSummary(
                run.getId(),
                run.getTrigger(),
                run.getStatus(),
                run.getStartedAt(),
                run.getEndedAt(),
                run.getNewCount(),
                run.getNotifiedCount(),
                run.getNotificationStatus(),
                run.isAborted(),
                run.getAbortReason(),
                run.getErrorMessage(),
                readOutcomes(run));
    }

    private String writeOutcomes(List<SourceOutcome> outcomes) {
        if (outcomes == null || outcomes.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(outcomes);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize source outcomes: {}", e.getOriginalMessage());
            return null;
        }
    }

    private List<SourceOutcome> readOutcomes(PipelineRun run) {
        if (run.getOutcomeSummary() == null || run.getOutcomeSummary().isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(run.getOutcomeSummary(), OUTCOME_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable outcome summary on run {}: {}", run.getId(), e.getOriginalMessage());
            return List.of();
        }
    }

    private static String requireHttpUrl(String url) {
        if (url == null || !UrlUtils.isAbsoluteHttpUrl(url.trim())) {
            throw new IllegalArgumentException("Source URL must be an absolute http(s) URL: " + url);
        }
        return url.trim();
    }

    private static String displayName(String name, String url) {
        if (name != null && !name.isBlank()) {
            return name.trim();
        }
        String host = UrlUtils.hostOf(url);
        return host != null ? host : url;
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
