package dev.jobtracker.service;

import dev.jobtracker.entity.JobPosting;
import dev.jobtracker.model.CandidatePosting;
import dev.jobtracker.model.IntegrityFault;
import dev.jobtracker.model.ReconciliationResult;
import dev.jobtracker.repository.JobPostingRepository;
import dev.jobtracker.util.IdentityKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compares one source's extracted candidates with what is already stored for that source.
 * Reads only; the caller persists the result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeDetectionService {

    private final JobPostingRepository postingRepository;
    private final Clock clock;

    /**
     * Partition candidates into new, updated and unchanged postings.
     * <p>
     * Candidates sharing an identity key are collapsed, first one wins. A key matching more than
     * one stored posting yields an {@link IntegrityFault} and the candidate is skipped. Output
     * lists follow candidate order.
     */
    public ReconciliationResult reconcile(long sourceId, List<CandidatePosting> candidates) {
        if (candidates.isEmpty()) {
            return ReconciliationResult.empty();
        }

        Map<String, List<JobPosting>> stored = new LinkedHashMap<>();
        for (JobPosting posting : postingRepository.findBySourceIdOrderByFirstSeenDescIdDesc(sourceId)) {
            stored.computeIfAbsent(posting.getIdentityKey(), k -> new ArrayList<>()).add(posting);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        List<JobPosting> created = new ArrayList<>();
        List<JobPosting> updated = new ArrayList<>();
        List<JobPosting> unchanged = new ArrayList<>();
        List<IntegrityFault> faults = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int collapsed = 0;

        for (CandidatePosting candidate : candidates) {
            String key = IdentityKeys.of(sourceId, candidate);
            if (!seen.add(key)) {
                collapsed++;
                continue;
            }

            List<JobPosting> matches = stored.getOrDefault(key, List.of());
            if (matches.isEmpty()) {
                created.add(newPosting(sourceId, key, candidate, now));
            } else if (matches.size() > 1) {
                IntegrityFault fault = IntegrityFault.duplicateIdentityKey(sourceId, key, candidate.title(),
                        matches.size());
                log.error("Integrity fault on source {}: {}", sourceId, fault.describe());
                faults.add(fault);
            } else {
                JobPosting existing = matches.get(0);
                JobPosting merged = merge(existing, candidate);
                if (merged == existing) {
                    unchanged.add(existing);
                } else {
                    updated.add(merged);
                }
            }
        }

        if (collapsed > 0) {
            log.debug("Collapsed {} duplicate candidates for source {}", collapsed, sourceId);
        }
        log.info("Reconciled source {}: {} new, {} updated, {} unchanged, {} faults",
                sourceId, created.size(), updated.size(), unchanged.size(), faults.size());
        return new ReconciliationResult(created, updated, unchanged, faults, collapsed);
    }

    private JobPosting newPosting(long sourceId, String key, CandidatePosting candidate, LocalDateTime now) {
        return JobPosting.builder()
                .sourceId(sourceId)
                .identityKey(key)
                .title(candidate.title())
                .company(candidate.company())
                .location(candidate.location())
                .url(candidate.url())
                .firstSeen(now)
                .lastSeen(now)
                .notified(false)
                .build();
    }

    /**
     * @return {@code existing} itself when nothing changed, otherwise a copy carrying the new values.
     * Absent candidate fields keep the stored value.
     */
    private JobPosting merge(JobPosting existing, CandidatePosting candidate) {
        String location = candidate.location() != null ? candidate.location() : existing.getLocation();
        String url = candidate.url() != null ? candidate.url() : existing.getUrl();

        if (Objects.equals(existing.getTitle(), candidate.title())
                && Objects.equals(existing.getCompany(), candidate.company())
                && Objects.equals(existing.getLocation(), location)
                && Objects.equals(existing.getUrl(), url)) {
            return existing;
        }

        return existing.toBuilder()
                .title(candidate.title())
                .company(candidate.company())
                .location(location)
                .url(url)
                .build();
    }
}
