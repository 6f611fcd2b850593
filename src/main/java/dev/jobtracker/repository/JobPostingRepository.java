package dev.jobtracker.repository;

import dev.jobtracker.entity.JobPosting;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Repository for discovered postings.
 */
@Repository
public interface JobPostingRepository extends JpaRepository<JobPosting, Long> {

    /**
     * All postings of a source carrying the given identity key. More than one row means the
     * uniqueness invariant has been broken.
     */
    List<JobPosting> findBySourceIdAndIdentityKey(Long sourceId, String identityKey);

    boolean existsBySourceIdAndIdentityKey(Long sourceId, String identityKey);

    List<JobPosting> findByNotifiedFalseOrderByFirstSeenAscIdAsc();

    List<JobPosting> findAllByOrderByFirstSeenDescIdDesc(Pageable pageable);

    List<JobPosting> findBySourceIdOrderByFirstSeenDescIdDesc(Long sourceId);

    long countBySourceId(Long sourceId);

    List<JobPosting> findBySourceIdAndCompany(Long sourceId, String company);

    @Query("SELECT DISTINCT p.company FROM JobPosting p ORDER BY p.company")
    List<String> findDistinctCompanies();

    /**
     * Flag postings as notified. Rows already notified are left alone.
     *
     * @return number of rows that changed
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE JobPosting p SET p.notified = true WHERE p.id IN :ids AND p.notified = false")
    int markNotified(Collection<Long> ids);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE JobPosting p SET p.lastSeen = :seenAt WHERE p.id IN :ids")
    int touchLastSeen(Collection<Long> ids, LocalDateTime seenAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM JobPosting p WHERE p.sourceId = :sourceId")
    int deleteBySourceId(Long sourceId);
}
