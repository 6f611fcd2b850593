package dev.jobtracker.repository;

import dev.jobtracker.entity.PipelineRun;
import dev.jobtracker.model.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface PipelineRunRepository extends JpaRepository<PipelineRun, Long> {

    Optional<PipelineRun> findFirstByOrderByStartedAtDescIdDesc();

    Optional<PipelineRun> findFirstByStatusInOrderByEndedAtDescIdDesc(List<RunStatus> statuses);

    List<PipelineRun> findByStatus(RunStatus status);

    long countByStartedAtGreaterThanEqual(LocalDateTime since);

    @Query("SELECT COALESCE(SUM(r.newCount), 0) FROM PipelineRun r WHERE r.startedAt >= :since")
    long sumNewCountSince(LocalDateTime since);
}
