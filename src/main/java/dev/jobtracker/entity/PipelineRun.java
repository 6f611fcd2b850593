package dev.jobtracker.entity;

import dev.jobtracker.model.NotificationStatus;
import dev.jobtracker.model.RunStatus;
import dev.jobtracker.model.RunTrigger;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Persistent record of one pipeline run. Written at start, finalized once at the end.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "runs", indexes = {
        @Index(name = "idx_runs_started_at", columnList = "started_at")
})
public class PipelineRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_trigger", nullable = false, length = 16)
    private RunTrigger trigger;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RunStatus status;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "ended_at")
    private LocalDateTime endedAt;

    @Column(name = "new_count", nullable = false)
    private int newCount;

    @Column(name = "notified_count", nullable = false)
    private int notifiedCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "notification_status", length = 16)
    private NotificationStatus notificationStatus;

    @Column(nullable = false)
    private boolean aborted;

    @Column(name = "abort_reason", length = 100)
    private String abortReason;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    /** JSON array of per-source outcomes. */
    @Column(name = "outcome_summary", length = 65535)
    private String outcomeSummary;
}
