package dev.jobtracker.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A career page the pipeline checks on every run.
 */
@Data
@Entity
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "sources", uniqueConstraints = {
        @UniqueConstraint(name = "uk_sources_url", columnNames = "url")
})
public class TrackedSource {

    public static final int MAX_ERROR_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, length = 2048)
    private String url;

    @Column(name = "requires_browser", nullable = false)
    private boolean requiresBrowser;

    @Column(name = "last_checked")
    private LocalDateTime lastChecked;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    @Column(name = "last_posting_count", nullable = false)
    private int lastPostingCount;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
