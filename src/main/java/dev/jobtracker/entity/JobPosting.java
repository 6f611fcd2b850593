package dev.jobtracker.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A job opening discovered on a tracked source.
 * Unique per source by its normalized identity key.
 */
@Data
@Entity
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "postings",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_postings_source_identity", columnNames = {"source_id", "identity_key"})
        },
        indexes = {
                @Index(name = "idx_postings_notified", columnList = "notified"),
                @Index(name = "idx_postings_first_seen", columnList = "first_seen")
        })
public class JobPosting {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    @Column(name = "identity_key", nullable = false, length = 80)
    private String identityKey;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(nullable = false)
    private String company;

    @Column(length = 500)
    private String location;

    @Column(length = 2048)
    private String url;

    @Column(name = "first_seen", nullable = false)
    private LocalDateTime firstSeen;

    @Column(name = "last_seen", nullable = false)
    private LocalDateTime lastSeen;

    @Column(nullable = false)
    private boolean notified;
}
