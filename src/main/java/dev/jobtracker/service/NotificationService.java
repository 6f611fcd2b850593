package dev.jobtracker.service;

import dev.jobtracker.config.TrackerProperties;
import dev.jobtracker.entity.JobPosting;
import dev.jobtracker.metrics.TrackerMetrics;
import dev.jobtracker.model.DeliveryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Delivers one batch of postings per run. Never signals an error: failures come back as a FAILED result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final EmailService emailService;
    private final TrackerProperties properties;
    private final TrackerMetrics metrics;

    public Mono<DeliveryResult> notify(List<JobPosting> batch) {
        List<Long> ids = batch.stream().map(JobPosting::getId).toList();
        if (batch.isEmpty()) {
            log.info("No new postings to notify about");
            return Mono.just(DeliveryResult.delivered(ids));
        }

        if (properties.isDryRun()) {
            log.info("DRY RUN - would notify about {} postings:", batch.size());
            batch.forEach(p -> log.info("  - {} @ {} ({})", p.getTitle(), p.getCompany(),
                    p.getUrl() != null ? p.getUrl() : "no link"));
            return Mono.just(DeliveryResult.skipped(ids));
        }

        return emailService.sendNewPostings(batch)
                .onErrorResume(e -> {
                    log.error("Notification transport error: {}", e.getMessage(), e);
                    return Mono.just(false);
                })
                .map(sent -> {
                    if (Boolean.TRUE.equals(sent)) {
                        metrics.recordNotificationSent(batch.size());
                        return DeliveryResult.delivered(ids);
                    }
                    metrics.recordNotificationFailure();
                    return DeliveryResult.failed(ids, DeliveryResult.TRANSPORT_FAILURE);
                });
    }
}
