package dev.jobtracker.model;

import java.util.List;

/**
 * Outcome of handing one batch to the notification channel.
 *
 * @param status     delivery outcome
 * @param postingIds ids of the postings included in the batch
 * @param error      failure kind when {@code status} is FAILED
 */
public record DeliveryResult(NotificationStatus status, List<Long> postingIds, String error) {

    public static final String TRANSPORT_FAILURE = "transport_failure";

    public DeliveryResult {
        postingIds = List.copyOf(postingIds);
    }

    public static DeliveryResult delivered(List<Long> postingIds) {
        return new DeliveryResult(NotificationStatus.DELIVERED, postingIds, null);
    }

    public static DeliveryResult failed(List<Long> postingIds, String error) {
        return new DeliveryResult(NotificationStatus.FAILED, postingIds, error);
    }

    public static DeliveryResult skipped(List<Long> postingIds) {
        return new DeliveryResult(NotificationStatus.SKIPPED, postingIds, null);
    }

    public boolean isDelivered() {
        return status == NotificationStatus.DELIVERED;
    }
}
