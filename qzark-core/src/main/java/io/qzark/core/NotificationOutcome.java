package io.qzark.core;

import java.util.List;

/**
 * Aggregate of all per-channel delivery results for one failure message.
 */
public record NotificationOutcome(
        String message,
        List<DeliveryResult> results
) {

    public NotificationOutcome {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public int attempted() {
        return results.size();
    }

    public long deliveredCount() {
        return results.stream().filter(DeliveryResult::delivered).count();
    }

    public boolean allDelivered() {
        return results.stream().allMatch(DeliveryResult::delivered);
    }

    public DeliveryResult resultFor(String channel) {
        return results.stream()
                .filter(r -> r.channel().equals(channel))
                .findFirst()
                .orElse(null);
    }
}
