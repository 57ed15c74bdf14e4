package io.qzark.core;

/**
 * Delivery outcome of a single notification channel.
 */
public record DeliveryResult(
        String channel,
        boolean delivered,
        String error
) {

    public static DeliveryResult delivered(String channel) {
        return new DeliveryResult(channel, true, null);
    }

    public static DeliveryResult failed(String channel, String error) {
        return new DeliveryResult(channel, false, error);
    }
}
