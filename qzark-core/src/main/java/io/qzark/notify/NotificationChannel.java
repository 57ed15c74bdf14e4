package io.qzark.notify;

/**
 * One independently configured delivery mechanism for failure alerts.
 */
public interface NotificationChannel {

    /**
     * Channel code used in logs and delivery results (e.g. "TELEGRAM").
     */
    String name();

    /**
     * Deliver the message. Any exception means the delivery failed.
     */
    void send(String message) throws Exception;
}
