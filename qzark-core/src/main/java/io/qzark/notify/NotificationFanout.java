package io.qzark.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.qzark.config.QzarkProperties;
import io.qzark.core.DeliveryResult;
import io.qzark.core.NotificationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Delivers one failure message to every enabled channel.
 *
 * <p>Channels are attempted in order and independently: a failing channel is recorded as a failed
 * {@link DeliveryResult} and never stops the remaining channels. {@link #notify(String, String)}
 * never throws.
 */
public class NotificationFanout {
    private static final Logger log = LoggerFactory.getLogger(NotificationFanout.class);

    private final List<NotificationChannel> channels;

    public NotificationFanout(List<NotificationChannel> channels) {
        this.channels = List.copyOf(Objects.requireNonNull(channels, "channels must not be null"));
    }

    /**
     * Builds the channels enabled by the given configuration.
     */
    public static NotificationFanout fromProperties(QzarkProperties props, HttpClient httpClient, ObjectMapper objectMapper) {
        QzarkProperties.Notification n = props.getNotification();
        List<NotificationChannel> enabled = new ArrayList<>(3);

        if (n.getTelegram().isEnabled()) {
            enabled.add(new TelegramChannel(n.getTelegram(), httpClient));
        }
        if (n.getDiscord().isEnabled()) {
            enabled.add(new DiscordChannel(n.getDiscord(), httpClient, objectMapper));
        }
        if (n.getSmtp().isEnabled()) {
            enabled.add(new SmtpChannel(n.getSmtp(), props.timeoutDuration()));
        }

        log.info("Notification channels enabled={}", enabled.stream().map(NotificationChannel::name).toList());
        return new NotificationFanout(enabled);
    }

    public static String formatMessage(String taskName, String errorMessage) {
        return "Task '" + taskName + "' failed.\nError: " + errorMessage;
    }

    public NotificationOutcome notify(String taskName, String errorMessage) {
        String message = formatMessage(taskName, errorMessage);
        log.error("Notifying about failure: {}", message);

        List<DeliveryResult> results = new ArrayList<>(channels.size());
        for (NotificationChannel channel : channels) {
            results.add(deliver(channel, message));
        }

        NotificationOutcome outcome = new NotificationOutcome(message, results);
        if (!outcome.allDelivered()) {
            log.warn("Failure notification for task '{}' delivered to {}/{} channels",
                    taskName, outcome.deliveredCount(), outcome.attempted());
        }
        return outcome;
    }

    public List<NotificationChannel> getChannels() {
        return channels;
    }

    private DeliveryResult deliver(NotificationChannel channel, String message) {
        try {
            channel.send(message);
            log.info("{} notification sent.", channel.name());
            return DeliveryResult.delivered(channel.name());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("{} notification interrupted", channel.name());
            return DeliveryResult.failed(channel.name(), "interrupted");
        } catch (Exception e) {
            log.error("Failed to send {} notification: {}", channel.name(), e.getMessage());
            return DeliveryResult.failed(channel.name(), String.valueOf(e.getMessage()));
        }
    }
}
