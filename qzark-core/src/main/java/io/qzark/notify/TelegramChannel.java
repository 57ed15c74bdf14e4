package io.qzark.notify;

import io.qzark.config.QzarkProperties;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Sends notifications through the Telegram bot API {@code sendMessage} endpoint.
 */
public class TelegramChannel implements NotificationChannel {

    public static final String NAME = "TELEGRAM";
    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final QzarkProperties.Telegram config;
    private final HttpClient client;

    public TelegramChannel(QzarkProperties.Telegram config, HttpClient client) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void send(String message) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(sendMessageUri(message))
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();

        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("Telegram API returned HTTP " + response.statusCode() + ": " + response.body());
        }
    }

    URI sendMessageUri(String message) {
        String base = config.getApiUrl().endsWith("/")
                ? config.getApiUrl().substring(0, config.getApiUrl().length() - 1)
                : config.getApiUrl();
        return URI.create(String.format("%s/bot%s/sendMessage?chat_id=%s&text=%s",
                base,
                config.getBotToken(),
                URLEncoder.encode(config.getChatId(), StandardCharsets.UTF_8),
                URLEncoder.encode(message, StandardCharsets.UTF_8)));
    }
}
