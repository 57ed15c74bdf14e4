package io.qzark.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.qzark.config.QzarkProperties;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Posts notifications to a Discord webhook as {@code {"content": message}}.
 */
public class DiscordChannel implements NotificationChannel {

    public static final String NAME = "DISCORD";
    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final QzarkProperties.Discord config;
    private final HttpClient client;
    private final ObjectMapper mapper;

    public DiscordChannel(QzarkProperties.Discord config, HttpClient client, ObjectMapper mapper) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void send(String message) throws IOException, InterruptedException {
        String payload = mapper.writeValueAsString(Map.of("content", message));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.getWebhookUrl()))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json; charset=UTF-8")
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .build();

        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("Discord webhook returned HTTP " + response.statusCode() + ": " + response.body());
        }
    }
}
