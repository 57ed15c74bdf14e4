package io.qzark.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.qzark.config.QzarkProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Flow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DiscordChannelTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private QzarkProperties.Discord config;
    private HttpClient client;

    @BeforeEach
    void setUp() {
        config = new QzarkProperties.Discord();
        config.setWebhookUrl("https://discord.example/api/webhooks/1/token");
        client = mock(HttpClient.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void sendShouldPostJsonContent() throws Exception {
        HttpResponse<Object> noContent = mock(HttpResponse.class);
        when(noContent.statusCode()).thenReturn(204);
        doReturn(noContent).when(client).send(any(HttpRequest.class), any());

        new DiscordChannel(config, client, mapper).send("Task \"A\" failed.\nError: boom");

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(client).send(captor.capture(), any());
        HttpRequest request = captor.getValue();

        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.uri().toString()).isEqualTo("https://discord.example/api/webhooks/1/token");
        assertThat(request.headers().firstValue("Content-Type")).hasValueSatisfying(v -> assertThat(v).startsWith("application/json"));

        JsonNode body = mapper.readTree(bodyOf(request));
        assertThat(body.get("content").asText()).isEqualTo("Task \"A\" failed.\nError: boom");
    }

    @Test
    @SuppressWarnings("unchecked")
    void non2xxShouldFail() throws Exception {
        HttpResponse<Object> notFound = mock(HttpResponse.class);
        when(notFound.statusCode()).thenReturn(404);
        when(notFound.body()).thenReturn("Unknown Webhook");
        doReturn(notFound).when(client).send(any(HttpRequest.class), any());

        DiscordChannel channel = new DiscordChannel(config, client, mapper);

        assertThatThrownBy(() -> channel.send("hello"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("HTTP 404");
    }

    private static String bodyOf(HttpRequest request) {
        HttpRequest.BodyPublisher publisher = request.bodyPublisher().orElseThrow();
        List<ByteBuffer> chunks = new ArrayList<>();
        publisher.subscribe(new Flow.Subscriber<>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(ByteBuffer item) {
                chunks.add(item);
            }

            @Override
            public void onError(Throwable throwable) {
                throw new IllegalStateException(throwable);
            }

            @Override
            public void onComplete() {
            }
        });

        StringBuilder sb = new StringBuilder();
        for (ByteBuffer chunk : chunks) {
            sb.append(StandardCharsets.UTF_8.decode(chunk));
        }
        return sb.toString();
    }
}
