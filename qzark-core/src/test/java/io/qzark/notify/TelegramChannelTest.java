package io.qzark.notify;

import io.qzark.config.QzarkProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelegramChannelTest {

    private QzarkProperties.Telegram config;
    private HttpClient client;

    @BeforeEach
    void setUp() {
        config = new QzarkProperties.Telegram();
        config.setBotToken("123:abc");
        config.setChatId("-1001");
        client = mock(HttpClient.class);
    }

    @Test
    void uriShouldCarryChatIdAndEncodedText() {
        TelegramChannel channel = new TelegramChannel(config, client);

        URI uri = channel.sendMessageUri("Task 'A' failed.\nError: x&y");

        assertThat(uri.toString())
                .startsWith("https://api.telegram.org/bot123:abc/sendMessage?")
                .contains("chat_id=-1001")
                .contains("text=Task+%27A%27+failed.%0AError%3A+x%26y");
    }

    @Test
    void trailingSlashOnApiUrlShouldBeIgnored() {
        config.setApiUrl("http://localhost:8081/");
        TelegramChannel channel = new TelegramChannel(config, client);

        assertThat(channel.sendMessageUri("hi").toString())
                .startsWith("http://localhost:8081/bot123:abc/sendMessage?");
    }

    @Test
    @SuppressWarnings("unchecked")
    void sendShouldIssueGetRequest() throws Exception {
        HttpResponse<Object> ok = mock(HttpResponse.class);
        when(ok.statusCode()).thenReturn(200);
        doReturn(ok).when(client).send(any(HttpRequest.class), any());

        new TelegramChannel(config, client).send("hello");

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(client).send(request.capture(), any());
        assertThat(request.getValue().method()).isEqualTo("GET");
        assertThat(request.getValue().timeout()).contains(TelegramChannel.REQUEST_TIMEOUT);
        assertThat(request.getValue().uri().getPath()).isEqualTo("/bot123:abc/sendMessage");
    }

    @Test
    @SuppressWarnings("unchecked")
    void non2xxShouldFail() throws Exception {
        HttpResponse<Object> unauthorized = mock(HttpResponse.class);
        when(unauthorized.statusCode()).thenReturn(401);
        when(unauthorized.body()).thenReturn("{\"ok\":false}");
        doReturn(unauthorized).when(client).send(any(HttpRequest.class), any());

        TelegramChannel channel = new TelegramChannel(config, client);

        assertThatThrownBy(() -> channel.send("hello"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("HTTP 401");
    }
}
