package io.github.hotbrkm.mailrouter.engine.email.send.transport.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sendgrid.Method;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import io.github.hotbrkm.mailrouter.engine.email.send.OutboundMessage;
import io.github.hotbrkm.mailrouter.engine.email.send.result.DeliveryResult;
import io.github.hotbrkm.mailrouter.engine.email.send.result.ProviderUsed;
import io.github.hotbrkm.mailrouter.engine.email.tenant.SendGridConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SendGridApiClientTest {

    private static final SendGridConfig CONFIG = new SendGridConfig("SG.live-key", "news@example.com", "News");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<String> apiKeys = new ArrayList<>();
    private SendGrid sendGrid;
    private SendGridApiClient client;

    @BeforeEach
    void setUp() {
        sendGrid = mock(SendGrid.class);
        client = new SendGridApiClient(apiKey -> {
            apiKeys.add(apiKey);
            return sendGrid;
        }, Clock.systemUTC());
    }

    private static OutboundMessage message() {
        return new OutboundMessage("tenant-1", "news@example.com", "News", "user@example.org", null, "Hello",
                "<p>Hi</p>", "campaign-9");
    }

    @Test
    @DisplayName("Posts the message to mail/send and returns the provider message id")
    void accepted() throws Exception {
        // given
        when(sendGrid.api(any())).thenReturn(new Response(202, "", Map.of("X-Message-Id", "sg-abc123")));

        // when
        DeliveryResult result = client.send(CONFIG, message());

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.messageId()).isEqualTo("sg-abc123");
        assertThat(result.providerUsed()).isEqualTo(ProviderUsed.SENDGRID);
        assertThat(result.reputationScore()).isNull();
        assertThat(apiKeys).containsExactly("SG.live-key");

        ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
        verify(sendGrid).api(captor.capture());
        Request request = captor.getValue();
        assertThat(request.getMethod()).isEqualTo(Method.POST);
        assertThat(request.getEndpoint()).isEqualTo("mail/send");

        JsonNode body = objectMapper.readTree(request.getBody());
        assertThat(body.at("/from/email").asText()).isEqualTo("news@example.com");
        assertThat(body.at("/from/name").asText()).isEqualTo("News");
        assertThat(body.at("/subject").asText()).isEqualTo("Hello");
        assertThat(body.at("/personalizations/0/to/0/email").asText()).isEqualTo("user@example.org");
        assertThat(body.at("/personalizations/0/custom_args/tenantId").asText()).isEqualTo("tenant-1");
        assertThat(body.at("/personalizations/0/custom_args/correlationId").asText()).isEqualTo("campaign-9");
        assertThat(body.at("/content/0/type").asText()).isEqualTo("text/html");
        assertThat(body.at("/content/0/value").asText()).isEqualTo("<p>Hi</p>");
        assertThat(body.has("reply_to")).isFalse();
    }

    @Test
    @DisplayName("A non 2xx response is a failed result carrying the status and body")
    void rejected() throws Exception {
        // given
        when(sendGrid.api(any())).thenReturn(new Response(401, "{\"errors\":[{\"message\":\"bad key\"}]}", Map.of()));

        // when
        DeliveryResult result = client.send(CONFIG, message());

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.providerUsed()).isEqualTo(ProviderUsed.SENDGRID);
        assertThat(result.error()).startsWith("SendGrid API error 401: ").contains("bad key");
    }

    @Test
    @DisplayName("A transport error is a failed result, never an exception")
    void ioFailure() throws Exception {
        // given
        when(sendGrid.api(any())).thenThrow(new IOException("connect timed out"));

        // when
        DeliveryResult result = client.send(CONFIG, message());

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("connect timed out");
    }
}
