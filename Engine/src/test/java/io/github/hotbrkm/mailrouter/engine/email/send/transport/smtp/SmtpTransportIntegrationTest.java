package io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp;

import io.github.hotbrkm.mailrouter.engine.email.config.DeliveryProperties;
import io.github.hotbrkm.mailrouter.engine.email.dns.DkimKeyPair;
import io.github.hotbrkm.mailrouter.engine.email.dns.DkimKeyPairGenerator;
import io.github.hotbrkm.mailrouter.engine.email.dns.DnsRecordGenerator;
import io.github.hotbrkm.mailrouter.engine.email.send.OutboundMessage;
import io.github.hotbrkm.mailrouter.engine.email.send.result.DeliveryResult;
import io.github.hotbrkm.mailrouter.engine.email.send.result.ProviderUsed;
import io.github.hotbrkm.mailrouter.engine.email.support.EmbeddedSmtpServer;
import io.github.hotbrkm.mailrouter.engine.email.support.EmbeddedSmtpServer.ReceivedMessage;
import io.github.hotbrkm.mailrouter.engine.email.tenant.DkimSettings;
import io.github.hotbrkm.mailrouter.engine.email.tenant.SmtpConfig;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
class SmtpTransportIntegrationTest {

    private EmbeddedSmtpServer server;
    private SmtpTransportPoolManager poolManager;

    @BeforeEach
    void setUp() throws Exception {
        server = EmbeddedSmtpServer.start();
        DeliveryProperties.Smtp smtpDefaults = new DeliveryProperties.Smtp();
        poolManager = new SmtpTransportPoolManager(new SmtpTransportSessionFactory(smtpDefaults, "MailRouter/1.0"), smtpDefaults,
                new DeliveryProperties.Scoring(), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        poolManager.shutdown();
        server.close();
    }

    private SmtpConfig config(int port) {
        return SmtpConfig.builder()
                .host(EmbeddedSmtpServer.HOST)
                .port(port)
                .enableTls(false)
                .fromEmail("news@example.com")
                .fromName("News")
                .replyTo("support@example.com")
                .connectionTimeout(2_000)
                .socketTimeout(5_000)
                .greetingTimeout(5_000)
                .build();
    }

    private static OutboundMessage message(String to) {
        return new OutboundMessage("tenant-1", "news@example.com", "News", to, "support@example.com", "Hello",
                "<p>Welcome aboard</p>", "campaign-1");
    }

    @Test
    @DisplayName("Delivers through the relay with the standard headers")
    void delivers() throws Exception {
        // when
        DeliveryResult result = poolManager.send(config(server.port()), message("user@example.org"));

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.providerUsed()).isEqualTo(ProviderUsed.SMTP);
        assertThat(result.reputationScore()).isNotNull();
        assertThat(server.messages()).hasSize(1);

        ReceivedMessage received = server.messages().get(0);
        assertThat(received.from()).isEqualTo("news@example.com");
        assertThat(received.recipients()).containsExactly("user@example.org");

        MimeMessage parsed = received.parse();
        assertThat(parsed.getHeader("Message-ID", null)).isEqualTo(result.messageId());
        assertThat(parsed.getHeader("X-Mailer", null)).isEqualTo("MailRouter/1.0");
        assertThat(parsed.getHeader("X-Campaign-ID", null)).isEqualTo("campaign-1");
        assertThat(parsed.getHeader("X-Sender-IP", null)).isEqualTo("dynamic");
        assertThat(parsed.getHeader("Reply-To", null)).isEqualTo("support@example.com");
        assertThat(parsed.getContentType()).startsWith("multipart/alternative");
    }

    @Test
    @DisplayName("Reuses one session for repeated sends to the same relay")
    void reusesSession() {
        // when
        poolManager.send(config(server.port()), message("first@example.org"));
        poolManager.send(config(server.port()), message("second@example.org"));

        // then
        assertThat(server.messages()).hasSize(2);
        assertThat(poolManager.sessionCount()).isEqualTo(1);
        assertThat(poolManager.getConnectionStats(SmtpConnectionKey.of(config(server.port()))).orElseThrow().totalSent())
                .isEqualTo(2);
    }

    @Test
    @DisplayName("A refused recipient is a failed result and the session survives")
    void rejectedRecipient() {
        // when
        DeliveryResult rejected = poolManager.send(config(server.port()), message("reject-me@example.org"));
        DeliveryResult accepted = poolManager.send(config(server.port()), message("user@example.org"));

        // then
        assertThat(rejected.success()).isFalse();
        assertThat(rejected.error()).startsWith("SMTP send to reject-me@example.org failed");
        assertThat(accepted.success()).isTrue();
        assertThat(poolManager.getConnectionStats(SmtpConnectionKey.of(config(server.port()))).orElseThrow().totalFailed())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("An unreachable relay is reported as a connection failure")
    void unreachableRelay() throws Exception {
        // given
        int port = EmbeddedSmtpServer.unusedPort();

        // when
        DeliveryResult result = poolManager.send(config(port), message("user@example.org"));

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("SMTP connection to 127.0.0.1:" + port + " failed");
        assertThat(poolManager.isAvailable(config(port))).isFalse();
        assertThat(poolManager.sessionCount()).isZero();
    }

    @Test
    @DisplayName("Signs outgoing mail when DKIM is enabled")
    void dkimSigned() throws Exception {
        // given
        DkimKeyPair keyPair = new DkimKeyPairGenerator(new DnsRecordGenerator(), Clock.systemUTC()).generate("example.com");
        SmtpConfig config = config(server.port()).toBuilder()
                .dkim(DkimSettings.builder()
                        .enabled(true)
                        .privateKey(keyPair.privateKey())
                        .selector(keyPair.selector())
                        .domain("example.com")
                        .build())
                .build();

        // when
        DeliveryResult result = poolManager.send(config, message("user@example.org"));

        // then
        assertThat(result.success()).isTrue();
        String[] signature = server.messages().get(0).parse().getHeader("DKIM-Signature");
        assertThat(signature).hasSize(1);
        assertThat(signature[0]).contains("d=example.com");
    }
}
