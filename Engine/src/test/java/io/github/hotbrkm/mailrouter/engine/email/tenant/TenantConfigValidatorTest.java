package io.github.hotbrkm.mailrouter.engine.email.tenant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TenantConfigValidatorTest {

    private static final SmtpConfig VALID_SMTP = SmtpConfig.builder()
            .host("smtp.example.com")
            .username("mailer")
            .password("secret")
            .fromEmail("news@example.com")
            .build();

    private final TenantConfigValidator validator = new TenantConfigValidator();

    @Test
    @DisplayName("Accepts complete SendGrid and SMTP configurations")
    void validConfigurations() {
        assertThatCode(() -> validator.validate(TenantEmailConfig.smtp("t1", VALID_SMTP))).doesNotThrowAnyException();
        assertThatCode(() -> validator.validate(TenantEmailConfig.sendGrid("t2",
                new SendGridConfig("SG.key", "news@example.com", null), VALID_SMTP))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Accepts zero pool limits and timeouts as unset and rejects negative ones")
    void zeroMeansUnset() {
        SmtpConfig zeros = VALID_SMTP.toBuilder()
                .maxConnections(0).maxMessages(0).rateLimitPerMinute(0)
                .connectionTimeout(0).socketTimeout(0).greetingTimeout(0)
                .build();
        SmtpConfig negativeTimeout = VALID_SMTP.toBuilder().socketTimeout(-1).build();

        assertThatCode(() -> validator.validate(TenantEmailConfig.smtp("t1", zeros))).doesNotThrowAnyException();
        assertThatThrownBy(() -> validator.validate(TenantEmailConfig.smtp("t1", negativeTimeout)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("SMTP configuration timeouts must not be negative");
    }

    @Test
    @DisplayName("Accepts a placeholder API key so routing can fall back later")
    void placeholderKeyIsStorable() {
        SendGridConfig placeholder = new SendGridConfig(SendGridConfig.PLACEHOLDER_API_KEY, "news@example.com", null);

        assertThatCode(() -> validator.validate(TenantEmailConfig.sendGrid("t1", placeholder))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Reports every missing SendGrid field")
    void incompleteSendGrid() {
        TenantEmailConfig config = TenantEmailConfig.sendGrid("t1", new SendGridConfig(" ", null, null));

        assertThatThrownBy(() -> validator.validate(config))
                .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.getViolations())
                        .containsExactly("SendGrid configuration requires API key", "SendGrid configuration requires from email"));
    }

    @Test
    @DisplayName("Reports every missing SMTP field")
    void incompleteSmtp() {
        SmtpConfig smtp = SmtpConfig.builder().port(0).fromEmail("not-an-address").build();

        assertThatThrownBy(() -> validator.validate(TenantEmailConfig.smtp("t1", smtp)))
                .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.getViolations())
                        .containsExactly(
                                "SMTP configuration requires host",
                                "SMTP configuration requires port",
                                "SMTP configuration requires username",
                                "SMTP configuration requires password",
                                "SMTP configuration has invalid fromEmail: not-an-address"));
    }

    @Test
    @DisplayName("Validates the fallback relay and DKIM settings")
    void fallbackAndDkim() {
        SmtpConfig fallback = VALID_SMTP.toBuilder()
                .rateLimitPerMinute(-1)
                .dkim(DkimSettings.builder().enabled(true).selector("s1").build())
                .build();
        TenantEmailConfig config = TenantEmailConfig.sendGrid("t1", new SendGridConfig("SG.key", "news@example.com", null), fallback);

        assertThatThrownBy(() -> validator.validate(config))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Fallback SMTP configuration pool limits must not be negative; "
                        + "Fallback SMTP configuration enables DKIM without privateKey, selector and domain");
    }
}
