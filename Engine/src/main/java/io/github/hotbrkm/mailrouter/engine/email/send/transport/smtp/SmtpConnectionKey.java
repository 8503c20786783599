package io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp;

import io.github.hotbrkm.mailrouter.engine.email.tenant.SmtpConfig;

import java.util.Locale;
import java.util.Objects;

/**
 * Pool identity of an SMTP relay. Configurations sharing host, port and username share one session.
 */
public record SmtpConnectionKey(String host, int port, String username) {

    public SmtpConnectionKey {
        Objects.requireNonNull(host, "host must not be null");
        host = host.trim().toLowerCase(Locale.ROOT);
        username = username == null ? "" : username.trim();
    }

    public static SmtpConnectionKey of(SmtpConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new SmtpConnectionKey(config.host(), config.port(), config.username());
    }

    @Override
    public String toString() {
        return host + ":" + port + ":" + username;
    }
}
