package io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp;

import io.github.hotbrkm.mailrouter.engine.email.config.DeliveryProperties;
import io.github.hotbrkm.mailrouter.engine.email.mime.DkimSigner;
import io.github.hotbrkm.mailrouter.engine.email.mime.EmailMimeComposer;
import io.github.hotbrkm.mailrouter.engine.email.tenant.ConfigurationException;
import io.github.hotbrkm.mailrouter.engine.email.tenant.DkimSettings;
import io.github.hotbrkm.mailrouter.engine.email.tenant.SmtpConfig;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import lombok.extern.slf4j.Slf4j;

import java.security.GeneralSecurityException;
import java.util.Objects;
import java.util.Properties;

/**
 * Builds verified {@link SmtpTransportSession}s on top of Jakarta Mail.
 */
@Slf4j
public class SmtpTransportSessionFactory {

    private final DeliveryProperties.Smtp smtpDefaults;
    private final String mailer;

    public SmtpTransportSessionFactory(DeliveryProperties.Smtp smtpDefaults, String mailer) {
        this.smtpDefaults = Objects.requireNonNull(smtpDefaults, "smtpDefaults must not be null");
        this.mailer = mailer == null || mailer.isBlank() ? DeliveryProperties.DEFAULT_MAILER : mailer;
    }

    /**
     * Creates a session and proves the relay accepts a connection, greeting and login before returning it.
     *
     * @throws TransportException     when the relay is unreachable or rejects the handshake or credentials
     * @throws ConfigurationException when DKIM is enabled with an unusable key
     */
    public SmtpTransportSession create(SmtpConfig config) {
        SmtpConnectionKey key = SmtpConnectionKey.of(config);
        EmailMimeComposer composer = new EmailMimeComposer(mailer, createSigner(key, config));

        int connectionTimeout = smtpDefaults.resolveConnectionTimeout(config.connectionTimeout());
        int socketTimeout = smtpDefaults.resolveSocketTimeout(config.socketTimeout());
        int greetingTimeout = smtpDefaults.resolveGreetingTimeout(config.greetingTimeout());

        verify(key, config, Session.getInstance(buildProperties(config, connectionTimeout, greetingTimeout)));

        Session mailSession = Session.getInstance(buildProperties(config, connectionTimeout, socketTimeout));
        SmtpTransportSession session = new SmtpTransportSession(key, mailSession, composer, s -> connect(s, config), config.staticIp(),
                smtpDefaults.resolveMaxConnections(config.maxConnections()), smtpDefaults.resolveMaxMessages(config.maxMessages()),
                connectionTimeout);
        log.info("SMTP session created. key={}, secure={}, dkim={}", key, config.secure(), config.isDkimEnabled());
        return session;
    }

    private void verify(SmtpConnectionKey key, SmtpConfig config, Session verifySession) {
        Transport transport = null;
        try {
            transport = connect(verifySession, config);
        } catch (MessagingException e) {
            throw new TransportException(key, SmtpTransportSession.describe(e), e);
        } finally {
            if (transport != null) {
                try {
                    transport.close();
                } catch (MessagingException e) {
                    log.debug("SMTP verification close failed. key={}, message={}", key, e.getMessage());
                }
            }
        }
    }

    Transport connect(Session session, SmtpConfig config) throws MessagingException {
        Transport transport = session.getTransport(protocol(config));
        if (config.hasCredentials()) {
            transport.connect(config.host(), config.port(), config.username(), config.password());
        } else {
            transport.connect(config.host(), config.port(), null, null);
        }
        return transport;
    }

    Properties buildProperties(SmtpConfig config, int connectionTimeout, int readTimeout) {
        String prefix = "mail." + protocol(config) + ".";
        Properties props = new Properties();
        props.setProperty(prefix + "host", config.host());
        props.setProperty(prefix + "port", Integer.toString(config.port()));
        props.setProperty(prefix + "connectiontimeout", Integer.toString(connectionTimeout));
        props.setProperty(prefix + "timeout", Integer.toString(readTimeout));
        props.setProperty(prefix + "writetimeout", Integer.toString(readTimeout));
        props.setProperty(prefix + "auth", Boolean.toString(config.hasCredentials()));
        props.setProperty(prefix + "from", config.fromEmail());
        if (config.secure()) {
            props.setProperty(prefix + "ssl.enable", "true");
            props.setProperty(prefix + "ssl.checkserveridentity", "true");
        } else {
            props.setProperty(prefix + "starttls.enable", Boolean.toString(config.enableTls() || config.requireTls()));
            props.setProperty(prefix + "starttls.required", Boolean.toString(config.requireTls()));
        }
        if (config.staticIp() != null && !config.staticIp().isBlank()) {
            props.setProperty(prefix + "localaddress", config.staticIp().trim());
        }
        if (smtpDefaults.isSmtpTrace()) {
            props.setProperty("mail.debug", "true");
        }
        return props;
    }

    private DkimSigner createSigner(SmtpConnectionKey key, SmtpConfig config) {
        DkimSettings dkim = config.dkim();
        if (dkim == null || !dkim.enabled()) {
            return null;
        }
        if (!dkim.isUsable()) {
            throw new ConfigurationException(null, "DKIM is enabled for " + key + " without privateKey, selector and domain");
        }
        try {
            return new DkimSigner(dkim);
        } catch (GeneralSecurityException e) {
            throw new ConfigurationException(null, "DKIM private key for " + key + " cannot be loaded: " + e.getMessage(), e);
        }
    }

    private static String protocol(SmtpConfig config) {
        return config.secure() ? "smtps" : "smtp";
    }
}
