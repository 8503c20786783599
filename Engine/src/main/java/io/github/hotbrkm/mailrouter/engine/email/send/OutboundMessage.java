package io.github.hotbrkm.mailrouter.engine.email.send;

import io.github.hotbrkm.mailrouter.engine.email.tenant.ProviderConfig;
import io.github.hotbrkm.mailrouter.engine.email.tenant.SmtpConfig;

import java.util.Objects;

/**
 * A message ready for a provider: sender identity resolved from the tenant configuration.
 *
 * @param replyTo       may be {@code null}; SMTP sends then reply to the sender
 * @param correlationId caller reference carried in headers and provider metadata, may be {@code null}
 */
public record OutboundMessage(String tenantId,
                              String fromEmail,
                              String fromName,
                              String to,
                              String replyTo,
                              String subject,
                              String htmlContent,
                              String correlationId) {

    public OutboundMessage {
        Objects.requireNonNull(fromEmail, "fromEmail must not be null");
        Objects.requireNonNull(to, "to must not be null");
        subject = subject == null ? "" : subject;
        htmlContent = htmlContent == null ? "" : htmlContent;
    }

    /**
     * Addresses the request with the sender identity of the provider that will carry it.
     */
    public static OutboundMessage of(String tenantId, ProviderConfig provider, SendRequest request) {
        String replyTo = provider instanceof SmtpConfig smtp ? smtp.replyTo() : null;
        return new OutboundMessage(tenantId, provider.fromEmail(), provider.fromName(), request.to().trim(), replyTo,
                request.subject(), request.content(), request.correlationId());
    }
}
