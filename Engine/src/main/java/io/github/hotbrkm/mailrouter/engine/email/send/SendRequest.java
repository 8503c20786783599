package io.github.hotbrkm.mailrouter.engine.email.send;

/**
 * A send as requested by the host application.
 *
 * @param content       HTML body
 * @param correlationId id of the originating email record, may be {@code null}
 */
public record SendRequest(String to, String subject, String content, String correlationId) {
}
