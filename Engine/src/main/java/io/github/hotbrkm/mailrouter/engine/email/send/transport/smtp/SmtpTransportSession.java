package io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp;

import io.github.hotbrkm.mailrouter.engine.email.mime.EmailMimeComposer;
import io.github.hotbrkm.mailrouter.engine.email.mime.EmailMimeComposer.ComposedMessage;
import io.github.hotbrkm.mailrouter.engine.email.mime.MimeCompositionException;
import io.github.hotbrkm.mailrouter.engine.email.send.OutboundMessage;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * A pooled relay session: up to {@code maxConnections} connected transports shared by every send for one key.
 * A transport is reconnected after {@code maxMessages} messages and dropped after any failure.
 */
@Slf4j
public class SmtpTransportSession implements AutoCloseable {

    @Getter
    private final SmtpConnectionKey key;
    private final Session mailSession;
    private final EmailMimeComposer composer;
    private final TransportConnector connector;
    private final String senderIp;
    private final int maxMessages;
    private final long borrowTimeoutMillis;
    private final Semaphore permits;
    private final BlockingDeque<PooledTransport> idle = new LinkedBlockingDeque<>();
    private volatile boolean closed;

    /**
     * @param connector           opens a connected, authenticated transport on {@code mailSession}
     * @param senderIp            value of the {@code X-Sender-IP} header, may be {@code null}
     * @param borrowTimeoutMillis wait for a free connection before the send fails
     */
    public SmtpTransportSession(SmtpConnectionKey key, Session mailSession, EmailMimeComposer composer, TransportConnector connector,
                                String senderIp, int maxConnections, int maxMessages, long borrowTimeoutMillis) {
        this.key = key;
        this.mailSession = mailSession;
        this.composer = composer;
        this.connector = connector;
        this.senderIp = senderIp;
        this.maxMessages = maxMessages;
        this.borrowTimeoutMillis = borrowTimeoutMillis;
        this.permits = new Semaphore(maxConnections, true);
    }

    /**
     * Sends one message and returns its Message-ID.
     *
     * @throws SendException on composition, connection or protocol failure
     */
    public String send(OutboundMessage message) {
        if (closed) {
            throw new SendException(key, message.to(), "SMTP session " + key + " is closed", null);
        }

        ComposedMessage composed;
        try {
            composed = composer.compose(mailSession, message, senderIp);
        } catch (MimeCompositionException e) {
            throw new SendException(key, message.to(), e.getMessage(), e);
        }

        PooledTransport pooled = borrow(message.to());
        boolean healthy = false;
        try {
            pooled.transport().sendMessage(composed.message(), composed.message().getAllRecipients());
            pooled.sent++;
            healthy = true;
            log.debug("SMTP message accepted. key={}, to={}, messageId={}", key, message.to(), composed.messageId());
            return composed.messageId();
        } catch (MessagingException e) {
            throw new SendException(key, message.to(), "SMTP send to " + message.to() + " failed: " + describe(e), e);
        } finally {
            release(pooled, healthy);
        }
    }

    public int idleConnections() {
        return idle.size();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        PooledTransport pooled;
        while ((pooled = idle.pollFirst()) != null) {
            closeTransport(pooled);
        }
        log.info("SMTP session closed. key={}", key);
    }

    private PooledTransport borrow(String recipient) {
        try {
            if (!permits.tryAcquire(borrowTimeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new SendException(key, recipient, "No SMTP connection available within " + borrowTimeoutMillis + "ms", null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SendException(key, recipient, "Interrupted while waiting for an SMTP connection", e);
        }

        PooledTransport pooled = idle.pollFirst();
        try {
            if (pooled != null && (pooled.sent >= maxMessages || !pooled.transport().isConnected())) {
                closeTransport(pooled);
                pooled = null;
            }
            if (pooled == null) {
                pooled = new PooledTransport(connector.connect(mailSession));
            }
            return pooled;
        } catch (MessagingException | RuntimeException e) {
            permits.release();
            throw new SendException(key, recipient, "SMTP connection to " + key.host() + ":" + key.port() + " failed: " + describe(e), e);
        }
    }

    private void release(PooledTransport pooled, boolean healthy) {
        try {
            if (healthy && !closed) {
                idle.offerFirst(pooled);
            } else {
                closeTransport(pooled);
            }
        } finally {
            permits.release();
        }
    }

    private void closeTransport(PooledTransport pooled) {
        try {
            pooled.transport().close();
        } catch (MessagingException e) {
            log.debug("SMTP transport close failed. key={}, message={}", key, e.getMessage());
        }
    }

    static String describe(Exception e) {
        Throwable cause = e;
        String message = e.getMessage();
        while ((message == null || message.isBlank()) && cause.getCause() != null) {
            cause = cause.getCause();
            message = cause.getMessage();
        }
        return message == null ? e.getClass().getSimpleName() : message.trim();
    }

    /**
     * Opens a connected transport.
     */
    @FunctionalInterface
    public interface TransportConnector {
        Transport connect(Session session) throws MessagingException;
    }

    private static final class PooledTransport {
        private final Transport transport;
        private int sent;

        private PooledTransport(Transport transport) {
            this.transport = transport;
        }

        private Transport transport() {
            return transport;
        }
    }
}
