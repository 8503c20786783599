package io.github.hotbrkm.mailrouter.engine.email.mime;

import io.github.hotbrkm.mailrouter.engine.email.domain.EmailAddressUtil;
import io.github.hotbrkm.mailrouter.engine.email.send.OutboundMessage;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders outbound messages with the standard delivery headers and signs them when a signer is set.
 */
@Slf4j
public class EmailMimeComposer {

    private final String mailer;
    private final DkimSigner dkimSigner;

    /**
     * @param mailer     value of the {@code X-Mailer} header
     * @param dkimSigner signer, or {@code null} to send unsigned
     */
    public EmailMimeComposer(String mailer, DkimSigner dkimSigner) {
        this.mailer = mailer;
        this.dkimSigner = dkimSigner;
    }

    public ComposedMessage compose(Session session, OutboundMessage message, String senderIp) {
        String fromDomain = EmailAddressUtil.extractDomain(message.fromEmail());
        String messageId = MessageIdGenerator.forSender(message.fromEmail());

        try {
            MimeMessageBuilder messageBuilder = new MimeMessageBuilder(session);
            messageBuilder.setFrom(message.fromName(), message.fromEmail());
            messageBuilder.setTo(message.to());
            messageBuilder.setReplyTo(message.replyTo() != null ? message.replyTo() : message.fromEmail());
            messageBuilder.setSubject(message.subject());
            messageBuilder.addAlterContent("text/plain", toPlainText(message.htmlContent()));
            messageBuilder.addAlterContent("text/html", message.htmlContent());
            messageBuilder.makeHeader(messageId, getCustomHeader(message, fromDomain, senderIp));
            messageBuilder.makeBody();

            if (dkimSigner != null) {
                messageBuilder.setExtension(dkimSigner.sign(messageBuilder.toBytes()));
            }
            return new ComposedMessage(messageBuilder.build(), messageId);
        } catch (MessagingException e) {
            throw new MimeCompositionException("Failed to compose message for " + message.to(), e);
        }
    }

    private Map<String, String> getCustomHeader(OutboundMessage message, String fromDomain, String senderIp) {
        Map<String, String> customHeader = new LinkedHashMap<>();
        customHeader.put("X-Mailer", mailer);
        customHeader.put("X-Priority", "3");
        if (!EmailAddressUtil.INVALID.equals(fromDomain)) {
            customHeader.put("List-Unsubscribe", "<mailto:unsubscribe@" + fromDomain + ">");
        }
        customHeader.put("X-Campaign-ID", hasText(message.correlationId()) ? message.correlationId() : "direct");
        customHeader.put("X-Sender-IP", hasText(senderIp) ? senderIp : "dynamic");
        return customHeader;
    }

    static String toPlainText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        String text = html.replaceAll("(?is)<(script|style)[^>]*>.*?</\\1>", " ")
                .replaceAll("(?i)<br\\s*/?>", "\n")
                .replaceAll("(?i)</p>", "\n")
                .replaceAll("<[^>]+>", " ")
                .replace("&nbsp;", " ")
                .replace("&amp;", "&")
                .replace("&lt;", "<")
                .replace("&gt;", ">");
        return text.replaceAll("[ \\t]+", " ").replaceAll(" *\\n *", "\n").trim();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public record ComposedMessage(MimeMessage message, String messageId) {
    }
}
