package io.github.hotbrkm.mailrouter.engine.email.mime;

import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.internet.MimeUtility;
import lombok.Getter;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

@Getter
class MimeMessageBuilder {

    private static final String CRLF = "\r\n";
    private static final DateTimeFormatter RFC_2822_FORMATTER =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss Z", Locale.US);
    private static final String ENC_BASE64 = "base64";

    private final Session session;
    private final MimeMessage mimeMessage;
    private final MimeMultipart alternativeContent;

    private String from;
    private String subject;
    private String to;
    private String replyTo;
    private String messageId;
    private boolean isAlter = false;

    private final String charset = "UTF-8";
    private String extensionHeader;

    MimeMessageBuilder(Session session) {
        this.session = session;
        this.mimeMessage = new MimeMessage(session);
        this.alternativeContent = new MimeMultipart("alternative");
    }

    public void setFrom(String name, String email) {
        from = formatAddress(name, email);
    }

    public void setTo(String email) {
        to = formatAddress(null, email);
    }

    public void setReplyTo(String email) {
        replyTo = email == null || email.isBlank() ? null : formatAddress(null, email);
    }

    public void setSubject(String subject) {
        try {
            this.subject = MimeUtility.fold(9, MimeUtility.encodeText(subject.trim(), charset, "B"));
        } catch (UnsupportedEncodingException ex) {
            this.subject = "";
        }
    }

    /**
     * Adds one alternative body part, e.g. {@code text/plain} then {@code text/html}.
     */
    public void addAlterContent(String contentType, String content) throws MessagingException {
        MimeBodyPart bodyPart = new MimeBodyPart();
        bodyPart.setText(content, charset, getSubtype(contentType));
        bodyPart.setHeader("Content-Transfer-Encoding", ENC_BASE64);
        alternativeContent.addBodyPart(bodyPart);
        isAlter = true;
    }

    private String getSubtype(String contentType) {
        int slashIndex = contentType.indexOf('/');
        if (slashIndex != -1 && slashIndex < contentType.length() - 1) {
            return contentType.substring(slashIndex + 1);
        }
        return "html";
    }

    public void makeHeader(String messageId, Map<String, String> customHeader) throws MessagingException {
        this.messageId = messageId;
        mimeMessage.setHeader("From", from);
        mimeMessage.setHeader("To", to);
        if (replyTo != null) {
            mimeMessage.setHeader("Reply-To", replyTo);
        }
        mimeMessage.setHeader("Subject", subject);
        mimeMessage.setHeader("Date", ZonedDateTime.now().format(RFC_2822_FORMATTER));
        mimeMessage.setHeader("MIME-Version", "1.0");
        mimeMessage.setHeader("Precedence", "bulk");

        for (Map.Entry<String, String> entry : customHeader.entrySet()) {
            if (entry.getValue() != null) {
                mimeMessage.setHeader(entry.getKey(), entry.getValue());
            }
        }
    }

    public void makeBody() throws MessagingException {
        if (isAlter) {
            mimeMessage.setContent(alternativeContent);
        }
        mimeMessage.saveChanges();
        // saveChanges assigns its own Message-ID
        mimeMessage.setHeader("Message-ID", messageId);
    }

    public void setExtension(String headerLine) {
        this.extensionHeader = headerLine;
    }

    /**
     * Returns the rendered message, prefixed by the extension header when one is set.
     */
    public byte[] toBytes() {
        try {
            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            if (extensionHeader != null) {
                outputStream.write((extensionHeader + CRLF).getBytes(StandardCharsets.US_ASCII));
            }
            mimeMessage.writeTo(outputStream);
            return outputStream.toByteArray();
        } catch (IOException | MessagingException e) {
            throw new MimeCompositionException("Failed to render MIME message", e);
        }
    }

    /**
     * Returns the message to hand to the transport. A signed message is re-read so the signature header
     * is sent byte for byte.
     */
    public MimeMessage build() {
        if (extensionHeader == null) {
            return mimeMessage;
        }
        try {
            return new MimeMessage(session, new ByteArrayInputStream(toBytes()));
        } catch (MessagingException e) {
            throw new MimeCompositionException("Failed to re-read signed MIME message", e);
        }
    }

    private String formatAddress(String name, String email) {
        String address = email == null ? "" : email.trim();
        if (name == null || name.isBlank()) {
            return address;
        }
        try {
            return "\"" + MimeUtility.fold(9, MimeUtility.encodeText(name.trim(), charset, "B")) + "\" <" + address + ">";
        } catch (UnsupportedEncodingException ex) {
            return address;
        }
    }

    @Override
    public String toString() {
        return new String(toBytes(), StandardCharsets.UTF_8);
    }
}
