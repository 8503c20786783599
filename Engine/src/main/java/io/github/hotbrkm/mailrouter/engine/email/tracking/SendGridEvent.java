package io.github.hotbrkm.mailrouter.engine.email.tracking;

/**
 * One entry of a SendGrid event webhook payload.
 *
 * @param event        SendGrid event name, e.g. {@code delivered} or {@code spamreport}
 * @param sgMessageId  {@code sg_message_id}, the API message id followed by a {@code .filter...} suffix
 * @param timestamp    epoch seconds, may be {@code null}
 * @param reason       bounce or drop reason, may be {@code null}
 */
public record SendGridEvent(String event, String sgMessageId, Long timestamp, String reason) {

    /**
     * The message id as returned by the send call, i.e. the part before the first {@code '.'}.
     */
    public String providerMessageId() {
        if (sgMessageId == null || sgMessageId.isBlank()) {
            return null;
        }
        int dot = sgMessageId.indexOf('.');
        return dot < 0 ? sgMessageId : sgMessageId.substring(0, dot);
    }
}
