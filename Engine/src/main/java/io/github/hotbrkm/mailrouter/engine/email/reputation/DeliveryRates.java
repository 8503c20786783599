package io.github.hotbrkm.mailrouter.engine.email.reputation;

import io.github.hotbrkm.mailrouter.engine.email.store.EmailEventType;
import io.github.hotbrkm.mailrouter.engine.email.store.EmailRecord;

import java.util.List;

/**
 * Event based rates over a set of email records, in percent of the records handed to a provider.
 */
record DeliveryRates(int sent, double deliveryRate, double bounceRate, double complaintRate, double unsubscribeRate) {

    static final DeliveryRates NONE = new DeliveryRates(0, 0, 0, 0, 0);

    static DeliveryRates of(List<EmailRecord> records) {
        int sent = 0;
        int delivered = 0;
        int bounced = 0;
        int complained = 0;
        int unsubscribed = 0;
        for (EmailRecord record : records) {
            if (record.status().isHandedOff()) {
                sent++;
            }
            // Opens and clicks imply delivery but are not counted as one
            if (record.hasEvent(EmailEventType.DELIVERED)) {
                delivered++;
            }
            if (record.hasEvent(EmailEventType.BOUNCED)) {
                bounced++;
            }
            if (record.hasEvent(EmailEventType.SPAM_REPORT)) {
                complained++;
            }
            if (record.hasEvent(EmailEventType.UNSUBSCRIBE)) {
                unsubscribed++;
            }
        }
        if (sent == 0) {
            return NONE;
        }
        return new DeliveryRates(sent, percent(delivered, sent), percent(bounced, sent), percent(complained, sent),
                percent(unsubscribed, sent));
    }

    double spamRate() {
        return complaintRate;
    }

    private static double percent(int count, int total) {
        return count * 100.0 / total;
    }
}
