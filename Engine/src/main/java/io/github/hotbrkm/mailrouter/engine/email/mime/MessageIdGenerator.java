package io.github.hotbrkm.mailrouter.engine.email.mime;

import io.github.hotbrkm.mailrouter.engine.email.domain.EmailAddressUtil;
import lombok.experimental.UtilityClass;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds {@code Message-ID} values of the form {@code <millis.seq@senderDomain>}.
 */
@UtilityClass
public class MessageIdGenerator {

    static final String FALLBACK_DOMAIN = "mailrouter.localdomain";
    private static final int SEQUENCE_MODULUS = 10_000_000;

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    public static String forSender(String fromEmail) {
        String domain = EmailAddressUtil.extractDomain(fromEmail);
        return next(EmailAddressUtil.INVALID.equals(domain) ? FALLBACK_DOMAIN : domain);
    }

    static String next(String domain) {
        int seq = SEQUENCE.updateAndGet(i -> i + 1 >= SEQUENCE_MODULUS ? 0 : i + 1);
        return "<" + System.currentTimeMillis() + '.' + seq + '@' + domain + '>';
    }
}
