package io.github.hotbrkm.mailrouter.engine.email.dns;

import io.github.hotbrkm.mailrouter.engine.email.EmailDeliveryException;
import lombok.Getter;

/**
 * A lookup that neither answered nor reported the name missing. Downgraded to an issue by the validators.
 */
@Getter
public class DnsLookupException extends EmailDeliveryException {
    private final String name;
    private final String recordType;
    private final DnsResolver.QueryStatus status;

    public DnsLookupException(String name, String recordType, DnsResolver.QueryStatus status, String detail) {
        super(buildMessage(name, recordType, status, detail));
        this.name = name;
        this.recordType = recordType;
        this.status = status;
    }

    private static String buildMessage(String name, String recordType, DnsResolver.QueryStatus status, String detail) {
        String reason = status == DnsResolver.QueryStatus.TEMP_ERROR ? "temporary failure" : "server failure";
        String message = reason + " resolving " + recordType + " " + name;
        return detail == null || detail.isBlank() ? message : message + " (" + detail + ")";
    }
}
