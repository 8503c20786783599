package io.github.hotbrkm.mailrouter.engine.email.dns;

import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.TXTRecord;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Thin dnsjava wrapper returning typed answers with a lookup status. Answers are never cached.
 */
@Slf4j
public class DnsResolver {

    private final Resolver resolver;
    private final int retryCount;

    public DnsResolver() {
        this(List.of(), Duration.ofSeconds(5), 2);
    }

    /**
     * @param servers    resolver addresses; empty means the system configuration
     * @param timeout    per-query timeout
     * @param retryCount attempts per lookup while the answer is {@code TRY_AGAIN}
     */
    public DnsResolver(List<String> servers, Duration timeout, int retryCount) {
        this.resolver = createResolver(servers, timeout);
        this.retryCount = Math.max(1, retryCount);
    }

    public QueryResult<String> txt(String name) {
        return lookup(name, Type.TXT, records -> {
            List<String> values = new ArrayList<>();
            for (Record record : records) {
                if (record instanceof TXTRecord txt) {
                    values.add(String.join("", txt.getStrings()));
                }
            }
            return values;
        });
    }

    public QueryResult<MxHost> mx(String name) {
        return lookup(name, Type.MX, records -> {
            List<MxHost> values = new ArrayList<>();
            for (Record record : records) {
                if (record instanceof MXRecord mx) {
                    values.add(new MxHost(mx.getPriority(), mx.getTarget().toString(true)));
                }
            }
            values.sort(Comparator.comparingInt(MxHost::priority));
            return values;
        });
    }

    public QueryResult<InetAddress> a(String name) {
        return lookup(name, Type.A, records -> {
            List<InetAddress> values = new ArrayList<>();
            for (Record record : records) {
                if (record instanceof ARecord a) {
                    values.add(a.getAddress());
                }
            }
            return values;
        });
    }

    private <T> QueryResult<T> lookup(String name, int type, Function<Record[], List<T>> extractor) {
        if (name == null || name.isBlank()) {
            return new QueryResult<>(QueryStatus.PERM_ERROR, Collections.emptyList(), "name is empty");
        }

        QueryResult<T> last = null;
        for (int attempt = 0; attempt < retryCount; attempt++) {
            last = lookupOnce(name, type, extractor);
            if (last.status() != QueryStatus.TEMP_ERROR) {
                return last;
            }
            log.debug("DNS lookup retry. name={}, type={}, attempt={}, detail={}", name, Type.string(type), attempt + 1, last.detail());
        }
        return last;
    }

    private <T> QueryResult<T> lookupOnce(String name, int type, Function<Record[], List<T>> extractor) {
        try {
            Lookup lookup = new Lookup(name, type);
            lookup.setResolver(resolver);
            lookup.setCache(null);
            Record[] records = lookup.run();
            QueryStatus status = mapStatus(lookup.getResult());
            if (records == null) {
                records = new Record[0];
            }
            return new QueryResult<>(status, List.copyOf(extractor.apply(records)), lookup.getErrorString());
        } catch (TextParseException e) {
            log.debug("DNS lookup parse error: name={}, type={}, message={}", name, type, e.getMessage());
            return new QueryResult<>(QueryStatus.PERM_ERROR, Collections.emptyList(), e.getMessage());
        } catch (RuntimeException e) {
            log.debug("DNS lookup runtime error: name={}, type={}, message={}", name, type, e.getMessage());
            return new QueryResult<>(QueryStatus.TEMP_ERROR, Collections.emptyList(), e.getMessage());
        }
    }

    private QueryStatus mapStatus(int result) {
        return switch (result) {
            case Lookup.SUCCESSFUL -> QueryStatus.SUCCESS;
            case Lookup.HOST_NOT_FOUND, Lookup.TYPE_NOT_FOUND -> QueryStatus.NOT_FOUND;
            case Lookup.TRY_AGAIN -> QueryStatus.TEMP_ERROR;
            default -> QueryStatus.PERM_ERROR;
        };
    }

    private static Resolver createResolver(List<String> servers, Duration timeout) {
        List<String> sanitized = servers == null ? List.of() : servers.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .toList();

        Resolver created;
        if (sanitized.isEmpty()) {
            created = Lookup.getDefaultResolver();
        } else {
            try {
                created = new ExtendedResolver(sanitized.toArray(new String[0]));
            } catch (UnknownHostException e) {
                throw new IllegalArgumentException("Invalid DNS server list: " + sanitized, e);
            }
        }
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            created.setTimeout(timeout);
        }
        return created;
    }

    public enum QueryStatus {
        SUCCESS,
        NOT_FOUND,
        TEMP_ERROR,
        PERM_ERROR
    }

    public record QueryResult<T>(QueryStatus status, List<T> values, String detail) {

        public static <T> QueryResult<T> success(List<T> values) {
            return new QueryResult<>(QueryStatus.SUCCESS, List.copyOf(values), null);
        }

        public static <T> QueryResult<T> notFound() {
            return new QueryResult<>(QueryStatus.NOT_FOUND, List.of(), null);
        }

        public static <T> QueryResult<T> failure(QueryStatus status, String detail) {
            return new QueryResult<>(status, List.of(), detail);
        }

        public boolean isFailure() {
            return status == QueryStatus.TEMP_ERROR || status == QueryStatus.PERM_ERROR;
        }

        /**
         * Values of a usable answer; a missing name yields an empty list, a failed lookup throws.
         */
        public List<T> valuesOrThrow(String name, String type) {
            if (isFailure()) {
                throw new DnsLookupException(name, type, status, detail);
            }
            return status == QueryStatus.SUCCESS ? values : List.of();
        }
    }

    public record MxHost(int priority, String exchange) {
    }
}
