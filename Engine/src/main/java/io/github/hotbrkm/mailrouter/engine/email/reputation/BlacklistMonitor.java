package io.github.hotbrkm.mailrouter.engine.email.reputation;

import io.github.hotbrkm.mailrouter.engine.email.dns.DnsResolver;
import io.github.hotbrkm.mailrouter.engine.email.dns.DnsResolver.QueryResult;
import io.github.hotbrkm.mailrouter.engine.email.dns.DnsResolver.QueryStatus;
import lombok.extern.slf4j.Slf4j;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Queries DNS block lists for the IPv4 address of a sending domain.
 * <p>
 * The address {@code 1.2.3.4} is looked up as {@code 4.3.2.1.{zone}} in every zone concurrently.
 * An answer means listed, NXDOMAIN means clean and anything else means unknown.
 */
@Slf4j
public class BlacklistMonitor {

    private final DnsResolver resolver;
    private final List<String> zones;
    private final Executor executor;
    private final Clock clock;

    public BlacklistMonitor(DnsResolver resolver, List<String> zones, Executor executor, Clock clock) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.zones = List.copyOf(Objects.requireNonNull(zones, "zones must not be null"));
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @return one status per configured zone, in zone order
     */
    public List<BlacklistStatus> checkBlacklist(String domain) {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain must not be blank");
        }
        String target = domain.trim().toLowerCase(Locale.ROOT);

        Optional<Inet4Address> address = resolveIpv4(target);
        if (address.isEmpty()) {
            log.warn("Blacklist check skipped, no IPv4 address. domain={}", target);
            List<BlacklistStatus> unknown = new ArrayList<>(zones.size());
            for (String zone : zones) {
                unknown.add(status(target, zone, BlacklistState.UNKNOWN));
            }
            return unknown;
        }

        String reversed = reverse(address.get());
        List<CompletableFuture<BlacklistStatus>> futures = new ArrayList<>(zones.size());
        for (String zone : zones) {
            futures.add(CompletableFuture.supplyAsync(() -> query(target, reversed, zone), executor)
                    .exceptionally(ex -> {
                        log.warn("Blacklist lookup failed. domain={}, zone={}, message={}", target, zone, ex.getMessage());
                        return status(target, zone, BlacklistState.UNKNOWN);
                    }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<BlacklistStatus> statuses = futures.stream().map(CompletableFuture::join).toList();
        long listed = statuses.stream().filter(BlacklistStatus::isListed).count();
        if (listed > 0) {
            log.warn("Domain listed on block lists. domain={}, ip={}, listed={}/{}", target, address.get().getHostAddress(), listed,
                    statuses.size());
        } else {
            log.info("Blacklist check completed. domain={}, ip={}, zones={}", target, address.get().getHostAddress(), statuses.size());
        }
        return statuses;
    }

    /**
     * {@code 1.2.3.4} becomes {@code 4.3.2.1}.
     */
    public static String reverse(Inet4Address address) {
        byte[] octets = address.getAddress();
        return (octets[3] & 0xff) + "." + (octets[2] & 0xff) + "." + (octets[1] & 0xff) + "." + (octets[0] & 0xff);
    }

    private BlacklistStatus query(String domain, String reversed, String zone) {
        String name = reversed + "." + zone;
        QueryResult<InetAddress> result = resolver.a(name);
        BlacklistState state;
        if (result.status() == QueryStatus.SUCCESS) {
            state = result.values().isEmpty() ? BlacklistState.CLEAN : BlacklistState.LISTED;
        } else if (result.status() == QueryStatus.NOT_FOUND) {
            state = BlacklistState.CLEAN;
        } else {
            state = BlacklistState.UNKNOWN;
        }
        log.debug("Blacklist lookup. name={}, status={}, state={}", name, result.status(), state);
        return status(domain, zone, state);
    }

    private Optional<Inet4Address> resolveIpv4(String domain) {
        QueryResult<InetAddress> result = resolver.a(domain);
        if (result.isFailure()) {
            log.debug("A lookup failed. domain={}, status={}, detail={}", domain, result.status(), result.detail());
            return Optional.empty();
        }
        return result.values().stream()
                .filter(Inet4Address.class::isInstance)
                .map(Inet4Address.class::cast)
                .findFirst();
    }

    private BlacklistStatus status(String domain, String zone, BlacklistState state) {
        return new BlacklistStatus(domain, zone, state, clock.instant());
    }
}
