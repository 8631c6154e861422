package com.tally.tracker.infrastructure.web;

import com.tally.ledger.EventRecord;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Works out the real client address of a request that may have passed through proxies or load
 * balancers.
 *
 * <p>Proxy headers are checked in {@link #ADDRESS_HEADERS} order. Each header may hold a
 * comma-separated chain; the first public address in it wins. Without a public address in any
 * header the socket's remote address is used, and {@value EventRecord#UNKNOWN_ORIGIN} when even
 * that is missing.
 */
@Component
public class ClientAddressResolver {

    static final List<String> ADDRESS_HEADERS =
            List.of(
                    "x-forwarded-for",
                    "x-real-ip",
                    "cf-connecting-ip",
                    "x-client-ip",
                    "x-forwarded",
                    "forwarded-for",
                    "forwarded");

    private static final List<String> PRIVATE_PREFIXES =
            List.of("127.", "10.", "192.168.", "172.", "169.254.");

    private static final Set<String> LOCAL_NAMES = Set.of("localhost", "::1", "0.0.0.0");

    public String resolve(HttpServletRequest request) {
        for (String header : ADDRESS_HEADERS) {
            String value = request.getHeader(header);
            if (value == null || value.isBlank()) {
                continue;
            }
            for (String candidate : value.split(",")) {
                String address = candidate.trim();
                if (!address.isEmpty() && !isPrivate(address)) {
                    return address;
                }
            }
        }
        String remote = request.getRemoteAddr();
        if (remote != null && !remote.isBlank()) {
            return remote;
        }
        return EventRecord.UNKNOWN_ORIGIN;
    }

    /**
     * Prefix match on common private and loopback ranges. The whole of {@code 172.} counts as
     * private, not just 172.16.0.0/12.
     */
    static boolean isPrivate(String address) {
        if (LOCAL_NAMES.contains(address)) {
            return true;
        }
        for (String prefix : PRIVATE_PREFIXES) {
            if (address.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
