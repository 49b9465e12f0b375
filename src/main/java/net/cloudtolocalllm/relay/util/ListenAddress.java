package net.cloudtolocalllm.relay.util;

import java.net.InetSocketAddress;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Host and port for a listener or a local peer, parsed from {@code host:port}.
 * <p>
 * A bare {@code :port} binds loopback, which is where desktop IPC belongs. IPv6 hosts are written
 * in brackets: {@code [::1]:8181}.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ListenAddress {
    public static final String LOOPBACK = "127.0.0.1";

    private final String host;
    private final int port;

    public static ListenAddress parse(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("address is required");
        }
        String value = raw.trim();
        int lastColon = value.lastIndexOf(':');
        if (lastColon < 0 || lastColon == value.length() - 1) {
            throw new IllegalArgumentException("address must be host:port: " + raw);
        }
        String host = value.substring(0, lastColon).trim();
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (host.isEmpty()) {
            host = LOOPBACK;
        }
        return of(host, parsePort(value.substring(lastColon + 1).trim()));
    }

    public static ListenAddress loopback(int port) {
        return of(LOOPBACK, port);
    }

    public static ListenAddress of(String host, int port) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host is required");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535: " + port);
        }
        return new ListenAddress(host, port);
    }

    private static int parsePort(String portRaw) {
        try {
            return Integer.parseInt(portRaw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("port must be numeric: " + portRaw, e);
        }
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}
