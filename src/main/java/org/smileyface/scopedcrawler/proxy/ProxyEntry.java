package org.smileyface.scopedcrawler.proxy;

import java.util.Objects;

/**
 * One outbound proxy identity.
 */
public record ProxyEntry(String host, int port, String username, String password) {

    public ProxyEntry {
        Objects.requireNonNull(host, "host");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Proxy port out of range: " + port);
        }
    }

    /**
     * Parses an {@code ip:port:username:password} record.
     *
     * @throws IllegalArgumentException if the record does not have exactly four fields or the port is invalid
     */
    public static ProxyEntry parse(String record) {
        String[] parts = record == null ? new String[0] : record.trim().split(":", -1);
        if (parts.length != 4 || parts[0].isBlank()) {
            throw new IllegalArgumentException("Expected format 'ip:port:username:password', got '" + record + "'");
        }
        int port;
        try {
            port = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid proxy port '" + parts[1] + "'", e);
        }
        return new ProxyEntry(parts[0].trim(), port, parts[2], parts[3]);
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty();
    }

    @Override
    public String toString() {
        return host + ":" + port + (hasCredentials() ? " (user=" + username + ", password=****)" : "");
    }
}
