package io.taskrelay.messaging.connection;

import java.time.Duration;
import java.util.Objects;

/**
 * Everything needed to reach the broker. There are no implicit defaults at this level; callers
 * pass every value explicitly.
 *
 * @param maxRetries total number of connection attempts, at least one
 */
public record BrokerConnectionSettings(
    String host,
    int port,
    String username,
    String password,
    String virtualHost,
    Duration connectTimeout,
    Duration heartbeatInterval,
    Duration retryDelay,
    int maxRetries,
    Duration confirmTimeout
) {

    public BrokerConnectionSettings {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(virtualHost, "virtualHost");
        requirePositive("connectTimeout", connectTimeout);
        requirePositive("heartbeatInterval", heartbeatInterval);
        Objects.requireNonNull(retryDelay, "retryDelay");
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative");
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        requirePositive("confirmTimeout", confirmTimeout);
    }

    private static void requirePositive(String field, Duration value) {
        Objects.requireNonNull(value, field);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(field + " must be positive");
        }
    }

    @Override
    public String toString() {
        return "BrokerConnectionSettings[host=%s, port=%d, username=%s, virtualHost=%s, maxRetries=%d]"
            .formatted(host, port, username, virtualHost, maxRetries);
    }
}
