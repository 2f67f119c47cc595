package io.taskrelay.messaging.connection;

/**
 * Raised once every connection attempt allowed by the settings has failed.
 */
public class BrokerConnectionFailedException extends RuntimeException {

    private final String connectionName;
    private final int attempts;

    public BrokerConnectionFailedException(String connectionName, int attempts, Throwable cause) {
        super("Could not connect '%s' to the broker after %d attempt(s)".formatted(connectionName, attempts), cause);
        this.connectionName = connectionName;
        this.attempts = attempts;
    }

    public String connectionName() {
        return connectionName;
    }

    public int attempts() {
        return attempts;
    }
}
